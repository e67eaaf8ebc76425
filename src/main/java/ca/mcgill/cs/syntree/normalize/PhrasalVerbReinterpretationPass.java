/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import ca.mcgill.cs.syntree.phrase.EdgeLabels;
import ca.mcgill.cs.syntree.phrase.PhrasalVerbLexicon;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Rewrites a verb followed by a prepositional phrase as a phrasal verb with a
 * direct object when the verb and preposition form a known phrasal verb.
 * Parsers often read "She ran over my friend" as "ran [over my friend]"; this
 * pass turns it into {@code verb:(PV verb:ran particle:over)} followed by
 * {@code obj:(my friend)}.
 */
public class PhrasalVerbReinterpretationPass implements NormalizationPass {

    private final PhrasalVerbLexicon lexicon;

    public PhrasalVerbReinterpretationPass(PhrasalVerbLexicon lexicon) {
        this.lexicon = lexicon;
    }

    /** {@inheritDoc} */
    @Override public String name() {
        return "phrasal verb reinterpretation";
    }

    /** {@inheritDoc} */
    @Override public boolean apply(SyntacticTree tree) {
        boolean changed = false;
        for (SyntacticNode node : tree.nodes()) {
            if (node.isPhrase(PhraseType.VERB_PHRASE) && tree.contains(node))
                changed |= reinterpret(tree, node);
        }
        return changed;
    }

    private boolean reinterpret(SyntacticTree tree, SyntacticNode vp) {
        SyntacticNode verb = vp.child(EdgeLabels.VERB);
        if (verb == null || !verb.isWord())
            return false;
        int pos = vp.indexOf(verb);
        if (pos + 1 >= vp.numChildren())
            return false;
        SyntacticNode pp = vp.child(pos + 1);
        if (!EdgeLabels.PREP_PHRASE.equals(pp.relation())
                || !pp.isPhrase(PhraseType.PREP_PHRASE)
                || pp.numChildren() != 2)
            return false;
        SyntacticNode prep = pp.child(EdgeLabels.PREP);
        SyntacticNode object = pp.child(EdgeLabels.POBJ);
        if (prep == null || object == null || !prep.isWord())
            return false;
        String verbLemma = verb.token().lemma();
        String particle = prep.token().text();
        if (!lexicon.contains(verbLemma, particle))
            return false;

        SyntreeLogger.veryVerbose("Reading \"%s %s\" as a phrasal verb",
                                  verb.text(), particle);
        SyntacticNode phrasal = tree.newPhraseNode(
            PhraseType.PHRASAL_VERB, verb.headIndex());
        vp.replaceChild(verb, phrasal);
        phrasal.addChild(verb, EdgeLabels.VERB);
        phrasal.addChild(prep, EdgeLabels.PARTICLE);
        vp.replaceChild(pp, object);
        object.setRelation(EdgeLabels.OBJ);
        return true;
    }
}
