/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.token.PartsOfSpeech;
import ca.mcgill.cs.syntree.token.Token;

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * Splits inflected words into their lemma and an edge naming the inflection.
 * The word "looked" is replaced, in the same position and with the same
 * relation, by an {@link PhraseType#INFLECTION} phrase whose single child is
 * the lemma "look" on an edge labeled {@code past}.
 */
public class LemmaDecompositionPass implements NormalizationPass {

    private static final Set<String> DECOMPOSABLE_TAGS =
        new HashSet<String>(Arrays.asList(
            PartsOfSpeech.VERB, PartsOfSpeech.NOUN, PartsOfSpeech.ADJ,
            PartsOfSpeech.ADV));

    /** {@inheritDoc} */
    @Override public String name() {
        return "lemma decomposition";
    }

    /**
     * Returns {@code true} if the token is an inflected verb, noun, adjective
     * or adverb whose surface form differs from its lemma.
     */
    public static boolean shouldDecompose(Token token) {
        if (token.text().length() <= 1)
            return false;
        if (token.text().equalsIgnoreCase(token.lemma()))
            return false;
        return DECOMPOSABLE_TAGS.contains(token.pos());
    }

    /** {@inheritDoc} */
    @Override public boolean apply(SyntacticTree tree) {
        boolean changed = false;
        for (SyntacticNode leaf : tree.leaves()) {
            if (leaf.isLemmaForm()
                    || leaf.parent().isPhrase(PhraseType.INFLECTION)
                    || !shouldDecompose(leaf.token()))
                continue;
            int t = leaf.headIndex();
            SyntacticNode inflection =
                tree.newPhraseNode(PhraseType.INFLECTION, t);
            leaf.parent().replaceChild(leaf, inflection);
            inflection.addChild(tree.newLemmaNode(t),
                                InflectionLabels.labelFor(leaf.token()));
            changed = true;
        }
        return changed;
    }
}
