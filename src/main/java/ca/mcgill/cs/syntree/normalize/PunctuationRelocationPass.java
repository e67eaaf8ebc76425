/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.phrase.EdgeLabels;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * Moves punctuation out of phrases.  A punctuation word inside a phrase
 * becomes the sibling that directly follows the phrase, after any punctuation
 * already moved there, and keeps moving up until it sits directly under a
 * clause or the sentence.  The relative order of everything else is unchanged.
 * A noun phrase layer left holding only its inner {@code head} or {@code
 * core} is replaced by that child, which takes over the layer's relation.
 */
public class PunctuationRelocationPass implements NormalizationPass {

    /** {@inheritDoc} */
    @Override public String name() {
        return "punctuation relocation";
    }

    /** {@inheritDoc} */
    @Override public boolean apply(SyntacticTree tree) {
        DependencyGraph graph = tree.graph();
        boolean changed = false;
        for (SyntacticNode leaf : tree.leaves()) {
            if (!graph.features(leaf.headIndex()).isPunctuation())
                continue;
            while (leaf.parent().isPhrase()) {
                SyntacticNode phrase = leaf.parent();
                SyntacticNode outer = phrase.parent();
                int pos = outer.indexOf(phrase) + 1;
                while (pos < outer.numChildren()
                           && isEarlierPunctuation(graph, outer.child(pos),
                                                   leaf))
                    ++pos;
                outer.insertChild(pos, leaf, leaf.relation());
                if (phrase.numChildren() == 0)
                    outer.removeChild(phrase);
                else if (isEmptiedLayer(phrase))
                    outer.replaceChild(phrase, phrase.child(0));
                changed = true;
            }
        }
        return changed;
    }

    private static boolean isEmptiedLayer(SyntacticNode phrase) {
        if (!phrase.isPhrase(PhraseType.NOUN_PHRASE)
                || phrase.numChildren() != 1)
            return false;
        String rel = phrase.child(0).relation();
        return EdgeLabels.HEAD.equals(rel) || EdgeLabels.CORE.equals(rel);
    }

    private static boolean isEarlierPunctuation(DependencyGraph graph,
                                                SyntacticNode node,
                                                SyntacticNode leaf) {
        return node.isWord()
            && graph.features(node.headIndex()).isPunctuation()
            && node.headIndex() < leaf.headIndex();
    }
}
