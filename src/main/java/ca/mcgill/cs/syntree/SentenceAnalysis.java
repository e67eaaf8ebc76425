/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree;

import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * The tree built for one sentence, and whether it had to fall back to the flat
 * tree.
 */
public class SentenceAnalysis {

    private final SyntacticTree tree;

    private final boolean usedFallback;

    private final String fallbackReason;

    SentenceAnalysis(SyntacticTree tree, boolean usedFallback,
                     String fallbackReason) {
        this.tree = tree;
        this.usedFallback = usedFallback;
        this.fallbackReason = fallbackReason;
    }

    public SyntacticTree tree() {
        return tree;
    }

    /**
     * Returns {@code true} if the sentence could not be structured and the
     * tree is the flat fallback.
     */
    public boolean usedFallback() {
        return usedFallback;
    }

    /**
     * Returns why the fallback was used, or {@code null} if it was not.
     */
    public String fallbackReason() {
        return fallbackReason;
    }

    @Override public String toString() {
        return (usedFallback ? "[fallback: " + fallbackReason + "] " : "")
            + tree.toBracketString();
    }
}
