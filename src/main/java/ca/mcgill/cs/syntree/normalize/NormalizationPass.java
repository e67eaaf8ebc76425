/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * A structural rewrite of a finished syntactic tree.  A pass changes the tree
 * in place, must leave it satisfying every tree invariant, and must be
 * idempotent: applying it to its own output changes nothing.
 */
public interface NormalizationPass {

    /**
     * Rewrites the tree.
     *
     * @return {@code true} if the tree was changed
     */
    boolean apply(SyntacticTree tree);

    /**
     * Returns a short name for the pass, used in log messages.
     */
    String name();
}
