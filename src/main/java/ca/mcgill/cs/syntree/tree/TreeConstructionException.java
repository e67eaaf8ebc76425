/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import java.util.Arrays;


/**
 * Thrown when a change to a syntactic tree would break one of its structural
 * invariants, or when a finished tree is found to violate one.  The
 * exception names the nodes involved.
 */
public class TreeConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int[] nodeIds;

    public TreeConstructionException(String message, int... nodeIds) {
        super(message + " (nodes " + Arrays.toString(nodeIds) + ")");
        this.nodeIds = nodeIds.clone();
    }

    /**
     * Returns the ids of the nodes involved in the violation.
     */
    public int[] nodeIds() {
        return nodeIds.clone();
    }
}
