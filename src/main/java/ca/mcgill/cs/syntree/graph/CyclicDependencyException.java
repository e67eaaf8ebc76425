/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.graph;

import java.util.Arrays;


/**
 * Thrown when following head links from a token revisits a token, i.e., the
 * parser's output contains a cycle.
 */
public class CyclicDependencyException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int[] chain;

    private final int repeatedIndex;

    /**
     * @param chain the token indices visited before the cycle was detected,
     *        starting with the token whose ancestors were requested
     * @param repeatedIndex the index that was reached a second time
     */
    public CyclicDependencyException(int[] chain, int repeatedIndex) {
        super("Dependency cycle: " + Arrays.toString(chain)
              + " returns to " + repeatedIndex);
        this.chain = chain.clone();
        this.repeatedIndex = repeatedIndex;
    }

    /**
     * Returns the token indices visited before the cycle was detected.
     */
    public int[] chain() {
        return chain.clone();
    }

    public int repeatedIndex() {
        return repeatedIndex;
    }
}
