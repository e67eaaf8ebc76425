/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.clause;

import java.util.Collection;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;


/**
 * The tokens that make up one clause of a sentence.  The members of a clause
 * need not be contiguous (a relative clause can interrupt its main clause), so
 * {@link #start()} and {@link #end()} give the extent while {@link
 * #tokenIndices()} gives the exact membership.
 */
public class ClauseBoundary {

    private final ClauseType type;

    private final int headIndex;

    private final int governorIndex;

    private final ImmutableSortedSet<Integer> tokenIndices;

    private final ImmutableList<Integer> verbIndices;

    private final ImmutableList<Integer> subjectIndices;

    private final boolean isFragment;

    /**
     * @param type the role of the clause
     * @param headIndex the token that heads the clause
     * @param governorIndex the token outside the clause that the head depends
     *        on, or {@code -1} if the head is a root
     * @param tokenIndices every token in the clause, including the head
     * @param verbIndices the verbs in the clause, in surface order
     * @param subjectIndices the subjects of the clause's verbs, in surface order
     * @param isFragment whether this clause stands in for a sentence that has
     *        no verb
     */
    public ClauseBoundary(ClauseType type, int headIndex, int governorIndex,
                          Collection<Integer> tokenIndices,
                          List<Integer> verbIndices,
                          List<Integer> subjectIndices,
                          boolean isFragment) {
        if (tokenIndices.isEmpty())
            throw new IllegalArgumentException("A clause needs tokens");
        this.type = type;
        this.headIndex = headIndex;
        this.governorIndex = governorIndex;
        this.tokenIndices = ImmutableSortedSet.copyOf(tokenIndices);
        this.verbIndices = ImmutableList.copyOf(verbIndices);
        this.subjectIndices = ImmutableList.copyOf(subjectIndices);
        this.isFragment = isFragment;
    }

    public ClauseType type() {
        return type;
    }

    public int headIndex() {
        return headIndex;
    }

    /**
     * Returns the token outside this clause that its head depends on, or
     * {@code -1}.
     */
    public int governorIndex() {
        return governorIndex;
    }

    /**
     * Returns the first token of the clause.
     */
    public int start() {
        return tokenIndices.first();
    }

    /**
     * Returns the last token of the clause, inclusive.
     */
    public int end() {
        return tokenIndices.last();
    }

    public ImmutableSortedSet<Integer> tokenIndices() {
        return tokenIndices;
    }

    public List<Integer> verbIndices() {
        return verbIndices;
    }

    public List<Integer> subjectIndices() {
        return subjectIndices;
    }

    public boolean contains(int tokenIndex) {
        return tokenIndices.contains(tokenIndex);
    }

    public boolean isFragment() {
        return isFragment;
    }

    @Override public String toString() {
        return type + "[" + start() + ".." + end() + ", head=" + headIndex
            + (isFragment ? ", fragment" : "") + "]";
    }
}
