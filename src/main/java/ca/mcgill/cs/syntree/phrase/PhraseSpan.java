/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.SortedSet;

import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;


/**
 * A phrase built around one head token.  Its children are labeled {@link
 * Constituent}s kept in surface order, so a span is itself an immutable tree
 * in which every token appears at most once.
 */
public class PhraseSpan {

    private static final Comparator<Constituent> SURFACE_ORDER =
        new Comparator<Constituent>() {
            public int compare(Constituent c1, Constituent c2) {
                return c1.start() - c2.start();
            }
        };

    private final PhraseType type;

    private final int headIndex;

    private final ImmutableList<Constituent> children;

    private final ImmutableList<Integer> tokenIndices;

    private final ImmutableSortedSet<Integer> modifierIndices;

    /**
     * Creates a phrase from its children, which are put into surface order.
     *
     * @throws IllegalArgumentException if there are no children, if the head
     *         token is not covered by the children, or if a token would appear
     *         twice in the phrase
     */
    public PhraseSpan(PhraseType type, int headIndex,
                      List<Constituent> children) {
        if (children.isEmpty())
            throw new IllegalArgumentException("A phrase needs children");
        List<Constituent> ordered = new ArrayList<Constituent>(children);
        Collections.sort(ordered, SURFACE_ORDER);

        TIntSet seen = new TIntHashSet();
        List<Integer> covered = new ArrayList<Integer>();
        List<Integer> modifiers = new ArrayList<Integer>();
        for (Constituent c : ordered) {
            for (Integer t : c.tokenIndices()) {
                if (!seen.add(t))
                    throw new IllegalArgumentException(
                        "Token " + t + " appears twice in " + ordered);
                covered.add(t);
            }
            if (c.headIndex() != headIndex)
                modifiers.add(c.headIndex());
        }
        if (!seen.contains(headIndex))
            throw new IllegalArgumentException(
                "Head " + headIndex + " is not in " + ordered);
        Collections.sort(covered);

        this.type = type;
        this.headIndex = headIndex;
        this.children = ImmutableList.copyOf(ordered);
        this.tokenIndices = ImmutableList.copyOf(covered);
        this.modifierIndices = ImmutableSortedSet.copyOf(modifiers);
    }

    public PhraseType type() {
        return type;
    }

    public int headIndex() {
        return headIndex;
    }

    public int start() {
        return tokenIndices.get(0);
    }

    /**
     * Returns the last token of the phrase, inclusive.
     */
    public int end() {
        return tokenIndices.get(tokenIndices.size() - 1);
    }

    public List<Constituent> children() {
        return children;
    }

    /**
     * Returns the heads of the direct children that modify the head.
     */
    public SortedSet<Integer> modifierIndices() {
        return modifierIndices;
    }

    /**
     * Returns every token in the phrase, in surface order.
     */
    public List<Integer> tokenIndices() {
        return tokenIndices;
    }

    /**
     * Returns the first child with this label, or {@code null} if there is
     * none.
     */
    public Constituent child(String relation) {
        for (Constituent c : children) {
            if (relation.equals(c.relation()))
                return c;
        }
        return null;
    }

    /**
     * Returns every child with this label, in surface order.
     */
    public List<Constituent> children(String relation) {
        List<Constituent> matches = new ArrayList<Constituent>();
        for (Constituent c : children) {
            if (relation.equals(c.relation()))
                matches.add(c);
        }
        return matches;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof PhraseSpan))
            return false;
        PhraseSpan s = (PhraseSpan)o;
        return type == s.type && headIndex == s.headIndex
            && children.equals(s.children);
    }

    @Override public int hashCode() {
        return type.hashCode() ^ (headIndex * 31) ^ children.hashCode();
    }

    @Override public String toString() {
        StringBuilder sb = new StringBuilder("(");
        sb.append(type.abbreviation());
        for (Constituent c : children)
            sb.append(' ').append(c);
        return sb.append(')').toString();
    }
}
