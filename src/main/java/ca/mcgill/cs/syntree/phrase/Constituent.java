/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import java.util.List;

import com.google.common.collect.ImmutableList;


/**
 * A labeled child of a {@link PhraseSpan}: either a single token or a nested
 * phrase.  Constituents are immutable; {@link #withRelation(String)} returns a
 * relabeled copy.
 */
public final class Constituent {

    private final String relation;

    private final int tokenIndex;

    private final PhraseSpan span;

    private Constituent(String relation, int tokenIndex, PhraseSpan span) {
        this.relation = relation;
        this.tokenIndex = tokenIndex;
        this.span = span;
    }

    public static Constituent word(String relation, int tokenIndex) {
        if (tokenIndex < 0)
            throw new IllegalArgumentException("Invalid token: " + tokenIndex);
        return new Constituent(relation, tokenIndex, null);
    }

    public static Constituent phrase(String relation, PhraseSpan span) {
        if (span == null)
            throw new NullPointerException("span");
        return new Constituent(relation, -1, span);
    }

    public Constituent withRelation(String newRelation) {
        return new Constituent(newRelation, tokenIndex, span);
    }

    public String relation() {
        return relation;
    }

    public boolean isWord() {
        return span == null;
    }

    /**
     * Returns the token of a word constituent, or {@code -1} for a phrase.
     */
    public int tokenIndex() {
        return tokenIndex;
    }

    /**
     * Returns the phrase of a phrase constituent, or {@code null} for a word.
     */
    public PhraseSpan span() {
        return span;
    }

    /**
     * Returns the token that heads this constituent.
     */
    public int headIndex() {
        return (span == null) ? tokenIndex : span.headIndex();
    }

    public int start() {
        return (span == null) ? tokenIndex : span.start();
    }

    public int end() {
        return (span == null) ? tokenIndex : span.end();
    }

    /**
     * Returns every token covered by this constituent in surface order.
     */
    public List<Integer> tokenIndices() {
        return (span == null)
            ? ImmutableList.of(tokenIndex) : span.tokenIndices();
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Constituent))
            return false;
        Constituent c = (Constituent)o;
        return tokenIndex == c.tokenIndex
            && (relation == null ? c.relation == null
                : relation.equals(c.relation))
            && (span == null ? c.span == null : span.equals(c.span));
    }

    @Override public int hashCode() {
        return (span == null) ? tokenIndex : span.hashCode();
    }

    @Override public String toString() {
        String body = (span == null) ? String.valueOf(tokenIndex)
            : span.toString();
        return (relation == null) ? body : relation + ":" + body;
    }
}
