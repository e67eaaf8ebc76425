/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.token;


/**
 * One word of a dependency-parsed sentence, exactly as the parser produced it.
 * Tokens are immutable.  A token whose head is itself is a root of the parse.
 * The part of speech is the coarse universal tag ({@code NOUN}, {@code VERB},
 * ...), while the fine tag is the Penn Treebank tag, when the parser provides
 * one.
 */
public class Token {

    private final int index;

    private final String text;

    private final String lemma;

    private final String pos;

    private final String fineTag;

    private final String dependencyRelation;

    private final int headIndex;

    public Token(int index, String text, String lemma, String pos,
                 String fineTag, String dependencyRelation, int headIndex) {
        if (text == null)
            throw new NullPointerException("Token text cannot be null");
        if (index < 0)
            throw new IllegalArgumentException("negative index: " + index);
        this.index = index;
        this.text = text;
        this.lemma = (lemma == null || lemma.isEmpty()) ? text : lemma;
        this.pos = (pos == null || pos.isEmpty()) ? "X" : pos;
        this.fineTag = (fineTag == null) ? "" : fineTag;
        this.dependencyRelation = (dependencyRelation == null)
            ? "dep" : dependencyRelation;
        this.headIndex = headIndex;
    }

    /**
     * Creates a token with no Penn Treebank tag.
     */
    public Token(int index, String text, String lemma, String pos,
                 String dependencyRelation, int headIndex) {
        this(index, text, lemma, pos, "", dependencyRelation, headIndex);
    }

    public int index() {
        return index;
    }

    public String text() {
        return text;
    }

    public String lemma() {
        return lemma;
    }

    /**
     * Returns the coarse, universal part of speech.
     */
    public String pos() {
        return pos;
    }

    /**
     * Returns the Penn Treebank tag, or the empty string if the parser did
     * not supply one.
     */
    public String fineTag() {
        return fineTag;
    }

    /**
     * Returns the relation label exactly as the parser assigned it.
     */
    public String dependencyRelation() {
        return dependencyRelation;
    }

    public int headIndex() {
        return headIndex;
    }

    public boolean isRoot() {
        return headIndex == index;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Token))
            return false;
        Token t = (Token)o;
        return index == t.index
            && headIndex == t.headIndex
            && text.equals(t.text)
            && lemma.equals(t.lemma)
            && pos.equals(t.pos)
            && fineTag.equals(t.fineTag)
            && dependencyRelation.equals(t.dependencyRelation);
    }

    @Override public int hashCode() {
        return index ^ (text.hashCode() * 31) ^ (headIndex << 16);
    }

    @Override public String toString() {
        return index + ":" + text + "/" + pos + "<-" + dependencyRelation
            + "-" + headIndex;
    }
}
