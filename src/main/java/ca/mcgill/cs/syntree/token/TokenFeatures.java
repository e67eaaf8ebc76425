/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.token;

import edu.mit.jwi.item.POS;


/**
 * The lexical features of a {@link Token} that the builders consult
 * repeatedly.  Features are derived once, when the token enters a {@link
 * ca.mcgill.cs.syntree.graph.DependencyGraph}, and are never changed.
 */
public class TokenFeatures {

    private final Token token;

    private final String relation;

    private final boolean isContentWord;

    private final boolean isFunctionWord;

    private final boolean isPunctuation;

    private final boolean isVerb;

    private final boolean isNominal;

    private final POS wordNetPos;

    private TokenFeatures(Token token) {
        this.token = token;
        this.relation = DependencyRelations.normalize(token.dependencyRelation());
        String pos = token.pos();
        String text = token.text();

        isPunctuation = PartsOfSpeech.PUNCT.equals(pos)
            || DependencyRelations.isPunctuation(relation)
            || isPunctuationText(text);
        isFunctionWord = !isPunctuation
            && (PartsOfSpeech.FUNCTION_TAGS.contains(pos)
                || FunctionWords.isFunctionWord(text));
        isContentWord = !isPunctuation && !isFunctionWord
            && PartsOfSpeech.CONTENT_TAGS.contains(pos);
        isVerb = !isPunctuation
            && PartsOfSpeech.isVerbal(pos, token.fineTag());
        isNominal = !isPunctuation && PartsOfSpeech.isNominal(pos);
        wordNetPos = PartsOfSpeech.toWordNet(pos);
    }

    public static TokenFeatures of(Token token) {
        return new TokenFeatures(token);
    }

    private static boolean isPunctuationText(String text) {
        if (text.isEmpty())
            return false;
        for (int i = 0; i < text.length(); ++i) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || Character.isWhitespace(c))
                return false;
        }
        return true;
    }

    public Token token() {
        return token;
    }

    /**
     * Returns the token's {@link DependencyRelations#normalize(String)
     * normalized} relation.
     */
    public String relation() {
        return relation;
    }

    public boolean isContentWord() {
        return isContentWord;
    }

    public boolean isFunctionWord() {
        return isFunctionWord;
    }

    public boolean isPunctuation() {
        return isPunctuation;
    }

    /**
     * Returns {@code true} for verbs and auxiliaries.
     */
    public boolean isVerb() {
        return isVerb;
    }

    public boolean isNominal() {
        return isNominal;
    }

    /**
     * Returns the WordNet part of speech under which this token's senses are
     * listed, or {@code null} if it has none.
     */
    public POS wordNetPos() {
        return wordNetPos;
    }

    @Override public String toString() {
        return token + (isContentWord ? "[content]" : "")
            + (isFunctionWord ? "[function]" : "")
            + (isPunctuation ? "[punct]" : "");
    }
}
