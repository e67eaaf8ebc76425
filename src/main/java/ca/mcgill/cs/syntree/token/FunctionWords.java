/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/


package ca.mcgill.cs.syntree.token;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

public class FunctionWords {

    /**
     * Words that carry grammatical rather than lexical meaning: determiners,
     * pronouns, prepositions, conjunctions, auxiliaries and a few adverbs.
     */
    private static final String[] FUNCTION_WORDS_ = new String[] {
        "a", "an", "the", "this", "that", "these", "those", "my", "your", "his",
        "her", "its", "our", "their", "some", "any", "each", "every", "no",
        "i", "me", "you", "he", "him", "she", "it", "we", "us", "they", "them",
        "myself", "yourself", "himself", "herself", "itself", "ourselves",
        "yourselves", "themselves", "who", "whom", "whose", "which", "what",
        "whoever", "whomever", "whatever", "whichever", "one", "ones",
        "in", "on", "at", "by", "for", "with", "about", "against", "between",
        "into", "through", "during", "before", "after", "above", "below", "to",
        "from", "up", "down", "out", "off", "over", "under", "of", "as",
        "and", "or", "but", "nor", "so", "yet", "both", "either", "neither",
        "because", "since", "unless", "although", "though", "whereas", "while",
        "if", "whether", "than", "rather",
        "be", "am", "is", "are", "was", "were", "been", "being",
        "have", "has", "had", "having", "do", "does", "did", "doing",
        "will", "would", "shall", "should", "may", "might", "must",
        "can", "could", "ought",
        "not", "yes", "there", "here", "then", "now" };

    /**
     * The set of function words, all lower case.
     */
    public static final Set<String> FUNCTION_WORDS =
        new HashSet<String>(Arrays.asList(FUNCTION_WORDS_));

    private static final String[] PARTICLES_ = new String[] {
        "up", "down", "out", "off", "on", "in", "over", "away", "back",
        "through", "around", "along", "across", "by", "into", "after"
    };

    /**
     * Words that may act as the particle of a phrasal verb.
     */
    public static final Set<String> PARTICLES =
        new HashSet<String>(Arrays.asList(PARTICLES_));

    private static final String[] AUXILIARIES_ = new String[] {
        "be", "am", "is", "are", "was", "were", "been", "being",
        "have", "has", "had", "having", "do", "does", "did", "doing",
        "will", "would", "shall", "should", "may", "might", "must",
        "can", "could", "ought"
    };

    /**
     * Forms of the auxiliary and modal verbs.
     */
    public static final Set<String> AUXILIARIES =
        new HashSet<String>(Arrays.asList(AUXILIARIES_));

    public static boolean isFunctionWord(String word) {
        return FUNCTION_WORDS.contains(word.toLowerCase());
    }

    public static boolean isParticle(String word) {
        return PARTICLES.contains(word.toLowerCase());
    }
}
