/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ca.mcgill.cs.syntree.token.Token;


/**
 * Hand-parsed sentences shared by the tests, in the basic Stanford dependency
 * style.  Indices and heads are 0-based and a root is its own head.
 */
public final class Sentences {

    private Sentences() { }

    public static Token t(int index, String text, String lemma, String pos,
                          String tag, String rel, int head) {
        return new Token(index, text, lemma, pos, tag, rel, head);
    }

    public static List<Token> tokens(Token... tokens) {
        return new ArrayList<Token>(Arrays.asList(tokens));
    }

    /** "The cat eats fish." */
    public static List<Token> catEatsFish() {
        return tokens(
            t(0, "The", "the", "DET", "DT", "det", 1),
            t(1, "cat", "cat", "NOUN", "NN", "nsubj", 2),
            t(2, "eats", "eat", "VERB", "VBZ", "root", 2),
            t(3, "fish", "fish", "NOUN", "NN", "dobj", 2),
            t(4, ".", ".", "PUNCT", ".", "punct", 2));
    }

    /** "I bought a scooter" */
    public static List<Token> boughtAScooter() {
        return tokens(
            t(0, "I", "I", "PRON", "PRP", "nsubj", 1),
            t(1, "bought", "buy", "VERB", "VBD", "root", 1),
            t(2, "a", "a", "DET", "DT", "det", 3),
            t(3, "scooter", "scooter", "NOUN", "NN", "dobj", 1));
    }

    /** "I saw my fat friend" */
    public static List<Token> sawMyFatFriend() {
        return tokens(
            t(0, "I", "I", "PRON", "PRP", "nsubj", 1),
            t(1, "saw", "see", "VERB", "VBD", "root", 1),
            t(2, "my", "my", "PRON", "PRP$", "poss", 4),
            t(3, "fat", "fat", "ADJ", "JJ", "amod", 4),
            t(4, "friend", "friend", "NOUN", "NN", "dobj", 1));
    }

    /** "She looked up the word." */
    public static List<Token> lookedUpTheWord() {
        return tokens(
            t(0, "She", "she", "PRON", "PRP", "nsubj", 1),
            t(1, "looked", "look", "VERB", "VBD", "root", 1),
            t(2, "up", "up", "ADP", "RP", "prt", 1),
            t(3, "the", "the", "DET", "DT", "det", 4),
            t(4, "word", "word", "NOUN", "NN", "dobj", 1),
            t(5, ".", ".", "PUNCT", ".", "punct", 1));
    }

    /** "She ran over my friend." with "over" parsed as a preposition */
    public static List<Token> ranOverMyFriend() {
        return tokens(
            t(0, "She", "she", "PRON", "PRP", "nsubj", 1),
            t(1, "ran", "run", "VERB", "VBD", "root", 1),
            t(2, "over", "over", "ADP", "IN", "prep", 1),
            t(3, "my", "my", "PRON", "PRP$", "poss", 4),
            t(4, "friend", "friend", "NOUN", "NN", "pobj", 2),
            t(5, ".", ".", "PUNCT", ".", "punct", 1));
    }

    /** "The man who left saw me." */
    public static List<Token> manWhoLeft() {
        return tokens(
            t(0, "The", "the", "DET", "DT", "det", 1),
            t(1, "man", "man", "NOUN", "NN", "nsubj", 4),
            t(2, "who", "who", "PRON", "WP", "nsubj", 3),
            t(3, "left", "leave", "VERB", "VBD", "relcl", 1),
            t(4, "saw", "see", "VERB", "VBD", "root", 4),
            t(5, "me", "me", "PRON", "PRP", "dobj", 4),
            t(6, ".", ".", "PUNCT", ".", "punct", 4));
    }

    /** "I think she left." */
    public static List<Token> thinkSheLeft() {
        return tokens(
            t(0, "I", "I", "PRON", "PRP", "nsubj", 1),
            t(1, "think", "think", "VERB", "VBP", "root", 1),
            t(2, "she", "she", "PRON", "PRP", "nsubj", 3),
            t(3, "left", "leave", "VERB", "VBD", "ccomp", 1),
            t(4, ".", ".", "PUNCT", ".", "punct", 1));
    }

    /** "The big red ball" with no verb */
    public static List<Token> bigRedBall() {
        return tokens(
            t(0, "The", "the", "DET", "DT", "det", 3),
            t(1, "big", "big", "ADJ", "JJ", "amod", 3),
            t(2, "red", "red", "ADJ", "JJ", "amod", 3),
            t(3, "ball", "ball", "NOUN", "NN", "root", 3));
    }

    /**
     * Six tokens in which token 3's head is token 5 and token 5's head is
     * token 3.
     */
    public static List<Token> cyclic() {
        return tokens(
            t(0, "They", "they", "PRON", "PRP", "nsubj", 1),
            t(1, "said", "say", "VERB", "VBD", "root", 1),
            t(2, "that", "that", "SCONJ", "IN", "mark", 3),
            t(3, "dogs", "dog", "NOUN", "NNS", "nsubj", 5),
            t(4, "often", "often", "ADV", "RB", "advmod", 5),
            t(5, "bark", "bark", "VERB", "VBP", "ccomp", 3));
    }
}
