/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.token;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import edu.mit.jwi.item.POS;


/**
 * Conversions between the part-of-speech tag sets in play: Penn Treebank tags
 * (what CoreNLP and CoNLL-X files carry), the coarse universal tags the tree
 * builders work with, and the four WordNet parts of speech.
 */
public final class PartsOfSpeech {

    public static final String NOUN = "NOUN";
    public static final String PROPN = "PROPN";
    public static final String VERB = "VERB";
    public static final String AUX = "AUX";
    public static final String ADJ = "ADJ";
    public static final String ADV = "ADV";
    public static final String NUM = "NUM";
    public static final String PUNCT = "PUNCT";

    private static final String[] CONTENT_TAGS_ = new String[] {
        NOUN, VERB, ADJ, ADV, PROPN, NUM };

    /**
     * Universal tags of words that carry lexical meaning.
     */
    public static final Set<String> CONTENT_TAGS =
        new HashSet<String>(Arrays.asList(CONTENT_TAGS_));

    private static final String[] FUNCTION_TAGS_ = new String[] {
        "DET", "PRON", "ADP", "CCONJ", "SCONJ", AUX, "PART" };

    /**
     * Universal tags of words with a grammatical role.
     */
    public static final Set<String> FUNCTION_TAGS =
        new HashSet<String>(Arrays.asList(FUNCTION_TAGS_));

    private static final String[] OTHER_TAGS_ = new String[] {
        PUNCT, "INTJ", "SYM", "X" };

    private static final Set<String> UNIVERSAL_TAGS = new HashSet<String>();

    static {
        UNIVERSAL_TAGS.addAll(CONTENT_TAGS);
        UNIVERSAL_TAGS.addAll(FUNCTION_TAGS);
        UNIVERSAL_TAGS.addAll(Arrays.asList(OTHER_TAGS_));
    }

    private static final Map<String,String> PENN_TO_UNIVERSAL =
        new HashMap<String,String>();

    static {
        String[][] table = new String[][] {
            { "NN", NOUN }, { "NNS", NOUN }, { "NNP", PROPN }, { "NNPS", PROPN },
            { "VB", VERB }, { "VBD", VERB }, { "VBG", VERB }, { "VBN", VERB },
            { "VBP", VERB }, { "VBZ", VERB }, { "MD", AUX },
            { "JJ", ADJ }, { "JJR", ADJ }, { "JJS", ADJ },
            { "RB", ADV }, { "RBR", ADV }, { "RBS", ADV }, { "WRB", ADV },
            { "CD", NUM }, { "DT", "DET" }, { "PDT", "DET" }, { "WDT", "DET" },
            { "PRP", "PRON" }, { "PRP$", "PRON" }, { "WP", "PRON" },
            { "WP$", "PRON" }, { "EX", "PRON" }, { "IN", "ADP" },
            { "RP", "ADP" }, { "TO", "PART" }, { "POS", "PART" },
            { "CC", "CCONJ" }, { "UH", "INTJ" }, { "SYM", "SYM" },
            { "FW", "X" }, { "LS", "X" }, { "$", "SYM" }, { "#", "SYM" },
            { ".", PUNCT }, { ",", PUNCT }, { ":", PUNCT }, { "``", PUNCT },
            { "''", PUNCT }, { "-LRB-", PUNCT }, { "-RRB-", PUNCT },
            { "HYPH", PUNCT }, { "NFP", PUNCT },
        };
        for (String[] row : table)
            PENN_TO_UNIVERSAL.put(row[0], row[1]);
    }

    private PartsOfSpeech() { }

    /**
     * Returns the universal tag for a Penn Treebank tag.  Verbs in the
     * auxiliary relation whose lemma is an auxiliary become {@code AUX}, since
     * the Penn tag set does not separate them.  Unknown tags map to {@code X}.
     *
     * @param pennTag the Penn Treebank tag
     * @param lemma the word's lemma, used to recognize auxiliaries
     * @param relation the normalized dependency relation of the word
     */
    public static String toUniversal(String pennTag, String lemma,
                                     String relation) {
        String upos = PENN_TO_UNIVERSAL.get(pennTag);
        if (upos == null)
            return "X";
        if (upos.equals(VERB)
                && DependencyRelations.isAuxiliary(relation)
                && FunctionWords.AUXILIARIES.contains(lemma.toLowerCase()))
            return AUX;
        return upos;
    }

    /**
     * Returns the WordNet part of speech for a universal tag, or {@code null}
     * if words with this tag are not in WordNet.
     */
    public static POS toWordNet(String upos) {
        if (NOUN.equals(upos) || PROPN.equals(upos))
            return POS.NOUN;
        if (VERB.equals(upos))
            return POS.VERB;
        if (ADJ.equals(upos))
            return POS.ADJECTIVE;
        if (ADV.equals(upos))
            return POS.ADVERB;
        return null;
    }

    /**
     * Returns {@code true} if the tag is one of the universal tags rather
     * than a Penn Treebank tag.
     */
    public static boolean isUniversal(String tag) {
        return UNIVERSAL_TAGS.contains(tag);
    }

    public static boolean isVerbal(String upos, String pennTag) {
        return VERB.equals(upos) || AUX.equals(upos) || pennTag.startsWith("VB");
    }

    public static boolean isNominal(String upos) {
        return NOUN.equals(upos) || PROPN.equals(upos) || "PRON".equals(upos)
            || NUM.equals(upos);
    }
}
