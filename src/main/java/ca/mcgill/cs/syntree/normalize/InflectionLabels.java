/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import java.util.HashMap;
import java.util.Map;

import ca.mcgill.cs.syntree.token.PartsOfSpeech;
import ca.mcgill.cs.syntree.token.Token;


/**
 * Names the inflection that turns a lemma into its surface form, e.g., {@code
 * past} for "looked" or {@code plural} for "cats".
 */
public final class InflectionLabels {

    public static final String FORM = "form";

    private static final Map<String,String> TAG_TO_LABEL =
        new HashMap<String,String>();

    static {
        TAG_TO_LABEL.put("VB", "base");
        TAG_TO_LABEL.put("VBD", "past");
        TAG_TO_LABEL.put("VBG", "gerund");
        TAG_TO_LABEL.put("VBN", "past_part");
        TAG_TO_LABEL.put("VBP", "present");
        TAG_TO_LABEL.put("VBZ", "present_3sg");
        TAG_TO_LABEL.put("NN", "singular");
        TAG_TO_LABEL.put("NNS", "plural");
        TAG_TO_LABEL.put("NNP", "proper_sg");
        TAG_TO_LABEL.put("NNPS", "proper_pl");
        TAG_TO_LABEL.put("JJ", "positive");
        TAG_TO_LABEL.put("JJR", "comparative");
        TAG_TO_LABEL.put("JJS", "superlative");
        TAG_TO_LABEL.put("RB", "positive");
        TAG_TO_LABEL.put("RBR", "comparative");
        TAG_TO_LABEL.put("RBS", "superlative");
    }

    private InflectionLabels() { }

    /**
     * Returns the inflection label of the token, from its Penn Treebank tag if
     * it has one and otherwise from how its surface form differs from its
     * lemma.  Returns {@link #FORM} when neither says anything.
     */
    public static String labelFor(Token token) {
        String label = TAG_TO_LABEL.get(token.fineTag());
        if (label != null)
            return label;
        String pos = token.pos();
        String text = token.text().toLowerCase();
        if (PartsOfSpeech.VERB.equals(pos)) {
            if (text.endsWith("ing"))
                return "gerund";
            if (text.endsWith("ed"))
                return "past";
            if (text.endsWith("s"))
                return "present_3sg";
        }
        else if (PartsOfSpeech.NOUN.equals(pos)) {
            if (text.endsWith("s"))
                return "plural";
        }
        else if (PartsOfSpeech.ADJ.equals(pos)
                 || PartsOfSpeech.ADV.equals(pos)) {
            if (text.endsWith("est"))
                return "superlative";
            if (text.endsWith("er"))
                return "comparative";
        }
        return FORM;
    }
}
