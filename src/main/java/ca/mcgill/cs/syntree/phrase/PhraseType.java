/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

public enum PhraseType {

    NOUN_PHRASE("NP"),

    VERB_PHRASE("VP"),

    PREP_PHRASE("PP"),

    /**
     * A verb and its particle acting as one lexical unit, e.g., "look up".
     */
    PHRASAL_VERB("PV"),

    /**
     * An adjective, adverb or other modifier together with its own modifiers,
     * e.g., "very big".
     */
    MODIFIER_PHRASE("MP"),

    /**
     * A word split into its lemma and an edge naming its inflection.
     */
    INFLECTION("INFL");

    private final String abbreviation;

    PhraseType(String abbreviation) {
        this.abbreviation = abbreviation;
    }

    public String abbreviation() {
        return abbreviation;
    }
}
