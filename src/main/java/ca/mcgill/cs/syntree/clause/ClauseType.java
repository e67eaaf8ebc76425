/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.clause;

/**
 * The role of a clause within its sentence.
 */
public enum ClauseType {

    /**
     * The independent clause that the sentence root heads.  Every sentence has
     * exactly one.
     */
    MAIN("main_clause"),

    SUBORDINATE("sub_clause"),

    /**
     * A clause that modifies a noun.
     */
    RELATIVE("rel_clause");

    private final String label;

    ClauseType(String label) {
        this.label = label;
    }

    /**
     * Returns the relation label a clause of this type carries under its
     * parent in the syntactic tree.
     */
    public String label() {
        return label;
    }
}
