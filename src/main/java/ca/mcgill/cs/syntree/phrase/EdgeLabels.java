/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import java.util.HashMap;
import java.util.Map;

import ca.mcgill.cs.syntree.token.DependencyRelations;


/**
 * The labels on the edges of a syntactic tree, each naming the role of a node
 * under its parent.
 */
public final class EdgeLabels {

    public static final String SUBJ = "subj";
    public static final String VERB = "verb";
    public static final String PRED = "pred";
    public static final String OBJ = "obj";
    public static final String IOBJ = "iobj";
    public static final String AUX = "aux";
    public static final String COP = "cop";
    public static final String MOD = "mod";
    public static final String COMP = "comp";
    public static final String MARK = "mark";
    public static final String PREP_PHRASE = "prep_phrase";
    public static final String PREP = "prep";
    public static final String POBJ = "pobj";
    public static final String PCOMP = "pcomp";
    public static final String CONJ = "conj";
    public static final String CC = "cc";
    public static final String APPOS = "appos";
    public static final String CASE = "case";
    public static final String PUNCT = "punct";

    public static final String HEAD = "head";
    public static final String CORE = "core";
    public static final String ADJ = "adj";
    public static final String COMPOUND = "compound";
    public static final String POSS = "poss";
    public static final String NUM = "num";
    public static final String DET = "det";

    public static final String PARTICLE = "particle";

    /**
     * A member of a group formed from several sibling objects.
     */
    public static final String PART = "part";

    /**
     * The label of the sentence root, which has no parent.
     */
    public static final String SENTENCE = "sentence";

    private static final Map<String,String> DEPENDENCY_TO_EDGE =
        new HashMap<String,String>();

    static {
        DEPENDENCY_TO_EDGE.put("amod", ADJ);
        DEPENDENCY_TO_EDGE.put("nummod", NUM);
        DEPENDENCY_TO_EDGE.put("predet", DET);
        DEPENDENCY_TO_EDGE.put("prt", PARTICLE);
        DEPENDENCY_TO_EDGE.put("auxpass", AUX);
        DEPENDENCY_TO_EDGE.put("prep", PREP_PHRASE);
        DEPENDENCY_TO_EDGE.put("dative", IOBJ);
        DEPENDENCY_TO_EDGE.put("preconj", CC);
        DEPENDENCY_TO_EDGE.put("obl", MOD);
    }

    private EdgeLabels() { }

    /**
     * Returns the edge label for a dependent that joins a phrase through the
     * given normalized dependency relation and has no more specific role.
     */
    public static String forRelation(String relation) {
        if (DependencyRelations.isSubject(relation))
            return SUBJ;
        if (DependencyRelations.isDirectObject(relation))
            return OBJ;
        if (DependencyRelations.isAdverbial(relation))
            return MOD;
        if (DependencyRelations.isComplement(relation))
            return COMP;
        String label = DEPENDENCY_TO_EDGE.get(relation);
        return (label == null) ? relation : label;
    }
}
