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


/**
 * The dependency relation vocabulary used by the tree builders.  Parsers
 * disagree on labels (Stanford basic dependencies, ClearNLP and Universal
 * Dependencies all name the same relations differently), so every label is
 * first {@link #normalize(String) normalized} to one vocabulary and the
 * relation classes below are defined over normalized labels only.
 */
public final class DependencyRelations {

    public static final String ROOT = "root";

    public static final String PUNCT = "punct";

    private static final Map<String,String> ALIASES =
        new HashMap<String,String>();

    static {
        ALIASES.put("obj", "dobj");
        ALIASES.put("compound:prt", "prt");
        ALIASES.put("nmod:poss", "poss");
        ALIASES.put("possessive", "case");
        ALIASES.put("nsubj:pass", "nsubjpass");
        ALIASES.put("csubj:pass", "csubjpass");
        ALIASES.put("aux:pass", "auxpass");
        ALIASES.put("nn", "compound");
        ALIASES.put("num", "nummod");
        ALIASES.put("det:predet", "predet");
        ALIASES.put("acl:relcl", "relcl");
        ALIASES.put("rcmod", "relcl");
        ALIASES.put("nmod:tmod", "tmod");
        ALIASES.put("obl:tmod", "tmod");
        ALIASES.put("nmod:npmod", "npadvmod");
        ALIASES.put("obl:npmod", "npadvmod");
        ALIASES.put("cc:preconj", "preconj");
    }

    private static final String[] SUBJECTS_ = new String[] {
        "nsubj", "nsubjpass", "csubj", "csubjpass", "expl" };

    public static final Set<String> SUBJECTS =
        new HashSet<String>(Arrays.asList(SUBJECTS_));

    private static final String[] DIRECT_OBJECTS_ = new String[] {
        "dobj", "attr", "oprd" };

    public static final Set<String> DIRECT_OBJECTS =
        new HashSet<String>(Arrays.asList(DIRECT_OBJECTS_));

    private static final String[] INDIRECT_OBJECTS_ = new String[] {
        "iobj", "dative" };

    public static final Set<String> INDIRECT_OBJECTS =
        new HashSet<String>(Arrays.asList(INDIRECT_OBJECTS_));

    private static final String[] AUXILIARIES_ = new String[] {
        "aux", "auxpass", "cop" };

    public static final Set<String> AUXILIARIES =
        new HashSet<String>(Arrays.asList(AUXILIARIES_));

    private static final String[] ADVERBIALS_ = new String[] {
        "advmod", "npadvmod", "tmod", "neg", "discourse" };

    public static final Set<String> ADVERBIALS =
        new HashSet<String>(Arrays.asList(ADVERBIALS_));

    private static final String[] COMPLEMENTS_ = new String[] {
        "xcomp", "acomp" };

    public static final Set<String> COMPLEMENTS =
        new HashSet<String>(Arrays.asList(COMPLEMENTS_));

    /**
     * Relations by which a verb heads a clause of its own rather than joining
     * the clause of its governor.
     */
    private static final String[] CLAUSE_HEADS_ = new String[] {
        "ccomp", "advcl", "relcl", "acl", "csubj", "csubjpass", "parataxis" };

    public static final Set<String> CLAUSE_HEADS =
        new HashSet<String>(Arrays.asList(CLAUSE_HEADS_));

    private static final String[] RELATIVE_CLAUSES_ = new String[] {
        "relcl", "acl" };

    public static final Set<String> RELATIVE_CLAUSES =
        new HashSet<String>(Arrays.asList(RELATIVE_CLAUSES_));

    /**
     * Innermost noun modifiers, grouped with the head noun first.
     */
    private static final String[] ATTRIBUTIVE_MODIFIERS_ = new String[] {
        "compound", "amod" };

    public static final Set<String> ATTRIBUTIVE_MODIFIERS =
        new HashSet<String>(Arrays.asList(ATTRIBUTIVE_MODIFIERS_));

    private static final String[] QUANTIFYING_MODIFIERS_ = new String[] {
        "poss", "nummod" };

    public static final Set<String> QUANTIFYING_MODIFIERS =
        new HashSet<String>(Arrays.asList(QUANTIFYING_MODIFIERS_));

    private static final String[] DETERMINERS_ = new String[] {
        "det", "predet" };

    public static final Set<String> DETERMINERS =
        new HashSet<String>(Arrays.asList(DETERMINERS_));

    /**
     * Relations by which a noun attaches to its governor through a
     * case-marking preposition in Universal Dependencies.
     */
    private static final String[] OBLIQUES_ = new String[] {
        "nmod", "obl" };

    public static final Set<String> OBLIQUES =
        new HashSet<String>(Arrays.asList(OBLIQUES_));

    private DependencyRelations() { }

    /**
     * Returns the label in the builder vocabulary for a relation label produced
     * by any of the supported parser conventions.
     */
    public static String normalize(String relation) {
        if (relation == null || relation.isEmpty())
            return "dep";
        String rel = relation.toLowerCase();
        String alias = ALIASES.get(rel);
        if (alias != null)
            return alias;
        // Keep only the universal part of language-specific subtypes, e.g.
        // "nmod:of" becomes "nmod"
        int colon = rel.indexOf(':');
        if (colon > 0)
            rel = rel.substring(0, colon);
        alias = ALIASES.get(rel);
        return (alias == null) ? rel : alias;
    }

    public static boolean isSubject(String rel) {
        return SUBJECTS.contains(rel);
    }

    public static boolean isDirectObject(String rel) {
        return DIRECT_OBJECTS.contains(rel);
    }

    public static boolean isIndirectObject(String rel) {
        return INDIRECT_OBJECTS.contains(rel);
    }

    public static boolean isAuxiliary(String rel) {
        return AUXILIARIES.contains(rel);
    }

    public static boolean isAdverbial(String rel) {
        return ADVERBIALS.contains(rel);
    }

    public static boolean isComplement(String rel) {
        return COMPLEMENTS.contains(rel);
    }

    public static boolean isClauseHead(String rel) {
        return CLAUSE_HEADS.contains(rel);
    }

    public static boolean isRelativeClause(String rel) {
        return RELATIVE_CLAUSES.contains(rel);
    }

    public static boolean isPrepositional(String rel) {
        return "prep".equals(rel);
    }

    public static boolean isPunctuation(String rel) {
        return PUNCT.equals(rel);
    }
}
