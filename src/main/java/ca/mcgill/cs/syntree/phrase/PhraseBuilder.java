/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.token.DependencyRelations;
import ca.mcgill.cs.syntree.token.FunctionWords;
import ca.mcgill.cs.syntree.token.TokenFeatures;


/**
 * Groups the tokens of a clause into phrases.
 *
 * <p> Noun phrases are layered from the inside out rather than built flat:
 * the head noun is first grouped with its attributive modifiers ({@code
 * compound}, {@code amod}), that group is wrapped with possessors and numbers,
 * and the result is wrapped with determiners.  Anything after the noun
 * (prepositional phrases, conjuncts, appositions) forms a final layer.  So "my
 * fat friend" becomes {@code (NP poss:my core:(NP adj:fat head:friend))} and a
 * determiner is always a child of the phrase, never the parent of its noun.
 *
 * <p> Every build only uses tokens of the given clause, and each build keeps a
 * set of the tokens it has claimed, so no token can be placed twice even when
 * the dependency graph is malformed.  Nesting is bounded by a maximum depth;
 * dependents below that depth are not placed and are left for the tree
 * assembler to attach at the clause level.
 */
public class PhraseBuilder {

    public static final int DEFAULT_MAX_DEPTH = 32;

    /**
     * How many tokens after its verb a particle that the parser attached as an
     * adverb or preposition may appear.
     */
    static final int PARTICLE_WINDOW = 3;

    private final DependencyGraph graph;

    private final int maxDepth;

    public PhraseBuilder(DependencyGraph graph) {
        this(graph, DEFAULT_MAX_DEPTH);
    }

    public PhraseBuilder(DependencyGraph graph, int maxDepth) {
        if (maxDepth < 1)
            throw new IllegalArgumentException("maxDepth must be positive");
        this.graph = graph;
        this.maxDepth = maxDepth;
    }

    public DependencyGraph graph() {
        return graph;
    }

    /**
     * Builds whichever kind of phrase suits the token: a verb phrase for verbs
     * and for predicates that have a subject or copula, a prepositional phrase
     * for prepositions, a noun phrase for nominals and a modifier phrase
     * otherwise.  A token with no dependents in the clause is returned as a
     * single word.
     */
    public Constituent buildPhrase(int head, ClauseBoundary clause) {
        return build(head, clause, newClaimSet(head), 0);
    }

    /**
     * Builds the layered noun phrase headed by this token.
     */
    public Constituent buildNounPhrase(int head, ClauseBoundary clause) {
        return nounPhrase(head, clause, newClaimSet(head), 0);
    }

    /**
     * Builds the layered noun phrase headed by this token using only the
     * tokens in {@code allowed}.
     */
    public Constituent buildNounPhrase(int head, ClauseBoundary clause,
                                       Collection<Integer> allowed) {
        TIntSet claimed = newClaimSet(head);
        for (Integer t : clause.tokenIndices()) {
            if (!allowed.contains(t))
                claimed.add(t);
        }
        return nounPhrase(head, clause, claimed, 0);
    }

    /**
     * Builds the phrase of a preposition and its object.
     */
    public Constituent buildPrepPhrase(int prep, ClauseBoundary clause) {
        return prepPhrase(prep, clause, newClaimSet(prep), 0);
    }

    /**
     * Builds the verb phrase headed by this token, with its subjects,
     * auxiliaries, objects, modifiers and complements as children in surface
     * order.
     */
    public Constituent buildVerbPhrase(int head, ClauseBoundary clause) {
        return verbPhrase(head, clause, newClaimSet(head), 0);
    }

    /**
     * Returns the phrasal verb formed by the verb and one of its particles, or
     * {@code null} if the verb has no particle.
     */
    public PhraseSpan detectPhrasalVerb(int verb, ClauseBoundary clause) {
        List<Integer> deps = new ArrayList<Integer>();
        for (Integer c : graph.children(verb)) {
            if (clause.contains(c))
                deps.add(c);
        }
        int particle = findParticle(verb, deps);
        return (particle < 0) ? null : phrasalVerb(verb, particle);
    }

    private static TIntSet newClaimSet(int head) {
        TIntSet claimed = new TIntHashSet();
        claimed.add(head);
        return claimed;
    }

    private Constituent build(int i, ClauseBoundary clause, TIntSet claimed,
                              int depth) {
        claimed.add(i);
        if (depth >= maxDepth)
            return Constituent.word(null, i);
        TokenFeatures f = graph.features(i);
        String rel = f.relation();
        if (DependencyRelations.isPrepositional(rel) && !f.isVerb())
            return prepPhrase(i, clause, claimed, depth);
        if (f.isVerb() || hasPredicateArguments(i, clause, claimed))
            return verbPhrase(i, clause, claimed, depth);
        if (f.isNominal()) {
            if (DependencyRelations.OBLIQUES.contains(rel)
                    && !available(i, clause, claimed, "case").isEmpty())
                return obliquePhrase(i, clause, claimed, depth);
            return nounPhrase(i, clause, claimed, depth);
        }
        return modifierPhrase(i, clause, claimed, depth);
    }

    private Constituent nounPhrase(int head, ClauseBoundary clause,
                                   TIntSet claimed, int depth) {
        List<Integer> deps = claim(head, clause, claimed);
        if (deps.isEmpty())
            return Constituent.word(null, head);

        List<Integer> attributive = new ArrayList<Integer>();
        List<Integer> quantifying = new ArrayList<Integer>();
        List<Integer> determiners = new ArrayList<Integer>();
        List<Integer> post = new ArrayList<Integer>();
        for (Integer d : deps) {
            String rel = graph.relation(d);
            if (DependencyRelations.ATTRIBUTIVE_MODIFIERS.contains(rel))
                attributive.add(d);
            else if (DependencyRelations.QUANTIFYING_MODIFIERS.contains(rel))
                quantifying.add(d);
            else if (DependencyRelations.DETERMINERS.contains(rel))
                determiners.add(d);
            else
                post.add(d);
        }

        // Layer 1: head noun with compounds and adjectives
        Constituent inner = Constituent.word(null, head);
        if (!attributive.isEmpty()) {
            List<Constituent> children = new ArrayList<Constituent>();
            children.add(inner.withRelation(EdgeLabels.HEAD));
            for (Integer d : attributive) {
                String label = "amod".equals(graph.relation(d))
                    ? EdgeLabels.ADJ : EdgeLabels.COMPOUND;
                children.add(build(d, clause, claimed, depth + 1)
                             .withRelation(label));
            }
            inner = wrap(PhraseType.NOUN_PHRASE, head, children);
        }

        // Layer 2: possessors and numbers
        if (!quantifying.isEmpty()) {
            List<Constituent> children = new ArrayList<Constituent>();
            children.add(inner.withRelation(innerLabel(inner)));
            for (Integer d : quantifying) {
                String label = "poss".equals(graph.relation(d))
                    ? EdgeLabels.POSS : EdgeLabels.NUM;
                children.add(build(d, clause, claimed, depth + 1)
                             .withRelation(label));
            }
            inner = wrap(PhraseType.NOUN_PHRASE, head, children);
        }

        // Layer 3: determiners
        if (!determiners.isEmpty()) {
            List<Constituent> children = new ArrayList<Constituent>();
            children.add(inner.withRelation(innerLabel(inner)));
            for (Integer d : determiners) {
                children.add(build(d, clause, claimed, depth + 1)
                             .withRelation(EdgeLabels.DET));
            }
            inner = wrap(PhraseType.NOUN_PHRASE, head, children);
        }

        // Layer 4: everything else, mostly after the noun
        if (!post.isEmpty()) {
            List<Constituent> children = new ArrayList<Constituent>();
            children.add(inner.withRelation(innerLabel(inner)));
            for (Integer d : post) {
                children.add(build(d, clause, claimed, depth + 1)
                             .withRelation(labelFor(d)));
            }
            inner = wrap(PhraseType.NOUN_PHRASE, head, children);
        }
        return inner;
    }

    private Constituent prepPhrase(int prep, ClauseBoundary clause,
                                   TIntSet claimed, int depth) {
        List<Integer> deps = claim(prep, clause, claimed);
        if (deps.isEmpty())
            return Constituent.word(null, prep);
        List<Constituent> children = new ArrayList<Constituent>();
        children.add(Constituent.word(EdgeLabels.PREP, prep));
        for (Integer d : deps) {
            String rel = graph.relation(d);
            String label = "pobj".equals(rel) ? EdgeLabels.POBJ
                : ("pcomp".equals(rel) ? EdgeLabels.PCOMP : labelFor(d));
            children.add(build(d, clause, claimed, depth + 1)
                         .withRelation(label));
        }
        return wrap(PhraseType.PREP_PHRASE, prep, children);
    }

    /**
     * Builds the prepositional phrase for a noun that, in the Universal
     * Dependencies style, governs its own preposition through a {@code case}
     * relation.  The preposition heads the resulting phrase, as it does for
     * the {@code prep}/{@code pobj} style.
     */
    private Constituent obliquePhrase(int noun, ClauseBoundary clause,
                                      TIntSet claimed, int depth) {
        List<Integer> cases = available(noun, clause, claimed, "case");
        for (Integer c : cases)
            claimed.add(c);
        List<Constituent> children = new ArrayList<Constituent>();
        for (Integer c : cases)
            children.add(Constituent.word(EdgeLabels.PREP, c));
        children.add(nounPhrase(noun, clause, claimed, depth + 1)
                     .withRelation(EdgeLabels.POBJ));
        return wrap(PhraseType.PREP_PHRASE, cases.get(0), children);
    }

    private Constituent verbPhrase(int head, ClauseBoundary clause,
                                   TIntSet claimed, int depth) {
        List<Integer> deps = claim(head, clause, claimed);
        boolean isVerb = graph.features(head).isVerb();
        Constituent verb = null;
        if (isVerb) {
            int particle = findParticle(head, deps);
            if (particle >= 0) {
                deps.remove(Integer.valueOf(particle));
                verb = Constituent.phrase(
                    EdgeLabels.VERB, phrasalVerb(head, particle));
            }
            else if (deps.isEmpty())
                return Constituent.word(null, head);
            else
                verb = Constituent.word(EdgeLabels.VERB, head);
        }
        else {
            // A predicate noun or adjective keeps its own modifiers, while its
            // subject, copula and other clause-level dependents join the verb
            // phrase
            List<Integer> own = new ArrayList<Integer>();
            for (Integer d : deps) {
                if (isPredicateModifier(graph.relation(d)))
                    own.add(d);
            }
            deps.removeAll(own);
            claimed.removeAll(own);
            Constituent pred = graph.features(head).isNominal()
                ? nounPhrase(head, clause, claimed, depth + 1)
                : modifierPhrase(head, clause, claimed, depth + 1);
            verb = pred.withRelation(EdgeLabels.PRED);
        }

        List<Constituent> children = new ArrayList<Constituent>();
        children.add(verb);
        for (Integer d : deps) {
            children.add(build(d, clause, claimed, depth + 1)
                         .withRelation(verbDependentLabel(d)));
        }
        return wrap(PhraseType.VERB_PHRASE, head, children);
    }

    private Constituent modifierPhrase(int head, ClauseBoundary clause,
                                       TIntSet claimed, int depth) {
        List<Integer> deps = claim(head, clause, claimed);
        if (deps.isEmpty())
            return Constituent.word(null, head);
        List<Constituent> children = new ArrayList<Constituent>();
        children.add(Constituent.word(EdgeLabels.HEAD, head));
        for (Integer d : deps) {
            children.add(build(d, clause, claimed, depth + 1)
                         .withRelation(labelFor(d)));
        }
        return wrap(PhraseType.MODIFIER_PHRASE, head, children);
    }

    /**
     * Returns the dependent of the verb that is its particle, or {@code -1}.
     * A {@code prt} dependent always qualifies.  Otherwise an adverb or
     * preposition qualifies if its lemma is a known particle, it closely
     * follows the verb and it has no object of its own.
     */
    private int findParticle(int verb, List<Integer> deps) {
        for (Integer d : deps) {
            if ("prt".equals(graph.relation(d)))
                return d;
        }
        for (Integer d : deps) {
            String rel = graph.relation(d);
            if (!("advmod".equals(rel) || "prep".equals(rel)))
                continue;
            if (d > verb && d - verb <= PARTICLE_WINDOW
                    && FunctionWords.isParticle(graph.token(d).lemma())
                    && !governsObject(d))
                return d;
        }
        return -1;
    }

    private boolean governsObject(int i) {
        for (Integer c : graph.children(i)) {
            String rel = graph.relation(c);
            if ("pobj".equals(rel) || "pcomp".equals(rel)
                    || DependencyRelations.isDirectObject(rel))
                return true;
        }
        return false;
    }

    private static PhraseSpan phrasalVerb(int verb, int particle) {
        List<Constituent> children = new ArrayList<Constituent>(2);
        children.add(Constituent.word(EdgeLabels.VERB, verb));
        children.add(Constituent.word(EdgeLabels.PARTICLE, particle));
        return new PhraseSpan(PhraseType.PHRASAL_VERB, verb, children);
    }

    private boolean hasPredicateArguments(int i, ClauseBoundary clause,
                                          TIntSet claimed) {
        for (Integer c : graph.children(i)) {
            if (!clause.contains(c) || claimed.contains(c))
                continue;
            String rel = graph.relation(c);
            if (DependencyRelations.isSubject(rel) || "cop".equals(rel))
                return true;
        }
        return false;
    }

    private static boolean isPredicateModifier(String rel) {
        return DependencyRelations.ATTRIBUTIVE_MODIFIERS.contains(rel)
            || DependencyRelations.QUANTIFYING_MODIFIERS.contains(rel)
            || DependencyRelations.DETERMINERS.contains(rel)
            || "case".equals(rel) || "prep".equals(rel)
            || "nmod".equals(rel) || "appos".equals(rel);
    }

    private String verbDependentLabel(int d) {
        String rel = graph.relation(d);
        if (DependencyRelations.isSubject(rel))
            return EdgeLabels.SUBJ;
        if ("cop".equals(rel))
            return EdgeLabels.COP;
        if (DependencyRelations.isAuxiliary(rel))
            return EdgeLabels.AUX;
        if (DependencyRelations.isDirectObject(rel))
            return EdgeLabels.OBJ;
        if (DependencyRelations.isIndirectObject(rel))
            return EdgeLabels.IOBJ;
        return labelFor(d);
    }

    /**
     * Returns the edge label of a dependent with no position-specific role.
     */
    private String labelFor(int d) {
        String rel = graph.relation(d);
        if (DependencyRelations.isPrepositional(rel))
            return EdgeLabels.PREP_PHRASE;
        if (DependencyRelations.OBLIQUES.contains(rel)
                && !graph.children(d, "case").isEmpty())
            return EdgeLabels.PREP_PHRASE;
        return EdgeLabels.forRelation(rel);
    }

    private static String innerLabel(Constituent inner) {
        return inner.isWord() ? EdgeLabels.HEAD : EdgeLabels.CORE;
    }

    private static Constituent wrap(PhraseType type, int head,
                                    List<Constituent> children) {
        return Constituent.phrase(null, new PhraseSpan(type, head, children));
    }

    /**
     * Returns the dependents of {@code i} that belong to the clause and have
     * not been claimed yet, and claims them.
     */
    private List<Integer> claim(int i, ClauseBoundary clause,
                                TIntSet claimed) {
        List<Integer> deps = new ArrayList<Integer>();
        for (Integer c : graph.children(i)) {
            if (clause.contains(c) && claimed.add(c))
                deps.add(c);
        }
        return deps;
    }

    private List<Integer> available(int i, ClauseBoundary clause,
                                    TIntSet claimed, String relation) {
        List<Integer> deps = new ArrayList<Integer>();
        for (Integer c : graph.children(i, relation)) {
            if (clause.contains(c) && !claimed.contains(c))
                deps.add(c);
        }
        return deps;
    }
}
