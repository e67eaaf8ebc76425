/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.clause;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.token.DependencyRelations;
import ca.mcgill.cs.syntree.token.TokenFeatures;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Partitions a sentence into clauses.  A clause is headed either by a root of
 * the parse or by a verb (or verbless predicate with a subject) that attaches
 * to its governor with one of the {@link DependencyRelations#CLAUSE_HEADS
 * clausal relations}.  Verbs in any other relation, e.g., auxiliaries,
 * coordinated verbs and open complements, stay in their governor's clause.
 * Every token then joins the clause of its nearest clause head above it.
 */
public class ClauseSegmenter {

    /**
     * Returns the clauses of the sentence ordered by their first token.  Every
     * token belongs to exactly one clause and exactly one clause is {@link
     * ClauseType#MAIN}.
     *
     * @throws NoClauseFoundException if the sentence has no verb
     */
    public List<ClauseBoundary> segment(DependencyGraph graph)
            throws NoClauseFoundException {
        int n = graph.size();
        boolean hasVerb = false;
        for (int i = 0; i < n && !hasVerb; ++i)
            hasVerb = graph.features(i).isVerb();
        if (!hasVerb)
            throw new NoClauseFoundException(
                "No verb in " + n + "-token sentence");

        TIntSet clauseHeads = new TIntHashSet();
        for (int i = 0; i < n; ++i) {
            if (isClauseHead(graph, i))
                clauseHeads.add(i);
        }

        int mainHead = graph.rootIndex();
        if (mainHead < 0) {
            // Every token has a head, so the graph is a cycle with no root.
            // Use the first clause head, or the first verb if none qualified
            mainHead = firstVerbOrHead(graph, clauseHeads);
            clauseHeads.add(mainHead);
        }

        TIntObjectMap<List<Integer>> members =
            new TIntObjectHashMap<List<Integer>>();
        for (int i = 0; i < n; ++i) {
            int head = mainHead;
            for (Integer a : graph.headChain(i)) {
                if (clauseHeads.contains(a)) {
                    head = a;
                    break;
                }
            }
            List<Integer> clause = members.get(head);
            if (clause == null) {
                clause = new ArrayList<Integer>();
                members.put(head, clause);
            }
            clause.add(i);
        }

        List<ClauseBoundary> clauses = new ArrayList<ClauseBoundary>();
        for (int head : members.keys()) {
            List<Integer> tokens = members.get(head);
            ClauseType type = (head == mainHead)
                ? ClauseType.MAIN
                : (DependencyRelations.isRelativeClause(graph.relation(head))
                   ? ClauseType.RELATIVE : ClauseType.SUBORDINATE);
            int governor = (head == mainHead) ? -1 : graph.head(head);
            clauses.add(new ClauseBoundary(
                type, head, governor, tokens, verbsOf(graph, tokens),
                subjectsOf(graph, tokens), false));
        }
        Collections.sort(clauses, new Comparator<ClauseBoundary>() {
                public int compare(ClauseBoundary c1, ClauseBoundary c2) {
                    return c1.start() - c2.start();
                }
            });
        SyntreeLogger.veryVerbose("Segmented %d tokens into %s", n, clauses);
        return clauses;
    }

    /**
     * Segments the sentence, returning the single {@link #fragment
     * fragment} clause if it has no verb.
     */
    public List<ClauseBoundary> segmentOrFragment(DependencyGraph graph) {
        try {
            return segment(graph);
        } catch (NoClauseFoundException ncfe) {
            SyntreeLogger.veryVerbose("Using a fragment clause: %s",
                                      ncfe.getMessage());
            return Collections.singletonList(fragment(graph));
        }
    }

    /**
     * Returns a single main clause that spans the whole sentence and is headed
     * by its first root (or first token, if the graph has no root).
     */
    public static ClauseBoundary fragment(DependencyGraph graph) {
        if (graph.size() == 0)
            throw new IllegalArgumentException("Empty sentence");
        List<Integer> all = new ArrayList<Integer>(graph.size());
        for (int i = 0; i < graph.size(); ++i)
            all.add(i);
        int head = Math.max(0, graph.rootIndex());
        return new ClauseBoundary(
            ClauseType.MAIN, head, -1, all, verbsOf(graph, all),
            subjectsOf(graph, all), true);
    }

    private static boolean isClauseHead(DependencyGraph graph, int i) {
        if (graph.isRoot(i))
            return true;
        if (!DependencyRelations.isClauseHead(graph.relation(i)))
            return false;
        if (graph.features(i).isVerb())
            return true;
        // A predicate adjective or noun with its own subject or copula, as in
        // "I think [she is happy]"
        for (Integer c : graph.children(i)) {
            String rel = graph.relation(c);
            if (DependencyRelations.isSubject(rel) || "cop".equals(rel))
                return true;
        }
        return false;
    }

    private static int firstVerbOrHead(DependencyGraph graph,
                                       TIntSet clauseHeads) {
        int first = -1;
        for (int h : clauseHeads.toArray()) {
            if (first < 0 || h < first)
                first = h;
        }
        if (first >= 0)
            return first;
        for (int i = 0; i < graph.size(); ++i) {
            if (graph.features(i).isVerb())
                return i;
        }
        return 0;
    }

    private static List<Integer> verbsOf(DependencyGraph graph,
                                         List<Integer> tokens) {
        List<Integer> verbs = new ArrayList<Integer>();
        for (Integer i : tokens) {
            TokenFeatures f = graph.features(i);
            if (f.isVerb())
                verbs.add(i);
        }
        return verbs;
    }

    private static List<Integer> subjectsOf(DependencyGraph graph,
                                            List<Integer> tokens) {
        List<Integer> subjects = new ArrayList<Integer>();
        for (Integer i : tokens) {
            if (DependencyRelations.isSubject(graph.relation(i))
                    && tokens.contains(graph.head(i)))
                subjects.add(i);
        }
        return subjects;
    }
}
