/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;
import ca.mcgill.cs.syntree.clause.ClauseType;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.phrase.Constituent;
import ca.mcgill.cs.syntree.phrase.EdgeLabels;
import ca.mcgill.cs.syntree.phrase.PhraseBuilder;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Turns the clauses of a sentence into one syntactic tree.  Each clause
 * becomes a clause node holding the phrase of its head; clause members that
 * no phrase placed are attached directly to the clause node.  The main clause
 * goes under the sentence root and every other clause is attached inside the
 * clause that governs it, under the smallest phrase headed by its governor.
 * The finished tree is checked against every {@link TreeInvariants invariant}.
 */
public class TreeAssembler {

    private final int maxPhraseDepth;

    public TreeAssembler() {
        this(PhraseBuilder.DEFAULT_MAX_DEPTH);
    }

    public TreeAssembler(int maxPhraseDepth) {
        this.maxPhraseDepth = maxPhraseDepth;
    }

    /**
     * Builds the tree for the sentence.
     *
     * @param graph the sentence
     * @param clauses a partition of the sentence's tokens into clauses, with
     *        exactly one main clause
     *
     * @throws TreeConstructionException if an attachment would create a cycle
     *         or the finished tree violates an invariant
     */
    public SyntacticTree assemble(DependencyGraph graph,
                                  List<ClauseBoundary> clauses) {
        SyntacticTree tree = new SyntacticTree(graph);
        PhraseBuilder builder = new PhraseBuilder(graph, maxPhraseDepth);

        Map<ClauseBoundary,SyntacticNode> clauseNodes =
            new IdentityHashMap<ClauseBoundary,SyntacticNode>();
        SyntacticNode mainNode = null;
        for (ClauseBoundary clause : clauses) {
            SyntacticNode clauseNode = buildClause(tree, builder, clause);
            clauseNodes.put(clause, clauseNode);
            if (clause.type() == ClauseType.MAIN) {
                if (mainNode != null)
                    throw new TreeConstructionException(
                        "More than one main clause", mainNode.id(),
                        clauseNode.id());
                mainNode = clauseNode;
            }
        }
        if (mainNode == null)
            throw new TreeConstructionException("No main clause");
        tree.root().addChild(mainNode, ClauseType.MAIN.label());

        for (ClauseBoundary clause : clauses) {
            if (clause.type() == ClauseType.MAIN)
                continue;
            SyntacticNode clauseNode = clauseNodes.get(clause);
            SyntacticNode target =
                attachmentPoint(tree, clause.governorIndex(), mainNode);
            SyntreeLogger.veryVerbose("Attaching %s under %s", clause, target);
            target.addChildInOrder(clauseNode, clause.type().label());
        }

        TreeInvariants.verify(tree);
        return tree;
    }

    private SyntacticNode buildClause(SyntacticTree tree,
                                      PhraseBuilder builder,
                                      ClauseBoundary clause) {
        SyntacticNode clauseNode = tree.newClauseNode(clause);
        Constituent head = builder.buildPhrase(clause.headIndex(), clause);
        clauseNode.addChild(tree.materialize(head), EdgeLabels.HEAD);

        // Anything the phrase builder could not place joins the clause itself
        DependencyGraph graph = tree.graph();
        for (Integer t : clause.tokenIndices()) {
            if (tree.wordNode(t) == null) {
                SyntacticNode word = tree.newWordNode(t);
                clauseNode.addChildInOrder(
                    word, EdgeLabels.forRelation(graph.relation(t)));
            }
        }
        return clauseNode;
    }

    /**
     * Returns the node under which a clause whose head depends on {@code
     * governor} is attached.  This is the node holding the governor's word,
     * which is the smallest phrase headed by the governor whenever the
     * governor heads one; a phrasal verb is not split, so its parent is used
     * instead.  Clauses without a governor go under the main clause.
     */
    private static SyntacticNode attachmentPoint(SyntacticTree tree,
                                                 int governor,
                                                 SyntacticNode mainNode) {
        if (governor < 0)
            return mainNode;
        SyntacticNode word = tree.wordNode(governor);
        if (word == null || word.parent() == null)
            return mainNode;
        SyntacticNode parent = word.parent();
        while (parent.isPhrase(PhraseType.PHRASAL_VERB)
                   && parent.parent() != null)
            parent = parent.parent();
        return parent;
    }
}
