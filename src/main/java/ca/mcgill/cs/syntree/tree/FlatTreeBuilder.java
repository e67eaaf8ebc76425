/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;
import ca.mcgill.cs.syntree.clause.ClauseSegmenter;
import ca.mcgill.cs.syntree.clause.ClauseType;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.phrase.EdgeLabels;


/**
 * Builds the tree of last resort: every token as a word directly under a single
 * fragment clause.  This tree depends on nothing but the token order, so it can
 * be built for any input, including graphs with cycles.
 */
public class FlatTreeBuilder {

    public SyntacticTree build(DependencyGraph graph) {
        SyntacticTree tree = new SyntacticTree(graph);
        if (graph.size() == 0)
            return tree;
        ClauseBoundary fragment = ClauseSegmenter.fragment(graph);
        SyntacticNode clauseNode = tree.newClauseNode(fragment);
        for (int i = 0; i < graph.size(); ++i) {
            clauseNode.addChild(tree.newWordNode(i),
                                EdgeLabels.forRelation(graph.relation(i)));
        }
        tree.root().addChild(clauseNode, ClauseType.MAIN.label());
        TreeInvariants.verify(tree);
        return tree;
    }
}
