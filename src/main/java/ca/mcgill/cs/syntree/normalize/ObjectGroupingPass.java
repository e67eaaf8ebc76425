/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.phrase.Constituent;
import ca.mcgill.cs.syntree.phrase.EdgeLabels;
import ca.mcgill.cs.syntree.phrase.PhraseBuilder;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.token.DependencyRelations;

import ca.mcgill.cs.syntree.tree.NodeType;
import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;


/**
 * Gathers the pieces of a direct object into one phrase.  An object whose
 * determiners, adjectives, compounds, possessors or numbers ended up as its
 * siblings is rebuilt as a layered noun phrase together with them, and a run
 * of adjacent object siblings becomes a single object phrase whose members are
 * labeled {@code part}.
 */
public class ObjectGroupingPass implements NormalizationPass {

    private final int maxPhraseDepth;

    public ObjectGroupingPass() {
        this(PhraseBuilder.DEFAULT_MAX_DEPTH);
    }

    public ObjectGroupingPass(int maxPhraseDepth) {
        this.maxPhraseDepth = maxPhraseDepth;
    }

    /** {@inheritDoc} */
    @Override public String name() {
        return "object grouping";
    }

    /** {@inheritDoc} */
    @Override public boolean apply(SyntacticTree tree) {
        PhraseBuilder builder =
            new PhraseBuilder(tree.graph(), maxPhraseDepth);
        boolean changed = false;
        for (SyntacticNode node : tree.nodes()) {
            if (!node.isPhrase() || !tree.contains(node))
                continue;
            changed |= absorbModifiers(tree, builder, node);
            changed |= groupAdjacentObjects(tree, node);
        }
        return changed;
    }

    private boolean absorbModifiers(SyntacticTree tree, PhraseBuilder builder,
                                    SyntacticNode parent) {
        DependencyGraph graph = tree.graph();
        boolean changed = false;
        for (SyntacticNode obj : new ArrayList<SyntacticNode>(parent.children())) {
            if (!EdgeLabels.OBJ.equals(obj.relation())
                    || obj.parent() != parent)
                continue;
            int head = obj.headIndex();
            List<SyntacticNode> modifiers = new ArrayList<SyntacticNode>();
            for (SyntacticNode sib : parent.children()) {
                if (sib == obj || sib.type() == NodeType.CLAUSE)
                    continue;
                int h = sib.headIndex();
                if (h >= 0 && graph.head(h) == head
                        && isNounModifier(graph.relation(h)))
                    modifiers.add(sib);
            }
            if (modifiers.isEmpty())
                continue;

            SyntacticNode clauseNode = SyntacticTree.enclosingClause(parent);
            if (clauseNode == null)
                continue;
            ClauseBoundary clause = clauseNode.clause();
            Set<Integer> allowed = new HashSet<Integer>();
            addTokens(obj, allowed);
            for (SyntacticNode m : modifiers)
                addTokens(m, allowed);
            Constituent np = builder.buildNounPhrase(head, clause, allowed);
            // Only regroup when the rebuilt phrase accounts for every token
            if (np.isWord()
                    || !allowed.equals(new HashSet<Integer>(np.tokenIndices())))
                continue;

            for (SyntacticNode m : modifiers)
                parent.removeChild(m);
            int pos = parent.indexOf(obj);
            parent.removeChild(obj);
            parent.insertChild(pos, tree.regroup(np), EdgeLabels.OBJ);
            changed = true;
        }
        return changed;
    }

    private boolean groupAdjacentObjects(SyntacticTree tree,
                                         SyntacticNode parent) {
        boolean changed = false;
        int i = 0;
        while (i < parent.numChildren()) {
            int j = i;
            while (j < parent.numChildren()
                       && EdgeLabels.OBJ.equals(parent.child(j).relation()))
                ++j;
            if (j - i < 2) {
                i = Math.max(j, i + 1);
                continue;
            }
            List<SyntacticNode> run = new ArrayList<SyntacticNode>();
            for (int k = i; k < j; ++k)
                run.add(parent.child(k));
            SyntacticNode group = tree.newPhraseNode(
                PhraseType.NOUN_PHRASE, run.get(0).headIndex());
            parent.insertChild(i, group, EdgeLabels.OBJ);
            for (SyntacticNode member : run)
                group.addChild(member, EdgeLabels.PART);
            changed = true;
            ++i;
        }
        return changed;
    }

    private static boolean isNounModifier(String rel) {
        return DependencyRelations.ATTRIBUTIVE_MODIFIERS.contains(rel)
            || DependencyRelations.QUANTIFYING_MODIFIERS.contains(rel)
            || DependencyRelations.DETERMINERS.contains(rel);
    }

    private static void addTokens(SyntacticNode node, Set<Integer> tokens) {
        for (SyntacticNode leaf : node.leaves())
            tokens.add(leaf.headIndex());
    }
}
