/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import gnu.trove.list.array.TIntArrayList;


/**
 * Checks the structural invariants of a finished tree:
 * <ol>
 *   <li> every node except the root has exactly one parent, and appears once
 *        among that parent's children,
 *   <li> every child's parent reference is the node that owns it,
 *   <li> no node is reachable from itself,
 *   <li> every token of the sentence is the token of exactly one word node.
 * </ol>
 */
public final class TreeInvariants {

    private TreeInvariants() { }

    /**
     * Throws if the tree violates any invariant.
     *
     * @throws TreeConstructionException naming the first violation found and
     *         the nodes involved
     */
    public static void verify(SyntacticTree tree) {
        List<TreeConstructionException> violations = check(tree);
        if (!violations.isEmpty())
            throw violations.get(0);
    }

    /**
     * Returns every invariant violation found in the tree, or an empty list if
     * it is well formed.  The walk is iterative and visits each node at most
     * once, so it terminates even on a corrupted structure.
     */
    public static List<TreeConstructionException> check(SyntacticTree tree) {
        List<TreeConstructionException> violations =
            new ArrayList<TreeConstructionException>();
        SyntacticNode root = tree.root();
        if (root.parent() != null)
            violations.add(new TreeConstructionException(
                "The root has a parent", root.id(), root.parent().id()));

        int n = tree.tokens().size();
        int[] tokenCounts = new int[n];
        Map<SyntacticNode,Boolean> visited =
            new IdentityHashMap<SyntacticNode,Boolean>();
        Deque<SyntacticNode> stack = new ArrayDeque<SyntacticNode>();
        stack.push(root);
        visited.put(root, Boolean.TRUE);
        while (!stack.isEmpty()) {
            SyntacticNode node = stack.pop();
            if (node.isWord()) {
                if (node.numChildren() > 0)
                    violations.add(new TreeConstructionException(
                        "Word node has children", node.id()));
                int t = node.token().index();
                if (t >= 0 && t < n)
                    tokenCounts[t]++;
            }
            for (SyntacticNode child : node.children()) {
                if (child.parent() != node)
                    violations.add(new TreeConstructionException(
                        "Child does not point back to its owner",
                        node.id(), child.id()));
                if (visited.put(child, Boolean.TRUE) != null) {
                    violations.add(new TreeConstructionException(
                        "Node is reachable twice (second parent or cycle)",
                        node.id(), child.id()));
                    continue;
                }
                stack.push(child);
            }
        }

        TIntArrayList missing = new TIntArrayList();
        for (int t = 0; t < n; ++t) {
            if (tokenCounts[t] == 0)
                missing.add(t);
            else if (tokenCounts[t] > 1) {
                SyntacticNode w = tree.wordNode(t);
                violations.add(new TreeConstructionException(
                    "Token " + t + " appears " + tokenCounts[t] + " times",
                    (w == null) ? -1 : w.id()));
            }
        }
        if (!missing.isEmpty())
            violations.add(new TreeConstructionException(
                "Tokens not in the tree: " + missing));
        return violations;
    }
}
