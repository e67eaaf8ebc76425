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
import java.util.List;

import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.phrase.Constituent;
import ca.mcgill.cs.syntree.phrase.PhraseSpan;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.token.Token;


/**
 * The syntactic tree of one sentence.  The tree owns its {@link
 * NodeType#SENTENCE} root and creates every node, numbering them in creation
 * order, and it tracks which word node currently stands for each token.
 */
public class SyntacticTree {

    private final DependencyGraph graph;

    private final SyntacticNode root;

    private final TIntObjectMap<SyntacticNode> wordNodes;

    private int nextId;

    public SyntacticTree(DependencyGraph graph) {
        this.graph = graph;
        this.wordNodes = new TIntObjectHashMap<SyntacticNode>();
        this.nextId = 0;
        this.root = new SyntacticNode(nextId++, NodeType.SENTENCE, null, null,
                                      null, -1, false);
    }

    public SyntacticNode root() {
        return root;
    }

    public DependencyGraph graph() {
        return graph;
    }

    public List<Token> tokens() {
        return graph.tokens();
    }

    public SyntacticNode newClauseNode(ClauseBoundary clause) {
        return new SyntacticNode(nextId++, NodeType.CLAUSE, null, null, clause,
                                 clause.headIndex(), false);
    }

    public SyntacticNode newPhraseNode(PhraseType type, int headIndex) {
        return new SyntacticNode(nextId++, NodeType.PHRASE, null, type, null,
                                 headIndex, false);
    }

    /**
     * Creates the word node for a token.
     *
     * @throws TreeConstructionException if the token already has a word node
     */
    public SyntacticNode newWordNode(int tokenIndex) {
        SyntacticNode existing = wordNodes.get(tokenIndex);
        if (existing != null)
            throw new TreeConstructionException(
                "Token " + tokenIndex + " already has a word node",
                existing.id());
        SyntacticNode word = new SyntacticNode(
            nextId++, NodeType.WORD, graph.token(tokenIndex), null, null,
            tokenIndex, false);
        wordNodes.put(tokenIndex, word);
        return word;
    }

    /**
     * Creates a word node that shows the token's lemma and from now on stands
     * for the token in place of its previous word node.
     */
    public SyntacticNode newLemmaNode(int tokenIndex) {
        SyntacticNode lemma = new SyntacticNode(
            nextId++, NodeType.WORD, graph.token(tokenIndex), null, null,
            tokenIndex, true);
        wordNodes.put(tokenIndex, lemma);
        return lemma;
    }

    /**
     * Returns the word node for the token, or {@code null} if none has been
     * created.
     */
    public SyntacticNode wordNode(int tokenIndex) {
        return wordNodes.get(tokenIndex);
    }

    /**
     * Creates the nodes for a constituent and everything inside it, returning
     * the top node, which is not yet attached.
     */
    public SyntacticNode materialize(Constituent c) {
        if (c.isWord())
            return newWordNode(c.tokenIndex());
        PhraseSpan span = c.span();
        SyntacticNode phrase = newPhraseNode(span.type(), span.headIndex());
        for (Constituent child : span.children())
            phrase.addChild(materialize(child), child.relation());
        return phrase;
    }

    /**
     * Creates the phrase nodes for a constituent, reusing the current word node
     * of every token that has one.  Reused words are moved out of wherever
     * they were, so this regroups tokens that are already in the tree.
     */
    public SyntacticNode regroup(Constituent c) {
        if (c.isWord()) {
            SyntacticNode existing = wordNodes.get(c.tokenIndex());
            return (existing == null)
                ? newWordNode(c.tokenIndex()) : existing;
        }
        PhraseSpan span = c.span();
        SyntacticNode phrase = newPhraseNode(span.type(), span.headIndex());
        for (Constituent child : span.children())
            phrase.addChild(regroup(child), child.relation());
        return phrase;
    }

    /**
     * Returns {@code true} if the node is the root or hangs below it.
     */
    public boolean contains(SyntacticNode node) {
        return node == root || root.isAncestorOf(node);
    }

    /**
     * Returns the clause node nearest above the node, or {@code null} if there
     * is none.
     */
    public static SyntacticNode enclosingClause(SyntacticNode node) {
        SyntacticNode cur = node.parent();
        while (cur != null && cur.type() != NodeType.CLAUSE)
            cur = cur.parent();
        return cur;
    }

    /**
     * Returns every node of the tree in pre-order.
     */
    public List<SyntacticNode> nodes() {
        List<SyntacticNode> nodes = new ArrayList<SyntacticNode>();
        Deque<SyntacticNode> stack = new ArrayDeque<SyntacticNode>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntacticNode n = stack.pop();
            nodes.add(n);
            for (int i = n.numChildren() - 1; i >= 0; --i)
                stack.push(n.child(i));
        }
        return nodes;
    }

    public List<SyntacticNode> leaves() {
        return root.leaves();
    }

    public String toBracketString() {
        return root.toBracketString();
    }

    @Override public String toString() {
        return toBracketString();
    }
}
