/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import edu.stanford.nlp.util.ArrayCoreMap;
import edu.stanford.nlp.util.CoreMap;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;

import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.token.Token;


/**
 * A node of a syntactic tree.  A node owns its children, in order, and keeps a
 * reference to its parent.  All structural changes go through {@link
 * #insertChild(int,SyntacticNode,String)} and {@link
 * #removeChild(SyntacticNode)}, which keep the two in agreement: a child is
 * detached from its old parent before it joins a new one, and an attachment
 * that would make a node its own ancestor is refused before anything is
 * changed.
 *
 * <p> Word nodes are always leaves.  Nodes are created by a {@link
 * SyntacticTree}, which assigns their ids.
 */
public class SyntacticNode {

    private final int id;

    private final NodeType type;

    private final Token token;

    private final PhraseType phraseType;

    private final ClauseBoundary clause;

    private final int headIndex;

    private final boolean isLemmaForm;

    private final List<SyntacticNode> children;

    private SyntacticNode parent;

    private String relation;

    private CoreMap annotations;

    SyntacticNode(int id, NodeType type, Token token, PhraseType phraseType,
                  ClauseBoundary clause, int headIndex, boolean isLemmaForm) {
        this.id = id;
        this.type = type;
        this.token = token;
        this.phraseType = phraseType;
        this.clause = clause;
        this.headIndex = headIndex;
        this.isLemmaForm = isLemmaForm;
        this.children = new ArrayList<SyntacticNode>();
        this.parent = null;
        this.relation = null;
        this.annotations = null;
    }

    public int id() {
        return id;
    }

    public NodeType type() {
        return type;
    }

    public boolean isWord() {
        return type == NodeType.WORD;
    }

    public boolean isPhrase() {
        return type == NodeType.PHRASE;
    }

    public boolean isPhrase(PhraseType pt) {
        return type == NodeType.PHRASE && phraseType == pt;
    }

    /**
     * Returns the token of a word node, or {@code null} for any other node.
     */
    public Token token() {
        return token;
    }

    /**
     * Returns the kind of phrase of a phrase node, or {@code null} for any
     * other node.
     */
    public PhraseType phraseType() {
        return phraseType;
    }

    /**
     * Returns the clause of a clause node, or {@code null} for any other node.
     */
    public ClauseBoundary clause() {
        return clause;
    }

    /**
     * Returns the token that heads this node: the word itself, the head of a
     * phrase or the head of a clause, or {@code -1} for the sentence root.
     */
    public int headIndex() {
        return headIndex;
    }

    /**
     * Returns {@code true} for word nodes that stand for their token's lemma
     * rather than its surface form.
     */
    public boolean isLemmaForm() {
        return isLemmaForm;
    }

    /**
     * Returns the label naming this node's role under its parent, or {@code
     * null} for a detached node.
     */
    public String relation() {
        return relation;
    }

    public void setRelation(String relation) {
        this.relation = relation;
    }

    public SyntacticNode parent() {
        return parent;
    }

    public List<SyntacticNode> children() {
        return Collections.unmodifiableList(children);
    }

    public int numChildren() {
        return children.size();
    }

    public SyntacticNode child(int i) {
        return children.get(i);
    }

    /**
     * Returns the first child with this relation, or {@code null}.
     */
    public SyntacticNode child(String rel) {
        for (SyntacticNode c : children) {
            if (rel.equals(c.relation))
                return c;
        }
        return null;
    }

    /**
     * Returns the position of this child, or {@code -1} if it is not a child
     * of this node.
     */
    public int indexOf(SyntacticNode child) {
        for (int i = 0; i < children.size(); ++i) {
            if (children.get(i) == child)
                return i;
        }
        return -1;
    }

    /**
     * Returns the annotations attached to this node, such as its resolved
     * sense.
     */
    public CoreMap annotations() {
        if (annotations == null)
            annotations = new ArrayCoreMap();
        return annotations;
    }

    public boolean hasAnnotations() {
        return annotations != null && annotations.size() > 0;
    }

    /**
     * Appends the child, moving it from its current parent if it has one.
     */
    public void addChild(SyntacticNode child, String rel) {
        insertChild(children.size(), child, rel);
    }

    /**
     * Adds the child before the first existing child that starts later in the
     * sentence, moving it from its current parent if it has one.
     */
    public void addChildInOrder(SyntacticNode child, String rel) {
        int start = child.firstTokenIndex();
        int pos = 0;
        while (pos < children.size()) {
            SyntacticNode c = children.get(pos);
            if (c != child && c.firstTokenIndex() > start)
                break;
            ++pos;
        }
        insertChild(pos, child, rel);
    }

    /**
     * Inserts the child at the position, moving it from its current parent if
     * it has one.  The position is interpreted after the child has been
     * detached.
     *
     * @throws TreeConstructionException if this node is a word, if the child
     *         is the sentence root, or if the child is this node or one of its
     *         ancestors.  The tree is unchanged when this is thrown.
     */
    public void insertChild(int position, SyntacticNode child, String rel) {
        if (child == null)
            throw new NullPointerException("child");
        if (type == NodeType.WORD)
            throw new TreeConstructionException(
                "Word nodes cannot have children", id, child.id);
        if (child.type == NodeType.SENTENCE)
            throw new TreeConstructionException(
                "The sentence node cannot be a child", id, child.id);
        if (child == this || child.isAncestorOf(this))
            throw new TreeConstructionException(
                "Attachment would create a cycle", id, child.id);

        int pos = position;
        if (child.parent != null) {
            SyntacticNode oldParent = child.parent;
            int oldPos = oldParent.indexOf(child);
            oldParent.children.remove(oldPos);
            if (oldParent == this && oldPos < pos)
                --pos;
        }
        if (pos < 0 || pos > children.size())
            pos = children.size();
        children.add(pos, child);
        child.parent = this;
        child.relation = rel;
    }

    /**
     * Detaches the child from this node.
     *
     * @return {@code true} if the node was a child of this node
     */
    public boolean removeChild(SyntacticNode child) {
        int pos = indexOf(child);
        if (pos < 0)
            return false;
        children.remove(pos);
        child.parent = null;
        return true;
    }

    /**
     * Puts {@code replacement} at the position of {@code existing}, which is
     * detached, giving it the relation of the replaced node.
     */
    public void replaceChild(SyntacticNode existing, SyntacticNode replacement) {
        int pos = indexOf(existing);
        if (pos < 0)
            throw new TreeConstructionException(
                "Not a child of this node", id, existing.id);
        if (replacement == this || replacement.isAncestorOf(this))
            throw new TreeConstructionException(
                "Replacement would create a cycle", id, replacement.id);
        String rel = existing.relation;
        removeChild(existing);
        insertChild(Math.min(pos, children.size()), replacement, rel);
    }

    /**
     * Returns {@code true} if this node lies on the parent chain of {@code
     * node}.  A node is not its own ancestor.
     */
    public boolean isAncestorOf(SyntacticNode node) {
        Map<SyntacticNode,Boolean> seen =
            new IdentityHashMap<SyntacticNode,Boolean>();
        SyntacticNode cur = node.parent;
        while (cur != null && seen.put(cur, Boolean.TRUE) == null) {
            if (cur == this)
                return true;
            cur = cur.parent;
        }
        return false;
    }

    /**
     * Returns the word nodes below this node in left-to-right order, or this
     * node itself if it is a word.
     */
    public List<SyntacticNode> leaves() {
        List<SyntacticNode> leaves = new ArrayList<SyntacticNode>();
        Deque<SyntacticNode> stack = new ArrayDeque<SyntacticNode>();
        Map<SyntacticNode,Boolean> seen =
            new IdentityHashMap<SyntacticNode,Boolean>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntacticNode n = stack.pop();
            if (seen.put(n, Boolean.TRUE) != null)
                continue;
            if (n.isWord())
                leaves.add(n);
            for (int i = n.children.size() - 1; i >= 0; --i)
                stack.push(n.children.get(i));
        }
        return leaves;
    }

    /**
     * Returns the smallest token index below this node, or {@link
     * Integer#MAX_VALUE} if there is none.
     */
    public int firstTokenIndex() {
        int min = Integer.MAX_VALUE;
        for (SyntacticNode leaf : leaves())
            min = Math.min(min, leaf.token.index());
        return min;
    }

    /**
     * Returns the words of this node separated by spaces.  Lemma-form words
     * contribute their lemma.
     */
    public String text() {
        if (isWord())
            return isLemmaForm ? token.lemma() : token.text();
        StringBuilder sb = new StringBuilder();
        for (SyntacticNode leaf : leaves()) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(leaf.text());
        }
        return sb.toString();
    }

    /**
     * Returns the label of this node's kind: the phrase abbreviation, the
     * clause type, the node type, or for words the token's part of speech.
     */
    public String label() {
        switch (type) {
        case WORD:
            return token.pos();
        case PHRASE:
            return phraseType.abbreviation();
        case CLAUSE:
            return clause.type().name();
        default:
            return type.name();
        }
    }

    /**
     * Returns a bracketed rendering of the subtree, with relations and labels,
     * that identifies its structure exactly.
     */
    public String toBracketString() {
        StringBuilder sb = new StringBuilder();
        appendBracketed(sb);
        return sb.toString();
    }

    private void appendBracketed(StringBuilder sb) {
        if (relation != null)
            sb.append(relation).append(':');
        if (isWord()) {
            sb.append(text());
            return;
        }
        sb.append('(').append(label());
        for (SyntacticNode c : children) {
            sb.append(' ');
            c.appendBracketed(sb);
        }
        sb.append(')');
    }

    @Override public String toString() {
        return "#" + id + " " + (relation == null ? "" : relation + ":")
            + label() + " \"" + text() + "\"";
    }
}
