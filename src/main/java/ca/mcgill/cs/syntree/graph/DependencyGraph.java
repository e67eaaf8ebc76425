/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;

import com.google.common.collect.ImmutableList;

import ca.mcgill.cs.syntree.token.Token;
import ca.mcgill.cs.syntree.token.TokenFeatures;


/**
 * A read-only view of a parsed sentence as a graph of head links.  Nothing
 * here assumes that the parser produced a tree: every walk carries a visited
 * set, so cyclic or otherwise malformed input produces an exception or an
 * empty answer, never an infinite loop.
 *
 * <p> A token is a root if its head is itself or if its head index lies
 * outside the sentence.
 */
public class DependencyGraph {

    private final ImmutableList<Token> tokens;

    private final ImmutableList<TokenFeatures> features;

    /**
     * The head of each token, or {@code -1} for roots.
     */
    private final int[] heads;

    /**
     * The dependents of each token, in surface order.
     */
    private final List<List<Integer>> children;

    /**
     * Creates the graph for these tokens, where the token at position {@code i}
     * must have index {@code i}.
     *
     * @throws IllegalArgumentException if the list or one of its tokens is
     *         {@code null} or if the token indices do not match their positions
     */
    public DependencyGraph(List<Token> tokens) {
        if (tokens == null)
            throw new IllegalArgumentException("Token list cannot be null");
        int n = tokens.size();
        List<TokenFeatures> feats = new ArrayList<TokenFeatures>(n);
        heads = new int[n];
        List<TIntArrayList> deps = new ArrayList<TIntArrayList>(n);
        for (int i = 0; i < n; ++i) {
            Token t = tokens.get(i);
            if (t == null)
                throw new IllegalArgumentException("Null token at " + i);
            if (t.index() != i)
                throw new IllegalArgumentException(
                    "Token at position " + i + " has index " + t.index());
            feats.add(TokenFeatures.of(t));
            deps.add(new TIntArrayList());
            int h = t.headIndex();
            heads[i] = (h == i || h < 0 || h >= n) ? -1 : h;
        }
        for (int i = 0; i < n; ++i) {
            if (heads[i] >= 0)
                deps.get(heads[i]).add(i);
        }
        List<List<Integer>> kids = new ArrayList<List<Integer>>(n);
        for (TIntArrayList d : deps) {
            List<Integer> l = new ArrayList<Integer>(d.size());
            for (int i = 0; i < d.size(); ++i)
                l.add(d.get(i));
            kids.add(Collections.unmodifiableList(l));
        }
        this.children = kids;
        this.tokens = ImmutableList.copyOf(tokens);
        this.features = ImmutableList.copyOf(feats);
    }

    public int size() {
        return tokens.size();
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Token token(int i) {
        return tokens.get(i);
    }

    public TokenFeatures features(int i) {
        return features.get(i);
    }

    /**
     * Returns the normalized relation of the token to its head.
     */
    public String relation(int i) {
        return features.get(i).relation();
    }

    /**
     * Returns the head of the token, or {@code -1} if it is a root.
     */
    public int head(int i) {
        return heads[i];
    }

    public boolean isRoot(int i) {
        return heads[i] < 0;
    }

    /**
     * Returns the tokens whose head is {@code i}, in surface order.  A token is
     * never its own child.
     */
    public List<Integer> children(int i) {
        return children.get(i);
    }

    /**
     * Returns the dependents of {@code i} whose normalized relation is {@code
     * relation}, in surface order.
     */
    public List<Integer> children(int i, String relation) {
        List<Integer> matches = new ArrayList<Integer>();
        for (Integer c : children.get(i)) {
            if (relation(c).equals(relation))
                matches.add(c);
        }
        return matches;
    }

    /**
     * Returns the chain of heads above {@code i}, nearest first, ending at a
     * root.
     *
     * @throws CyclicDependencyException if the chain returns to a token it
     *         already visited
     */
    public List<Integer> ancestors(int i) throws CyclicDependencyException {
        TIntArrayList chain = new TIntArrayList();
        TIntSet visited = new TIntHashSet();
        chain.add(i);
        visited.add(i);
        int cur = heads[i];
        while (cur >= 0) {
            if (!visited.add(cur))
                throw new CyclicDependencyException(chain.toArray(), cur);
            chain.add(cur);
            cur = heads[cur];
        }
        List<Integer> ancestors = new ArrayList<Integer>(chain.size() - 1);
        for (int j = 1; j < chain.size(); ++j)
            ancestors.add(chain.get(j));
        return ancestors;
    }

    /**
     * Returns {@code i} followed by its heads, nearest first, stopping at a
     * root or just before the first repeated token.  Unlike {@link
     * #ancestors(int)}, this never fails.
     */
    public List<Integer> headChain(int i) {
        List<Integer> chain = new ArrayList<Integer>();
        TIntSet visited = new TIntHashSet();
        int cur = i;
        while (cur >= 0 && visited.add(cur)) {
            chain.add(cur);
            cur = heads[cur];
        }
        return chain;
    }

    /**
     * Returns {@code true} if {@code ancestor} lies on the head chain of
     * {@code dependent}.  A token is not its own dependent.
     */
    public boolean isDependentOf(int dependent, int ancestor) {
        List<Integer> chain = headChain(dependent);
        return chain.indexOf(ancestor) > 0;
    }

    /**
     * Returns the shortest path from {@code i} to {@code j}, following head
     * links in either direction, or {@code null} if the tokens are not
     * connected.
     */
    public DependencyPath path(int i, int j) {
        checkIndex(i);
        checkIndex(j);
        int n = size();
        int[] previous = new int[n];
        boolean[] seen = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<Integer>();
        queue.add(i);
        seen[i] = true;
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            if (cur == j)
                break;
            int h = heads[cur];
            if (h >= 0 && !seen[h]) {
                seen[h] = true;
                previous[h] = cur;
                queue.add(h);
            }
            for (Integer c : children.get(cur)) {
                if (!seen[c]) {
                    seen[c] = true;
                    previous[c] = cur;
                    queue.add(c);
                }
            }
        }
        if (!seen[j])
            return null;

        List<Integer> indices = new ArrayList<Integer>();
        List<String> relations = new ArrayList<String>();
        int cur = j;
        indices.add(cur);
        while (cur != i) {
            int prev = previous[cur];
            // Moving from prev to cur was either up to prev's head or down to
            // one of prev's dependents
            if (heads[prev] == cur)
                relations.add(DependencyPath.UP + relation(prev));
            else
                relations.add(DependencyPath.DOWN + relation(cur));
            indices.add(prev);
            cur = prev;
        }
        Collections.reverse(indices);
        Collections.reverse(relations);
        return new DependencyPath(indices, relations);
    }

    /**
     * Returns the number of edges between the two tokens, or {@code -1} if
     * they are not connected.
     */
    public int distance(int i, int j) {
        DependencyPath p = path(i, j);
        return (p == null) ? -1 : p.length();
    }

    /**
     * Returns the lowest token that is an ancestor-or-self of both tokens, or
     * {@code -1} if they share none.
     */
    public int lowestCommonAncestor(int i, int j) {
        checkIndex(i);
        checkIndex(j);
        TIntSet aboveI = new TIntHashSet();
        for (Integer a : headChain(i))
            aboveI.add(a);
        for (Integer b : headChain(j)) {
            if (aboveI.contains(b))
                return b;
        }
        return -1;
    }

    /**
     * Returns {@code true} if following head links from some token returns to
     * that token.
     */
    public boolean isCyclic() {
        return !findCycle().isEmpty();
    }

    /**
     * Returns the tokens of one cycle in head-link order, or an empty list if
     * the graph has none.
     */
    public List<Integer> findCycle() {
        int n = size();
        // 0 = unvisited, 1 = on the current walk, 2 = finished
        int[] state = new int[n];
        for (int start = 0; start < n; ++start) {
            if (state[start] != 0)
                continue;
            TIntArrayList walk = new TIntArrayList();
            int cur = start;
            while (cur >= 0 && state[cur] == 0) {
                state[cur] = 1;
                walk.add(cur);
                cur = heads[cur];
            }
            if (cur >= 0 && state[cur] == 1) {
                List<Integer> cycle = new ArrayList<Integer>();
                for (int k = walk.indexOf(cur); k < walk.size(); ++k)
                    cycle.add(walk.get(k));
                return cycle;
            }
            for (int k = 0; k < walk.size(); ++k)
                state[walk.get(k)] = 2;
        }
        return Collections.<Integer>emptyList();
    }

    /**
     * Returns {@code i} and every token reachable from it through dependent
     * links, in surface order.
     */
    public List<Integer> subtree(int i) {
        checkIndex(i);
        TIntSet visited = new TIntHashSet();
        Deque<Integer> queue = new ArrayDeque<Integer>();
        queue.add(i);
        visited.add(i);
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            for (Integer c : children.get(cur)) {
                if (visited.add(c))
                    queue.add(c);
            }
        }
        int[] members = visited.toArray();
        Arrays.sort(members);
        List<Integer> result = new ArrayList<Integer>(members.length);
        for (int m : members)
            result.add(m);
        return result;
    }

    /**
     * Returns the other dependents of the token's head, in surface order, or an
     * empty list for a root.
     */
    public List<Integer> siblings(int i) {
        int h = heads[i];
        if (h < 0)
            return Collections.<Integer>emptyList();
        List<Integer> sibs = new ArrayList<Integer>(children.get(h));
        sibs.remove(Integer.valueOf(i));
        return sibs;
    }

    /**
     * Returns every root token, in surface order.
     */
    public List<Integer> roots() {
        List<Integer> roots = new ArrayList<Integer>();
        for (int i = 0; i < heads.length; ++i) {
            if (heads[i] < 0)
                roots.add(i);
        }
        return roots;
    }

    /**
     * Returns the first root token, or {@code -1} if every token has a head
     * (which is only possible when the graph is cyclic).
     */
    public int rootIndex() {
        for (int i = 0; i < heads.length; ++i) {
            if (heads[i] < 0)
                return i;
        }
        return -1;
    }

    /**
     * Returns the nearest verb on the head chain of {@code i}, including
     * {@code i} itself, or {@code -1} if there is none.
     */
    public int findHeadVerb(int i) {
        for (Integer a : headChain(i)) {
            if (features(a).isVerb())
                return a;
        }
        return -1;
    }

    /**
     * Returns {@code i} and every token connected to it by a chain of edges
     * labeled {@code relation}, in either direction, in surface order.  This
     * recovers, for example, all members of a coordination from any one of
     * them with the {@code conj} relation.
     */
    public List<Integer> dependencyChain(int i, String relation) {
        checkIndex(i);
        TIntSet visited = new TIntHashSet();
        Deque<Integer> queue = new ArrayDeque<Integer>();
        queue.add(i);
        visited.add(i);
        while (!queue.isEmpty()) {
            int cur = queue.poll();
            if (heads[cur] >= 0 && relation(cur).equals(relation)
                    && visited.add(heads[cur]))
                queue.add(heads[cur]);
            for (Integer c : children.get(cur)) {
                if (relation(c).equals(relation) && visited.add(c))
                    queue.add(c);
            }
        }
        int[] members = visited.toArray();
        Arrays.sort(members);
        List<Integer> result = new ArrayList<Integer>(members.length);
        for (int m : members)
            result.add(m);
        return result;
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= size())
            throw new IndexOutOfBoundsException(
                "No token " + i + " in a sentence of " + size());
    }

    @Override public String toString() {
        return "DependencyGraph" + tokens;
    }
}
