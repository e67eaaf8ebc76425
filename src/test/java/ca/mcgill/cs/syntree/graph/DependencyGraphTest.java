/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.graph;

import static org.junit.Assert.*;
import static ca.mcgill.cs.syntree.Sentences.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import ca.mcgill.cs.syntree.token.Token;

public class DependencyGraphTest {

    @Test public void testChildrenExcludeSelf() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        assertEquals(Arrays.asList(1, 3, 4), g.children(2));
        assertEquals(Arrays.asList(0), g.children(1));
        assertTrue(g.children(0).isEmpty());
        assertEquals(Arrays.asList(3), g.children(2, "dobj"));
    }

    @Test public void testAncestors() throws CyclicDependencyException {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        assertEquals(Arrays.asList(1, 2), g.ancestors(0));
        assertTrue(g.ancestors(2).isEmpty());
        assertTrue(g.isRoot(2));
        assertEquals(-1, g.head(2));
        assertEquals(2, g.rootIndex());
        assertEquals(Arrays.asList(2), g.roots());
    }

    @Test public void testCyclicAncestorsThrow() {
        DependencyGraph g = new DependencyGraph(cyclic());
        try {
            g.ancestors(3);
            fail("ancestors(3) should detect the 3 <-> 5 cycle");
        } catch (CyclicDependencyException cde) {
            assertEquals(3, cde.repeatedIndex());
            assertArrayEquals(new int[] { 3, 5 }, cde.chain());
        }
    }

    @Test public void testCycleDetection() {
        DependencyGraph g = new DependencyGraph(cyclic());
        assertTrue(g.isCyclic());
        assertEquals(Arrays.asList(3, 5), g.findCycle());
        assertEquals(Arrays.asList(4, 5, 3), g.headChain(4));
        assertFalse(new DependencyGraph(catEatsFish()).isCyclic());
        assertTrue(new DependencyGraph(catEatsFish()).findCycle().isEmpty());
    }

    @Test public void testPath() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        DependencyPath p = g.path(0, 3);
        assertEquals(Arrays.asList(0, 1, 2, 3), p.indices());
        assertEquals(Arrays.asList("↑det", "↑nsubj", "↓dobj"), p.relations());
        assertEquals(0, p.source());
        assertEquals(3, p.target());
        assertEquals(3, g.distance(0, 3));
        assertEquals(0, g.distance(2, 2));
    }

    @Test public void testUnreachable() {
        DependencyGraph g = new DependencyGraph(cyclic());
        assertNull(g.path(0, 3));
        assertEquals(-1, g.distance(0, 3));
        assertEquals(-1, g.lowestCommonAncestor(0, 4));
    }

    @Test public void testLowestCommonAncestor() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        assertEquals(2, g.lowestCommonAncestor(0, 3));
        assertEquals(1, g.lowestCommonAncestor(0, 1));
        assertTrue(g.isDependentOf(0, 2));
        assertFalse(g.isDependentOf(2, 0));
        assertFalse(g.isDependentOf(2, 2));
    }

    @Test public void testSubtreeAndSiblings() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        assertEquals(Arrays.asList(0, 1), g.subtree(1));
        assertEquals(Arrays.asList(0, 1, 2, 3, 4), g.subtree(2));
        assertEquals(Arrays.asList(3, 4), g.siblings(1));
        assertEquals(Collections.<Integer>emptyList(), g.siblings(2));
        assertEquals(2, g.findHeadVerb(0));
    }

    @Test public void testDependencyChain() {
        List<Token> toks = tokens(
            t(0, "cats", "cat", "NOUN", "NNS", "root", 0),
            t(1, "and", "and", "CCONJ", "CC", "cc", 0),
            t(2, "dogs", "dog", "NOUN", "NNS", "conj", 0));
        DependencyGraph g = new DependencyGraph(toks);
        assertEquals(Arrays.asList(0, 2), g.dependencyChain(2, "conj"));
        assertEquals(Arrays.asList(1), g.dependencyChain(1, "conj"));
    }

    @Test public void testOutOfRangeHeadIsRoot() {
        List<Token> toks = tokens(
            t(0, "Hello", "hello", "INTJ", "UH", "root", 7),
            t(1, "!", "!", "PUNCT", ".", "punct", 0));
        DependencyGraph g = new DependencyGraph(toks);
        assertTrue(g.isRoot(0));
        assertEquals(Arrays.asList(1), g.children(0));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testMismatchedIndex() {
        new DependencyGraph(tokens(
            t(0, "a", "a", "DET", "DT", "det", 1),
            t(2, "b", "b", "NOUN", "NN", "root", 2)));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testNullTokens() {
        new DependencyGraph(null);
    }
}
