/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import static org.junit.Assert.*;
import static ca.mcgill.cs.syntree.Sentences.*;

import java.util.Arrays;

import org.junit.Before;
import org.junit.Test;

import ca.mcgill.cs.syntree.graph.DependencyGraph;
import ca.mcgill.cs.syntree.phrase.PhraseType;

public class SyntacticNodeTest {

    private SyntacticTree tree;

    @Before public void setup() {
        tree = new SyntacticTree(new DependencyGraph(catEatsFish()));
    }

    @Test public void testAddChildSetsParent() {
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        SyntacticNode cat = tree.newWordNode(1);
        np.addChild(cat, "head");
        assertSame(np, cat.parent());
        assertEquals("head", cat.relation());
        assertEquals(1, np.numChildren());
        assertSame(cat, np.child("head"));
        assertNull(np.child("det"));
    }

    @Test public void testAddChildMovesFromOldParent() {
        SyntacticNode a = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        SyntacticNode b = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 3);
        SyntacticNode cat = tree.newWordNode(1);
        a.addChild(cat, "head");
        b.addChild(cat, "part");
        assertEquals(0, a.numChildren());
        assertSame(b, cat.parent());
        assertEquals("part", cat.relation());
    }

    @Test public void testAddChildInOrder() {
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        vp.addChild(tree.newWordNode(3), "obj");
        vp.addChildInOrder(tree.newWordNode(1), "subj");
        vp.addChildInOrder(tree.newWordNode(2), "verb");
        vp.addChildInOrder(tree.newWordNode(4), "punct");
        assertEquals("(VP subj:cat verb:eats obj:fish punct:.)",
                     vp.toBracketString());
        assertEquals(1, vp.firstTokenIndex());
        assertEquals("cat eats fish .", vp.text());
    }

    @Test public void testCycleRejectedBeforeMutation() {
        SyntacticNode outer = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        SyntacticNode inner = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        outer.addChild(inner, "subj");
        try {
            inner.addChild(outer, "bad");
            fail("attaching a node under its own descendant must fail");
        } catch (TreeConstructionException tce) {
            assertEquals(2, tce.nodeIds().length);
        }
        assertNull(outer.parent());
        assertSame(outer, inner.parent());
        assertEquals(0, inner.numChildren());
        assertTrue(outer.isAncestorOf(inner));
        assertFalse(inner.isAncestorOf(outer));
    }

    @Test(expected=TreeConstructionException.class)
    public void testSelfAttachment() {
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        np.addChild(np, "self");
    }

    @Test(expected=TreeConstructionException.class)
    public void testWordCannotHaveChildren() {
        SyntacticNode cat = tree.newWordNode(1);
        cat.addChild(tree.newWordNode(0), "det");
    }

    @Test(expected=TreeConstructionException.class)
    public void testRootCannotBeChild() {
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        np.addChild(tree.root(), "root");
    }

    @Test public void testReplaceChildKeepsRelation() {
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        SyntacticNode fish = tree.newWordNode(3);
        vp.addChild(tree.newWordNode(2), "verb");
        vp.addChild(fish, "obj");
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 3);
        vp.replaceChild(fish, np);
        assertEquals(1, vp.indexOf(np));
        assertEquals("obj", np.relation());
        assertNull(fish.parent());
        assertEquals(-1, vp.indexOf(fish));
    }

    @Test public void testRemoveChild() {
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        SyntacticNode eats = tree.newWordNode(2);
        vp.addChild(eats, "verb");
        assertTrue(vp.removeChild(eats));
        assertFalse(vp.removeChild(eats));
        assertNull(eats.parent());
    }

    @Test public void testLeavesInOrder() {
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        SyntacticNode the = tree.newWordNode(0);
        SyntacticNode cat = tree.newWordNode(1);
        SyntacticNode eats = tree.newWordNode(2);
        np.addChild(the, "det");
        np.addChild(cat, "head");
        vp.addChild(np, "subj");
        vp.addChild(eats, "verb");
        assertEquals(Arrays.asList(the, cat, eats), vp.leaves());
        assertEquals(Arrays.asList(eats), eats.leaves());
    }

    @Test public void testLabels() {
        SyntacticNode np = tree.newPhraseNode(PhraseType.NOUN_PHRASE, 1);
        SyntacticNode cat = tree.newWordNode(1);
        assertEquals("NP", np.label());
        assertEquals("NOUN", cat.label());
        assertEquals("SENTENCE", tree.root().label());
        assertTrue(np.isPhrase());
        assertTrue(np.isPhrase(PhraseType.NOUN_PHRASE));
        assertFalse(np.isPhrase(PhraseType.VERB_PHRASE));
        assertTrue(cat.isWord());
        assertEquals(NodeType.WORD, cat.type());
    }

    @Test public void testAnnotationsCreatedLazily() {
        SyntacticNode cat = tree.newWordNode(1);
        assertFalse(cat.hasAnnotations());
        assertNotNull(cat.annotations());
        assertFalse(cat.hasAnnotations());
    }

    @Test public void testLemmaNode() {
        SyntacticNode eats = tree.newWordNode(2);
        SyntacticNode eat = tree.newLemmaNode(2);
        assertEquals("eats", eats.text());
        assertEquals("eat", eat.text());
        assertTrue(eat.isLemmaForm());
        assertSame(eat, tree.wordNode(2));
    }

    @Test(expected=TreeConstructionException.class)
    public void testDuplicateWordNode() {
        tree.newWordNode(2);
        tree.newWordNode(2);
    }
}
