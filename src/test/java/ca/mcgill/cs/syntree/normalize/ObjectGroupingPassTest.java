/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import static org.junit.Assert.*;
import static ca.mcgill.cs.syntree.Sentences.*;

import org.junit.Test;

import ca.mcgill.cs.syntree.clause.ClauseSegmenter;
import ca.mcgill.cs.syntree.graph.DependencyGraph;
import ca.mcgill.cs.syntree.phrase.PhraseType;
import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;
import ca.mcgill.cs.syntree.tree.TreeInvariants;

public class ObjectGroupingPassTest {

    @Test public void testAbsorbsStrayDeterminer() {
        DependencyGraph g = new DependencyGraph(boughtAScooter());
        SyntacticTree tree = new SyntacticTree(g);
        SyntacticNode clause =
            tree.newClauseNode(ClauseSegmenter.fragment(g));
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 1);
        vp.addChild(tree.newWordNode(0), "subj");
        vp.addChild(tree.newWordNode(1), "verb");
        vp.addChild(tree.newWordNode(2), "det");
        vp.addChild(tree.newWordNode(3), "obj");
        clause.addChild(vp, "head");
        tree.root().addChild(clause, "main_clause");

        ObjectGroupingPass pass = new ObjectGroupingPass();
        assertTrue(pass.apply(tree));
        assertEquals("head:(VP subj:I verb:bought obj:(NP det:a head:scooter))",
                     vp.toBracketString());
        assertEquals("obj:(NP det:a head:scooter)",
                     vp.child("obj").toBracketString());
        TreeInvariants.verify(tree);
        assertFalse(pass.apply(tree));
    }

    @Test public void testGroupsAdjacentObjects() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        SyntacticTree tree = new SyntacticTree(g);
        SyntacticNode clause =
            tree.newClauseNode(ClauseSegmenter.fragment(g));
        SyntacticNode vp = tree.newPhraseNode(PhraseType.VERB_PHRASE, 2);
        clause.addChild(tree.newWordNode(0), "det");
        vp.addChild(tree.newWordNode(2), "verb");
        vp.addChild(tree.newWordNode(1), "obj");
        vp.addChild(tree.newWordNode(3), "obj");
        clause.addChild(vp, "head");
        clause.addChild(tree.newWordNode(4), "punct");
        tree.root().addChild(clause, "main_clause");

        ObjectGroupingPass pass = new ObjectGroupingPass();
        assertTrue(pass.apply(tree));
        assertEquals("head:(VP verb:eats obj:(NP part:cat part:fish))",
                     vp.toBracketString());
        TreeInvariants.verify(tree);
        assertFalse(pass.apply(tree));
    }

    @Test public void testLeavesBuiltObjectsAlone() {
        SyntacticTree tree = TreeNormalizerTest.assemble(sawMyFatFriend());
        String before = tree.toBracketString();
        assertFalse(new ObjectGroupingPass().apply(tree));
        assertEquals(before, tree.toBracketString());
    }
}
