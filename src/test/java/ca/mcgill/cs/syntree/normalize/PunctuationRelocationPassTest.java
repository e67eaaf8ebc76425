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

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;
import ca.mcgill.cs.syntree.tree.TreeInvariants;

public class PunctuationRelocationPassTest {

    @Test public void testMovesPunctuationOutOfPhrase() {
        SyntacticTree tree = TreeNormalizerTest.assemble(manWhoLeft());
        PunctuationRelocationPass pass = new PunctuationRelocationPass();
        assertTrue(pass.apply(tree));
        SyntacticNode period = tree.wordNode(6);
        SyntacticNode clause = period.parent();
        assertFalse(clause.isPhrase());
        assertEquals("punct", period.relation());
        // Right after the phrase that held it
        assertEquals(clause.indexOf(tree.wordNode(4).parent()) + 1,
                     clause.indexOf(period));
        assertFalse(pass.apply(tree));
    }

    @Test public void testNothingToMove() {
        SyntacticTree tree = TreeNormalizerTest.assemble(boughtAScooter());
        assertFalse(new PunctuationRelocationPass().apply(tree));
    }

    @Test public void testCollapsesLayerLeftWithOnlyItsCore() {
        // "The dogs, which ran, barked."
        SyntacticTree tree = TreeNormalizerTest.assemble(tokens(
            t(0, "The", "the", "DET", "DT", "det", 1),
            t(1, "dogs", "dog", "NOUN", "NNS", "nsubj", 6),
            t(2, ",", ",", "PUNCT", ",", "punct", 1),
            t(3, "which", "which", "PRON", "WDT", "nsubj", 4),
            t(4, "ran", "run", "VERB", "VBD", "relcl", 1),
            t(5, ",", ",", "PUNCT", ",", "punct", 1),
            t(6, "barked", "bark", "VERB", "VBD", "root", 6),
            t(7, ".", ".", "PUNCT", ".", "punct", 6)));
        PunctuationRelocationPass pass = new PunctuationRelocationPass();
        assertTrue(pass.apply(tree));
        TreeInvariants.verify(tree);

        SyntacticNode np = tree.wordNode(1).parent();
        SyntacticNode vp = tree.wordNode(6).parent();
        assertSame(vp, np.parent());
        assertEquals("subj", np.relation());
        assertEquals("det", np.child(0).relation());
        assertEquals("head", np.child(1).relation());
        assertNull(np.child("core"));
        assertNull(np.child("punct"));

        SyntacticNode clause = vp.parent();
        assertFalse(clause.isPhrase());
        assertSame(clause, tree.wordNode(2).parent());
        assertSame(clause, tree.wordNode(5).parent());
        assertEquals(clause.indexOf(vp) + 1,
                     clause.indexOf(tree.wordNode(2)));
        assertEquals(clause.indexOf(tree.wordNode(2)) + 1,
                     clause.indexOf(tree.wordNode(5)));
        assertFalse(pass.apply(tree));
    }
}
