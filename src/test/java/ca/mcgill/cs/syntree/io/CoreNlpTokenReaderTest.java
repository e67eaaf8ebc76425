/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.io;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import edu.stanford.nlp.trees.Tree;

import org.junit.Test;

import ca.mcgill.cs.syntree.token.Token;

public class CoreNlpTokenReaderTest {

    static final String PARSE =
        "(ROOT (S (NP (DT The) (NN cat)) (VP (VBZ eats) (NP (NN fish))) "
        + "(. .)))";

    @Test public void testDependenciesFromParse() {
        List<Token> tokens =
            new CoreNlpTokenReader().toTokens(Tree.valueOf(PARSE));
        assertEquals(5, tokens.size());
        assertEquals("det", tokens.get(0).dependencyRelation());
        assertEquals(1, tokens.get(0).headIndex());
        assertEquals("nsubj", tokens.get(1).dependencyRelation());
        assertEquals(2, tokens.get(1).headIndex());
        assertEquals("root", tokens.get(2).dependencyRelation());
        assertEquals(2, tokens.get(2).headIndex());
        assertEquals(2, tokens.get(3).headIndex());
        assertEquals("punct", tokens.get(4).dependencyRelation());
        assertEquals(2, tokens.get(4).headIndex());

        assertEquals("VERB", tokens.get(2).pos());
        assertEquals("VBZ", tokens.get(2).fineTag());
        assertEquals("PUNCT", tokens.get(4).pos());
        assertEquals("eat", tokens.get(2).lemma());
    }

    @Test public void testGivenLemmas() {
        List<Token> tokens = new CoreNlpTokenReader().toTokens(
            Tree.valueOf(PARSE),
            Arrays.asList("the", "cat", "devour", "fish", "."));
        assertEquals("devour", tokens.get(2).lemma());
        assertEquals("the", tokens.get(0).lemma());
    }
}
