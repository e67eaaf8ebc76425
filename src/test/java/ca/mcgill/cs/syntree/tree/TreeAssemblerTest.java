/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.tree;

import static org.junit.Assert.*;
import static ca.mcgill.cs.syntree.Sentences.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;
import ca.mcgill.cs.syntree.clause.ClauseSegmenter;
import ca.mcgill.cs.syntree.clause.ClauseType;
import ca.mcgill.cs.syntree.graph.DependencyGraph;
import ca.mcgill.cs.syntree.phrase.PhraseType;
import ca.mcgill.cs.syntree.token.Token;

public class TreeAssemblerTest {

    private static SyntacticTree assemble(List<Token> sentence) {
        DependencyGraph g = new DependencyGraph(sentence);
        return new TreeAssembler().assemble(
            g, new ClauseSegmenter().segmentOrFragment(g));
    }

    @Test public void testSingleClause() {
        SyntacticTree tree = assemble(catEatsFish());
        assertEquals("(SENTENCE main_clause:(MAIN head:(VP subj:(NP det:The "
                     + "head:cat) verb:eats obj:fish punct:.)))",
                     tree.toBracketString());
    }

    @Test public void testDeterminerUnderNounPhrase() {
        SyntacticTree tree = assemble(boughtAScooter());
        SyntacticNode a = tree.wordNode(2);
        SyntacticNode scooter = tree.wordNode(3);
        assertSame(a.parent(), scooter.parent());
        assertTrue(a.parent().isPhrase(PhraseType.NOUN_PHRASE));
        assertEquals(3, a.parent().headIndex());
        assertEquals("det", a.relation());
        assertEquals(0, scooter.numChildren());
    }

    @Test public void testComplementClauseUnderGovernorPhrase() {
        SyntacticTree tree = assemble(thinkSheLeft());
        assertEquals("(SENTENCE main_clause:(MAIN head:(VP subj:I verb:think "
                     + "sub_clause:(SUBORDINATE head:(VP subj:she verb:left)) "
                     + "punct:.)))",
                     tree.toBracketString());
    }

    @Test public void testRelativeClauseUnderNoun() {
        SyntacticTree tree = assemble(manWhoLeft());
        SyntacticNode left = tree.wordNode(3);
        SyntacticNode clause = SyntacticTree.enclosingClause(left);
        assertEquals(ClauseType.RELATIVE, clause.clause().type());
        assertEquals("rel_clause", clause.relation());
        // The relative clause hangs from the phrase of the noun it modifies
        assertSame(tree.wordNode(1).parent(), clause.parent());
        assertEquals(1, clause.parent().headIndex());
    }

    @Test public void testFragment() {
        SyntacticTree tree = assemble(bigRedBall());
        assertEquals("(SENTENCE main_clause:(MAIN head:(NP det:The "
                     + "core:(NP adj:big adj:red head:ball))))",
                     tree.toBracketString());
        SyntacticNode clause = tree.root().child(0);
        assertTrue(clause.clause().isFragment());
    }

    @Test public void testUnplacedTokensJoinClause() {
        DependencyGraph g = new DependencyGraph(catEatsFish());
        SyntacticTree tree = new TreeAssembler(1).assemble(
            g, new ClauseSegmenter().segmentOrFragment(g));
        assertEquals("(SENTENCE main_clause:(MAIN det:The head:(VP subj:cat "
                     + "verb:eats obj:fish punct:.)))",
                     tree.toBracketString());
    }

    @Test public void testEveryTokenOnce() {
        for (List<Token> sentence : Arrays.asList(
                 catEatsFish(), boughtAScooter(), sawMyFatFriend(),
                 lookedUpTheWord(), ranOverMyFriend(), manWhoLeft(),
                 thinkSheLeft(), bigRedBall())) {
            SyntacticTree tree = assemble(sentence);
            List<Integer> seen = new ArrayList<Integer>();
            for (SyntacticNode leaf : tree.leaves())
                seen.add(leaf.headIndex());
            Collections.sort(seen);
            List<Integer> expected = new ArrayList<Integer>();
            for (int i = 0; i < sentence.size(); ++i)
                expected.add(i);
            assertEquals(expected, seen);
        }
    }

    @Test(expected=TreeConstructionException.class)
    public void testTwoMainClauses() {
        DependencyGraph g = new DependencyGraph(thinkSheLeft());
        List<Integer> none = Collections.<Integer>emptyList();
        List<ClauseBoundary> clauses = Arrays.asList(
            new ClauseBoundary(ClauseType.MAIN, 1, -1, Arrays.asList(0, 1, 4),
                               none, none, false),
            new ClauseBoundary(ClauseType.MAIN, 3, -1, Arrays.asList(2, 3),
                               none, none, false));
        new TreeAssembler().assemble(g, clauses);
    }
}
