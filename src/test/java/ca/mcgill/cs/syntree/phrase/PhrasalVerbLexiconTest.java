/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import static org.junit.Assert.*;

import org.junit.Test;

public class PhrasalVerbLexiconTest {

    @Test public void testDefaults() {
        PhrasalVerbLexicon lex = new PhrasalVerbLexicon();
        assertTrue(lex.contains("look", "up"));
        assertTrue(lex.contains("run", "over"));
        assertTrue(lex.contains("Figure", "OUT"));
        assertFalse(lex.contains("eat", "up"));
        assertFalse(lex.contains("look", "across"));
    }

    @Test public void testAdd() {
        PhrasalVerbLexicon lex = new PhrasalVerbLexicon();
        lex.add("Eat", "up");
        assertTrue(lex.contains("eat", "up"));
    }
}
