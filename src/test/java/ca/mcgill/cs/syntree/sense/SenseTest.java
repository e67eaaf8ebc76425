/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import static org.junit.Assert.*;

import edu.mit.jwi.item.POS;

import org.junit.Test;

public class SenseTest {

    @Test public void testEqualityById() {
        Sense a = new Sense("dog%1:05:00::", "dog", POS.NOUN,
                            "a member of the genus Canis", 42, false);
        Sense b = new Sense("dog%1:05:00::", "dog", POS.NOUN, null, 0, false);
        Sense c = new Sense("dog%1:18:01::", "dog", POS.NOUN,
                            "a dull unattractive unpleasant girl", 1, false);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertFalse(a.equals(c));
        assertEquals("", b.definition());
    }

    @Test public void testGlossWithoutExamples() {
        String gloss = "move fast by using one's feet; \"Don't run--you'll "
            + "be out of breath\"; \"The children ran to the store\"";
        assertEquals("move fast by using one's feet",
                     WordNetSenseRepository.USAGE_IN_GLOSS.matcher(gloss)
                     .replaceAll("").trim());
    }
}
