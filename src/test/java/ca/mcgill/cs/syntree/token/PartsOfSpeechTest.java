/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.token;

import static org.junit.Assert.*;

import edu.mit.jwi.item.POS;

import org.junit.Test;

public class PartsOfSpeechTest {

    @Test public void testPennToUniversal() {
        assertEquals("NOUN", PartsOfSpeech.toUniversal("NNS", "cat", "dobj"));
        assertEquals("PROPN", PartsOfSpeech.toUniversal("NNP", "Bob", "nsubj"));
        assertEquals("VERB", PartsOfSpeech.toUniversal("VBD", "go", "root"));
        assertEquals("ADP", PartsOfSpeech.toUniversal("RP", "up", "prt"));
        assertEquals("PUNCT", PartsOfSpeech.toUniversal(".", ".", "punct"));
        assertEquals("X", PartsOfSpeech.toUniversal("???", "x", "dep"));
    }

    @Test public void testAuxiliaryVerbs() {
        assertEquals("AUX", PartsOfSpeech.toUniversal("VBZ", "has", "aux"));
        assertEquals("AUX", PartsOfSpeech.toUniversal("VBZ", "is", "cop"));
        // A main verb "have" stays a verb
        assertEquals("VERB", PartsOfSpeech.toUniversal("VBZ", "have", "root"));
    }

    @Test public void testWordNet() {
        assertEquals(POS.NOUN, PartsOfSpeech.toWordNet("NOUN"));
        assertEquals(POS.NOUN, PartsOfSpeech.toWordNet("PROPN"));
        assertEquals(POS.VERB, PartsOfSpeech.toWordNet("VERB"));
        assertEquals(POS.ADJECTIVE, PartsOfSpeech.toWordNet("ADJ"));
        assertEquals(POS.ADVERB, PartsOfSpeech.toWordNet("ADV"));
        assertNull(PartsOfSpeech.toWordNet("DET"));
        assertNull(PartsOfSpeech.toWordNet("AUX"));
    }

    @Test public void testIsUniversal() {
        assertTrue(PartsOfSpeech.isUniversal("NOUN"));
        assertTrue(PartsOfSpeech.isUniversal("PUNCT"));
        assertTrue(PartsOfSpeech.isUniversal("CCONJ"));
        assertFalse(PartsOfSpeech.isUniversal("NN"));
        assertFalse(PartsOfSpeech.isUniversal("VBD"));
    }
}
