/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.phrase;

import java.util.Arrays;
import java.util.Set;

import edu.ucla.sspace.util.HashMultiMap;
import edu.ucla.sspace.util.MultiMap;


/**
 * Known verb and particle pairs.  The lexicon is consulted when a parser has
 * attached a particle as a preposition, as in "ran [over my friend]", to
 * decide whether the preposition really belongs to the verb.
 */
public class PhrasalVerbLexicon {

    private static final String[][] DEFAULT_PAIRS = new String[][] {
        { "run", "over", "into", "down", "up", "out", "across" },
        { "knock", "over", "down", "out" },
        { "look", "up", "over", "into", "after", "for" },
        { "turn", "on", "off", "over", "down", "up", "in" },
        { "take", "over", "off", "out", "up", "on" },
        { "put", "on", "off", "up", "down", "out", "away" },
        { "get", "up", "down", "over", "off", "on", "through" },
        { "give", "up", "in", "away", "back" },
        { "come", "across", "up", "over" },
        { "go", "over", "through" },
        { "pick", "up" },
        { "break", "down", "into" },
        { "figure", "out" },
        { "find", "out" },
        { "set", "up", "off" },
        { "bring", "up" },
        { "call", "off", "up" },
        { "carry", "out", "on" },
        { "fill", "out", "in" },
        { "hand", "in", "over", "out" },
    };

    private final MultiMap<String,String> verbToParticles;

    /**
     * Creates a lexicon with the common English phrasal verbs.
     */
    public PhrasalVerbLexicon() {
        verbToParticles = new HashMultiMap<String,String>();
        for (String[] row : DEFAULT_PAIRS)
            verbToParticles.putMany(
                row[0], Arrays.asList(row).subList(1, row.length));
    }

    public void add(String verbLemma, String particle) {
        verbToParticles.put(verbLemma.toLowerCase(), particle.toLowerCase());
    }

    /**
     * Returns {@code true} if the verb and particle form a known phrasal verb.
     */
    public boolean contains(String verbLemma, String particle) {
        Set<String> particles = verbToParticles.get(verbLemma.toLowerCase());
        return particles != null
            && particles.contains(particle.toLowerCase());
    }
}
