/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import java.util.List;

import edu.mit.jwi.item.POS;


/**
 * A source of word senses, such as WordNet.
 */
public interface SenseRepository {

    /**
     * Returns the senses of the lemma under the part of speech, in the
     * repository's own order, or an empty list if the lemma is unknown.
     * Multi-word lemmas are joined with underscores, e.g., {@code look_up}.
     */
    List<Sense> lookup(String lemma, POS pos);
}
