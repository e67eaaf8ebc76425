/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import edu.mit.jwi.item.POS;


/**
 * One meaning of a lemma, as listed by a {@link SenseRepository}.
 */
public class Sense {

    private final String id;

    private final String lemma;

    private final POS pos;

    private final String definition;

    private final int frequency;

    private final boolean isTechnical;

    /**
     * @param id the repository's identifier for the sense, e.g., a WordNet
     *        sense key
     * @param lemma the lemma the sense belongs to
     * @param pos the part of speech of the lemma
     * @param definition the gloss of the sense
     * @param frequency how often the sense was observed in a sense-tagged
     *        corpus
     * @param isTechnical whether the sense belongs to a specialized domain,
     *        such as chemistry or cricket
     */
    public Sense(String id, String lemma, POS pos, String definition,
                 int frequency, boolean isTechnical) {
        this.id = id;
        this.lemma = lemma;
        this.pos = pos;
        this.definition = (definition == null) ? "" : definition;
        this.frequency = frequency;
        this.isTechnical = isTechnical;
    }

    public String id() {
        return id;
    }

    public String lemma() {
        return lemma;
    }

    public POS pos() {
        return pos;
    }

    public String definition() {
        return definition;
    }

    public int frequency() {
        return frequency;
    }

    public boolean isTechnical() {
        return isTechnical;
    }

    @Override public boolean equals(Object o) {
        if (!(o instanceof Sense))
            return false;
        Sense s = (Sense)o;
        return id.equals(s.id);
    }

    @Override public int hashCode() {
        return id.hashCode();
    }

    @Override public String toString() {
        return id + " (" + frequency + "): " + definition;
    }
}
