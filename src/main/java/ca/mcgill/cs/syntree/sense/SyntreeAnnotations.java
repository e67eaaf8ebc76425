/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import edu.stanford.nlp.ling.CoreAnnotation;


/**
 * The annotation keys stored on syntactic tree nodes.
 */
public final class SyntreeAnnotations {

    /**
     * The sense chosen for a word node.
     */
    public static class SenseAnnotation implements CoreAnnotation<Sense> {
        public Class<Sense> getType() {
            return Sense.class;
        }
    }

    /**
     * The multi-word lemma under which a phrasal verb's sense was found, e.g.,
     * {@code look_up}.
     */
    public static class PhrasalLemmaAnnotation
            implements CoreAnnotation<String> {
        public Class<String> getType() {
            return String.class;
        }
    }

    private SyntreeAnnotations() { }
}
