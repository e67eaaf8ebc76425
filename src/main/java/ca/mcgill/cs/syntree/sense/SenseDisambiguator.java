/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import java.util.ArrayList;
import java.util.List;

import java.util.regex.Pattern;

import edu.mit.jwi.item.POS;

import ca.mcgill.cs.syntree.phrase.EdgeLabels;
import ca.mcgill.cs.syntree.phrase.PhraseType;

import ca.mcgill.cs.syntree.token.TokenFeatures;

import ca.mcgill.cs.syntree.tree.SyntacticNode;
import ca.mcgill.cs.syntree.tree.SyntacticTree;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Picks a single sense for each content word of a syntactic tree.  The choice
 * is the most frequent sense, skipping senses from technical domains when a
 * general one exists.  The verb of a phrasal verb is first looked up as a
 * multi-word lemma, e.g., {@code look_up}, and otherwise restricted to the
 * senses whose definitions mention its particle.
 */
public class SenseDisambiguator {

    private final SenseRepository repository;

    public SenseDisambiguator(SenseRepository repository) {
        if (repository == null)
            throw new NullPointerException("repository");
        this.repository = repository;
    }

    /**
     * Returns the sense chosen for the word node, or {@code null} if the word
     * is punctuation, a function word, has no WordNet part of speech, or has
     * no senses.
     */
    public Sense disambiguate(SyntacticNode node, SyntacticTree tree) {
        if (!node.isWord())
            return null;
        TokenFeatures f = tree.graph().features(node.headIndex());
        POS pos = f.wordNetPos();
        if (pos == null || f.isPunctuation() || f.isFunctionWord())
            return null;
        String lemma = node.token().lemma().toLowerCase();

        List<Sense> candidates = null;
        String particle = particleOf(node);
        if (particle != null && pos == POS.VERB) {
            candidates = repository.lookup(lemma + "_" + particle, POS.VERB);
            if (candidates.isEmpty()) {
                candidates = mentioning(repository.lookup(lemma, pos),
                                        particle);
            }
        }
        if (candidates == null || candidates.isEmpty())
            candidates = repository.lookup(lemma, pos);
        if (candidates.isEmpty())
            return null;
        return mostFrequent(withoutTechnical(candidates));
    }

    /**
     * Stores the chosen sense on every word node of the tree that has one.
     *
     * @return the number of words that received a sense
     */
    public int annotate(SyntacticTree tree) {
        int annotated = 0;
        for (SyntacticNode leaf : tree.leaves()) {
            Sense s = disambiguate(leaf, tree);
            if (s == null)
                continue;
            leaf.annotations().set(SyntreeAnnotations.SenseAnnotation.class, s);
            if (s.lemma().indexOf('_') >= 0) {
                leaf.annotations().set(
                    SyntreeAnnotations.PhrasalLemmaAnnotation.class,
                    s.lemma());
            }
            ++annotated;
        }
        SyntreeLogger.veryVerbose("Assigned senses to %d of %d words",
                                  annotated, tree.tokens().size());
        return annotated;
    }

    /**
     * Returns the particle of the phrasal verb whose verb is this node, or
     * {@code null} if the node is not the verb of a phrasal verb.
     */
    private static String particleOf(SyntacticNode node) {
        SyntacticNode cur = node;
        if (cur.parent() != null && cur.parent().isPhrase(PhraseType.INFLECTION))
            cur = cur.parent();
        SyntacticNode pv = cur.parent();
        if (pv == null || !pv.isPhrase(PhraseType.PHRASAL_VERB)
                || !EdgeLabels.VERB.equals(cur.relation()))
            return null;
        SyntacticNode particle = pv.child(EdgeLabels.PARTICLE);
        if (particle == null || particle.leaves().isEmpty())
            return null;
        return particle.leaves().get(0).token().lemma().toLowerCase();
    }

    private static List<Sense> mentioning(List<Sense> senses, String word) {
        Pattern p = Pattern.compile("\\b" + Pattern.quote(word) + "\\b",
                                    Pattern.CASE_INSENSITIVE);
        List<Sense> matching = new ArrayList<Sense>();
        for (Sense s : senses) {
            if (p.matcher(s.definition()).find())
                matching.add(s);
        }
        return matching;
    }

    private static List<Sense> withoutTechnical(List<Sense> senses) {
        List<Sense> general = new ArrayList<Sense>();
        for (Sense s : senses) {
            if (!s.isTechnical())
                general.add(s);
        }
        return general.isEmpty() ? senses : general;
    }

    /**
     * Returns the sense with the highest frequency, keeping the earliest on
     * ties.
     */
    private static Sense mostFrequent(List<Sense> senses) {
        Sense best = null;
        for (Sense s : senses) {
            if (best == null || s.frequency() > best.frequency())
                best = s;
        }
        return best;
    }
}
