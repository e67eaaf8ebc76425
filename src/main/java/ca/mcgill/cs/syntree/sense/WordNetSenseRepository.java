/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.sense;

import java.io.File;
import java.io.IOException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import edu.mit.jwi.CachingDictionary;
import edu.mit.jwi.Dictionary;
import edu.mit.jwi.ICachingDictionary;
import edu.mit.jwi.IDictionary;

import edu.mit.jwi.item.IIndexWord;
import edu.mit.jwi.item.ISenseEntry;
import edu.mit.jwi.item.ISynset;
import edu.mit.jwi.item.IWord;
import edu.mit.jwi.item.IWordID;
import edu.mit.jwi.item.POS;
import edu.mit.jwi.item.Pointer;

import edu.mit.jwi.morph.IStemmer;
import edu.mit.jwi.morph.SimpleStemmer;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * A {@link SenseRepository} backed by a WordNet dictionary read through JWI.
 * Each sense is a word of the lemma's index entry, identified by its sense key
 * and weighted by the tag count of its sense entry.
 */
public class WordNetSenseRepository implements SenseRepository {

    static final Pattern USAGE_IN_GLOSS = Pattern.compile(";[\\s]*\"[^\"]+\"");

    /**
     * Words whose presence in a gloss marks the sense as belonging to a
     * specialized domain.
     */
    static final String[] TECHNICAL_TERMS_ = new String[] {
        "cricket", "chemistry", "physics", "mathematics", "biology",
        "medicine", "chemical", "baseball"
    };

    static final Set<String> TECHNICAL_TERMS =
        new HashSet<String>(Arrays.asList(TECHNICAL_TERMS_));

    private static final Pattern WORD = Pattern.compile("[a-z]+");

    private final IDictionary dict;

    private final IStemmer stemmer;

    public WordNetSenseRepository(IDictionary dict) {
        if (dict == null)
            throw new NullPointerException("dictionary");
        this.dict = dict;
        this.stemmer = new SimpleStemmer();
    }

    /**
     * Opens the WordNet dictionary in the directory, caching its entries.
     *
     * @throws IOException if the directory does not hold a readable
     *         dictionary
     */
    public static WordNetSenseRepository open(File wnDictDir)
            throws IOException {
        IDictionary dict = new Dictionary(wnDictDir.toURI().toURL());
        if (!dict.open())
            throw new IOException("Unable to open dictionary at " + wnDictDir);
        ICachingDictionary cache = new CachingDictionary(dict);
        cache.getCache().setEnabled(true);
        cache.getCache().setMaximumCapacity(500_000);
        SyntreeLogger.info("Opened WordNet %s at %s",
                           dict.getVersion(), wnDictDir);
        return new WordNetSenseRepository(cache);
    }

    /**
     * Returns the gloss of this synset, without the examples contained in it
     */
    static String getGlossWithoutExamples(ISynset syn) {
        Matcher m = USAGE_IN_GLOSS.matcher(syn.getGloss());
        return m.replaceAll("").trim();
    }

    /**
     * Returns {@code true} if the synset is filed under a topic, or if its
     * gloss names one of the technical domains.
     */
    static boolean isTechnical(ISynset syn, String gloss) {
        if (!syn.getRelatedSynsets(Pointer.TOPIC).isEmpty())
            return true;
        Matcher m = WORD.matcher(gloss.toLowerCase());
        while (m.find()) {
            if (TECHNICAL_TERMS.contains(m.group()))
                return true;
        }
        return false;
    }

    /** {@inheritDoc} */
    @Override public synchronized List<Sense> lookup(String lemma, POS pos) {
        if (lemma == null || lemma.trim().isEmpty() || pos == null)
            return Collections.<Sense>emptyList();
        String key = lemma.trim().toLowerCase().replace(' ', '_');
        IIndexWord iw = dict.getIndexWord(key, pos);
        if (iw == null) {
            // Fall back to what Morphy thinks the base form is
            for (String stem : stemmer.findStems(key, pos)) {
                if (!stem.equals(key)) {
                    iw = dict.getIndexWord(stem, pos);
                    if (iw != null)
                        break;
                }
            }
        }
        if (iw == null) {
            SyntreeLogger.veryVerbose("No WordNet entry for %s (%s)",
                                      key, pos);
            return Collections.<Sense>emptyList();
        }

        List<Sense> senses = new ArrayList<Sense>();
        for (IWordID wid : iw.getWordIDs()) {
            IWord word = dict.getWord(wid);
            if (word == null)
                continue;
            ISynset syn = word.getSynset();
            String gloss = getGlossWithoutExamples(syn);
            ISenseEntry entry = dict.getSenseEntry(word.getSenseKey());
            int frequency = (entry == null) ? 0 : entry.getTagCount();
            senses.add(new Sense(word.getSenseKey().toString(),
                                 iw.getLemma(), pos, gloss, frequency,
                                 isTechnical(syn, gloss)));
        }
        return senses;
    }
}
