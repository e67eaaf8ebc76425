/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.util;

import java.util.Properties;

import edu.stanford.nlp.pipeline.Annotation;
import edu.stanford.nlp.pipeline.StanfordCoreNLP;


/**
 * Thread-safe access to thread-local instances of a CoreNLP pipeline that
 * tokenizes, tags, lemmatizes and constituency-parses raw text.  The pipeline
 * is only created the first time a thread asks for it, since loading the
 * parser model is expensive.
 */
public class CoreNlpUtils {

    /**
     * The annotators needed to recover dependency-parsed tokens from text.
     */
    public static final String ANNOTATORS = "tokenize, ssplit, pos, lemma, parse";

    private static final ThreadLocal<StanfordCoreNLP> pipelines
        = new ThreadLocal<StanfordCoreNLP>();

    /**
     * Returns the thread-local copy of a {@link StanfordCoreNLP} instance.
     *
     * @return the thread-local copy of a {@link StanfordCoreNLP} instance.
     */
    public static StanfordCoreNLP get() {
        StanfordCoreNLP pipeline = pipelines.get();
        if (pipeline == null) {
            Properties props = new Properties();
            props.put("annotators", ANNOTATORS);
            props.put("tokenize.options", "untokenizable=noneDelete");
            SyntreeLogger.verbose("Loading CoreNLP pipeline for %s",
                                  Thread.currentThread().getName());
            pipeline = new StanfordCoreNLP(props);
            pipelines.set(pipeline);
        }
        return pipeline;
    }

    /**
     * Runs the thread-local pipeline over the text and returns the annotated
     * document.
     */
    public static Annotation annotate(String text) {
        Annotation document = new Annotation(text);
        get().annotate(document);
        return document;
    }
}
