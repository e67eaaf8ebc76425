/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.util;

import java.io.File;
import java.io.IOError;
import java.io.IOException;
import java.io.InputStream;

import java.util.Properties;


/**
 * The settings that control tree construction.  Defaults come from the {@code
 * syntree.properties} resource on the classpath; any key may be overridden by
 * a JVM system property of the same name, and then by the setters (which is
 * how the command line applies its options).
 */
public class SyntreeConfig {

    public static final String RESOURCE_NAME = "syntree.properties";

    /**
     * Whether inflected words are split into a lemma plus an inflection edge.
     */
    public static final String DECOMPOSE_LEMMAS = "syntree.decomposeLemmas";

    /**
     * Whether the normalization passes run after assembly.
     */
    public static final String NORMALIZE = "syntree.normalize";

    /**
     * Whether a sentence whose tree cannot be built falls back to a flat tree
     * instead of failing.
     */
    public static final String FLAT_FALLBACK = "syntree.flatFallback";

    /**
     * How deeply phrases may be nested before remaining dependents are left to
     * the clause-level sweep.
     */
    public static final String MAX_PHRASE_DEPTH = "syntree.maxPhraseDepth";

    /**
     * The WordNet {@code dict/} directory used for sense annotation, if any.
     */
    public static final String WORDNET_DIR = "syntree.wordnet.dir";

    private final Properties props;

    /**
     * Creates a configuration from the classpath defaults and the current
     * system properties.
     */
    public SyntreeConfig() {
        this(loadDefaults());
        for (String key : props.stringPropertyNames()) {
            String override = System.getProperty(key);
            if (override != null)
                props.setProperty(key, override);
        }
        String wnDir = System.getProperty(WORDNET_DIR);
        if (wnDir != null)
            props.setProperty(WORDNET_DIR, wnDir);
    }

    /**
     * Creates a configuration from exactly these properties, ignoring the
     * classpath defaults and system properties.
     */
    public SyntreeConfig(Properties props) {
        this.props = new Properties();
        this.props.putAll(props);
    }

    private static Properties loadDefaults() {
        Properties defaults = new Properties();
        InputStream is = SyntreeConfig.class.getClassLoader()
            .getResourceAsStream(RESOURCE_NAME);
        if (is == null) {
            SyntreeLogger.verbose("No %s on the classpath; using built-in " +
                                  "defaults", RESOURCE_NAME);
            return defaults;
        }
        try {
            defaults.load(is);
            is.close();
        } catch (IOException ioe) {
            throw new IOError(ioe);
        }
        return defaults;
    }

    public boolean decomposeLemmas() {
        return getBoolean(DECOMPOSE_LEMMAS, false);
    }

    public void setDecomposeLemmas(boolean decompose) {
        props.setProperty(DECOMPOSE_LEMMAS, String.valueOf(decompose));
    }

    public boolean normalize() {
        return getBoolean(NORMALIZE, true);
    }

    public void setNormalize(boolean normalize) {
        props.setProperty(NORMALIZE, String.valueOf(normalize));
    }

    public boolean useFlatFallback() {
        return getBoolean(FLAT_FALLBACK, true);
    }

    public void setUseFlatFallback(boolean useFallback) {
        props.setProperty(FLAT_FALLBACK, String.valueOf(useFallback));
    }

    public int maxPhraseDepth() {
        String value = props.getProperty(MAX_PHRASE_DEPTH);
        if (value == null)
            return 32;
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth < 1)
                throw new IllegalArgumentException(
                    MAX_PHRASE_DEPTH + " must be positive: " + value);
            return depth;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException(
                "Invalid value for " + MAX_PHRASE_DEPTH + ": " + value, nfe);
        }
    }

    public void setMaxPhraseDepth(int depth) {
        props.setProperty(MAX_PHRASE_DEPTH, String.valueOf(depth));
    }

    /**
     * Returns the configured WordNet dictionary directory or {@code null} if
     * sense annotation was not configured.
     */
    public File wordNetDir() {
        String dir = props.getProperty(WORDNET_DIR);
        return (dir == null || dir.trim().isEmpty()) ? null : new File(dir);
    }

    public void setWordNetDir(File dir) {
        props.setProperty(WORDNET_DIR, dir.getPath());
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = props.getProperty(key);
        return (value == null)
            ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    @Override public String toString() {
        return "SyntreeConfig" + props;
    }
}
