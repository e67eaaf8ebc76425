/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;

import java.nio.charset.StandardCharsets;

import java.util.List;

import java.util.logging.Level;

import com.google.common.io.Files;

import edu.ucla.sspace.common.ArgOptions;

import ca.mcgill.cs.syntree.io.ConllReader;
import ca.mcgill.cs.syntree.io.CoreNlpTokenReader;
import ca.mcgill.cs.syntree.io.JsonTokenReader;
import ca.mcgill.cs.syntree.io.TreeJsonSerializer;

import ca.mcgill.cs.syntree.sense.SenseDisambiguator;
import ca.mcgill.cs.syntree.sense.WordNetSenseRepository;

import ca.mcgill.cs.syntree.token.Token;

import ca.mcgill.cs.syntree.util.SyntreeConfig;
import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * The command-line entry point, which builds a syntactic tree for every
 * sentence of its input and writes each as one line of JSON.
 */
public class SyntreeMain {

    public static void main(String[] args) {
        try {
            ArgOptions opts = createOptions();
            opts.parseOptions(args);

            if (opts.hasOption('v'))
                SyntreeLogger.setLevel(Level.FINE);
            if (opts.hasOption('V'))
                SyntreeLogger.setLevel(Level.FINER);

            int numInputs = (opts.hasOption('c') ? 1 : 0)
                + (opts.hasOption('j') ? 1 : 0)
                + (opts.hasOption('t') ? 1 : 0);
            if (numInputs != 1) {
                usage(opts);
                System.exit(1);
            }

            SyntreeConfig config = new SyntreeConfig();
            if (opts.hasOption('l'))
                config.setDecomposeLemmas(true);
            if (opts.hasOption('w'))
                config.setWordNetDir(new File(opts.getStringOption('w')));
            SyntreeLogger.verbose("Configuration: %s", config);

            SenseDisambiguator disambiguator = null;
            if (config.wordNetDir() != null) {
                disambiguator = new SenseDisambiguator(
                    WordNetSenseRepository.open(config.wordNetDir()));
            }

            List<List<Token>> sentences = readInput(opts);
            SentenceTreeBuilder builder =
                new SentenceTreeBuilder(config, disambiguator);
            TreeJsonSerializer serializer = new TreeJsonSerializer();

            PrintWriter out = (opts.hasOption('o'))
                ? new PrintWriter(Files.newWriter(
                      new File(opts.getStringOption('o')),
                      StandardCharsets.UTF_8))
                : new PrintWriter(new OutputStreamWriter(
                      System.out, StandardCharsets.UTF_8));
            int fallbacks = 0;
            try {
                for (List<Token> sentence : sentences) {
                    SentenceAnalysis analysis = builder.build(sentence);
                    if (analysis.usedFallback())
                        fallbacks++;
                    out.println(serializer.serialize(analysis.tree()));
                }
            } finally {
                out.flush();
                if (opts.hasOption('o'))
                    out.close();
            }
            SyntreeLogger.info("Built %d trees (%d flat)",
                               sentences.size(), fallbacks);
        }
        catch (Throwable t) {
            t.printStackTrace();
        }
    }

    private static List<List<Token>> readInput(ArgOptions opts)
            throws IOException {
        if (opts.hasOption('c'))
            return new ConllReader().read(new File(opts.getStringOption('c')));
        if (opts.hasOption('j'))
            return new JsonTokenReader().read(
                new File(opts.getStringOption('j')));
        File textFile = new File(opts.getStringOption('t'));
        String text = Files.asCharSource(textFile, StandardCharsets.UTF_8)
            .read();
        return new CoreNlpTokenReader().read(text);
    }

    private static ArgOptions createOptions() {
        ArgOptions options = new ArgOptions();

        options.addOption('c', "conll",
                          "a file of dependency-parsed sentences in the " +
                          "CoNLL-X or CoNLL-U format",
                          true, "FILE", "Input Options");
        options.addOption('j', "json",
                          "a file with one JSON array of tokens per line",
                          true, "FILE", "Input Options");
        options.addOption('t', "text",
                          "a file of raw text, which will be parsed with " +
                          "CoreNLP",
                          true, "FILE", "Input Options");

        options.addOption('w', "wordnet",
                          "the WordNet dict directory; if given, every " +
                          "content word is assigned a sense",
                          true, "DIR", "Tree Options");
        options.addOption('l', "decompose-lemmas",
                          "splits inflected words into their lemma and " +
                          "inflection",
                          false, null, "Tree Options");

        options.addOption('o', "output",
                          "the file to which the trees are written " +
                          "(default: stdout)",
                          true, "FILE", "Output Options");

        options.addOption('v', "verbose", "prints verbose output",
                          false, null, "Program Options");
        options.addOption('V', "veryVerbose", "prints very verbose output, "+
                          "which is generally only useful for debugging",
                          false, null, "Program Options");

        return options;
    }

    /**
     * Prints out information on how to run the program to {@code stdout}.
     */
    private static void usage(ArgOptions argOptions) {
        System.out.println(
            "usage: java "
            + SyntreeMain.class.getName()
            + " [options] (-c FILE | -j FILE | -t FILE)\n"
            + argOptions.prettyPrint());
    }
}
