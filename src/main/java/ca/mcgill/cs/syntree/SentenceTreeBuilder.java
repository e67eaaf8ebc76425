/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree;

import java.util.List;

import ca.mcgill.cs.syntree.clause.ClauseBoundary;
import ca.mcgill.cs.syntree.clause.ClauseSegmenter;

import ca.mcgill.cs.syntree.graph.DependencyGraph;

import ca.mcgill.cs.syntree.normalize.TreeNormalizer;

import ca.mcgill.cs.syntree.phrase.PhrasalVerbLexicon;

import ca.mcgill.cs.syntree.sense.SenseDisambiguator;

import ca.mcgill.cs.syntree.token.Token;

import ca.mcgill.cs.syntree.tree.FlatTreeBuilder;
import ca.mcgill.cs.syntree.tree.SyntacticTree;
import ca.mcgill.cs.syntree.tree.TreeAssembler;
import ca.mcgill.cs.syntree.tree.TreeConstructionException;

import ca.mcgill.cs.syntree.util.SyntreeConfig;
import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * The end-to-end pipeline that turns the tokens of one dependency-parsed
 * sentence into a syntactic tree: clause segmentation, phrase building and
 * tree assembly, followed by normalization and, if a {@link
 * SenseDisambiguator} is given, sense annotation.
 *
 * <p> A sentence always yields a tree.  When the dependency graph has a cycle,
 * or assembly or normalization fails, the in-progress tree is discarded and
 * the flat tree of {@link FlatTreeBuilder} is returned instead, unless the
 * configuration turns the fallback off.  Instances keep no state between
 * sentences and may be shared between threads.
 */
public class SentenceTreeBuilder {

    private final SyntreeConfig config;

    private final ClauseSegmenter segmenter;

    private final TreeAssembler assembler;

    private final TreeNormalizer normalizer;

    private final FlatTreeBuilder flatBuilder;

    /**
     * May be {@code null}, in which case no senses are assigned.
     */
    private final SenseDisambiguator disambiguator;

    public SentenceTreeBuilder() {
        this(new SyntreeConfig(), null);
    }

    public SentenceTreeBuilder(SyntreeConfig config,
                               SenseDisambiguator disambiguator) {
        this(config, new PhrasalVerbLexicon(), disambiguator);
    }

    public SentenceTreeBuilder(SyntreeConfig config,
                               PhrasalVerbLexicon lexicon,
                               SenseDisambiguator disambiguator) {
        this.config = config;
        this.segmenter = new ClauseSegmenter();
        this.assembler = new TreeAssembler(config.maxPhraseDepth());
        this.normalizer = TreeNormalizer.standard(config, lexicon);
        this.flatBuilder = new FlatTreeBuilder();
        this.disambiguator = disambiguator;
    }

    /**
     * Builds the tree for the sentence.
     *
     * @throws IllegalArgumentException if the tokens are not a valid sentence,
     *         i.e., their indices are not 0 to n-1 in order
     * @throws TreeConstructionException if the tree could not be built and the
     *         flat fallback is disabled
     */
    public SentenceAnalysis build(List<Token> tokens) {
        DependencyGraph graph = new DependencyGraph(tokens);
        if (graph.size() == 0)
            return new SentenceAnalysis(new SyntacticTree(graph), false, null);

        if (graph.isCyclic()) {
            List<Integer> cycle = graph.findCycle();
            String reason = "dependency cycle through tokens " + cycle;
            if (!config.useFlatFallback())
                throw new TreeConstructionException(
                    "Cannot structure a sentence with a " + reason);
            SyntreeLogger.warning("Using flat tree for \"%s\": %s",
                                  sentenceText(graph), reason);
            return fallback(graph, reason);
        }

        SyntacticTree tree;
        try {
            List<ClauseBoundary> clauses = segmenter.segmentOrFragment(graph);
            SyntreeLogger.verbose("Segmented %d tokens into %d clauses",
                                  graph.size(), clauses.size());
            tree = assembler.assemble(graph, clauses);
            if (config.normalize())
                normalizer.normalize(tree);
        } catch (TreeConstructionException tce) {
            if (!config.useFlatFallback())
                throw tce;
            SyntreeLogger.warning("Using flat tree for \"%s\": %s",
                                  sentenceText(graph), tce.getMessage());
            return fallback(graph, tce.getMessage());
        }

        if (disambiguator != null)
            disambiguator.annotate(tree);
        return new SentenceAnalysis(tree, false, null);
    }

    private SentenceAnalysis fallback(DependencyGraph graph, String reason) {
        SyntacticTree flat = flatBuilder.build(graph);
        if (disambiguator != null)
            disambiguator.annotate(flat);
        return new SentenceAnalysis(flat, true, reason);
    }

    private static String sentenceText(DependencyGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (Token t : graph.tokens()) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append(t.text());
        }
        return sb.toString();
    }
}
