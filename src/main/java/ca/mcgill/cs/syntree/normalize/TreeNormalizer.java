/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import ca.mcgill.cs.syntree.phrase.PhrasalVerbLexicon;

import ca.mcgill.cs.syntree.tree.SyntacticTree;
import ca.mcgill.cs.syntree.tree.TreeInvariants;

import ca.mcgill.cs.syntree.util.SyntreeConfig;
import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Runs a sequence of {@link NormalizationPass} instances over a tree, one
 * after the other, checking the tree invariants after each pass.
 */
public class TreeNormalizer {

    private final List<NormalizationPass> passes;

    public TreeNormalizer() {
        passes = new ArrayList<NormalizationPass>();
    }

    public TreeNormalizer(Collection<NormalizationPass> passes) {
        this.passes = new ArrayList<NormalizationPass>(passes);
    }

    /**
     * Returns the normalizer with the standard passes in their standard order:
     * object grouping, phrasal verb reinterpretation, punctuation relocation
     * and, if the configuration asks for it, lemma decomposition.
     */
    public static TreeNormalizer standard(SyntreeConfig config,
                                          PhrasalVerbLexicon lexicon) {
        TreeNormalizer normalizer = new TreeNormalizer();
        normalizer.add(new ObjectGroupingPass(config.maxPhraseDepth()));
        normalizer.add(new PhrasalVerbReinterpretationPass(lexicon));
        normalizer.add(new PunctuationRelocationPass());
        if (config.decomposeLemmas())
            normalizer.add(new LemmaDecompositionPass());
        return normalizer;
    }

    public void add(NormalizationPass pass) {
        passes.add(pass);
    }

    /**
     * Returns the passes in the order in which they are applied.
     */
    public List<NormalizationPass> getPasses() {
        return passes;
    }

    /**
     * Applies every pass in order.
     *
     * @throws ca.mcgill.cs.syntree.tree.TreeConstructionException if a pass
     *         leaves the tree in violation of an invariant
     */
    public void normalize(SyntacticTree tree) {
        for (NormalizationPass pass : passes) {
            boolean changed = pass.apply(tree);
            if (changed)
                SyntreeLogger.veryVerbose("%s changed the tree to %s",
                                          pass.name(), tree);
            TreeInvariants.verify(tree);
        }
    }
}
