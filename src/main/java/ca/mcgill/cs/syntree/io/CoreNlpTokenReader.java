/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.io;

import java.util.ArrayList;
import java.util.List;

import edu.stanford.nlp.ling.CoreAnnotations;
import edu.stanford.nlp.ling.CoreLabel;
import edu.stanford.nlp.ling.TaggedWord;

import edu.stanford.nlp.pipeline.Annotation;

import edu.stanford.nlp.process.Morphology;

import edu.stanford.nlp.trees.EnglishGrammaticalStructure;
import edu.stanford.nlp.trees.GrammaticalStructure;
import edu.stanford.nlp.trees.Tree;
import edu.stanford.nlp.trees.TreeCoreAnnotations;
import edu.stanford.nlp.trees.TypedDependency;

import edu.stanford.nlp.util.CoreMap;

import ca.mcgill.cs.syntree.token.DependencyRelations;
import ca.mcgill.cs.syntree.token.PartsOfSpeech;
import ca.mcgill.cs.syntree.token.Token;

import ca.mcgill.cs.syntree.util.CoreNlpUtils;
import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Produces dependency-parsed tokens with CoreNLP.  A constituency parse is
 * converted to basic Stanford dependencies by {@link
 * EnglishGrammaticalStructure}; the words the converter leaves out, which are
 * punctuation, are attached to the root with the relation {@code punct}.
 */
public class CoreNlpTokenReader {

    private final Morphology morphology;

    public CoreNlpTokenReader() {
        morphology = new Morphology();
    }

    /**
     * Parses the raw text with the thread-local CoreNLP pipeline and returns
     * the tokens of each sentence.
     */
    public List<List<Token>> read(String text) {
        Annotation document = CoreNlpUtils.annotate(text);
        List<List<Token>> sentences = new ArrayList<List<Token>>();
        for (CoreMap sentence
                 : document.get(CoreAnnotations.SentencesAnnotation.class)) {
            Tree tree = sentence.get(TreeCoreAnnotations.TreeAnnotation.class);
            List<String> lemmas = new ArrayList<String>();
            for (CoreLabel cl
                     : sentence.get(CoreAnnotations.TokensAnnotation.class))
                lemmas.add(cl.get(CoreAnnotations.LemmaAnnotation.class));
            sentences.add(toTokens(tree, lemmas));
        }
        SyntreeLogger.verbose("Parsed %d sentences", sentences.size());
        return sentences;
    }

    /**
     * Converts a constituency parse to tokens, lemmatizing each word with
     * CoreNLP's {@link Morphology}.
     */
    public List<Token> toTokens(Tree tree) {
        return toTokens(tree, null);
    }

    /**
     * Converts a constituency parse to tokens.
     *
     * @param lemmas the lemma of each leaf, or {@code null} to compute them
     */
    public List<Token> toTokens(Tree tree, List<String> lemmas) {
        List<TaggedWord> words = tree.taggedYield();
        int n = words.size();
        int[] heads = new int[n];
        String[] relations = new String[n];
        for (int i = 0; i < n; ++i)
            heads[i] = -2;

        GrammaticalStructure gs = new EnglishGrammaticalStructure(tree);
        int root = -1;
        for (TypedDependency td : gs.typedDependencies()) {
            int dep = td.dep().index() - 1;
            int gov = td.gov().index() - 1;
            if (dep < 0 || dep >= n)
                continue;
            relations[dep] = td.reln().toString();
            if (gov < 0) {
                heads[dep] = dep;
                if (root < 0)
                    root = dep;
            }
            else
                heads[dep] = gov;
        }

        List<Token> tokens = new ArrayList<Token>(n);
        for (int i = 0; i < n; ++i) {
            TaggedWord tw = words.get(i);
            String word = tw.word();
            String tag = tw.tag();
            String lemma = (lemmas != null && i < lemmas.size()
                            && lemmas.get(i) != null)
                ? lemmas.get(i)
                : lemma(word, tag);
            String rel;
            int head;
            if (heads[i] == -2) {
                rel = "punct";
                head = (root < 0) ? i : root;
            }
            else {
                rel = relations[i];
                head = heads[i];
            }
            String pos = PartsOfSpeech.toUniversal(
                tag, lemma, DependencyRelations.normalize(rel));
            tokens.add(new Token(i, word, lemma, pos, tag, rel, head));
        }
        return tokens;
    }

    private synchronized String lemma(String word, String tag) {
        return morphology.lemma(word, tag);
    }
}
