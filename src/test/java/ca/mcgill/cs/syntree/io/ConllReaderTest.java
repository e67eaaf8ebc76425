/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.io;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;

import java.nio.charset.StandardCharsets;

import java.util.List;

import com.google.common.io.Files;

import org.junit.Test;

import ca.mcgill.cs.syntree.token.Token;

public class ConllReaderTest {

    static String line(String... cols) {
        StringBuilder sb = new StringBuilder();
        for (String c : cols) {
            if (sb.length() > 0)
                sb.append('\t');
            sb.append(c);
        }
        return sb.append('\n').toString();
    }

    static final String CONLL_U =
        "# sent_id = 1\n"
        + "# text = The cat doesn't eat.\n"
        + line("1", "The", "the", "DET", "DT", "_", "2", "det", "_", "_")
        + line("2", "cat", "cat", "NOUN", "NN", "_", "5", "nsubj", "_", "_")
        + line("3-4", "doesn't", "_", "_", "_", "_", "_", "_", "_", "_")
        + line("3", "does", "do", "AUX", "VBZ", "_", "5", "aux", "_", "_")
        + line("4", "n't", "not", "PART", "RB", "_", "5", "advmod", "_", "_")
        + line("5", "eat", "eat", "VERB", "VB", "_", "0", "root", "_", "_")
        + line("5.1", "food", "food", "NOUN", "NN", "_", "_", "_", "_", "_")
        + line("6", ".", ".", "PUNCT", ".", "_", "5", "punct", "_", "_")
        + "\n";

    static final String CONLL_X =
        line("1", "Dogs", "dog", "NNS", "NNS", "_", "2", "nsubj", "_", "_")
        + line("2", "bark", "_", "VBP", "VBP", "_", "0", "root", "_", "_")
        + "\n\n"
        + line("1", "Stop", "stop", "VB", "_", "_", "0", "root", "_", "_")
        + line("2", "!", "!", ".", "_", "_", "1", "punct", "_", "_");

    @Test public void testConllU() throws IOException {
        List<List<Token>> sentences = new ConllReader().readString(CONLL_U);
        assertEquals(1, sentences.size());
        List<Token> s = sentences.get(0);
        assertEquals(6, s.size());
        // The range line 3-4 and the empty node 5.1 are skipped
        assertEquals("does", s.get(2).text());
        assertEquals("eat", s.get(4).text());
        assertEquals(4, s.get(4).headIndex());
        assertEquals(1, s.get(0).headIndex());
        assertEquals(4, s.get(1).headIndex());
        assertEquals(".", s.get(5).text());
        assertEquals("AUX", s.get(2).pos());
        assertEquals("VBZ", s.get(2).fineTag());
        assertEquals("nsubj", s.get(1).dependencyRelation());
        for (int i = 0; i < s.size(); ++i)
            assertEquals(i, s.get(i).index());
    }

    @Test public void testConllXWithPennTags() throws IOException {
        List<List<Token>> sentences = new ConllReader().readString(CONLL_X);
        assertEquals(2, sentences.size());
        Token dogs = sentences.get(0).get(0);
        assertEquals("NOUN", dogs.pos());
        assertEquals("NNS", dogs.fineTag());
        Token bark = sentences.get(0).get(1);
        assertEquals("VERB", bark.pos());
        assertEquals("bark", bark.lemma());
        assertEquals(1, bark.headIndex());

        Token stop = sentences.get(1).get(0);
        assertEquals("VB", stop.fineTag());
        assertEquals("VERB", stop.pos());
        Token bang = sentences.get(1).get(1);
        assertEquals("PUNCT", bang.pos());
        assertEquals(0, bang.headIndex());
    }

    @Test public void testSpaceSeparatedColumns() throws IOException {
        List<List<Token>> sentences = new ConllReader().readString(
            "1 Dogs dog NOUN NNS _ 2 nsubj _ _\n"
            + "2 bark bark VERB VBP _ 0 root _ _\n");
        assertEquals(1, sentences.size());
        assertEquals(2, sentences.get(0).size());
    }

    @Test(expected=IOException.class)
    public void testTooFewColumns() throws IOException {
        new ConllReader().readString("1\tDogs\tdog\tNOUN\n");
    }

    @Test(expected=IOException.class)
    public void testNonConsecutiveIds() throws IOException {
        new ConllReader().readString(
            line("1", "Dogs", "dog", "NOUN", "NNS", "_", "3", "nsubj", "_", "_")
            + line("3", "bark", "bark", "VERB", "VBP", "_", "0", "root", "_",
                   "_"));
    }

    @Test(expected=IOException.class)
    public void testNonNumericHead() throws IOException {
        new ConllReader().readString(
            line("1", "Dogs", "dog", "NOUN", "NNS", "_", "x", "nsubj", "_",
                 "_"));
    }

    @Test public void testReadFile() throws IOException {
        File f = File.createTempFile("syntree-test", ".conllu");
        f.deleteOnExit();
        Files.asCharSink(f, StandardCharsets.UTF_8).write(CONLL_U + CONLL_X);
        List<List<Token>> sentences = new ConllReader().read(f);
        assertEquals(3, sentences.size());
    }

    @Test(expected=IOException.class)
    public void testMissingFile() throws IOException {
        new ConllReader().read(new File("no/such/file.conllu"));
    }
}
