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

public class JsonTokenReaderTest {

    static final String SENTENCE =
        "[{\"index\":0,\"text\":\"Dogs\",\"lemma\":\"dog\",\"pos\":\"NOUN\","
        + "\"tag\":\"NNS\",\"dep\":\"nsubj\",\"head\":1},"
        + "{\"index\":1,\"text\":\"bark\",\"lemma\":\"bark\",\"pos\":\"VERB\","
        + "\"tag\":\"VBP\",\"dep\":\"root\",\"head\":1}]";

    @Test public void testReadSentence() throws IOException {
        List<Token> tokens = new JsonTokenReader().readSentence(SENTENCE);
        assertEquals(2, tokens.size());
        Token dogs = tokens.get(0);
        assertEquals("Dogs", dogs.text());
        assertEquals("dog", dogs.lemma());
        assertEquals("NOUN", dogs.pos());
        assertEquals("NNS", dogs.fineTag());
        assertEquals("nsubj", dogs.dependencyRelation());
        assertEquals(1, dogs.headIndex());
        assertEquals(1, tokens.get(1).headIndex());
    }

    @Test public void testOptionalKeys() throws IOException {
        List<Token> tokens = new JsonTokenReader().readSentence(
            "[{\"text\":\"Hello\",\"head\":-1},{\"text\":\"!\",\"head\":0}]");
        Token hello = tokens.get(0);
        assertEquals(0, hello.index());
        assertEquals(0, hello.headIndex());
        assertEquals("Hello", hello.lemma());
        assertEquals("X", hello.pos());
        assertEquals("dep", hello.dependencyRelation());
        assertEquals(1, tokens.get(1).index());
    }

    @Test(expected=IOException.class)
    public void testMissingHead() throws IOException {
        new JsonTokenReader().readSentence("[{\"text\":\"Hello\"}]");
    }

    @Test(expected=IOException.class)
    public void testNotAnArray() throws IOException {
        new JsonTokenReader().readSentence("{\"text\":\"Hello\"}");
    }

    @Test public void testReadFile() throws IOException {
        File f = File.createTempFile("syntree-test", ".jsonl");
        f.deleteOnExit();
        Files.asCharSink(f, StandardCharsets.UTF_8)
            .write(SENTENCE + "\n\n" + SENTENCE + "\n");
        List<List<Token>> sentences = new JsonTokenReader().read(f);
        assertEquals(2, sentences.size());
    }

    @Test public void testLineNumberInError() throws IOException {
        File f = File.createTempFile("syntree-test", ".jsonl");
        f.deleteOnExit();
        Files.asCharSink(f, StandardCharsets.UTF_8)
            .write(SENTENCE + "\n[{\"text\":\"oops\"}]\n");
        try {
            new JsonTokenReader().read(f);
            fail("Expected an IOException");
        } catch (IOException ioe) {
            assertTrue(ioe.getMessage(), ioe.getMessage().startsWith("Line 2"));
        }
    }
}
