/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.io;

import java.io.File;
import java.io.IOException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import edu.ucla.sspace.util.LineReader;

import ca.mcgill.cs.syntree.token.DependencyRelations;
import ca.mcgill.cs.syntree.token.PartsOfSpeech;
import ca.mcgill.cs.syntree.token.Token;

import ca.mcgill.cs.syntree.util.SyntreeLogger;


/**
 * Reads dependency-parsed sentences in the CoNLL-X or CoNLL-U format.  Each
 * non-blank line describes one word in ten tab-separated columns, of which
 * the id, form, lemma, coarse tag, fine tag, head and relation are used;
 * blank lines separate sentences.  Comment lines starting with {@code #}, and
 * the multi-word ({@code 1-2}) and empty-node ({@code 1.1}) lines of CoNLL-U,
 * are skipped.
 *
 * <p> Heads are 1-based in the file, with 0 marking the root.  The tokens
 * returned are 0-based, and a root token is its own head.
 */
public class ConllReader {

    private static final String MISSING = "_";

    /**
     * Reads every sentence in the file.
     *
     * @throws IOException if the file cannot be read or a line is malformed
     */
    public List<List<Token>> read(File conllFile) throws IOException {
        if (!conllFile.exists())
            throw new IOException("No such file: " + conllFile);
        List<List<Token>> sentences = read(new LineReader(conllFile));
        SyntreeLogger.verbose("Read %d sentences from %s",
                              sentences.size(), conllFile);
        return sentences;
    }

    /**
     * Reads every sentence in the text.
     *
     * @throws IOException if a line is malformed
     */
    public List<List<Token>> readString(String conll) throws IOException {
        return read(Arrays.asList(conll.split("\r?\n", -1)));
    }

    private List<List<Token>> read(Iterable<String> lines) throws IOException {
        List<List<Token>> sentences = new ArrayList<List<Token>>();
        List<Token> cur = new ArrayList<Token>();
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                if (!cur.isEmpty()) {
                    sentences.add(cur);
                    cur = new ArrayList<Token>();
                }
                continue;
            }
            if (trimmed.startsWith("#"))
                continue;
            String[] cols = line.split("\t");
            if (cols.length < 8)
                cols = trimmed.split("\\s+");
            if (cols.length < 8) {
                throw new IOException("Line " + lineNo + " has " + cols.length
                                      + " columns; expected at least 8");
            }
            String id = cols[0];
            if (id.indexOf('-') >= 0 || id.indexOf('.') >= 0)
                continue;
            cur.add(toToken(cols, cur.size(), lineNo));
        }
        if (!cur.isEmpty())
            sentences.add(cur);
        return sentences;
    }

    private static Token toToken(String[] cols, int index, int lineNo)
            throws IOException {
        int id, head;
        try {
            id = Integer.parseInt(cols[0]);
            head = MISSING.equals(cols[6]) ? 0 : Integer.parseInt(cols[6]);
        } catch (NumberFormatException nfe) {
            throw new IOException("Line " + lineNo + " has a non-numeric id "
                                  + "or head", nfe);
        }
        if (id != index + 1) {
            throw new IOException("Line " + lineNo + " has id " + id
                                  + "; expected " + (index + 1));
        }

        String text = cols[1];
        String lemma = MISSING.equals(cols[2]) ? text : cols[2];
        String relation = MISSING.equals(cols[7]) ? "dep" : cols[7];
        String coarse = cols[3];
        String fine = MISSING.equals(cols[4]) ? "" : cols[4];

        String pos;
        if (PartsOfSpeech.isUniversal(coarse))
            pos = coarse;
        else {
            // CoNLL-X files carry Penn tags in both tag columns
            String penn = fine.isEmpty() ? coarse : fine;
            if (fine.isEmpty() && !MISSING.equals(penn))
                fine = penn;
            pos = PartsOfSpeech.toUniversal(
                penn, lemma, DependencyRelations.normalize(relation));
        }
        int headIndex = (head == 0) ? index : head - 1;
        return new Token(index, text, lemma, pos, fine, relation, headIndex);
    }
}
