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
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import edu.ucla.sspace.util.LineReader;

import ca.mcgill.cs.syntree.token.Token;


/**
 * Reads sentences stored as JSON, one sentence per line.  A sentence is an
 * array of token objects with the keys {@code index}, {@code text}, {@code
 * lemma}, {@code pos}, {@code tag}, {@code dep} and {@code head}.  Indices
 * are 0-based and a token whose {@code head} is its own index, or negative,
 * is a root.  Only {@code text} and {@code head} are required.
 */
public class JsonTokenReader {

    /**
     * Reads every sentence in the file, skipping blank lines.
     */
    public List<List<Token>> read(File jsonFile) throws IOException {
        if (!jsonFile.exists())
            throw new IOException("No such file: " + jsonFile);
        List<List<Token>> sentences = new ArrayList<List<Token>>();
        int lineNo = 0;
        for (String line : new LineReader(jsonFile)) {
            lineNo++;
            if (line.trim().isEmpty())
                continue;
            try {
                sentences.add(readSentence(line));
            } catch (IOException ioe) {
                throw new IOException("Line " + lineNo + ": "
                                      + ioe.getMessage(), ioe);
            }
        }
        return sentences;
    }

    /**
     * Reads the tokens of one sentence from its JSON array.
     *
     * @throws IOException if the text is not an array of token objects
     */
    public List<Token> readSentence(String json) throws IOException {
        try {
            return toTokens(new JSONArray(json));
        } catch (JSONException je) {
            throw new IOException("Malformed sentence: " + je.getMessage(), je);
        }
    }

    static List<Token> toTokens(JSONArray arr) {
        List<Token> tokens = new ArrayList<Token>(arr.length());
        for (int i = 0; i < arr.length(); ++i) {
            JSONObject jo = arr.getJSONObject(i);
            int index = jo.optInt("index", i);
            int head = jo.getInt("head");
            if (head < 0)
                head = index;
            tokens.add(new Token(index,
                                 jo.getString("text"),
                                 jo.optString("lemma", null),
                                 jo.optString("pos", null),
                                 jo.optString("tag", ""),
                                 jo.optString("dep", null),
                                 head));
        }
        return tokens;
    }
}
