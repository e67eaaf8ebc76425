/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.clause;


/**
 * Thrown when a sentence contains no verb around which a clause could be
 * built.  Callers are expected to fall back to a single fragment clause.
 */
public class NoClauseFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    public NoClauseFoundException(String message) {
        super(message);
    }
}
