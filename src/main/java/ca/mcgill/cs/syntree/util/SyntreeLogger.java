/*
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package ca.mcgill.cs.syntree.util;

import java.io.IOError;
import java.io.IOException;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The shared logger for tree construction.  Messages are formatted with {@link
 * String#format(String,Object[])} and are attributed to the class and method
 * that called into this logger, so callers never need to hold their own
 * {@link Logger} instance.
 */
public class SyntreeLogger {

    public static final String LOGGER_NAME = "ca.mcgill.cs.syntree";

    public static final Logger LOGGER = Logger.getLogger(LOGGER_NAME);

    /**
     * The system property that, when set, names a file to which all log
     * messages are also written.
     */
    public static final String LOG_FILE_PROPERTY = "syntree.logfile";

    static {
        String logFileName = System.getProperty(LOG_FILE_PROPERTY);
        if (logFileName != null) {
            try {
                Handler handler = new FileHandler(logFileName);
                LOGGER.addHandler(handler);
            } catch (IOException ioe) {
                throw new IOError(ioe);
            }
        }
    }

    /**
     * Returns {@code true} if log messages sent at this output level will be
     * shown to the user.
     */
    public static boolean isLoggable(Level outputLevel) {
        return LOGGER.isLoggable(outputLevel);
    }

    /**
     * Sets which logging is reported to the console according to the desired
     * level.
     */
    public static void setLevel(Level outputLevel) {
        Handler verboseHandler = new ConsoleHandler();
        verboseHandler.setLevel(outputLevel);
        LOGGER.addHandler(verboseHandler);
        LOGGER.setLevel(outputLevel);
        LOGGER.setUseParentHandlers(false);
    }

    /**
     * Prints {@link Level#FINER} messages, which are generally only useful
     * when debugging a single sentence.
     */
    public static void veryVerbose(String format, Object... args) {
        log(Level.FINER, format, args);
    }

    /**
     * Prints {@link Level#FINE} messages.
     */
    public static void verbose(String format, Object... args) {
        log(Level.FINE, format, args);
    }

    public static void info(String format, Object... args) {
        log(Level.INFO, format, args);
    }

    public static void warning(String format, Object... args) {
        log(Level.WARNING, format, args);
    }

    public static void severe(String format, Object... args) {
        log(Level.SEVERE, format, args);
    }

    private static void log(Level level, String format, Object[] args) {
        if (!LOGGER.isLoggable(level))
            return;
        StackTraceElement[] callStack =
            Thread.currentThread().getStackTrace();
        // Index 0 is Thread.getStackTrace()
        // Index 1 is this method
        // Index 2 is the public level method
        // Index 3 is the caller
        StackTraceElement caller = callStack[3];
        String message = (args.length == 0)
            ? format : String.format(format, args);
        LOGGER.logp(level, caller.getClassName(), caller.getMethodName(),
                    message);
    }
}
