package org.gudu0.wordlebot.util;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Tagged console logger. INFO/WARN/DEBUG go to stdout, ERROR to stderr.
 * <p>
 * Timestamps follow the bot's configured zone once {@link #useZone(ZoneId)} is called,
 * so log lines line up with round dates.
 */
public final class ConsoleLog {
    private ConsoleLog() {}

    // Set from GlobalConfig.debug at startup and from the console ("debug on|off").
    @SuppressWarnings("CanBeFinal")
    public static volatile boolean DEBUG = false;

    private enum Level {
        INFO(null), WARN("93m"), DEBUG("32m"), ERROR("31m");

        private final String label;

        Level(String ansiColor) {
            this.label = ansiColor == null ? name() : "\u001B[" + ansiColor + name() + "\u001B[0m";
        }
    }

    private static final String PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";

    private static volatile DateTimeFormatter ts =
            DateTimeFormatter.ofPattern(PATTERN).withZone(ZoneId.systemDefault());

    public static void useZone(ZoneId zone) {
        ts = DateTimeFormatter.ofPattern(PATTERN).withZone(zone);
    }

    public static void info(String tag, String msg) {
        emit(Level.INFO, tag, msg);
    }

    public static void warn(String tag, String msg) {
        emit(Level.WARN, tag, msg);
    }

    public static void debug(String tag, String msg) {
        if (DEBUG) emit(Level.DEBUG, tag, msg);
    }

    public static void error(String tag, String msg) {
        emit(Level.ERROR, tag, msg);
    }

    public static void error(String tag, String msg, Throwable t) {
        emit(Level.ERROR, tag, msg);
        if (t != null) t.printStackTrace(System.err);
    }

    private static void emit(Level level, String tag, String msg) {
        PrintStream out = level == Level.ERROR ? System.err : System.out;
        out.println("[" + ts.format(Instant.now()) + "] [" + level.label + "] [" + tag + "] " + msg);
    }
}
