package org.gudu0.wordlebot.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout. The root defaults to ./data and can be moved with {@code -Dwordlebot.data=/some/dir}.
 * <pre>
 * data/global/config.json          bot-wide config
 * data/global/wordle.db            results database (default location)
 * data/guilds/&lt;id&gt;/config.json    per-guild config
 * data/guilds/&lt;id&gt;/autopost.json  weekly auto-post bookkeeping
 * </pre>
 */
public final class BotPaths {
    private BotPaths() {}

    public static final Path DATA = Path.of(System.getProperty("wordlebot.data", "data"));
    public static final Path GLOBAL_DIR = DATA.resolve("global");
    public static final Path GUILDS_DIR = DATA.resolve("guilds");

    public static final String CONFIG_FILE = "config.json";
    public static final String AUTOPOST_FILE = "autopost.json";

    public static Path globalConfig() {
        return GLOBAL_DIR.resolve(CONFIG_FILE);
    }

    /** Creates the global and guild roots. Failure is logged; stores will report their own write errors later. */
    public static void ensureBaseDirs() {
        for (Path dir : new Path[]{GLOBAL_DIR, GUILDS_DIR}) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                ConsoleLog.error("BotPaths", "Cannot create " + dir.toAbsolutePath() + ": " + e.getMessage(), e);
            }
        }
        ConsoleLog.info("BotPaths", "Data root: " + DATA.toAbsolutePath());
    }
}
