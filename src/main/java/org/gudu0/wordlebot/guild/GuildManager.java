package org.gudu0.wordlebot.guild;

import org.gudu0.wordlebot.util.BotPaths;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One lazily loaded {@link GuildContext} per guild id, shared by every listener.
 */
public final class GuildManager {

    private final Map<Long, GuildContext> contexts = new ConcurrentHashMap<>();
    private final Path guildsDir;

    public GuildManager() {
        this(BotPaths.GUILDS_DIR);
    }

    /** Tests point this at a temp dir. */
    public GuildManager(Path guildsDir) {
        this.guildsDir = guildsDir;
    }

    public GuildContext get(long guildId) {
        return contexts.computeIfAbsent(guildId, id -> {
            ConsoleLog.debug("GuildManager", "Loading context guildId=" + id);
            return new GuildContext(id, guildsDir.resolve(Long.toString(id)));
        });
    }

    public int cachedCount() {
        return contexts.size();
    }
}
