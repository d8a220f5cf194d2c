package org.gudu0.wordlebot.guild;

import org.gudu0.wordlebot.autopost.AutoPostStore;
import org.gudu0.wordlebot.config.GuildConfig;
import org.gudu0.wordlebot.config.TypedConfigStore;
import org.gudu0.wordlebot.util.BotPaths;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.nio.file.Path;

/**
 * Everything that is "per guild" lives here: its config and its auto-post bookkeeping.
 * Results are not per guild; they live in the shared database keyed by user id.
 */
public final class GuildContext {

    public final long guildId;

    public final TypedConfigStore<GuildConfig> configStore;
    public final GuildConfig cfg;

    public final AutoPostStore autoPostStore;

    public GuildContext(long guildId, Path dir) {
        this.guildId = guildId;

        ConsoleLog.info("GuildContext", "Initializing guild context dir=" + dir);

        this.configStore = new TypedConfigStore<>(dir.resolve(BotPaths.CONFIG_FILE), GuildConfig.class, GuildConfig::new);
        this.cfg = configStore.cfg();

        this.autoPostStore = new AutoPostStore(dir.resolve(BotPaths.AUTOPOST_FILE));

        ConsoleLog.info(
                "GuildContext",
                "Loaded guild cfg guildId=" + guildId
                        + " autoPostEnabled=" + cfg.autoPostEnabled
                        + " autoPostChannelId=" + cfg.autoPostChannelId
                        + " enableLogs=" + cfg.enableLogs
                        + " logThreadId=" + cfg.logThreadId
        );
    }

    /** Saves the guild config, logging instead of throwing. Returns false on failure. */
    public boolean saveConfig(String action) {
        try {
            configStore.save();
            ConsoleLog.info("GuildContext", "Saved guild config: guildId=" + guildId + " action=" + action);
            return true;
        } catch (Exception e) {
            ConsoleLog.error("GuildContext", "Failed saving guild config guildId=" + guildId + ": " + e.getMessage(), e);
            return false;
        }
    }
}
