package org.gudu0.wordlebot.config;

/**
 * Per-guild config.
 * <p>
 * Stored at: data/guilds/&lt;guildId&gt;/config.json
 */
public class GuildConfig {
    /** Whether the weekly leaderboard is auto-posted in this guild (toggled by /toggle). */
    public boolean autoPostEnabled = true;

    /** Channel for the weekly auto-post. Blank = pick one by name. */
    public String autoPostChannelId = "";

    /** Per-guild log thread. */
    public String logThreadId = "";

    /** Whether the bot should send ingestion logs for this guild. */
    public boolean enableLogs = false;
}
