package org.gudu0.wordlebot.autopost;

/**
 * Per-guild auto-post bookkeeping.
 * Stored at: data/guilds/&lt;guildId&gt;/autopost.json
 */
public class AutoPostState {
    /** ISO date of the last successful weekly post, or null if never posted. */
    public String lastPostedDate = null;

    public String lastChannelId = "";
    public long lastMessageId = 0;
}
