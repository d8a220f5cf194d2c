package org.gudu0.wordlebot.logging;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.wordlebot.config.GuildConfig;
import org.gudu0.wordlebot.guild.GuildManager;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;

/**
 * Console logging plus an optional per-guild Discord log channel/thread (see /setup).
 */
public class LogService {
    public static final DateTimeFormatter TS = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);

    private final GuildManager guilds;
    private final ZoneId zone;
    private volatile JDA jda;

    public LogService(GuildManager guilds, ZoneId zone) {
        this.guilds = guilds;
        this.zone = zone;
    }

    public void attach(JDA jda) {
        this.jda = jda;
    }

    public void log(long guildId, String message) {
        ConsoleLog.info("LogService", "guildId=" + guildId + " " + message);

        GuildConfig cfg = guilds.get(guildId).cfg;
        if (!cfg.enableLogs) return;
        if (cfg.logThreadId == null || cfg.logThreadId.isBlank()) {
            ConsoleLog.debug("LogService", "Discord logging disabled for guildId=" + guildId + " (logThreadId missing)");
            return;
        }
        JDA j = jda;
        if (j == null) {
            ConsoleLog.debug("LogService", "Discord logging skipped (JDA not ready yet)");
            return;
        }

        MessageChannel ch = j.getChannelById(MessageChannel.class, cfg.logThreadId);
        if (ch == null) {
            ConsoleLog.warn("LogService", "guildId=" + guildId + " logThreadId not found: " + cfg.logThreadId);
            return;
        }

        String out = "[" + ZonedDateTime.now(zone).format(TS) + "] " + message;
        ch.sendMessage(out).queue(
                ok -> ConsoleLog.debug("LogService", "Sent discord log guildId=" + guildId),
                err -> ConsoleLog.error("LogService", "Log send failed guildId=" + guildId + ": " + err.getMessage(), err)
        );
    }
}
