package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.Channel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.exceptions.InsufficientPermissionException;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.wordlebot.discord.BackfillReport;
import org.gudu0.wordlebot.discord.BackfillService;
import org.gudu0.wordlebot.logging.LogService;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

/**
 * /backfill [days] [channel]: re-reads recent channel history for results summaries.
 */
public class BackfillListener extends ListenerAdapter implements CommandGuards {

    public static final int DEFAULT_DAYS = 7;

    private final BackfillService backfill;
    private final LogService logs;

    public BackfillListener(BackfillService backfill, LogService logs) {
        this.backfill = backfill;
        this.logs = logs;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("backfill")) return;
        logCommand(event);

        Guild g = requireGuild(event);
        if (g == null) return;
        if (!requireAdmin(event)) return;

        int days = backfill.clampDays(event.getOption("days", DEFAULT_DAYS, OptionMapping::getAsInt));

        MessageChannel channel;
        Channel picked = event.getOption("channel", null, OptionMapping::getAsChannel);
        if (picked == null) {
            channel = event.getChannel();
        } else if (picked instanceof GuildMessageChannel gmc) {
            channel = gmc;
        } else {
            event.reply("Please choose a text channel or thread.").setEphemeral(true).queue();
            return;
        }

        long guildId = g.getIdLong();
        event.deferReply(true).queue();

        try {
            backfill.backfill(channel, guildId, days).whenComplete((report, err) -> {
                if (err != null) {
                    ConsoleLog.error("Backfill", "guildId=" + guildId + " failed: " + err.getMessage(), err);
                    event.getHook().editOriginal("Backfill failed: " + err.getMessage()).queue();
                    return;
                }
                logs.log(guildId, "Backfill of <#" + channel.getId() + "> by " + event.getUser().getName()
                        + ": " + report.resultsAdded() + " result(s) added");
                event.getHook().editOriginal(summary(report, days, channel.getId())).queue();
            });
        } catch (InsufficientPermissionException e) {
            ConsoleLog.warn("Backfill", "guildId=" + guildId + " missing permission " + e.getPermission()
                    + " in channelId=" + channel.getId());
            event.getHook().editOriginal("I can't read the history of <#" + channel.getId()
                    + "> (missing " + e.getPermission().getName() + ").").queue();
        }
    }

    static String summary(BackfillReport r, int days, String channelId) {
        return "**Backfill complete** for <#" + channelId + "> (last " + days + " day" + (days == 1 ? "" : "s") + ")\n"
                + "Messages processed: **" + r.messagesScanned() + "**\n"
                + "Results summaries found: **" + r.summariesIngested() + "**\n"
                + "Results added: **" + r.resultsAdded() + "**\n"
                + "Already recorded: **" + r.duplicates() + "**"
                + (r.malformed() > 0 ? "\nUnusable summaries: **" + r.malformed() + "**" : "");
    }
}
