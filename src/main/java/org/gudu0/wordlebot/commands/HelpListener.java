package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.ingest.ScorePolicy;
import org.jetbrains.annotations.NotNull;

public class HelpListener extends ListenerAdapter implements CommandGuards {

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("help")) return;
        logCommand(event);

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("🎯 Wordle Leaderboard Bot")
                .setDescription("I read the Wordle app's daily results summaries and keep score.")
                .setColor(0x0099ff)
                .addField("/leaderboard [period]", "Show the leaderboard (weekly, monthly, alltime)", false)
                .addField("/mystats [period] [user]", "Your stats, or another player's", false)
                .addField("/post", "Post the weekly leaderboard in this channel", false)
                .addField("/toggle", "Turn the weekly auto-post on or off (Manage Server)", false)
                .addField("/backfill [days] [channel]", "Import results summaries from channel history (Manage Server)", false)
                .addField("/setup", "Configure auto-post channel and logging (Manage Server)", false)
                .setFooter(ScorePolicy.DESCRIPTION);

        event.replyEmbeds(eb.build()).setEphemeral(true).queue();
    }
}
