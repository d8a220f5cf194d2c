package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.wordlebot.stats.PlayerStats;
import org.gudu0.wordlebot.stats.StatsEngine;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

public class MyStatsListener extends ListenerAdapter implements CommandGuards {
    private final StatsEngine stats;
    private final LeaderboardRenderer renderer;

    public MyStatsListener(StatsEngine stats, LeaderboardRenderer renderer) {
        this.stats = stats;
        this.renderer = renderer;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("mystats")) return;
        logCommand(event);

        Optional<Window> window = requireWindow(event, Window.ALLTIME);
        if (window.isEmpty()) return;

        User target = event.getOption("user", event.getUser(), OptionMapping::getAsUser);
        long id = target.getIdLong();

        try {
            PlayerStats s = stats.getStats(id, window.get());
            if (s.isEmpty()) {
                event.reply("No games found for " + window.get().key() + " period.").setEphemeral(true).queue();
                return;
            }

            event.replyEmbeds(renderer.personalStats(
                            target.getEffectiveName(),
                            window.get(),
                            s,
                            stats.getStreak(id),
                            stats.getRank(id, window.get())))
                    .setEphemeral(true)
                    .queue();
        } catch (StorageException e) {
            ConsoleLog.error("MyStats", "Stats query failed for userId=" + id + ": " + e.getMessage(), e);
            event.reply("Error retrieving your stats.").setEphemeral(true).queue();
        }
    }
}
