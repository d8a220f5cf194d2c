package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.Optional;

/**
 * /leaderboard, /post and the period buttons under a posted leaderboard.
 */
public class LeaderboardListener extends ListenerAdapter implements CommandGuards {

    private final LeaderboardRenderer renderer;

    public LeaderboardListener(LeaderboardRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        switch (event.getName()) {
            case "leaderboard" -> leaderboard(event);
            case "post" -> post(event);
            default -> { }
        }
    }

    private void leaderboard(SlashCommandInteractionEvent event) {
        logCommand(event);
        Optional<Window> window = requireWindow(event, Window.WEEKLY);
        if (window.isEmpty()) return;

        try {
            event.replyEmbeds(renderer.leaderboard(window.get()))
                    .addActionRow(renderer.buttons(window.get()))
                    .queue();
        } catch (StorageException e) {
            ConsoleLog.error("Leaderboard", "Leaderboard query failed: " + e.getMessage(), e);
            event.reply("Error retrieving leaderboard.").setEphemeral(true).queue();
        }
    }

    private void post(SlashCommandInteractionEvent event) {
        logCommand(event);
        if (requireGuild(event) == null) return;

        try {
            event.replyEmbeds(renderer.leaderboard(Window.WEEKLY))
                    .addActionRow(renderer.buttons(Window.WEEKLY))
                    .queue(
                            ok -> ConsoleLog.info("Leaderboard", "Posted weekly leaderboard in channelId=" + event.getChannel().getId()),
                            err -> ConsoleLog.error("Leaderboard", "Post failed: " + err.getMessage(), err)
                    );
        } catch (StorageException e) {
            ConsoleLog.error("Leaderboard", "Leaderboard query failed: " + e.getMessage(), e);
            event.reply("Error posting leaderboard.").setEphemeral(true).queue();
        }
    }

    @Override
    public void onButtonInteraction(@NotNull ButtonInteractionEvent event) {
        String id = event.getComponentId();
        if (!id.startsWith(LeaderboardRenderer.BUTTON_PREFIX)) return;

        Optional<Window> window = windowForButton(id);
        if (window.isEmpty()) {
            ConsoleLog.warn("Leaderboard", "Unknown leaderboard button id=" + id);
            event.reply("Unknown button.").setEphemeral(true).queue();
            return;
        }

        ConsoleLog.debug("Leaderboard", "Button " + id + " by userId=" + event.getUser().getId());
        try {
            event.editMessageEmbeds(renderer.leaderboard(window.get()))
                    .setComponents(ActionRow.of(renderer.buttons(window.get())))
                    .queue();
        } catch (StorageException e) {
            ConsoleLog.error("Leaderboard", "Leaderboard query failed: " + e.getMessage(), e);
            event.reply("Error updating leaderboard.").setEphemeral(true).queue();
        }
    }

    /** {@code lb:<period>} or {@code lb:refresh:<period>}. */
    static Optional<Window> windowForButton(String componentId) {
        if (!componentId.startsWith(LeaderboardRenderer.BUTTON_PREFIX)) return Optional.empty();
        String rest = componentId.substring(LeaderboardRenderer.BUTTON_PREFIX.length());
        String refresh = LeaderboardRenderer.REFRESH + ":";
        if (rest.startsWith(refresh)) rest = rest.substring(refresh.length());
        return Window.parse(rest);
    }
}
