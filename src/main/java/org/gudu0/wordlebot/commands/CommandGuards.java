package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.util.Optional;

public interface CommandGuards {

    default void logCommand(SlashCommandInteractionEvent event) {
        ConsoleLog.info("Command - " + this.getClass().getSimpleName(),
                "/" + event.getName()
                        + (event.getSubcommandName() != null ? " " + event.getSubcommandName() : "")
                        + " by userId=" + event.getUser().getId()
                        + " name=" + event.getUser().getName()
                        + " guildId=" + (event.getGuild() != null ? event.getGuild().getId() : "DM")
                        + " channelId=" + event.getChannel().getId());
    }

    // --- Guild / member guards ---

    default Guild requireGuild(SlashCommandInteractionEvent event) {
        Guild g = event.getGuild();
        if (g == null) {
            event.reply("This command can only be used in a server.")
                    .setEphemeral(true).queue();
            return null;
        }
        return g;
    }

    /** Manage Server, like the backfill and auto-post settings require. */
    default boolean requireAdmin(SlashCommandInteractionEvent event) {
        Member m = event.getMember();
        if (m == null || !m.hasPermission(Permission.MANAGE_SERVER)) {
            event.reply("You need Manage Server permission to use this.")
                    .setEphemeral(true).queue();
            ConsoleLog.warn("Command", "Denied (missing MANAGE_SERVER) /" + event.getName()
                    + " userId=" + event.getUser().getId());
            return false;
        }
        return true;
    }

    // --- Options ---

    /**
     * Reads the "period" option. Replies with an error and returns empty when it is not a known window.
     */
    default Optional<Window> requireWindow(SlashCommandInteractionEvent event, Window fallback) {
        String raw = event.getOption("period", fallback.key(), OptionMapping::getAsString);
        Optional<Window> w = Window.parse(raw);
        if (w.isEmpty()) {
            event.reply("Invalid period! Use: `weekly`, `monthly`, or `alltime`")
                    .setEphemeral(true).queue();
        }
        return w;
    }
}
