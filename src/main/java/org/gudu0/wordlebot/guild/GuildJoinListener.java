package org.gudu0.wordlebot.guild;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.function.Consumer;

/**
 * Servers joined while running get their data folder and slash commands right away;
 * those present at startup are handled by Main.
 * Leaving a server keeps its folder; results are per user and stay in the shared database.
 */
public class GuildJoinListener extends ListenerAdapter {

    private final GuildManager guilds;
    private final Consumer<Guild> commandRegistrar;

    public GuildJoinListener(GuildManager guilds, Consumer<Guild> commandRegistrar) {
        this.guilds = guilds;
        this.commandRegistrar = commandRegistrar;
    }

    @Override
    public void onGuildJoin(@NotNull GuildJoinEvent event) {
        Guild g = event.getGuild();
        GuildContext ctx = guilds.get(g.getIdLong());

        ConsoleLog.warn("GuildJoin", "Joined " + g.getName() + " (" + g.getId() + "), members=" + g.getMemberCount()
                + " autoPostEnabled=" + ctx.cfg.autoPostEnabled);
        commandRegistrar.accept(g);
    }

    @Override
    public void onGuildLeave(@NotNull GuildLeaveEvent event) {
        Guild g = event.getGuild();
        ConsoleLog.warn("GuildJoin", "Removed from " + g.getName() + " (" + g.getId() + "); data folder kept");
    }
}
