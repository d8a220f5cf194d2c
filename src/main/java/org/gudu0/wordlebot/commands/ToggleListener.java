package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.config.GlobalConfig;
import org.gudu0.wordlebot.guild.GuildContext;
import org.gudu0.wordlebot.guild.GuildManager;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * /toggle: flips this guild's weekly auto-post.
 */
public class ToggleListener extends ListenerAdapter implements CommandGuards {

    private final GuildManager guilds;
    private final GlobalConfig globalCfg;

    public ToggleListener(GuildManager guilds, GlobalConfig globalCfg) {
        this.guilds = guilds;
        this.globalCfg = globalCfg;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("toggle")) return;
        logCommand(event);

        Guild g = requireGuild(event);
        if (g == null) return;
        if (!requireAdmin(event)) return;

        GuildContext ctx = guilds.get(g.getIdLong());
        ctx.cfg.autoPostEnabled = !ctx.cfg.autoPostEnabled;
        boolean saved = ctx.saveConfig("toggle autoPostEnabled=" + ctx.cfg.autoPostEnabled);

        String msg = "Weekly auto-post is now **" + (ctx.cfg.autoPostEnabled ? "enabled" : "disabled") + "**.\n"
                + "Schedule: " + schedule(globalCfg);
        if (!globalCfg.autoPostEnabled) {
            msg += "\n_Auto-posting is switched off globally by the bot operator._";
        }
        if (!saved) {
            msg += "\n_Warning: the setting could not be saved and will reset on restart._";
        }
        event.reply(msg).setEphemeral(true).queue();
    }

    static String schedule(GlobalConfig cfg) {
        String day = cfg.autoPostDayOfWeek().name().charAt(0)
                + cfg.autoPostDayOfWeek().name().substring(1).toLowerCase(Locale.ROOT);
        return String.format(Locale.ROOT, "%ss at %02d:%02d (%s)",
                day, cfg.autoPostHour, cfg.autoPostMinute, cfg.zone().getId());
    }
}
