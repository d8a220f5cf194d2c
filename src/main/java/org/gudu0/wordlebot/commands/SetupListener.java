package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.Channel;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.autopost.AutoPostState;
import org.gudu0.wordlebot.config.GlobalConfig;
import org.gudu0.wordlebot.guild.GuildContext;
import org.gudu0.wordlebot.guild.GuildManager;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * /setup ...
 * <p>
 * Edits data/guilds/&lt;guildId&gt;/config.json. Changes apply immediately; the auto-poster and
 * LogService read the live config object.
 */
public class SetupListener extends ListenerAdapter implements CommandGuards {

    private final GuildManager guilds;
    private final GlobalConfig globalCfg;

    public SetupListener(GuildManager guilds, GlobalConfig globalCfg) {
        this.guilds = guilds;
        this.globalCfg = globalCfg;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!event.getName().equals("setup")) return;
        logCommand(event);

        Guild g = requireGuild(event);
        if (g == null) return;
        if (!requireAdmin(event)) return;

        GuildContext ctx = guilds.get(g.getIdLong());

        String sub = event.getSubcommandName();
        if (sub == null) {
            event.reply("Missing subcommand. Use /setup status or /setup setautopostchannel ...")
                    .setEphemeral(true).queue();
            return;
        }

        switch (sub) {
            case "status" -> event.reply(buildStatus(g, ctx)).setEphemeral(true).queue();

            case "setautopostchannel" -> {
                Channel ch = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
                if (!(ch instanceof GuildMessageChannel gmc)) {
                    event.reply("Please choose a normal text channel (not a voice/category).")
                            .setEphemeral(true).queue();
                    return;
                }
                if (!gmc.canTalk()) {
                    event.reply("I can't send messages in <#" + ch.getId() + ">. Check my permissions there first.")
                            .setEphemeral(true).queue();
                    return;
                }

                ctx.cfg.autoPostChannelId = ch.getId();
                reply(event, ctx, "setautopostchannel", "Weekly leaderboard will be posted in <#" + ch.getId() + ">.");
            }

            case "setlogthread" -> {
                Channel ch = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
                if (!(ch instanceof MessageChannel)) {
                    event.reply("Please choose a thread or a text channel.")
                            .setEphemeral(true).queue();
                    return;
                }

                ctx.cfg.logThreadId = ch.getId();
                reply(event, ctx, "setlogthread", "Log channel/thread set to <#" + ctx.cfg.logThreadId + ">.");
            }

            case "setenablelogs" -> {
                boolean enabled = Objects.requireNonNull(event.getOption("enabled")).getAsBoolean();
                ctx.cfg.enableLogs = enabled;
                reply(event, ctx, "setenablelogs", "enableLogs set to " + ctx.cfg.enableLogs + ".");
            }

            default -> event.reply("Unknown subcommand: " + sub).setEphemeral(true).queue();
        }
    }

    private static void reply(SlashCommandInteractionEvent event, GuildContext ctx, String action, String ok) {
        if (ctx.saveConfig(action)) {
            event.reply(ok).setEphemeral(true).queue();
        } else {
            event.reply(ok + "\n_Warning: the setting could not be saved and will reset on restart._")
                    .setEphemeral(true).queue();
        }
    }

    private String buildStatus(Guild g, GuildContext ctx) {
        AutoPostState st = ctx.autoPostStore.state();

        return "**Setup Status — " + g.getName() + "**\n"
                + "- autoPostEnabled: " + ctx.cfg.autoPostEnabled
                + (globalCfg.autoPostEnabled ? "" : " (globally disabled)") + "\n"
                + "- autoPostChannel: " + channelOrUnset(ctx.cfg.autoPostChannelId) + "\n"
                + "- schedule: " + ToggleListener.schedule(globalCfg) + "\n"
                + "- lastPosted: " + (st.lastPostedDate == null ? "_never_" : st.lastPostedDate) + "\n"
                + "- enableLogs: " + ctx.cfg.enableLogs + "\n"
                + "- logChannel/thread: " + channelOrUnset(ctx.cfg.logThreadId) + "\n"
                + "\n"
                + "_Tip: without an auto-post channel I pick a channel named like general, wordle, games or bot._";
    }

    private static String channelOrUnset(String id) {
        return (id == null || id.isBlank()) ? "_not set_" : "<#" + id + ">";
    }
}
