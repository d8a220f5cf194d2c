package org.gudu0.wordlebot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.interactions.commands.DefaultMemberPermissions;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.ChunkingFilter;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.gudu0.wordlebot.autopost.WeeklyLeaderboardPoster;
import org.gudu0.wordlebot.commands.*;
import org.gudu0.wordlebot.config.GlobalConfig;
import org.gudu0.wordlebot.config.TypedConfigStore;
import org.gudu0.wordlebot.console.ConsoleCommandService;
import org.gudu0.wordlebot.discord.BackfillService;
import org.gudu0.wordlebot.discord.ResultMessageListener;
import org.gudu0.wordlebot.guild.GuildJoinListener;
import org.gudu0.wordlebot.guild.GuildManager;
import org.gudu0.wordlebot.ingest.IngestionGate;
import org.gudu0.wordlebot.ingest.ResultIngestor;
import org.gudu0.wordlebot.logging.LogService;
import org.gudu0.wordlebot.message.ResultDetector;
import org.gudu0.wordlebot.message.TextExtractor;
import org.gudu0.wordlebot.parsing.DateResolver;
import org.gudu0.wordlebot.parsing.ResultParser;
import org.gudu0.wordlebot.stats.StatsEngine;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.storage.SqliteResultStore;
import org.gudu0.wordlebot.util.BotPaths;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

public class Main {

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Token (env)
        String token = reqEnv("DISCORD_TOKEN");

        // 2) Global config (data/global/config.json)
        GlobalConfig globalCfg = loadOrCreateGlobalConfig();
        if (globalCfg.debug) ConsoleLog.DEBUG = true;
        ConsoleLog.useZone(globalCfg.zone());

        ConsoleLog.info("Main", "GlobalConfig: database=" + globalCfg.databaseFile()
                + " timeZone=" + globalCfg.timeZone
                + " roundEpoch=" + globalCfg.roundEpoch
                + " resultsBotName=" + globalCfg.resultsBotName);

        // 3) Results database
        SqliteResultStore store = new SqliteResultStore(globalCfg.databaseFile());
        store.initSchema();
        ConsoleLog.info("Main", "Results stored: " + store.countResults());

        // 4) Pipeline + read side
        Clock clock = Clock.system(globalCfg.zone());

        ResultIngestor ingestor = new ResultIngestor(
                new TextExtractor(),
                new ResultDetector(globalCfg.resultsBotName),
                new ResultParser(),
                new DateResolver(globalCfg.zone(), globalCfg.roundEpochDate()),
                new IngestionGate(store, clock));

        StatsEngine statsEngine = new StatsEngine(store, clock, globalCfg.allTimeStartDate());
        LeaderboardRenderer renderer = new LeaderboardRenderer(statsEngine, globalCfg.leaderboardLimit);

        // 5) Multi-guild router + services
        GuildManager guilds = new GuildManager();
        LogService logs = new LogService(guilds, globalCfg.zone());
        BackfillService backfill = new BackfillService(ingestor, clock, globalCfg.backfillMaxDays);
        WeeklyLeaderboardPoster poster = new WeeklyLeaderboardPoster(globalCfg, guilds, renderer);

        // 6) Build JDA
        ConsoleLog.info("Main", "Building JDA (MESSAGE_CONTENT + GUILD_MEMBERS enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.MESSAGE_CONTENT, GatewayIntent.GUILD_MEMBERS)
                .setMemberCachePolicy(MemberCachePolicy.ALL)
                .setChunkingFilter(ChunkingFilter.ALL)
                .addEventListeners(
                        // Commands
                        new LeaderboardListener(renderer),
                        new MyStatsListener(statsEngine, renderer),
                        new HelpListener(),
                        new ToggleListener(guilds, globalCfg),
                        new BackfillListener(backfill, logs),
                        new SetupListener(guilds, globalCfg),
                        new GuildJoinListener(guilds, Main::registerGuildCommandsOne),
                        // Core listeners
                        new ResultMessageListener(ingestor, logs),
                        poster
                )
                .build();

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        // 7) Attach services that need JDA
        logs.attach(jda);

        ConsoleCommandService console = new ConsoleCommandService(guilds, jda, statsEngine, store, globalCfg.leaderboardLimit);
        console.start();

        // 8) Register commands (guild-scoped, for every guild)
        ConsoleLog.info("Main", "Registering guild commands (all guilds)");
        for (Guild g : jda.getGuilds()) {
            guilds.get(g.getIdLong());
            registerGuildCommandsOne(g);
        }

        ConsoleLog.info("Main", "Startup complete (" + jda.getGuilds().size() + " guilds)");
    }

    private static GlobalConfig loadOrCreateGlobalConfig() {
        try {
            Path p = BotPaths.globalConfig();
            boolean existed = Files.exists(p);

            TypedConfigStore<GlobalConfig> s = new TypedConfigStore<>(p, GlobalConfig.class, GlobalConfig::new);

            // TypedConfigStore loads defaults but DOES NOT write by itself.
            if (!existed) {
                ConsoleLog.warn("Main", "Global config missing; creating default at " + p);
                s.save();
            }

            return s.cfg();
        } catch (Exception e) {
            ConsoleLog.error("Main", "Failed to load GlobalConfig; using defaults. " + e.getMessage(), e);
            return new GlobalConfig();
        }
    }

    // ----------------------------
    // Commands registration
    // ----------------------------

    private static OptionData periodOption(String description) {
        OptionData o = new OptionData(OptionType.STRING, "period", description, false);
        for (Window w : Window.values()) {
            o.addChoice(w.title(), w.key());
        }
        return o;
    }

    private static void registerGuildCommandsOne(Guild g) {
        DefaultMemberPermissions admin = DefaultMemberPermissions.enabledFor(Permission.MANAGE_SERVER);

        g.updateCommands()
                .addCommands(
                        Commands.slash("leaderboard", "Show the Wordle leaderboard")
                                .addOptions(periodOption("Time period (default: weekly)")),

                        Commands.slash("mystats", "Show Wordle stats for you or another player")
                                .addOptions(periodOption("Time period (default: alltime)"))
                                .addOption(OptionType.USER, "user", "User to view (defaults to you)", false),

                        Commands.slash("post", "Post the weekly leaderboard in this channel"),

                        Commands.slash("help", "How the bot works and what it can do"),

                        Commands.slash("toggle", "Turn the weekly leaderboard auto-post on or off")
                                .setDefaultPermissions(admin),

                        Commands.slash("backfill", "Import results summaries from recent channel history")
                                .addOption(OptionType.INTEGER, "days", "How many days back (default 7, capped by config)", false)
                                .addOption(OptionType.CHANNEL, "channel", "Channel to scan (defaults to this one)", false)
                                .setDefaultPermissions(admin),

                        Commands.slash("setup", "Configure this bot for this server (admin only)")
                                .setDefaultPermissions(admin)
                                .addSubcommands(
                                        new SubcommandData("status", "Show current config for this server"),

                                        new SubcommandData("setautopostchannel", "Set the channel for the weekly leaderboard")
                                                .addOption(OptionType.CHANNEL, "channel", "A text channel", true),

                                        new SubcommandData("setenablelogs", "Enable/disable per-guild logging")
                                                .addOption(OptionType.BOOLEAN, "enabled", "true=send logs to log thread", true),

                                        new SubcommandData("setlogthread", "Set the log channel/thread to send logs to")
                                                .addOption(OptionType.CHANNEL, "channel", "A thread or text channel", true)
                                )
                )
                .queue(
                        ok -> ConsoleLog.info("Main", "Guild commands updated: " + g.getName() + " (" + g.getId() + ")"),
                        err -> ConsoleLog.error("Main", "Failed registering commands in guildId=" + g.getId() + ": " + err.getMessage(), err)
                );
    }

    private static String reqEnv(String key) {
        String v = System.getenv(key);
        if (v == null || v.isBlank()) throw new IllegalStateException("Missing environment variable: " + key);
        return v;
    }
}
