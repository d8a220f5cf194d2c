package org.gudu0.wordlebot.console;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.gudu0.wordlebot.autopost.AutoPostState;
import org.gudu0.wordlebot.guild.GuildContext;
import org.gudu0.wordlebot.guild.GuildManager;
import org.gudu0.wordlebot.stats.LeaderboardEntry;
import org.gudu0.wordlebot.stats.PlayerStats;
import org.gudu0.wordlebot.stats.StatsEngine;
import org.gudu0.wordlebot.stats.Streak;
import org.gudu0.wordlebot.stats.Window;
import org.gudu0.wordlebot.storage.Participant;
import org.gudu0.wordlebot.storage.ResultStore;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

public final class ConsoleCommandService {

    private final GuildManager guilds;
    private final JDA jda;
    private final StatsEngine stats;
    private final ResultStore store;
    private final int leaderboardLimit;

    public ConsoleCommandService(GuildManager guilds, JDA jda, StatsEngine stats, ResultStore store, int leaderboardLimit) {
        this.guilds = guilds;
        this.jda = jda;
        this.stats = stats;
        this.store = store;
        this.leaderboardLimit = leaderboardLimit;
    }

    public void start() {
        Thread t = new Thread(this::runLoop, "ConsoleCommandService");
        t.setDaemon(true); // don't prevent JVM shutdown
        t.start();

        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
    }

    private void runLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {

            while (true) {
                String line = br.readLine();
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                try {
                    handle(line);
                } catch (StorageException e) {
                    ConsoleLog.error("Console", "Database error: " + e.getMessage(), e);
                }
            }
        } catch (Exception e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    private void handle(String raw) {
        String[] parts = raw.trim().split("\\s+");
        String cmd = parts[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();

            case "listguilds", "guilds" -> listGuilds();

            case "guild" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: guild <guildId> [status]");
                    return;
                }
                Long guildId = parseId(parts[1]);
                if (guildId == null) return;

                String sub = (parts.length >= 3) ? parts[2].toLowerCase(Locale.ROOT) : "status";
                if (sub.equals("status")) {
                    guildStatus(guildId);
                } else {
                    ConsoleLog.warn("Console", "Unknown guild subcommand: " + sub + " (try: status)");
                }
            }

            case "leaderboard", "lb" -> {
                Optional<Window> w = windowArg(parts, 1, Window.WEEKLY);
                w.ifPresent(this::printLeaderboard);
            }

            case "stats" -> {
                if (parts.length < 2) {
                    ConsoleLog.warn("Console", "Usage: stats <userId> [weekly|monthly|alltime]");
                    return;
                }
                Long userId = parseId(parts[1]);
                if (userId == null) return;
                Optional<Window> w = windowArg(parts, 2, Window.ALLTIME);
                w.ifPresent(window -> printStats(userId, window));
            }

            case "debug" -> {
                if (parts.length >= 2) {
                    ConsoleLog.DEBUG = parts[1].equalsIgnoreCase("on") || parts[1].equalsIgnoreCase("true");
                }
                ConsoleLog.info("Console", "Debug logging " + (ConsoleLog.DEBUG ? "ON" : "OFF"));
            }

            case "shutdown", "exit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                System.exit(0);
            }

            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                          - show this help
                  listguilds|guilds             - list guilds the bot is in
                  guild <id> [status]           - show per-guild config and auto-post info
                  leaderboard|lb [period]       - print the leaderboard (weekly|monthly|alltime)
                  stats <userId> [period]       - print one player's stats
                  debug on|off                  - toggle debug logging
                  shutdown|exit                 - terminate process

                Examples:
                  guilds
                  lb monthly
                  stats 712304553931833385 weekly
                """.trim());
    }

    private void listGuilds() {
        var gs = jda.getGuilds();
        ConsoleLog.info("Console", "Guilds (" + gs.size() + ", " + guilds.cachedCount() + " contexts loaded):");
        for (Guild g : gs) {
            ConsoleLog.info("Console", " - " + g.getName() + " | " + g.getId());
        }
    }

    private void guildStatus(long guildId) {
        Guild g = jda.getGuildById(guildId);
        if (g == null) {
            ConsoleLog.warn("Console", "Bot is not in guildId=" + guildId);
            return;
        }

        GuildContext ctx = guilds.get(guildId);
        AutoPostState st = ctx.autoPostStore.state();

        ConsoleLog.info("Console", "Guild status: " + g.getName() + " (" + guildId + ")");
        ConsoleLog.info("Console", "  autoPostEnabled=" + ctx.cfg.autoPostEnabled);
        ConsoleLog.info("Console", "  autoPostChannelId=" + orUnset(ctx.cfg.autoPostChannelId));
        ConsoleLog.info("Console", "  lastPostedDate=" + (st.lastPostedDate == null ? "(never)" : st.lastPostedDate));
        ConsoleLog.info("Console", "  enableLogs=" + ctx.cfg.enableLogs);
        ConsoleLog.info("Console", "  logThreadId=" + orUnset(ctx.cfg.logThreadId));
    }

    private void printLeaderboard(Window window) {
        List<LeaderboardEntry> entries = stats.getLeaderboard(window, leaderboardLimit);
        ConsoleLog.info("Console", window.title() + " leaderboard (from " + stats.windowStart(window)
                + ", " + store.countResults() + " results stored):");
        if (entries.isEmpty()) {
            ConsoleLog.info("Console", "  (no data)");
            return;
        }
        for (LeaderboardEntry e : entries) {
            ConsoleLog.info("Console", String.format(Locale.ROOT, "  %2d. %-24s score=%d games=%d avg=%.2f streak=%d",
                    e.rank(), e.participant().label(), e.totalScore(), e.gamesPlayed(), e.averageScore(), e.currentStreak()));
        }
    }

    private void printStats(long userId, Window window) {
        String name = store.findParticipant(userId).map(Participant::label).orElse(Long.toString(userId));
        PlayerStats s = stats.getStats(userId, window);
        if (s.isEmpty()) {
            ConsoleLog.info("Console", "No games found for " + name + " (" + window.key() + ")");
            return;
        }
        Streak streak = stats.getStreak(userId);
        OptionalInt rank = stats.getRank(userId, window);

        ConsoleLog.info("Console", name + " " + window.title() + ": games=" + s.gamesPlayed()
                + " total=" + s.totalScore()
                + String.format(Locale.ROOT, " avg=%.2f", s.averageScore())
                + " solved=" + s.successfulGames() + "/" + s.gamesPlayed()
                + " streak=" + streak.current() + " best=" + streak.longest()
                + " rank=" + (rank.isPresent() ? "#" + rank.getAsInt() : "-")
                + " first=" + s.firstGameDate() + " last=" + s.lastGameDate());
    }

    private static Optional<Window> windowArg(String[] parts, int index, Window fallback) {
        if (parts.length <= index) return Optional.of(fallback);
        Optional<Window> w = Window.parse(parts[index]);
        if (w.isEmpty()) ConsoleLog.warn("Console", "Invalid period: " + parts[index] + " (weekly|monthly|alltime)");
        return w;
    }

    private static Long parseId(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            ConsoleLog.warn("Console", "Invalid id: " + raw);
            return null;
        }
    }

    private static String orUnset(String s) {
        return (s == null || s.isBlank()) ? "(not set)" : s;
    }
}
