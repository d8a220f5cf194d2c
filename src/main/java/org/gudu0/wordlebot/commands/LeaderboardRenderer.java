package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import org.gudu0.wordlebot.ingest.ScorePolicy;
import org.gudu0.wordlebot.stats.LeaderboardEntry;
import org.gudu0.wordlebot.stats.PlayerStats;
import org.gudu0.wordlebot.stats.Streak;
import org.gudu0.wordlebot.stats.StatsEngine;
import org.gudu0.wordlebot.stats.Window;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Embeds and buttons shared by /leaderboard, the period buttons, /post, /mystats and the weekly auto-post.
 */
public final class LeaderboardRenderer {

    public static final String BUTTON_PREFIX = "lb:";
    public static final String REFRESH = "refresh";

    private static final int LEADERBOARD_COLOR = 0x00ff00;
    private static final int STATS_COLOR = 0x0099ff;

    private static final DateTimeFormatter RANGE_DATE = DateTimeFormatter.ofPattern("MMM d", Locale.ENGLISH);

    private final StatsEngine stats;
    private final int limit;

    public LeaderboardRenderer(StatsEngine stats, int limit) {
        this.stats = stats;
        this.limit = limit;
    }

    public MessageEmbed leaderboard(Window window) {
        return leaderboard(window, "Click buttons to switch periods • " + ScorePolicy.DESCRIPTION + " • 🔥 = current streak");
    }

    public MessageEmbed leaderboard(Window window, String footer) {
        return render("🏆 " + window.title() + " Wordle Leaderboard", window.key(),
                stats.getLeaderboard(window, limit), footer);
    }

    /** The last fully finished Monday..Sunday week, as posted by the weekly auto-post. */
    public MessageEmbed lastWeek(String footer) {
        LocalDate from = stats.lastWeekStart();
        LocalDate to = from.plusDays(6);
        String range = RANGE_DATE.format(from) + " to " + RANGE_DATE.format(to);
        return render("🏆 Last Week's Wordle Leaderboard (" + range + ")", range,
                stats.getLeaderboard(from, to, limit), footer);
    }

    private static MessageEmbed render(String title, String period, List<LeaderboardEntry> entries, String footer) {
        EmbedBuilder eb = new EmbedBuilder()
                .setTitle(title)
                .setColor(LEADERBOARD_COLOR)
                .setFooter(footer);

        if (entries.isEmpty()) {
            eb.setDescription("No data available for this period.");
            return eb.build();
        }

        eb.setDescription("**Top performers (" + period + "):**");
        for (LeaderboardEntry e : entries) {
            String streak = e.currentStreak() > 0 ? " 🔥 " + e.currentStreak() : "";
            eb.addField(
                    medal(e.rank()) + " " + e.participant().label() + streak,
                    "Score: " + e.totalScore()
                            + " | Games: " + e.gamesPlayed()
                            + " | Avg: " + formatAverage(e.averageScore()),
                    false);
        }
        return eb.build();
    }

    public MessageEmbed personalStats(String name, Window window, PlayerStats s, Streak streak, OptionalInt rank) {
        EmbedBuilder eb = new EmbedBuilder()
                .setTitle("📊 " + name + " — " + window.title() + " Statistics")
                .setColor(STATS_COLOR)
                .setFooter("Period: " + window.title() + " • " + ScorePolicy.DESCRIPTION);

        eb.addField("Games Played", Integer.toString(s.gamesPlayed()), true);
        eb.addField("Total Score", Integer.toString(s.totalScore()), true);
        eb.addField("Average Score", formatAverage(s.averageScore()), true);
        eb.addField("Success Rate", s.successfulGames() + "/" + s.gamesPlayed(), true);

        String streakText = "🔥 " + streak.current();
        if (streak.longest() > streak.current()) streakText += " (Best: " + streak.longest() + ")";
        eb.addField("Streak", streakText, true);

        if (rank.isPresent()) eb.addField("Rank", "#" + rank.getAsInt(), true);

        if (s.firstGameDate() != null && s.lastGameDate() != null) {
            eb.addField("First Game", s.firstGameDate().toString(), true);
            eb.addField("Last Game", s.lastGameDate().toString(), true);
        }
        return eb.build();
    }

    public List<Button> buttons(Window active) {
        List<Button> out = new ArrayList<>();
        out.add(periodButton(Window.WEEKLY, active, "📅"));
        out.add(periodButton(Window.MONTHLY, active, "📆"));
        out.add(periodButton(Window.ALLTIME, active, "🏆"));
        out.add(Button.success(BUTTON_PREFIX + REFRESH + ":" + active.key(), "Refresh")
                .withEmoji(Emoji.fromUnicode("🔄")));
        return out;
    }

    private static Button periodButton(Window w, Window active, String emoji) {
        String id = BUTTON_PREFIX + w.key();
        Button b = (w == active) ? Button.primary(id, w.title()) : Button.secondary(id, w.title());
        return b.withEmoji(Emoji.fromUnicode(emoji));
    }

    static String medal(int rank) {
        return switch (rank) {
            case 1 -> "🥇";
            case 2 -> "🥈";
            case 3 -> "🥉";
            default -> rank + ".";
        };
    }

    static String formatAverage(double avg) {
        return String.format(Locale.ROOT, "%.2f", avg);
    }
}
