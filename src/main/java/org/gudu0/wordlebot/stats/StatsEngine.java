package org.gudu0.wordlebot.stats;

import org.gudu0.wordlebot.storage.AggregateRow;
import org.gudu0.wordlebot.storage.ResultStore;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Read side: personal stats, streaks, leaderboards and ranks.
 * <p>
 * Nothing is cached; every call reads the ledger. Streaks are always computed over the full history,
 * windows only scope the aggregates. "Today" comes from the clock, so the clock's zone decides
 * where weeks and months start.
 */
public final class StatsEngine {

    /** Total score desc, average desc, then user id so equal rows keep a stable order. */
    static final Comparator<AggregateRow> LEADERBOARD_ORDER =
            Comparator.comparingInt(AggregateRow::totalScore).reversed()
                    .thenComparing(Comparator.comparingDouble(AggregateRow::averageScore).reversed())
                    .thenComparingLong(r -> r.participant().id());

    private final ResultStore store;
    private final Clock clock;
    private final LocalDate allTimeStart;

    public StatsEngine(ResultStore store, Clock clock, LocalDate allTimeStart) {
        this.store = store;
        this.clock = clock;
        this.allTimeStart = allTimeStart;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate windowStart(Window window) {
        return window.start(today(), allTimeStart);
    }

    /**
     * Monday of the most recent Monday..Sunday week that has fully ended.
     * Rows are dated the day before they are posted, so on a Monday the live weekly window is still empty.
     */
    public LocalDate lastWeekStart() {
        return today().with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).minusWeeks(1);
    }

    public PlayerStats getStats(long participantId, Window window) {
        LocalDate today = today();
        return store.aggregate(participantId, window.start(today, allTimeStart), today)
                .map(r -> new PlayerStats(
                        r.gamesPlayed(),
                        r.totalScore(),
                        r.averageScore(),
                        r.successfulGames(),
                        r.firstGameDate(),
                        r.lastGameDate()))
                .orElseGet(PlayerStats::empty);
    }

    public List<LeaderboardEntry> getLeaderboard(Window window, int limit) {
        LocalDate today = today();
        return getLeaderboard(window.start(today, allTimeStart), today, limit);
    }

    /** Leaderboard over an explicit inclusive date range. */
    public List<LeaderboardEntry> getLeaderboard(LocalDate from, LocalDate to, int limit) {
        List<AggregateRow> ordered = rankedRows(from, to);
        int n = Math.min(Math.max(limit, 0), ordered.size());

        List<LeaderboardEntry> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            AggregateRow r = ordered.get(i);
            Streak streak = getStreak(r.participant().id());
            out.add(new LeaderboardEntry(
                    i + 1,
                    r.participant(),
                    r.gamesPlayed(),
                    r.totalScore(),
                    r.averageScore(),
                    r.successfulGames(),
                    streak.current(),
                    streak.longest()));
        }
        ConsoleLog.debug("StatsEngine", "Leaderboard " + from + ".." + to + " rows=" + ordered.size() + " shown=" + n);
        return out;
    }

    /** 1-based position in the full leaderboard for the window; empty when the participant has no rows in it. */
    public OptionalInt getRank(long participantId, Window window) {
        LocalDate today = today();
        List<AggregateRow> ordered = rankedRows(window.start(today, allTimeStart), today);
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).participant().id() == participantId) return OptionalInt.of(i + 1);
        }
        return OptionalInt.empty();
    }

    public Streak getStreak(long participantId) {
        return StreakCalculator.compute(store.playDates(participantId));
    }

    private List<AggregateRow> rankedRows(LocalDate from, LocalDate to) {
        List<AggregateRow> rows = new ArrayList<>(store.aggregateAll(from, to));
        rows.removeIf(r -> r.gamesPlayed() <= 0);
        rows.sort(LEADERBOARD_ORDER);
        return rows;
    }
}
