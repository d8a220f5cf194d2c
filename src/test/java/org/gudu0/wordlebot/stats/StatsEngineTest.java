package org.gudu0.wordlebot.stats;

import org.gudu0.wordlebot.parsing.ParticipantRef;
import org.gudu0.wordlebot.storage.RoundResult;
import org.gudu0.wordlebot.storage.SqliteResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StatsEngineTest {

    private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
    // Wednesday 2024-10-16, 09:00 in Los Angeles
    private static final Instant NOW = Instant.parse("2024-10-16T16:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 10, 16);

    @TempDir
    Path tmp;

    private SqliteResultStore store;
    private StatsEngine stats;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(NOW, LA);
        store = new SqliteResultStore(tmp.resolve("wordle.db"), clock);
        store.initSchema();
        stats = new StatsEngine(store, clock, LocalDate.of(2020, 1, 1));
    }

    private void play(long id, String name, LocalDate date, int attempts) {
        int round = (int) date.toEpochDay();
        boolean ok = attempts <= 6;
        int a = ok ? attempts : 6;
        store.recordResult(new ParticipantRef(id, name, null),
                new RoundResult(id, round, date, a, ok, ok ? 8 - a : 1, NOW));
    }

    @Test
    public void testTieOnTotalBrokenByAverage() {
        // alice: 2 games, total 10, avg 5.0
        play(1, "alice", TODAY, 3);
        play(1, "alice", TODAY.minusDays(1), 3);
        // bob: 5 games, total 10, avg 2.0
        for (int i = 0; i < 5; i++) play(2, "bob", TODAY.minusDays(i + 20), 6);
        // carol: highest total
        play(3, "carol", TODAY, 1);
        play(3, "carol", TODAY.minusDays(1), 1);

        List<LeaderboardEntry> lb = stats.getLeaderboard(Window.ALLTIME, 10);

        assertEquals(3, lb.size());
        assertEquals("carol", lb.get(0).participant().label());
        assertEquals(14, lb.get(0).totalScore());
        assertEquals("alice", lb.get(1).participant().label());
        assertEquals(2, lb.get(1).rank());
        assertEquals("bob", lb.get(2).participant().label());
        assertEquals(10, lb.get(2).totalScore());
    }

    @Test
    public void testWindowExcludesOlderRows() {
        play(1, "alice", TODAY, 3);
        play(2, "bob", TODAY.minusDays(20), 1);

        List<LeaderboardEntry> weekly = stats.getLeaderboard(Window.WEEKLY, 10);

        assertEquals(1, weekly.size());
        assertEquals(1L, weekly.get(0).participant().id());
        assertTrue(stats.getRank(2L, Window.WEEKLY).isEmpty());
        // bob's single 1/6 (7 points) outranks alice's 3/6 (5 points) over all time
        assertEquals(1, stats.getRank(2L, Window.ALLTIME).getAsInt());
    }

    @Test
    public void testLimit() {
        for (long id = 1; id <= 5; id++) play(id, "p" + id, TODAY, (int) id);

        List<LeaderboardEntry> top = stats.getLeaderboard(Window.ALLTIME, 3);

        assertEquals(3, top.size());
        assertEquals(List.of(1L, 2L, 3L), top.stream().map(e -> e.participant().id()).toList());
        assertTrue(stats.getLeaderboard(Window.ALLTIME, 0).isEmpty());
    }

    @Test
    public void testStatsAndStreak() {
        play(1, "alice", TODAY, 2);
        play(1, "alice", TODAY.minusDays(1), 7);
        play(1, "alice", TODAY.minusDays(3), 4);

        PlayerStats s = stats.getStats(1L, Window.ALLTIME);
        assertEquals(3, s.gamesPlayed());
        assertEquals(6 + 1 + 4, s.totalScore());
        assertEquals(2, s.successfulGames());
        assertEquals(TODAY.minusDays(3), s.firstGameDate());
        assertEquals(TODAY, s.lastGameDate());

        assertEquals(new Streak(2, 2), stats.getStreak(1L));

        LeaderboardEntry only = stats.getLeaderboard(Window.ALLTIME, 10).get(0);
        assertEquals(2, only.currentStreak());
    }

    @Test
    public void testNoGames() {
        assertTrue(stats.getStats(9L, Window.ALLTIME).isEmpty());
        assertEquals(Streak.NONE, stats.getStreak(9L));
        assertTrue(stats.getLeaderboard(Window.WEEKLY, 10).isEmpty());
    }

    @Test
    public void testParticipantWithoutResultsIsNotRanked() {
        store.upsertParticipant(new ParticipantRef(5L, "lurker", null));
        play(1, "alice", TODAY, 3);

        List<LeaderboardEntry> lb = stats.getLeaderboard(Window.ALLTIME, 10);
        assertEquals(1, lb.size());
        assertTrue(stats.getRank(5L, Window.ALLTIME).isEmpty());
    }

    @Test
    public void testTodayUsesClockZone() {
        assertEquals(TODAY, stats.today());
        assertEquals(LocalDate.of(2024, 10, 14), stats.windowStart(Window.WEEKLY));
    }

    @Test
    public void testLastWeekRightAfterMondayRollover() {
        // Monday 2024-10-21, 00:01 in Los Angeles
        Clock monday = Clock.fixed(Instant.parse("2024-10-21T07:01:00Z"), LA);
        StatsEngine atRollover = new StatsEngine(store, monday, LocalDate.of(2020, 1, 1));
        LocalDate lastMonday = LocalDate.of(2024, 10, 14);
        for (int i = 0; i < 7; i++) play(1, "alice", lastMonday.plusDays(i), 3);
        play(2, "bob", lastMonday.minusDays(1), 1);

        assertTrue(atRollover.getLeaderboard(Window.WEEKLY, 10).isEmpty());
        assertEquals(lastMonday, atRollover.lastWeekStart());

        List<LeaderboardEntry> lastWeek = atRollover.getLeaderboard(lastMonday, lastMonday.plusDays(6), 10);
        assertEquals(1, lastWeek.size());
        assertEquals(1L, lastWeek.get(0).participant().id());
        assertEquals(7, lastWeek.get(0).gamesPlayed());
        assertEquals(35, lastWeek.get(0).totalScore());
    }

    @Test
    public void testLastWeekStartMidWeek() {
        assertEquals(LocalDate.of(2024, 10, 7), stats.lastWeekStart());
    }
}
