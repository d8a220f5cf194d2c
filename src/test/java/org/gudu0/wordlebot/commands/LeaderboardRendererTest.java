package org.gudu0.wordlebot.commands;

import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import net.dv8tion.jda.api.interactions.components.buttons.ButtonStyle;
import org.gudu0.wordlebot.ingest.ScorePolicy;
import org.gudu0.wordlebot.parsing.ParticipantRef;
import org.gudu0.wordlebot.stats.StatsEngine;
import org.gudu0.wordlebot.stats.Window;
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

public class LeaderboardRendererTest {

    private static final Instant NOW = Instant.parse("2024-10-16T16:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2024, 10, 16);

    @TempDir
    Path tmp;

    private SqliteResultStore store;
    private LeaderboardRenderer renderer;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneId.of("America/Los_Angeles"));
        store = new SqliteResultStore(tmp.resolve("wordle.db"), clock);
        store.initSchema();
        renderer = new LeaderboardRenderer(new StatsEngine(store, clock, LocalDate.of(2020, 1, 1)), 10);
    }

    @Test
    public void testEmptyLeaderboard() {
        MessageEmbed embed = renderer.leaderboard(Window.WEEKLY);

        assertEquals("🏆 Weekly Wordle Leaderboard", embed.getTitle());
        assertEquals("No data available for this period.", embed.getDescription());
        assertTrue(embed.getFields().isEmpty());
        assertTrue(embed.getFooter().getText().contains(ScorePolicy.DESCRIPTION));
    }

    @Test
    public void testRowsHaveMedalsAndStreaks() {
        store.recordResult(new ParticipantRef(1L, "alice", "Alice"),
                new RoundResult(1L, 100, TODAY, 2, true, 6, NOW));
        store.recordResult(new ParticipantRef(1L, "alice", "Alice"),
                new RoundResult(1L, 99, TODAY.minusDays(1), 2, true, 6, NOW));
        store.recordResult(new ParticipantRef(2L, "bob", null),
                new RoundResult(2L, 100, TODAY, 6, false, 1, NOW));

        List<MessageEmbed.Field> fields = renderer.leaderboard(Window.ALLTIME).getFields();

        assertEquals(2, fields.size());
        assertEquals("🥇 Alice 🔥 2", fields.get(0).getName());
        assertEquals("Score: 12 | Games: 2 | Avg: 6.00", fields.get(0).getValue());
        assertEquals("🥈 bob 🔥 1", fields.get(1).getName());
    }

    @Test
    public void testActivePeriodButtonIsPrimary() {
        List<Button> buttons = renderer.buttons(Window.MONTHLY);

        assertEquals(4, buttons.size());
        assertEquals("lb:weekly", buttons.get(0).getId());
        assertEquals(ButtonStyle.SECONDARY, buttons.get(0).getStyle());
        assertEquals(ButtonStyle.PRIMARY, buttons.get(1).getStyle());
        assertEquals("lb:refresh:monthly", buttons.get(3).getId());
    }

    @Test
    public void testMedals() {
        assertEquals("🥉", LeaderboardRenderer.medal(3));
        assertEquals("4.", LeaderboardRenderer.medal(4));
        assertEquals("2.50", LeaderboardRenderer.formatAverage(2.5));
    }

    @Test
    public void testLastWeekShowsFinishedWeekOnMonday() {
        // Monday 2024-10-21, 00:01 in Los Angeles
        Clock monday = Clock.fixed(Instant.parse("2024-10-21T07:01:00Z"), ZoneId.of("America/Los_Angeles"));
        LeaderboardRenderer atRollover =
                new LeaderboardRenderer(new StatsEngine(store, monday, LocalDate.of(2020, 1, 1)), 10);
        for (int i = 0; i < 7; i++) {
            LocalDate day = LocalDate.of(2024, 10, 14).plusDays(i);
            store.recordResult(new ParticipantRef(1L, "alice", "Alice"),
                    new RoundResult(1L, 1212 + i, day, 4, true, 4, NOW));
        }

        MessageEmbed live = atRollover.leaderboard(Window.WEEKLY);
        MessageEmbed recap = atRollover.lastWeek("Weekly auto-post");

        assertEquals("No data available for this period.", live.getDescription());
        assertEquals("🏆 Last Week's Wordle Leaderboard (Oct 14 to Oct 20)", recap.getTitle());
        assertEquals(1, recap.getFields().size());
        assertEquals("Score: 28 | Games: 7 | Avg: 4.00", recap.getFields().get(0).getValue());
        assertEquals("Weekly auto-post", recap.getFooter().getText());
    }
}
