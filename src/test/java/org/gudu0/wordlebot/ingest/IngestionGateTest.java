package org.gudu0.wordlebot.ingest;

import org.gudu0.wordlebot.parsing.ParsedRecord;
import org.gudu0.wordlebot.parsing.ParticipantRef;
import org.gudu0.wordlebot.parsing.RoundInfo;
import org.gudu0.wordlebot.storage.RoundResult;
import org.gudu0.wordlebot.storage.SqliteResultStore;
import org.gudu0.wordlebot.storage.StoredResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IngestionGateTest {

    private static final Instant NOW = Instant.parse("2024-10-15T16:00:00Z");
    private static final RoundInfo ROUND = new RoundInfo(1213, LocalDate.of(2024, 10, 14), false);

    @TempDir
    Path tmp;

    private SqliteResultStore store;
    private IngestionGate gate;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new SqliteResultStore(tmp.resolve("wordle.db"), clock);
        store.initSchema();
        gate = new IngestionGate(store, clock);
    }

    private static ParsedRecord rec(long id, int attempts, boolean ok) {
        return new ParsedRecord(new ParticipantRef(id, "u" + id, null), attempts, ok, "line");
    }

    @Test
    public void testCountsAcceptedAndRejected() {
        IngestResult r = gate.ingest(List.of(rec(1, 3, true), rec(2, 6, false), rec(1, 4, true)), ROUND);

        assertEquals(2, r.acceptedCount());
        assertEquals(1, r.rejectedCount());
        assertEquals(3, r.acceptedCount() + r.rejectedCount());
    }

    @Test
    public void testScoresAndTimestamps() {
        gate.ingest(List.of(rec(1, 1, true), rec(2, 6, false)), ROUND);

        RoundResult ace = StoredResults.of(tmp.resolve("wordle.db"), 1L).get(0);
        assertEquals(7, ace.score());
        assertEquals(NOW, ace.createdAt());
        assertEquals(ROUND.roundDate(), ace.roundDate());

        RoundResult miss = StoredResults.of(tmp.resolve("wordle.db"), 2L).get(0);
        assertEquals(1, miss.score());
        assertEquals(6, miss.attemptCount());
    }

    @Test
    public void testEmptyInput() {
        assertEquals(new IngestResult(0, 0), gate.ingest(List.of(), ROUND));
    }
}
