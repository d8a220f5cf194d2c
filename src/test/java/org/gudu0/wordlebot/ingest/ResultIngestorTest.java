package org.gudu0.wordlebot.ingest;

import org.gudu0.wordlebot.message.ResultDetector;
import org.gudu0.wordlebot.message.RichBlock;
import org.gudu0.wordlebot.message.TestMessage;
import org.gudu0.wordlebot.message.TextExtractor;
import org.gudu0.wordlebot.parsing.DateResolver;
import org.gudu0.wordlebot.parsing.FakeResolver;
import org.gudu0.wordlebot.parsing.ResultParser;
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
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultIngestorTest {

    private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
    // 09:00 in Los Angeles on 2024-10-15
    private static final Instant T = Instant.parse("2024-10-15T16:00:00Z");

    @TempDir
    Path tmp;

    private SqliteResultStore store;
    private ResultIngestor ingestor;
    private final FakeResolver resolver = new FakeResolver().with(42L, "alice", "Alice");

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(T, LA);
        store = new SqliteResultStore(tmp.resolve("wordle.db"), clock);
        store.initSchema();
        ingestor = new ResultIngestor(
                new TextExtractor(),
                new ResultDetector("wordle"),
                new ResultParser(),
                new DateResolver(LA, LocalDate.of(2021, 6, 19)),
                new IngestionGate(store, clock));
    }

    @Test
    public void testEndToEndWithDuplicateLine() {
        TestMessage msg = TestMessage.fromUser(
                "Here are yesterday's results: Wordle No. 1234\n<@!42> 3/6\n<@!42> 3/6", T);

        IngestOutcome outcome = ingestor.ingestMessage(msg, resolver);

        assertEquals(IngestOutcome.Status.INGESTED, outcome.status());
        assertEquals(1, outcome.acceptedResults());
        assertEquals(1, outcome.rejectedResults());

        List<RoundResult> rows = StoredResults.of(tmp.resolve("wordle.db"), 42L);
        assertEquals(1, rows.size());
        RoundResult r = rows.get(0);
        assertEquals(1234, r.roundId());
        assertEquals(LocalDate.of(2024, 10, 14), r.roundDate());
        assertEquals(3, r.attemptCount());
        assertTrue(r.succeeded());
        assertEquals(5, r.score());
        assertEquals("Alice", store.findParticipant(42L).orElseThrow().displayName());
    }

    @Test
    public void testReingestingIsIdempotent() {
        TestMessage msg = TestMessage.fromUser(
                "Here are yesterday's results: Wordle No. 1234\n<@!42> 3/6", T);

        ingestor.ingestMessage(msg, resolver);
        IngestOutcome again = ingestor.ingestMessage(msg, resolver);

        assertTrue(again.ingested());
        assertEquals(0, again.acceptedResults());
        assertEquals(1, again.rejectedResults());
        assertEquals(1, store.countResults());
    }

    @Test
    public void testFailureMarker() {
        TestMessage msg = TestMessage.fromUser(
                "Here are yesterday's results: Wordle No. 1234\n<@!7> X/6", T);

        ingestor.ingestMessage(msg, resolver);

        RoundResult r = StoredResults.of(tmp.resolve("wordle.db"), 7L).get(0);
        assertEquals(6, r.attemptCount());
        assertFalse(r.succeeded());
        assertEquals(1, r.score());
    }

    @Test
    public void testEmbedOnlySummaryFromResultsBot() {
        TestMessage msg = new TestMessage(9L, 100L, "",
                List.of(new RichBlock(null, "👑 2/6: @Alice\n4/6: <@8>", null, null, List.of())),
                "Wordle", true, T);

        IngestOutcome outcome = ingestor.ingestMessage(msg, resolver);

        assertTrue(outcome.ingested());
        assertEquals(2, outcome.acceptedResults());
        // No marker: derived from the epoch
        int expectedRound = (int) ChronoUnit.DAYS.between(
                LocalDate.of(2021, 6, 19), LocalDate.of(2024, 10, 14));
        assertEquals(expectedRound, StoredResults.of(tmp.resolve("wordle.db"), 42L).get(0).roundId());
        assertEquals(6, StoredResults.of(tmp.resolve("wordle.db"), 42L).get(0).score());
    }

    @Test
    public void testOrdinaryChatIsIgnored() {
        IngestOutcome outcome = ingestor.ingestMessage(TestMessage.fromUser("I got 3/6 today <@42>", T), resolver);

        assertEquals(IngestOutcome.Status.NOT_RESULTS, outcome.status());
        assertEquals(0, store.countResults());
    }

    @Test
    public void testSummaryWithoutPlayersIsUnparseable() {
        IngestOutcome outcome = ingestor.ingestMessage(
                TestMessage.fromUser("Here are yesterday's results: Wordle No. 1234\nNobody played.", T), resolver);

        assertEquals(IngestOutcome.Status.UNPARSEABLE, outcome.status());
        assertTrue(outcome.malformed());
    }

    @Test
    public void testNoRoundIdBeforeEpoch() {
        Instant early = Instant.parse("2021-06-19T20:00:00Z");
        TestMessage msg = TestMessage.fromBot("Wordle", "<@42> 3/6", early);

        IngestOutcome outcome = ingestor.ingestMessage(msg, resolver);

        assertEquals(IngestOutcome.Status.NO_ROUND_ID, outcome.status());
        assertEquals(0, store.countResults());
    }
}
