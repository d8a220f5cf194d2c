package org.gudu0.wordlebot.ingest;

import org.gudu0.wordlebot.parsing.ParsedRecord;
import org.gudu0.wordlebot.parsing.RoundInfo;
import org.gudu0.wordlebot.storage.InsertOutcome;
import org.gudu0.wordlebot.storage.ResultStore;
import org.gudu0.wordlebot.storage.RoundResult;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.time.Clock;
import java.util.List;

/**
 * Scores parsed records and appends them to the ledger, rejecting keys that already exist.
 * <p>
 * Duplicates are a normal outcome and never stop the remaining records.
 * A {@link StorageException} aborts the call; records already recorded stay recorded.
 */
public final class IngestionGate {

    private final ResultStore store;
    private final Clock clock;

    public IngestionGate(ResultStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public IngestResult ingest(List<ParsedRecord> records, RoundInfo round) {
        int accepted = 0;
        int rejected = 0;

        for (ParsedRecord rec : records) {
            long userId = rec.participant().id();
            RoundResult result = new RoundResult(
                    userId,
                    round.roundId(),
                    round.roundDate(),
                    rec.attemptCount(),
                    rec.succeeded(),
                    ScorePolicy.score(rec.attemptCount(), rec.succeeded()),
                    clock.instant());

            InsertOutcome outcome = store.recordResult(rec.participant(), result);

            if (outcome == InsertOutcome.INSERTED) {
                accepted++;
                ConsoleLog.info("IngestionGate", "Added result userId=" + userId
                        + " name=" + rec.participant().label()
                        + " " + attemptsLabel(rec) + " score=" + result.score()
                        + " round=" + round.roundId() + " date=" + round.roundDate());
            } else {
                rejected++;
                ConsoleLog.debug("IngestionGate", "Duplicate result userId=" + userId
                        + " round=" + round.roundId() + " date=" + round.roundDate());
            }
        }
        return new IngestResult(accepted, rejected);
    }

    private static String attemptsLabel(ParsedRecord rec) {
        return (rec.succeeded() ? Integer.toString(rec.attemptCount()) : "X") + "/6";
    }
}
