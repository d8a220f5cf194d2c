package org.gudu0.wordlebot.ingest;

import org.gudu0.wordlebot.message.ChatMessage;
import org.gudu0.wordlebot.message.ResultDetector;
import org.gudu0.wordlebot.message.TextExtractor;
import org.gudu0.wordlebot.parsing.DateResolver;
import org.gudu0.wordlebot.parsing.ParsedRecord;
import org.gudu0.wordlebot.parsing.ParticipantResolver;
import org.gudu0.wordlebot.parsing.ResultParser;
import org.gudu0.wordlebot.parsing.RoundInfo;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.util.List;
import java.util.Optional;

/**
 * Message-level entry point: extract, detect, parse, date, ingest.
 * <p>
 * Detection and parsing problems come back as an {@link IngestOutcome}; only
 * {@link StorageException} is thrown.
 */
public final class ResultIngestor {

    private final TextExtractor extractor;
    private final ResultDetector detector;
    private final ResultParser parser;
    private final DateResolver dates;
    private final IngestionGate gate;

    public ResultIngestor(TextExtractor extractor,
                          ResultDetector detector,
                          ResultParser parser,
                          DateResolver dates,
                          IngestionGate gate) {
        this.extractor = extractor;
        this.detector = detector;
        this.parser = parser;
        this.dates = dates;
        this.gate = gate;
    }

    public IngestOutcome ingestMessage(ChatMessage message, ParticipantResolver resolver) {
        String corpus = extractor.extract(message);

        if (!detector.isResultMessage(corpus, message.authorIsBot(), message.authorName())) {
            return IngestOutcome.skipped(IngestOutcome.Status.NOT_RESULTS);
        }

        ConsoleLog.info("ResultIngestor", "Results summary detected msgId=" + message.messageId()
                + " guildId=" + message.groupId() + " author=" + message.authorName());

        List<ParsedRecord> records = parser.parse(corpus, message.groupId(), resolver);
        if (records.isEmpty()) {
            ConsoleLog.warn("ResultIngestor", "No player results found in msgId=" + message.messageId());
            return IngestOutcome.skipped(IngestOutcome.Status.UNPARSEABLE);
        }

        Optional<RoundInfo> round = dates.resolve(message.createdAt(), corpus);
        if (round.isEmpty()) {
            ConsoleLog.warn("ResultIngestor", "Could not determine a round id for msgId=" + message.messageId()
                    + " createdAt=" + message.createdAt());
            return IngestOutcome.skipped(IngestOutcome.Status.NO_ROUND_ID);
        }

        IngestResult result = gate.ingest(records, round.get());

        ConsoleLog.info("ResultIngestor", "msgId=" + message.messageId()
                + " round=" + round.get().roundId() + (round.get().derived() ? " (derived)" : "")
                + " date=" + round.get().roundDate()
                + " accepted=" + result.acceptedCount() + " rejected=" + result.rejectedCount());

        return IngestOutcome.ingested(result);
    }
}
