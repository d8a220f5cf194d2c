package org.gudu0.wordlebot.discord;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.wordlebot.ingest.IngestOutcome;
import org.gudu0.wordlebot.ingest.ResultIngestor;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Replays a channel's recent history through the results pipeline.
 * Runs alongside live ingestion safely: the store rejects keys it already has.
 */
public class BackfillService {

    private final ResultIngestor ingestor;
    private final Clock clock;
    private final int maxDays;

    public BackfillService(ResultIngestor ingestor, Clock clock, int maxDays) {
        this.ingestor = ingestor;
        this.clock = clock;
        this.maxDays = maxDays;
    }

    public int clampDays(int requested) {
        return Math.max(1, Math.min(requested, maxDays));
    }

    public CompletableFuture<BackfillReport> backfill(MessageChannel channel, long guildId, int days) {
        int window = clampDays(days);
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(Duration.ofDays(window));

        ConsoleLog.info("Backfill", "guildId=" + guildId + " channel=#" + channel.getName()
                + " scanning " + window + " day(s) back to " + cutoff);

        return channel.getIterableHistory()
                .takeWhileAsync(m -> m.getTimeCreated().isAfter(cutoff))
                .thenApply(history -> replay(history, guildId));
    }

    private BackfillReport replay(List<Message> newestFirst, long guildId) {
        List<Message> history = new ArrayList<>(newestFirst);
        Collections.reverse(history);

        int summaries = 0;
        int added = 0;
        int duplicates = 0;
        int malformed = 0;

        for (Message m : history) {
            if (m.getAuthor().getIdLong() == m.getJDA().getSelfUser().getIdLong()) continue;

            IngestOutcome outcome = ingestor.ingestMessage(new JdaChatMessage(m),
                    new GuildParticipantResolver(m.getJDA(), guildId));
            if (outcome.ingested()) {
                summaries++;
                added += outcome.acceptedResults();
                duplicates += outcome.rejectedResults();
            } else if (outcome.malformed()) {
                malformed++;
            }
        }

        BackfillReport report = new BackfillReport(history.size(), summaries, added, duplicates, malformed);
        ConsoleLog.info("Backfill", "guildId=" + guildId + " done: " + report);
        return report;
    }
}
