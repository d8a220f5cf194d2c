package org.gudu0.wordlebot.discord;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.events.message.MessageUpdateEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.wordlebot.ingest.IngestOutcome;
import org.gudu0.wordlebot.ingest.ResultIngestor;
import org.gudu0.wordlebot.logging.LogService;
import org.gudu0.wordlebot.storage.StorageException;
import org.gudu0.wordlebot.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

/**
 * Feeds every guild message into the results pipeline.
 * <p>
 * Edits are fed through too: the results app sometimes fills in its embed after posting,
 * and re-ingesting an already seen summary only produces duplicates.
 * Messages from other bots are processed (the results app is one); our own are not.
 */
public class ResultMessageListener extends ListenerAdapter {

    private final ResultIngestor ingestor;
    private final LogService logs;

    public ResultMessageListener(ResultIngestor ingestor, LogService logs) {
        this.ingestor = ingestor;
        this.logs = logs;
    }

    @Override
    public void onMessageReceived(@NotNull MessageReceivedEvent event) {
        if (!event.isFromGuild()) return;
        if (event.getAuthor().getIdLong() == event.getJDA().getSelfUser().getIdLong()) return;
        process(event.getMessage(), "live");
    }

    @Override
    public void onMessageUpdate(@NotNull MessageUpdateEvent event) {
        if (!event.isFromGuild()) return;
        if (event.getAuthor().getIdLong() == event.getJDA().getSelfUser().getIdLong()) return;
        process(event.getMessage(), "edit");
    }

    private void process(Message msg, String source) {
        long guildId = msg.getGuild().getIdLong();
        IngestOutcome outcome;
        try {
            outcome = ingestor.ingestMessage(new JdaChatMessage(msg),
                    new GuildParticipantResolver(msg.getJDA(), guildId));
        } catch (StorageException e) {
            ConsoleLog.error("Results", "guildId=" + guildId + " msgId=" + msg.getId()
                    + " storage failure (" + source + "): " + e.getMessage(), e);
            logs.log(guildId, "Failed to store results from message " + msg.getJumpUrl() + ": database unavailable.");
            return;
        }

        switch (outcome.status()) {
            case NOT_RESULTS -> { }
            case INGESTED -> {
                if (outcome.acceptedResults() > 0) {
                    logs.log(guildId, "Recorded " + outcome.acceptedResults() + " result(s) from " + msg.getJumpUrl()
                            + (outcome.rejectedResults() > 0 ? " (" + outcome.rejectedResults() + " already known)" : ""));
                } else {
                    ConsoleLog.debug("Results", "guildId=" + guildId + " msgId=" + msg.getId()
                            + " (" + source + ") all " + outcome.rejectedResults() + " result(s) already known");
                }
            }
            case UNPARSEABLE, NO_ROUND_ID ->
                    logs.log(guildId, "Results summary " + msg.getJumpUrl() + " could not be used: " + outcome.status());
        }
    }
}
