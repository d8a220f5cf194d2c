package org.gudu0.wordlebot.storage;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One participant's outcome for one round. Immutable once stored;
 * (participantId, roundId, roundDate) is unique.
 */
public record RoundResult(long participantId,
                          int roundId,
                          LocalDate roundDate,
                          int attemptCount,
                          boolean succeeded,
                          int score,
                          Instant createdAt) {}
