package org.gudu0.wordlebot.storage;

import org.gudu0.wordlebot.parsing.ParticipantRef;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable store for participants and the append-only round result ledger.
 * Every method throws {@link StorageException} when the database is unavailable.
 */
public interface ResultStore {

    void initSchema();

    /** Creates the participant or refreshes its cached names. Null names keep the cached value. */
    void upsertParticipant(ParticipantRef participant);

    /**
     * Inserts the result unless its (participant, round id, round date) key already exists.
     * Safe under concurrent callers: exactly one of them sees {@link InsertOutcome#INSERTED}.
     */
    InsertOutcome insertResultIfAbsent(RoundResult result);

    /** {@link #upsertParticipant} and {@link #insertResultIfAbsent} in one transaction. */
    InsertOutcome recordResult(ParticipantRef participant, RoundResult result);

    Optional<Participant> findParticipant(long participantId);

    /** Aggregate for one participant over [from, to]; empty when they have no rows in range. */
    Optional<AggregateRow> aggregate(long participantId, LocalDate from, LocalDate to);

    /** One aggregate per participant with at least one row in [from, to], unordered. */
    List<AggregateRow> aggregateAll(LocalDate from, LocalDate to);

    /** Distinct dates with at least one result for the participant, ascending. */
    List<LocalDate> playDates(long participantId);

    long countResults();
}
