package org.gudu0.wordlebot.ingest;

/**
 * What happened to one message. Only {@link Status#INGESTED} touched the store.
 */
public record IngestOutcome(Status status, int acceptedResults, int rejectedResults) {

    public enum Status {
        /** Not a results summary. */
        NOT_RESULTS,
        /** Detected as a summary but no line produced a record. */
        UNPARSEABLE,
        /** Detected and parsed, but no valid round id could be obtained. */
        NO_ROUND_ID,
        INGESTED
    }

    public static IngestOutcome skipped(Status status) {
        return new IngestOutcome(status, 0, 0);
    }

    public static IngestOutcome ingested(IngestResult result) {
        return new IngestOutcome(Status.INGESTED, result.acceptedCount(), result.rejectedCount());
    }

    public boolean ingested() {
        return status == Status.INGESTED;
    }

    /** True for messages that looked like summaries but could not be used. */
    public boolean malformed() {
        return status == Status.UNPARSEABLE || status == Status.NO_ROUND_ID;
    }
}
