package org.gudu0.wordlebot.ingest;

public record IngestResult(int acceptedCount, int rejectedCount) {
}
