package org.gudu0.wordlebot.ingest;

/**
 * Points per round: 8 - guesses for a solve (1 guess = 7, 6 guesses = 2), 1 for a failed round (X/6).
 * A round that was never attempted has no row and counts as 0.
 */
public final class ScorePolicy {
    private ScorePolicy() {}

    public static final int FAILURE_SCORE = 1;
    private static final int SUCCESS_BASE = 8;

    public static final String DESCRIPTION = "Score = 8 - guesses; X = 1; no attempt = 0";

    public static int score(int attemptCount, boolean succeeded) {
        if (!succeeded) return FAILURE_SCORE;
        return SUCCESS_BASE - attemptCount;
    }
}
