package org.gudu0.wordlebot.stats;

/**
 * @param current run of consecutive play dates ending on the most recent play date
 * @param longest longest run of consecutive play dates anywhere in history
 */
public record Streak(int current, int longest) {
    public static final Streak NONE = new Streak(0, 0);
}
