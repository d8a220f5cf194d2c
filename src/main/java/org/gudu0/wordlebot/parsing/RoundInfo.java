package org.gudu0.wordlebot.parsing;

import java.time.LocalDate;

/**
 * Round a summary reports on.
 *
 * @param derived true when the id was computed from the date instead of read from the text
 */
public record RoundInfo(int roundId, LocalDate roundDate, boolean derived) {}
