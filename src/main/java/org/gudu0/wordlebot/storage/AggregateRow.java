package org.gudu0.wordlebot.storage;

import java.time.LocalDate;

/**
 * Per-participant aggregate over a date range.
 */
public record AggregateRow(Participant participant,
                           int gamesPlayed,
                           int totalScore,
                           double averageScore,
                           int successfulGames,
                           LocalDate firstGameDate,
                           LocalDate lastGameDate) {}
