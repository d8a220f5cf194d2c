package org.gudu0.wordlebot.stats;

import java.time.LocalDate;

/**
 * One participant's aggregate over a window. Dates are null when {@code gamesPlayed == 0}.
 */
public record PlayerStats(int gamesPlayed,
                          int totalScore,
                          double averageScore,
                          int successfulGames,
                          LocalDate firstGameDate,
                          LocalDate lastGameDate) {

    public static PlayerStats empty() {
        return new PlayerStats(0, 0, 0.0, 0, null, null);
    }

    public boolean isEmpty() {
        return gamesPlayed == 0;
    }
}
