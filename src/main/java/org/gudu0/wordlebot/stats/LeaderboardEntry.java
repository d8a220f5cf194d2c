package org.gudu0.wordlebot.stats;

import org.gudu0.wordlebot.storage.Participant;

public record LeaderboardEntry(int rank,
                               Participant participant,
                               int gamesPlayed,
                               int totalScore,
                               double averageScore,
                               int successfulGames,
                               int currentStreak,
                               int longestStreak) {}
