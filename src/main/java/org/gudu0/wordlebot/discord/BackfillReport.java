package org.gudu0.wordlebot.discord;

public record BackfillReport(int messagesScanned,
                             int summariesIngested,
                             int resultsAdded,
                             int duplicates,
                             int malformed) {}
