package org.gudu0.wordlebot.parsing;

public record ParsedRecord(ParticipantRef participant,
                           int attemptCount,
                           boolean succeeded,
                           String rawLine) {}
