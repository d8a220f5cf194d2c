package org.gudu0.wordlebot.storage;

public enum InsertOutcome {
    INSERTED,
    /** A row with the same (participant, round id, round date) already existed; nothing was written. */
    DUPLICATE
}
