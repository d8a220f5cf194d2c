package org.gudu0.wordlebot.storage;

import java.time.Instant;

/**
 * Stored participant row. Names are cached copies refreshed on every observed mention and may be null.
 */
public record Participant(long id, String username, String displayName, Instant firstSeen) {

    public String label() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (username != null && !username.isBlank()) return username;
        return "<@" + id + ">";
    }
}
