package org.gudu0.wordlebot.parsing;

/**
 * A resolved participant: stable user id plus whatever display attributes were known when it was seen.
 * Names are null when the reference could only be resolved to an id.
 */
public record ParticipantRef(long id, String username, String displayName) {

    public static ParticipantRef idOnly(long id) {
        return new ParticipantRef(id, null, null);
    }

    public boolean hasNames() {
        return username != null || displayName != null;
    }

    /** Best name for rendering: display name, then username, then a mention. */
    public String label() {
        if (displayName != null && !displayName.isBlank()) return displayName;
        if (username != null && !username.isBlank()) return username;
        return "<@" + id + ">";
    }
}
