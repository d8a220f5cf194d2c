package org.gudu0.wordlebot.parsing;

import java.util.Optional;

/**
 * Identity lookup used by {@link ResultParser}.
 */
public interface ParticipantResolver {

    /**
     * Resolves a structured mention ({@code <@123>}). Always yields a reference;
     * names are filled in when the platform knows the user.
     */
    ParticipantRef resolveByMentionToken(long userId);

    /**
     * Case-insensitive lookup of a bare {@code @name} against display names and usernames
     * known within one guild.
     */
    Optional<ParticipantRef> resolveByDisplayName(String name, long groupId);
}
