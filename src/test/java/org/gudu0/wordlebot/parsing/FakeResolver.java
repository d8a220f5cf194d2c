package org.gudu0.wordlebot.parsing;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/** Resolver over a fixed name table. Mentions of unknown ids resolve to id-only refs. */
public class FakeResolver implements ParticipantResolver {

    private final Map<Long, ParticipantRef> byId = new HashMap<>();
    private final Map<String, ParticipantRef> byName = new HashMap<>();

    public FakeResolver with(long id, String username, String displayName) {
        ParticipantRef ref = new ParticipantRef(id, username, displayName);
        byId.put(id, ref);
        byName.put(username.toLowerCase(Locale.ROOT), ref);
        if (displayName != null) byName.put(displayName.toLowerCase(Locale.ROOT), ref);
        return this;
    }

    @Override
    public ParticipantRef resolveByMentionToken(long userId) {
        return byId.getOrDefault(userId, ParticipantRef.idOnly(userId));
    }

    @Override
    public Optional<ParticipantRef> resolveByDisplayName(String name, long groupId) {
        return Optional.ofNullable(byName.get(name.toLowerCase(Locale.ROOT)));
    }
}
