package org.gudu0.wordlebot.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.User;
import org.gudu0.wordlebot.parsing.ParticipantRef;
import org.gudu0.wordlebot.parsing.ParticipantResolver;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.util.List;
import java.util.Optional;

/**
 * Resolves participants from JDA's caches. Needs the GUILD_MEMBERS intent with member caching
 * for display-name lookups to find anyone.
 */
public final class GuildParticipantResolver implements ParticipantResolver {

    private final JDA jda;
    private final long guildId;

    public GuildParticipantResolver(JDA jda, long guildId) {
        this.jda = jda;
        this.guildId = guildId;
    }

    @Override
    public ParticipantRef resolveByMentionToken(long userId) {
        Guild guild = jda.getGuildById(guildId);
        Member member = guild != null ? guild.getMemberById(userId) : null;
        if (member != null) {
            return new ParticipantRef(userId, member.getUser().getName(), member.getEffectiveName());
        }

        User user = jda.getUserById(userId);
        if (user != null) {
            return new ParticipantRef(userId, user.getName(), user.getEffectiveName());
        }

        ConsoleLog.debug("Resolver", "userId=" + userId + " not cached in guildId=" + guildId + "; storing id only");
        return ParticipantRef.idOnly(userId);
    }

    @Override
    public Optional<ParticipantRef> resolveByDisplayName(String name, long groupId) {
        Guild guild = jda.getGuildById(groupId);
        if (guild == null || name == null || name.isBlank()) return Optional.empty();

        List<Member> matches = guild.getMembersByEffectiveName(name, true);
        if (matches.isEmpty()) matches = guild.getMembersByName(name, true);
        if (matches.isEmpty()) return Optional.empty();

        if (matches.size() > 1) {
            ConsoleLog.warn("Resolver", "Name @" + name + " matches " + matches.size()
                    + " members in guildId=" + groupId + "; using the first");
        }
        Member m = matches.get(0);
        return Optional.of(new ParticipantRef(m.getIdLong(), m.getUser().getName(), m.getEffectiveName()));
    }
}
