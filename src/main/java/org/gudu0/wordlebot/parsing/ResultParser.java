package org.gudu0.wordlebot.parsing;

import org.gudu0.wordlebot.message.ResultDetector;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls per-participant results out of a detected summary, one line at a time.
 * <p>
 * A line contributes only if it has both a score token ({@code 3/6}, {@code X/6}) and at least one
 * resolvable participant. Structured mentions win; bare {@code @name} tokens are only looked at
 * when the line has no structured mention. The first score token on a line applies to every
 * participant on it.
 */
public final class ResultParser {

    /** Attempt count recorded for a failed round (X/6). */
    public static final int MAX_ATTEMPTS = 6;

    private static final Pattern MENTION = Pattern.compile("<@!?(\\d+)>");
    private static final Pattern BARE_AT = Pattern.compile("(?<![\\w<])@");
    private static final int MAX_NAME_WORDS = 3;

    public List<ParsedRecord> parse(String corpus, long groupId, ParticipantResolver resolver) {
        List<ParsedRecord> out = new ArrayList<>();
        if (corpus == null || corpus.isBlank()) return out;

        for (String raw : corpus.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;

            Matcher score = ResultDetector.SCORE.matcher(line);
            if (!score.find()) continue;

            String token = score.group(1);
            boolean succeeded = !token.equalsIgnoreCase("X");
            int attempts = succeeded ? Integer.parseInt(token) : MAX_ATTEMPTS;

            List<ParticipantRef> participants = participantsOn(line, groupId, resolver);
            if (participants.isEmpty()) {
                ConsoleLog.debug("ResultParser", "Score without resolvable participant: \"" + line + "\"");
                continue;
            }

            for (ParticipantRef p : participants) {
                out.add(new ParsedRecord(p, attempts, succeeded, line));
            }
        }
        return out;
    }

    private List<ParticipantRef> participantsOn(String line, long groupId, ParticipantResolver resolver) {
        List<ParticipantRef> refs = new ArrayList<>();

        Matcher mention = MENTION.matcher(line);
        while (mention.find()) {
            long userId;
            try {
                userId = Long.parseLong(mention.group(1));
            } catch (NumberFormatException e) {
                ConsoleLog.debug("ResultParser", "Mention id out of range: " + mention.group());
                continue;
            }
            refs.add(resolver.resolveByMentionToken(userId));
        }
        if (!refs.isEmpty()) return refs;

        Matcher at = BARE_AT.matcher(line);
        while (at.find()) {
            int start = at.end();
            int end = line.indexOf('@', start);
            if (end < 0) end = line.length();

            resolveBareName(line.substring(start, end), groupId, resolver).ifPresent(refs::add);
        }
        return refs;
    }

    /**
     * Display names may contain spaces, so the longest run of up to three words that resolves wins.
     */
    private static Optional<ParticipantRef> resolveBareName(String tail, long groupId, ParticipantResolver resolver) {
        String trimmed = tail.strip();
        if (trimmed.isEmpty()) return Optional.empty();

        String[] words = trimmed.split("\\s+");
        for (int n = Math.min(MAX_NAME_WORDS, words.length); n >= 1; n--) {
            String candidate = stripTrailingPunctuation(String.join(" ", Arrays.copyOf(words, n)));
            if (candidate.isEmpty()) continue;

            Optional<ParticipantRef> ref = resolver.resolveByDisplayName(candidate, groupId);
            if (ref.isPresent()) return ref;
        }
        ConsoleLog.debug("ResultParser", "Unresolved bare name in guildId=" + groupId + ": @" + trimmed);
        return Optional.empty();
    }

    private static String stripTrailingPunctuation(String s) {
        int end = s.length();
        while (end > 0 && ":,;.!?".indexOf(s.charAt(end - 1)) >= 0) end--;
        return s.substring(0, end).strip();
    }
}
