package org.gudu0.wordlebot.message;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a text corpus is a daily results summary.
 * <p>
 * Primary rule: the "here are yesterday's results" header plus a round marker ("Wordle No. 1234").
 * Fallback rule: a bot author whose name contains the configured token, plus at least one n/6 score.
 * The fallback also fires on unrelated bot posts that happen to contain "n/6"; that is accepted.
 */
public final class ResultDetector {

    public static final Pattern HEADER = Pattern.compile(
            "here\\s+are\\s+yesterday['’‘`´]?s\\s+results\\s*:?",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /** Round label: "Wordle No. 1234", "Wordle No 1234", "Round No: 7", "Wordle #12". */
    public static final Pattern ROUND_MARKER = Pattern.compile(
            "\\b(?:Wordle|Round)\\s+(?:No\\b\\s*[.:]?\\s*#?|#)\\s*(\\d+)",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern SCORE = Pattern.compile(
            "(?<![\\w/])([0-6X])/6(?!\\d)",
            Pattern.CASE_INSENSITIVE);

    private final String botNameToken;

    public ResultDetector(String botNameToken) {
        this.botNameToken = botNameToken == null ? "" : botNameToken.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isResultMessage(String corpus, boolean authorIsBot, String authorName) {
        if (corpus == null || corpus.isBlank()) return false;

        if (HEADER.matcher(corpus).find() && ROUND_MARKER.matcher(corpus).find()) {
            return true;
        }

        return authorIsBot
                && isResultsBot(authorName)
                && SCORE.matcher(corpus).find();
    }

    boolean isResultsBot(String authorName) {
        if (authorName == null || botNameToken.isEmpty()) return false;
        return authorName.toLowerCase(Locale.ROOT).contains(botNameToken);
    }

    /** Digits of the first round marker, or null if there is none. */
    public static String roundMarkerDigits(String corpus) {
        if (corpus == null) return null;
        Matcher m = ROUND_MARKER.matcher(corpus);
        return m.find() ? m.group(1) : null;
    }
}
