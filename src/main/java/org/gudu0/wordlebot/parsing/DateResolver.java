package org.gudu0.wordlebot.parsing;

import org.gudu0.wordlebot.message.ResultDetector;
import org.gudu0.wordlebot.util.ConsoleLog;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Works out which round a summary reports on.
 * <p>
 * The summary always covers the previous day, so the round date is the message's local date minus one.
 * The round id is read from the "Wordle No. 1234" marker; when that is missing it is the number of days
 * from the round epoch to the round date.
 */
public final class DateResolver {

    private final ZoneId zone;
    private final LocalDate roundEpoch;

    public DateResolver(ZoneId zone, LocalDate roundEpoch) {
        this.zone = zone;
        this.roundEpoch = roundEpoch;
    }

    /**
     * @return empty when no marker is present and the round date falls before the epoch
     */
    public Optional<RoundInfo> resolve(Instant messageTimestamp, String corpus) {
        LocalDate roundDate = messageTimestamp.atZone(zone).toLocalDate().minusDays(1);

        String digits = ResultDetector.roundMarkerDigits(corpus);
        if (digits != null) {
            try {
                return Optional.of(new RoundInfo(Integer.parseInt(digits), roundDate, false));
            } catch (NumberFormatException e) {
                ConsoleLog.warn("DateResolver", "Round marker out of range (" + digits + "), deriving from date");
            }
        }

        OptionalInt derived = deriveRoundId(roundDate);
        if (derived.isEmpty()) {
            ConsoleLog.debug("DateResolver", "No round marker and roundDate=" + roundDate + " is before epoch " + roundEpoch);
            return Optional.empty();
        }
        return Optional.of(new RoundInfo(derived.getAsInt(), roundDate, true));
    }

    /** Days from the epoch to {@code roundDate}; empty when negative or too large for an int. */
    public OptionalInt deriveRoundId(LocalDate roundDate) {
        long days = ChronoUnit.DAYS.between(roundEpoch, roundDate);
        if (days < 0 || days > Integer.MAX_VALUE) return OptionalInt.empty();
        return OptionalInt.of((int) days);
    }
}
