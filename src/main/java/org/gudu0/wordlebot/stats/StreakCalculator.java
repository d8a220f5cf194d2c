package org.gudu0.wordlebot.stats;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Streaks over distinct calendar dates.
 * "Current" is the run ending on the last play date, even if that date is not today.
 */
public final class StreakCalculator {
    private StreakCalculator() {}

    public static Streak compute(Collection<LocalDate> playDates) {
        if (playDates == null || playDates.isEmpty()) return Streak.NONE;

        List<LocalDate> days = List.copyOf(new TreeSet<>(playDates));

        int longest = 1;
        int run = 1;
        for (int i = 1; i < days.size(); i++) {
            if (days.get(i - 1).plusDays(1).equals(days.get(i))) {
                run++;
            } else {
                run = 1;
            }
            if (run > longest) longest = run;
        }

        // After the loop, run is the length of the run that ends on the last date.
        return new Streak(run, longest);
    }
}
