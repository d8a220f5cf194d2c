package org.gudu0.wordlebot.stats;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;

/**
 * Named date ranges for aggregate queries. Every window ends today, inclusive.
 */
public enum Window {
    WEEKLY("weekly", "Weekly"),
    MONTHLY("monthly", "Monthly"),
    ALLTIME("alltime", "All Time");

    private final String key;
    private final String title;

    Window(String key, String title) {
        this.key = key;
        this.title = title;
    }

    public String key() { return key; }

    public String title() { return title; }

    /** First day of the window. {@code allTimeStart} is only used by {@link #ALLTIME}. */
    public LocalDate start(LocalDate today, LocalDate allTimeStart) {
        return switch (this) {
            case WEEKLY -> today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY -> today.withDayOfMonth(1);
            case ALLTIME -> allTimeStart;
        };
    }

    public static Optional<Window> parse(String raw) {
        if (raw == null) return Optional.empty();
        String k = raw.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
        for (Window w : values()) {
            if (w.key.equals(k)) return Optional.of(w);
        }
        return Optional.empty();
    }
}
