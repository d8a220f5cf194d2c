package org.gudu0.wordlebot.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.gudu0.wordlebot.util.BotPaths;

import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Global bot config (one per bot process).
 * Stored at: data/global/config.json
 */
public class GlobalConfig {
    /** SQLite database file holding participants and round results. Blank means data/global/wordle.db. */
    public String databasePath = "";

    /** Case-insensitive token the results bot's name must contain for the fallback detection rule. */
    public String resultsBotName = "wordle";

    /** Day of round #0. Round ids missing from a summary are derived as days since this date. */
    public String roundEpoch = "2021-06-19";

    /** Start of the "alltime" window. */
    public String allTimeStart = "2020-01-01";

    /** Zone used for round dates, window boundaries and the auto-post schedule. */
    public String timeZone = "America/Los_Angeles";

    public int leaderboardLimit = 10;

    /** Upper bound for /backfill days. */
    public int backfillMaxDays = 60;

    public boolean autoPostEnabled = true;
    public String autoPostDay = "MONDAY";
    public int autoPostHour = 0;
    public int autoPostMinute = 1;

    public boolean debug = false;

    @JsonIgnore
    public Path databaseFile() {
        return (databasePath == null || databasePath.isBlank())
                ? BotPaths.GLOBAL_DIR.resolve("wordle.db")
                : Path.of(databasePath);
    }

    @JsonIgnore
    public ZoneId zone() {
        return ZoneId.of(timeZone);
    }

    @JsonIgnore
    public LocalDate roundEpochDate() {
        return LocalDate.parse(roundEpoch);
    }

    @JsonIgnore
    public LocalDate allTimeStartDate() {
        return LocalDate.parse(allTimeStart);
    }

    @JsonIgnore
    public DayOfWeek autoPostDayOfWeek() {
        return DayOfWeek.valueOf(autoPostDay.trim().toUpperCase(Locale.ROOT));
    }
}
