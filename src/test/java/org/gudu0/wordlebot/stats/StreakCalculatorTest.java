package org.gudu0.wordlebot.stats;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StreakCalculatorTest {

    private static final LocalDate D = LocalDate.of(2024, 10, 14);

    @Test
    public void testGapSplitsRuns() {
        Streak s = StreakCalculator.compute(List.of(D, D.minusDays(1), D.minusDays(3), D.minusDays(4), D.minusDays(5)));

        assertEquals(2, s.current());
        assertEquals(3, s.longest());
    }

    @Test
    public void testDuplicatesAndOrderDoNotMatter() {
        Streak s = StreakCalculator.compute(List.of(D, D.minusDays(2), D, D.minusDays(1)));

        assertEquals(new Streak(3, 3), s);
    }

    @Test
    public void testSingleDay() {
        assertEquals(new Streak(1, 1), StreakCalculator.compute(List.of(D)));
    }

    @Test
    public void testEmpty() {
        assertEquals(Streak.NONE, StreakCalculator.compute(List.of()));
        assertEquals(Streak.NONE, StreakCalculator.compute(null));
    }

    @Test
    public void testMonthAndYearBoundaries() {
        Streak s = StreakCalculator.compute(List.of(
                LocalDate.of(2023, 12, 30), LocalDate.of(2023, 12, 31), LocalDate.of(2024, 1, 1)));

        assertEquals(3, s.current());
    }
}
