package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.TimeSample;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeWindowTest {
    @Test
    void emptyFieldMatchesAnyValue() {
        TimeWindow everyHourAtQuarterPast = new TimeWindow(Set.of(), Set.of(15), Set.of());

        assertTrue(everyHourAtQuarterPast.test(new TimeSample(0, 15, 0)));
        assertTrue(everyHourAtQuarterPast.test(new TimeSample(23, 15, 6)));
        assertFalse(everyHourAtQuarterPast.test(new TimeSample(23, 16, 6)));
    }

    @Test
    void weeklyWindowRequiresDayHourAndMinute() {
        TimeWindow window = TimeWindow.weekly(DayOfWeek.FRIDAY, 19, 0);

        assertTrue(window.test(TimeSample.of(DayOfWeek.FRIDAY, 19, 0)));
        assertFalse(window.test(TimeSample.of(DayOfWeek.THURSDAY, 19, 0)));
        assertFalse(window.test(TimeSample.of(DayOfWeek.FRIDAY, 18, 0)));
        assertFalse(window.test(TimeSample.of(DayOfWeek.FRIDAY, 19, 1)));
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.daily(Set.of(24), 0));
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.daily(Set.of(9), 60));
        assertThrows(IllegalArgumentException.class, () -> TimeWindow.daily(Set.of(-1), 0));
    }

    @Test
    void describeListsSortedValues() {
        assertEquals(
                "hours=[9, 21] minutes=[30] weekdays=any",
                TimeWindow.daily(Set.of(21, 9), 30).describe()
        );
        assertEquals(
                "hours=[19] minutes=[0] weekdays=[FRIDAY]",
                TimeWindow.weekly(DayOfWeek.FRIDAY, 19, 0).describe()
        );
    }
}
