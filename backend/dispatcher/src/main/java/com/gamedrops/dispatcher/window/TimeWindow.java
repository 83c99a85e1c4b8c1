package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.TimeSample;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

public record TimeWindow(Set<Integer> hours, Set<Integer> minutes, Set<DayOfWeek> weekdays)
        implements Predicate<TimeSample> {

    public TimeWindow {
        Objects.requireNonNull(hours, "hours is required");
        Objects.requireNonNull(minutes, "minutes is required");
        Objects.requireNonNull(weekdays, "weekdays is required");
        requireRange("hour", hours, 23);
        requireRange("minute", minutes, 59);
        hours = Set.copyOf(hours);
        minutes = Set.copyOf(minutes);
        weekdays = Set.copyOf(weekdays);
    }

    public static TimeWindow daily(Set<Integer> hours, int minute) {
        return new TimeWindow(hours, Set.of(minute), Set.of());
    }

    public static TimeWindow weekly(DayOfWeek day, int hour, int minute) {
        return new TimeWindow(Set.of(hour), Set.of(minute), Set.of(day));
    }

    @Override
    public boolean test(TimeSample sample) {
        return (hours.isEmpty() || hours.contains(sample.hour()))
                && (minutes.isEmpty() || minutes.contains(sample.minute()))
                && (weekdays.isEmpty() || weekdays.contains(sample.dayOfWeek()));
    }

    public String describe() {
        return "hours=" + render(hours) + " minutes=" + render(minutes) + " weekdays=" + render(weekdays);
    }

    private static String render(Collection<?> values) {
        return values.isEmpty() ? "any" : new TreeSet<>(values).toString();
    }

    private static void requireRange(String field, Set<Integer> values, int max) {
        for (Integer value : values) {
            if (value == null || value < 0 || value > max) {
                throw new IllegalArgumentException(field + " must be between 0 and " + max + ": " + value);
            }
        }
    }
}
