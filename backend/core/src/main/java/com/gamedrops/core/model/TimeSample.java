package com.gamedrops.core.model;

import java.time.DayOfWeek;

// weekday counts from Sunday = 0
public record TimeSample(int hour, int minute, int weekday) {
    public TimeSample {
        requireRange("hour", hour, 0, 23);
        requireRange("minute", minute, 0, 59);
        requireRange("weekday", weekday, 0, 6);
    }

    public static TimeSample of(DayOfWeek day, int hour, int minute) {
        return new TimeSample(hour, minute, weekdayIndex(day));
    }

    public static int weekdayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public DayOfWeek dayOfWeek() {
        return weekday == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekday);
    }

    @Override
    public String toString() {
        return String.format("%s %02d:%02d UTC", dayOfWeek(), hour, minute);
    }

    private static void requireRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(field + " must be between " + min + " and " + max + ": " + value);
        }
    }
}
