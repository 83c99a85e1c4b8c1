package com.gamedrops.dispatcher.clock;

import com.gamedrops.core.model.TimeSample;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

public final class ClockSampler {
    private final Clock clock;

    public ClockSampler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Instant now() {
        return clock.instant();
    }

    public TimeSample sample() {
        return sample(clock.instant());
    }

    public static TimeSample sample(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        return TimeSample.of(utc.getDayOfWeek(), utc.getHour(), utc.getMinute());
    }
}
