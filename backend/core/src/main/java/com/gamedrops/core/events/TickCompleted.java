package com.gamedrops.core.events;

import com.gamedrops.core.model.TickReport;

import java.time.Instant;

public record TickCompleted(Instant timestamp, TickReport report, long durationMillis) implements Event {
    @Override
    public String type() {
        return "TickCompleted";
    }
}
