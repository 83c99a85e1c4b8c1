package com.gamedrops.core.events;

import com.gamedrops.core.model.TimeSample;

import java.time.Instant;
import java.util.List;

public record TickStarted(Instant timestamp, TimeSample sample, List<String> matchedGroups) implements Event {
    public TickStarted {
        matchedGroups = List.copyOf(matchedGroups);
    }

    @Override
    public String type() {
        return "TickStarted";
    }
}
