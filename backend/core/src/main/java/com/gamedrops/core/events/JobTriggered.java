package com.gamedrops.core.events;

import com.gamedrops.core.model.DispatchOutcome;

import java.time.Instant;

public record JobTriggered(Instant timestamp, DispatchOutcome outcome) implements Event {
    @Override
    public String type() {
        return "JobTriggered";
    }
}
