package com.gamedrops.core.events;

import java.time.Instant;
import java.util.Map;

public record AlertRaised(
        Instant timestamp,
        String category,
        String message,
        Map<String, Object> details
) implements Event {
    public AlertRaised {
        details = Map.copyOf(details);
    }

    @Override
    public String type() {
        return "AlertRaised";
    }
}
