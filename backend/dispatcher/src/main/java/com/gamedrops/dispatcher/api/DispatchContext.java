package com.gamedrops.dispatcher.api;

import com.gamedrops.core.bus.EventBus;
import com.gamedrops.dispatcher.config.DispatcherSettings;

import java.time.Clock;
import java.util.Objects;

public record DispatchContext(
        JobTrigger trigger,
        EventBus eventBus,
        Clock clock,
        DispatcherSettings settings
) {
    public DispatchContext {
        Objects.requireNonNull(trigger, "trigger is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(settings, "settings is required");
    }
}
