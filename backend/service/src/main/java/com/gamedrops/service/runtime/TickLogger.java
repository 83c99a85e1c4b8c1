package com.gamedrops.service.runtime;

import com.gamedrops.core.bus.EventBus;
import com.gamedrops.core.events.AlertRaised;
import com.gamedrops.core.events.TickCompleted;
import com.gamedrops.core.model.DispatchOutcome;
import com.gamedrops.core.model.TickReport;
import com.gamedrops.core.util.JsonUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class TickLogger {
    private final Logger logger;

    public TickLogger(EventBus eventBus) {
        this(eventBus, Logger.getLogger(TickLogger.class.getName()));
    }

    TickLogger(EventBus eventBus, Logger logger) {
        this.logger = logger;
        eventBus.subscribe(TickCompleted.class, this::onTickCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
    }

    static Map<String, Object> summary(TickCompleted event) {
        TickReport report = event.report();
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("event", "tick");
        line.put("tickAt", report.tickAt());
        line.put("sample", report.sample().toString());
        line.put("matchedGroups", report.matchedGroups());
        line.put("succeeded", report.succeededCount());
        line.put("failed", report.failedCount());
        line.put("durationMillis", event.durationMillis());
        line.put("outcomes", report.outcomes().stream().map(TickLogger::outcome).toList());
        return line;
    }

    private static Map<String, Object> outcome(DispatchOutcome outcome) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("group", outcome.group());
        entry.put("job", outcome.job());
        entry.put("result", outcome.succeeded() ? "succeeded" : "failed");
        if (outcome.reason() != null) {
            entry.put("reason", outcome.reason());
        }
        if (outcome.statusCode() > 0) {
            entry.put("status", outcome.statusCode());
        }
        entry.put("durationMillis", outcome.durationMillis());
        return entry;
    }

    private void onTickCompleted(TickCompleted event) {
        Level level = event.report().isIdle() ? Level.FINE : Level.INFO;
        if (logger.isLoggable(level)) {
            logger.log(level, JsonUtils.toJsonLine(summary(event)));
        }
    }

    private void onAlertRaised(AlertRaised alert) {
        logger.warning(alert.message());
    }
}
