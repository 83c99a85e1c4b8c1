package com.gamedrops.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record TickReport(
        Instant tickAt,
        TimeSample sample,
        List<String> matchedGroups,
        List<DispatchOutcome> outcomes
) {
    public TickReport {
        Objects.requireNonNull(tickAt, "tickAt is required");
        Objects.requireNonNull(sample, "sample is required");
        matchedGroups = List.copyOf(matchedGroups);
        outcomes = List.copyOf(outcomes);
    }

    public long succeededCount() {
        return outcomes.stream().filter(DispatchOutcome::succeeded).count();
    }

    public long failedCount() {
        return outcomes.stream().filter(DispatchOutcome::failed).count();
    }

    public List<DispatchOutcome> failures() {
        return outcomes.stream().filter(DispatchOutcome::failed).toList();
    }

    public boolean isIdle() {
        return matchedGroups.isEmpty();
    }
}
