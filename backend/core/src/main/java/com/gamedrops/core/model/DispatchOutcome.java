package com.gamedrops.core.model;

import java.util.Objects;

// statusCode is 0 when no response was received
public record DispatchOutcome(
        String group,
        String job,
        boolean succeeded,
        String reason,
        int statusCode,
        long durationMillis
) {
    public static final String TIMEOUT = "timeout";
    public static final String INTERRUPTED = "interrupted";

    public DispatchOutcome {
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(job, "job is required");
        if (!succeeded && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A failed outcome needs a reason");
        }
    }

    public static DispatchOutcome succeeded(String group, String job, int statusCode, long durationMillis) {
        return new DispatchOutcome(group, job, true, null, statusCode, durationMillis);
    }

    public static DispatchOutcome failed(String group, String job, String reason, int statusCode, long durationMillis) {
        return new DispatchOutcome(group, job, false, reason, statusCode, durationMillis);
    }

    public static DispatchOutcome failed(JobSpec job, String reason) {
        return failed(job.group(), job.name(), reason, 0, 0);
    }

    public boolean failed() {
        return !succeeded;
    }
}
