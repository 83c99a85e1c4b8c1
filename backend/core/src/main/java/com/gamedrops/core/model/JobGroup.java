package com.gamedrops.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

public record JobGroup(String id, List<String> jobs) {
    public JobGroup {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(jobs, "jobs is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Job group id must not be blank");
        }
        if (jobs.isEmpty()) {
            throw new IllegalArgumentException("Job group " + id + " has no jobs");
        }
        Set<String> seen = new HashSet<>();
        for (String job : jobs) {
            if (job == null || job.isBlank()) {
                throw new IllegalArgumentException("Job group " + id + " contains a blank job name");
            }
            if (!seen.add(job)) {
                throw new IllegalArgumentException("Job group " + id + " lists " + job + " twice");
            }
        }
        jobs = List.copyOf(jobs);
    }

    public static JobGroup of(String id, String... jobs) {
        return new JobGroup(id, List.of(jobs));
    }
}
