package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.TimeSample;

import java.util.Objects;
import java.util.function.Predicate;

public record WindowRule(String name, Predicate<TimeSample> predicate, String jobGroup) {
    public WindowRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(jobGroup, "jobGroup is required");
    }

    public static WindowRule of(String name, TimeWindow window, String jobGroup) {
        return new WindowRule(name, window, jobGroup);
    }

    public boolean matches(TimeSample sample) {
        return predicate.test(sample);
    }

    public String describe() {
        String when = predicate instanceof TimeWindow window ? window.describe() : "custom predicate";
        return name + " -> " + jobGroup + " (" + when + ")";
    }
}
