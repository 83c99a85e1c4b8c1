package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.TimeSample;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class WindowMatcher {
    private final List<WindowRule> rules;

    public WindowMatcher(List<WindowRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<String> match(TimeSample sample) {
        Set<String> groups = new LinkedHashSet<>();
        for (WindowRule rule : matchingRules(sample)) {
            groups.add(rule.jobGroup());
        }
        return List.copyOf(groups);
    }

    public List<WindowRule> matchingRules(TimeSample sample) {
        List<WindowRule> matched = new ArrayList<>();
        for (WindowRule rule : rules) {
            if (rule.matches(sample)) {
                matched.add(rule);
            }
        }
        return matched;
    }

    public List<Collision> collisions() {
        List<Collision> collisions = new ArrayList<>();
        for (int weekday = 0; weekday < 7; weekday++) {
            for (int hour = 0; hour < 24; hour++) {
                for (int minute = 0; minute < 60; minute++) {
                    TimeSample sample = new TimeSample(hour, minute, weekday);
                    List<WindowRule> matched = matchingRules(sample);
                    if (matched.size() > 1) {
                        collisions.add(new Collision(sample, matched.stream().map(WindowRule::name).toList()));
                    }
                }
            }
        }
        return collisions;
    }

    public List<WindowRule> rules() {
        return rules;
    }

    public record Collision(TimeSample sample, List<String> ruleNames) {
    }
}
