package com.gamedrops.dispatcher.window;

import com.gamedrops.core.model.JobGroup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Schedule {
    private final Map<String, JobGroup> groups;
    private final List<WindowRule> rules;
    private final WindowMatcher matcher;

    public Schedule(List<JobGroup> groups, List<WindowRule> rules) {
        Map<String, JobGroup> byId = new LinkedHashMap<>();
        for (JobGroup group : groups) {
            if (byId.putIfAbsent(group.id(), group) != null) {
                throw new IllegalArgumentException("Duplicate job group: " + group.id());
            }
        }
        for (WindowRule rule : rules) {
            if (!byId.containsKey(rule.jobGroup())) {
                throw new IllegalArgumentException("Rule " + rule.name() + " references unknown job group " + rule.jobGroup());
            }
        }
        this.groups = Collections.unmodifiableMap(byId);
        this.rules = List.copyOf(rules);
        this.matcher = new WindowMatcher(this.rules);
    }

    public JobGroup group(String id) {
        JobGroup group = groups.get(id);
        if (group == null) {
            throw new IllegalArgumentException("Unknown job group: " + id);
        }
        return group;
    }

    public boolean hasGroup(String id) {
        return groups.containsKey(id);
    }

    public Map<String, JobGroup> groups() {
        return groups;
    }

    public List<WindowRule> rules() {
        return rules;
    }

    public WindowMatcher matcher() {
        return matcher;
    }
}
