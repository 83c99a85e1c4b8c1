package com.gamedrops.service.config;

import java.util.List;
import java.util.Map;

public record ScheduleConfig(Map<String, List<String>> groups, List<RuleConfig> rules) {
    public record RuleConfig(
            String name,
            List<Integer> hours,
            List<Integer> minutes,
            List<Integer> weekdays,
            String group
    ) {
    }
}
