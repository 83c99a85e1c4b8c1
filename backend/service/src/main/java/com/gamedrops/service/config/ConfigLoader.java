package com.gamedrops.service.config;

import com.gamedrops.core.model.JobGroup;
import com.gamedrops.core.util.JsonUtils;
import com.gamedrops.dispatcher.config.DispatcherSettings;
import com.gamedrops.dispatcher.window.DefaultSchedule;
import com.gamedrops.dispatcher.window.Schedule;
import com.gamedrops.dispatcher.window.TimeWindow;
import com.gamedrops.dispatcher.window.WindowRule;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

public final class ConfigLoader {
    public static final String API_URL = "API_URL";
    public static final String API_KEY = "API_KEY";
    public static final String ENVIRONMENT = "ENVIRONMENT";
    public static final String CONFIG_DIR = "CONFIG_DIR";
    public static final String REQUEST_TIMEOUT_SECONDS = "REQUEST_TIMEOUT_SECONDS";
    public static final String TICK_TIMEOUT_SECONDS = "TICK_TIMEOUT_SECONDS";
    public static final String CONNECT_TIMEOUT_SECONDS = "CONNECT_TIMEOUT_SECONDS";

    static final String SCHEDULE_FILE = "schedule.json";
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private ConfigLoader() {
    }

    public static Map<String, String> loadEnvironment(Path workDir, Map<String, String> processEnv, Consumer<String> info) {
        Map<String, String> merged = new HashMap<>(processEnv);
        mergeFile(merged, workDir.resolve("config.env"), info);

        String environment = merged.getOrDefault(ENVIRONMENT, "development").toLowerCase(Locale.ROOT);
        Path envFile = workDir.resolve("production".equals(environment) ? ".env.production" : ".env.development");
        mergeFile(merged, envFile, info);
        return merged;
    }

    public static DispatcherSettings loadSettings(Map<String, String> env) {
        String apiUrl = required(env, API_URL);
        String apiKey = required(env, API_KEY);
        URI baseUrl;
        try {
            baseUrl = URI.create(apiUrl);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(API_URL + " is not a valid URL: " + apiUrl, e);
        }
        try {
            return new DispatcherSettings(
                    baseUrl,
                    apiKey,
                    seconds(env, REQUEST_TIMEOUT_SECONDS, DispatcherSettings.DEFAULT_REQUEST_TIMEOUT),
                    seconds(env, TICK_TIMEOUT_SECONDS, DispatcherSettings.DEFAULT_TICK_TIMEOUT)
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid dispatcher configuration: " + e.getMessage(), e);
        }
    }

    public static Duration connectTimeout(Map<String, String> env) {
        return seconds(env, CONNECT_TIMEOUT_SECONDS, DEFAULT_CONNECT_TIMEOUT);
    }

    public static Path configDir(Map<String, String> env) {
        return Path.of(env.getOrDefault(CONFIG_DIR, "config"));
    }

    public static Schedule loadSchedule(Path configDir) {
        Path path = configDir.resolve(SCHEDULE_FILE);
        if (!Files.exists(path)) {
            return DefaultSchedule.create();
        }
        ScheduleConfig config;
        try (InputStream in = Files.newInputStream(path)) {
            config = JsonUtils.objectMapper().readValue(in, ScheduleConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
        try {
            return toSchedule(config);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid schedule in " + path + ": " + e.getMessage(), e);
        }
    }

    static Schedule toSchedule(ScheduleConfig config) {
        if (config.groups() == null || config.groups().isEmpty()) {
            throw new IllegalArgumentException("no job groups defined");
        }
        List<JobGroup> groups = new ArrayList<>();
        config.groups().forEach((id, jobs) -> groups.add(new JobGroup(id, jobs == null ? List.of() : jobs)));

        List<WindowRule> rules = new ArrayList<>();
        for (ScheduleConfig.RuleConfig rule : config.rules() == null ? List.<ScheduleConfig.RuleConfig>of() : config.rules()) {
            if (rule.name() == null || rule.group() == null) {
                throw new IllegalArgumentException("every rule needs a name and a group");
            }
            TimeWindow window = new TimeWindow(
                    toSet(rule.hours()),
                    toSet(rule.minutes()),
                    toWeekdays(rule.weekdays())
            );
            rules.add(WindowRule.of(rule.name(), window, rule.group()));
        }
        return new Schedule(groups, rules);
    }

    private static Set<Integer> toSet(List<Integer> values) {
        return values == null ? Set.of() : new HashSet<>(values);
    }

    private static Set<DayOfWeek> toWeekdays(List<Integer> weekdays) {
        Set<DayOfWeek> days = new HashSet<>();
        if (weekdays != null) {
            for (Integer weekday : weekdays) {
                if (weekday == null || weekday < 0 || weekday > 6) {
                    throw new IllegalArgumentException("weekday must be between 0 (Sunday) and 6: " + weekday);
                }
                days.add(weekday == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekday));
            }
        }
        return days;
    }

    private static void mergeFile(Map<String, String> merged, Path file, Consumer<String> info) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        EnvFile.read(file).forEach(merged::putIfAbsent);
        info.accept("Loaded environment variables from " + file);
    }

    private static String required(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " must be set");
        }
        return value.strip();
    }

    private static Duration seconds(Map<String, String> env, String key, Duration fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.strip());
            if (value <= 0) {
                throw new IllegalStateException(key + " must be a positive number of seconds: " + raw);
            }
            return Duration.ofSeconds(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " must be a whole number of seconds: " + raw, e);
        }
    }
}
