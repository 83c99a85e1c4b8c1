package com.gamedrops.dispatcher.tick;

import com.gamedrops.core.events.AlertRaised;
import com.gamedrops.core.events.JobTriggered;
import com.gamedrops.core.events.TickCompleted;
import com.gamedrops.core.events.TickStarted;
import com.gamedrops.core.model.DispatchOutcome;
import com.gamedrops.core.model.JobGroup;
import com.gamedrops.core.model.TickReport;
import com.gamedrops.core.model.TimeSample;
import com.gamedrops.dispatcher.api.DispatchContext;
import com.gamedrops.dispatcher.clock.ClockSampler;
import com.gamedrops.dispatcher.dispatch.JobDispatcher;
import com.gamedrops.dispatcher.window.Schedule;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class TickRunner {
    private final Schedule schedule;
    private final DispatchContext context;
    private final ClockSampler sampler;
    private final JobDispatcher dispatcher;

    public TickRunner(Schedule schedule, DispatchContext context) {
        this.schedule = Objects.requireNonNull(schedule, "schedule is required");
        this.context = Objects.requireNonNull(context, "context is required");
        this.sampler = new ClockSampler(context.clock());
        this.dispatcher = new JobDispatcher(context);
    }

    public TickReport tick() {
        return tick(sampler.now());
    }

    public TickReport tick(Instant tickAt) {
        TimeSample sample = ClockSampler.sample(tickAt);
        return run(tickAt, sample, schedule.matcher().match(sample));
    }

    public TickReport runGroups(List<String> groupIds) {
        groupIds.forEach(schedule::group);
        Instant tickAt = sampler.now();
        return run(tickAt, ClockSampler.sample(tickAt), groupIds);
    }

    public Schedule schedule() {
        return schedule;
    }

    private TickReport run(Instant tickAt, TimeSample sample, List<String> groupIds) {
        Instant startedAt = context.clock().instant();
        context.eventBus().publish(new TickStarted(tickAt, sample, groupIds));

        List<JobGroup> groups = groupIds.stream().map(schedule::group).toList();
        List<DispatchOutcome> outcomes = dispatcher.dispatch(groups);

        for (DispatchOutcome outcome : outcomes) {
            context.eventBus().publish(new JobTriggered(context.clock().instant(), outcome));
            if (outcome.failed()) {
                context.eventBus().publish(new AlertRaised(
                        context.clock().instant(),
                        "dispatch",
                        "Job trigger failed: " + outcome.group() + "/" + outcome.job() + " - " + outcome.reason(),
                        Map.of("group", outcome.group(), "job", outcome.job(), "reason", outcome.reason())
                ));
            }
        }

        TickReport report = new TickReport(tickAt, sample, groupIds, outcomes);
        long durationMillis = Duration.between(startedAt, context.clock().instant()).toMillis();
        context.eventBus().publish(new TickCompleted(context.clock().instant(), report, durationMillis));
        return report;
    }
}
