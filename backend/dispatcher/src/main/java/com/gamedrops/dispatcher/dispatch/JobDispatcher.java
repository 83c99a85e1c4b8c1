package com.gamedrops.dispatcher.dispatch;

import com.gamedrops.core.model.DispatchOutcome;
import com.gamedrops.core.model.JobGroup;
import com.gamedrops.core.model.JobSpec;
import com.gamedrops.dispatcher.api.DispatchContext;
import com.gamedrops.dispatcher.config.DispatcherSettings;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

public class JobDispatcher {
    private static final Logger LOGGER = Logger.getLogger(JobDispatcher.class.getName());

    private final DispatchContext context;

    public JobDispatcher(DispatchContext context) {
        this.context = context;
    }

    public List<JobSpec> resolve(List<JobGroup> groups) {
        DispatcherSettings settings = context.settings();
        List<JobSpec> specs = new ArrayList<>();
        for (JobGroup group : groups) {
            for (String job : group.jobs()) {
                specs.add(JobSpec.post(group.id(), job, settings.jobEndpoint(job), settings.apiKey()));
            }
        }
        return specs;
    }

    public List<DispatchOutcome> dispatch(List<JobGroup> groups) {
        return dispatchAll(resolve(groups));
    }

    public List<DispatchOutcome> dispatchAll(List<JobSpec> jobs) {
        if (jobs.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<DispatchOutcome>> tasks = jobs.stream().map(this::launch).toList();

        String unsettledReason = DispatchOutcome.TIMEOUT;
        Duration deadline = context.settings().tickTimeout();
        try {
            CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                    .get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOGGER.warning("Tick deadline of " + deadline + " reached; abandoning unfinished job calls");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            unsettledReason = DispatchOutcome.INTERRUPTED;
        } catch (ExecutionException e) {
            // launch() converts every failure, so allOf only completes normally
            throw new IllegalStateException("Unexpected dispatch failure", e);
        }

        List<DispatchOutcome> outcomes = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            CompletableFuture<DispatchOutcome> task = tasks.get(i);
            if (task.isDone()) {
                outcomes.add(task.join());
            } else {
                task.cancel(true);
                outcomes.add(DispatchOutcome.failed(jobs.get(i), unsettledReason));
            }
        }
        return outcomes;
    }

    private CompletableFuture<DispatchOutcome> launch(JobSpec job) {
        Instant startedAt = context.clock().instant();
        CompletableFuture<DispatchOutcome> call;
        try {
            call = context.trigger().trigger(job);
        } catch (RuntimeException ex) {
            return CompletableFuture.completedFuture(DispatchOutcome.failed(job, FailureReasons.describe(ex)));
        }
        if (call == null) {
            return CompletableFuture.completedFuture(DispatchOutcome.failed(job, FailureReasons.NO_RESULT));
        }
        return call.handle((outcome, error) -> {
            if (error == null && outcome != null) {
                return outcome;
            }
            long durationMillis = Duration.between(startedAt, context.clock().instant()).toMillis();
            String reason = error != null ? FailureReasons.describe(error) : FailureReasons.NO_RESULT;
            return DispatchOutcome.failed(job.group(), job.name(), reason, 0, durationMillis);
        });
    }
}
