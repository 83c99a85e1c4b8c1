package com.gamedrops.service.runtime;

import com.gamedrops.core.model.TickReport;
import com.gamedrops.dispatcher.tick.TickRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

// A wake up to earlyToleranceMillis ahead of a boundary ticks that boundary; later wakes tick the current minute.
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());
    private static final long MAX_EARLY_WAKE_MILLIS = 1_000;

    private final TickRunner runner;
    private final Clock clock;
    private final long periodMillis;
    private final long earlyToleranceMillis;
    private final ScheduledThreadPoolExecutor timerExecutor = new ScheduledThreadPoolExecutor(1);
    private final ExecutorService tickExecutor = Executors.newCachedThreadPool();
    // touched only on the timer thread
    private Instant lastBoundary;

    public SchedulerService(TickRunner runner, Clock clock) {
        this(runner, clock, Duration.ofMinutes(1));
    }

    SchedulerService(TickRunner runner, Clock clock, Duration period) {
        this.runner = runner;
        this.clock = clock;
        this.periodMillis = period.toMillis();
        this.earlyToleranceMillis = Math.min(MAX_EARLY_WAKE_MILLIS, periodMillis / 10);
        timerExecutor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        timerExecutor.setRemoveOnCancelPolicy(true);
    }

    public void start() {
        Instant now = clock.instant();
        Instant first = nextBoundary(now, periodMillis);
        LOGGER.info("Scheduler started; first tick at " + first);
        scheduleAt(first, now);
    }

    public TickReport runOnce() {
        return runner.tick();
    }

    public void shutdown() {
        timerExecutor.shutdown();
        tickExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!tickExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Ticks still running after shutdown grace period");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Instant nextBoundary(Instant now, long periodMillis) {
        long epochMillis = now.toEpochMilli();
        return Instant.ofEpochMilli((Math.floorDiv(epochMillis, periodMillis) + 1) * periodMillis);
    }

    static Instant tickBoundary(Instant now, long periodMillis, long earlyToleranceMillis) {
        long epochMillis = now.toEpochMilli();
        long current = Math.floorDiv(epochMillis, periodMillis) * periodMillis;
        long upcoming = current + periodMillis;
        return Instant.ofEpochMilli(upcoming - epochMillis <= earlyToleranceMillis ? upcoming : current);
    }

    private void scheduleAt(Instant boundary, Instant now) {
        scheduleIn(Math.max(0, Duration.between(now, boundary).toMillis()));
    }

    private void scheduleIn(long delayMillis) {
        try {
            timerExecutor.schedule(this::fire, delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Scheduler stopped; no further ticks scheduled");
        }
    }

    private void fire() {
        Instant now;
        try {
            now = clock.instant();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Clock read failed; skipping this tick", e);
            scheduleIn(periodMillis);
            return;
        }
        Instant boundary = tickBoundary(now, periodMillis, earlyToleranceMillis);
        if (lastBoundary != null && !boundary.isAfter(lastBoundary)) {
            LOGGER.warning("Clock moved back to " + now + "; tick at " + lastBoundary + " already ran");
            scheduleAt(lastBoundary.plusMillis(periodMillis), now);
            return;
        }
        lastBoundary = boundary;
        try {
            tickExecutor.submit(() -> runTickSafely(boundary));
        } catch (RejectedExecutionException e) {
            LOGGER.fine("Scheduler stopped; dropping tick at " + boundary);
            return;
        }
        scheduleAt(boundary.plusMillis(periodMillis), now);
    }

    private void runTickSafely(Instant boundary) {
        try {
            runner.tick(boundary);
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Tick at " + boundary + " aborted", e);
        }
    }
}
