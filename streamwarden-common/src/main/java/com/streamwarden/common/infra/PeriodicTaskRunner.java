package com.streamwarden.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a named maintenance task at a fixed delay. A failing run is logged and
 * does not cancel later runs.
 */
public class PeriodicTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(PeriodicTaskRunner.class);

    private static final long MIN_INTERVAL_MS = 1_000;

    // ── Result type ─────────────────────────────────────────────────────

    public record RunResult(String status, String reason, long durationMs) {
        public static RunResult ran(long durationMs) {
            return new RunResult("ran", null, durationMs);
        }

        public static RunResult failed(String reason, long durationMs) {
            return new RunResult("failed", reason, durationMs);
        }

        public boolean ok() {
            return "ran".equals(status);
        }
    }

    // ── Fields ──────────────────────────────────────────────────────────

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Runnable task;
    private final long intervalMs;
    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicReference<ScheduledFuture<?>> scheduledTask = new AtomicReference<>();

    public PeriodicTaskRunner(String name, ScheduledExecutorService scheduler,
            Duration interval, Runnable task) {
        this.name = name;
        this.scheduler = scheduler;
        this.task = task;
        this.intervalMs = Math.max(MIN_INTERVAL_MS, interval.toMillis());
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    public void start() {
        stop();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                this::runOnce,
                intervalMs,
                intervalMs,
                TimeUnit.MILLISECONDS);
        scheduledTask.set(future);
        log.info("Task '{}' started with interval {}ms", name, intervalMs);
    }

    public void stop() {
        ScheduledFuture<?> future = scheduledTask.getAndSet(null);
        if (future != null) {
            future.cancel(false);
            log.info("Task '{}' stopped", name);
        }
    }

    public boolean isRunning() {
        return scheduledTask.get() != null;
    }

    /**
     * Run the task once on the calling thread.
     */
    public RunResult runOnce() {
        long startedAt = System.currentTimeMillis();
        try {
            task.run();
            runCount.incrementAndGet();
            long duration = System.currentTimeMillis() - startedAt;
            log.debug("Task '{}' completed in {}ms", name, duration);
            return RunResult.ran(duration);
        } catch (RuntimeException e) {
            failureCount.incrementAndGet();
            long duration = System.currentTimeMillis() - startedAt;
            log.warn("Task '{}' failed after {}ms: {}", name, duration, e.getMessage(), e);
            return RunResult.failed(e.getMessage(), duration);
        }
    }

    public String getName() {
        return name;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    public long getRunCount() {
        return runCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }
}
