package com.streamwarden.app.config;

import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.infra.PeriodicTaskRunner;
import com.streamwarden.moderation.state.LinkPermits;
import com.streamwarden.moderation.state.MessageCache;
import com.streamwarden.moderation.state.WarningStateTracker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Periodically drops cached messages past their retention, warnings past
 * their window and expired link permits.
 */
@Slf4j
@Component
public class CleanupJobs {

    public record CleanupResult(int messages, int warnings, int permits) {
    }

    private final MessageCache messageCache;
    private final WarningStateTracker warnings;
    private final LinkPermits permits;
    private final Clock clock;
    private final Duration retention;
    private final ScheduledExecutorService scheduler;
    private final PeriodicTaskRunner runner;

    public CleanupJobs(WardenConfig config, MessageCache messageCache, WarningStateTracker warnings,
            LinkPermits permits, Clock clock) {
        this.messageCache = messageCache;
        this.warnings = warnings;
        this.permits = permits;
        this.clock = clock;
        this.retention = Duration.ofSeconds(Math.max(1, config.getModeration().getMessageRetentionSeconds()));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "streamwarden-cleanup");
            t.setDaemon(true);
            return t;
        });
        this.runner = new PeriodicTaskRunner("moderation-cleanup", scheduler,
                Duration.ofSeconds(config.getModeration().getCleanupIntervalSeconds()), this::cleanup);
    }

    @PostConstruct
    public void start() {
        runner.start();
    }

    @PreDestroy
    public void stop() {
        runner.stop();
        scheduler.shutdownNow();
    }

    public PeriodicTaskRunner runner() {
        return runner;
    }

    /**
     * One cleanup pass.
     */
    public CleanupResult cleanup() {
        Instant now = clock.instant();
        CleanupResult result = new CleanupResult(
                messageCache.prune(now.minus(retention)),
                warnings.prune(now),
                permits.prune(now));
        if (result.messages() + result.warnings() + result.permits() > 0) {
            log.debug("Cleanup removed {} messages, {} warnings, {} permits",
                    result.messages(), result.warnings(), result.permits());
        }
        return result;
    }
}
