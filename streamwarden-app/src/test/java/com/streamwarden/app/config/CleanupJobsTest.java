package com.streamwarden.app.config;

import com.streamwarden.app.WardenFixture;
import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.moderation.ChatMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.streamwarden.app.WardenFixture.CHANNEL;
import static org.junit.jupiter.api.Assertions.*;

class CleanupJobsTest {

    private WardenFixture fx;
    private CleanupJobs jobs;

    @BeforeEach
    void setUp() {
        fx = new WardenFixture();
        WardenConfig config = new WardenConfig();
        WardenConfig.ModerationConfig moderation = new WardenConfig.ModerationConfig();
        moderation.setMessageRetentionSeconds(60);
        moderation.setCleanupIntervalSeconds(300);
        config.setModeration(moderation);
        jobs = new CleanupJobs(config, fx.messageCache, fx.warnings, fx.permits, fx.clock);
    }

    @AfterEach
    void tearDown() {
        jobs.stop();
    }

    @Test
    void cleanup_dropsOnlyExpiredState() {
        fx.messageCache.record(ChatMessage.of(CHANNEL, "1", "one", "old"), fx.clock.instant());
        fx.warnings.escalate(CHANNEL, "1", Duration.ofSeconds(30), fx.clock.instant());
        fx.warnings.escalate(CHANNEL, "2", Duration.ofHours(1), fx.clock.instant());
        fx.permits.grant(CHANNEL, "1", Duration.ofSeconds(30), fx.clock.instant());

        fx.clock.advance(Duration.ofSeconds(45));
        fx.messageCache.record(ChatMessage.of(CHANNEL, "2", "two", "new"), fx.clock.instant());
        fx.clock.advance(Duration.ofSeconds(30));

        CleanupJobs.CleanupResult result = jobs.cleanup();

        assertEquals(new CleanupJobs.CleanupResult(1, 1, 1), result);
        assertEquals(1, fx.messageCache.size(CHANNEL));
        assertTrue(fx.warnings.lastWarningAt(CHANNEL, "2").isPresent());
    }

    @Test
    void cleanup_nothingToDo() {
        assertEquals(new CleanupJobs.CleanupResult(0, 0, 0), jobs.cleanup());
    }

    @Test
    void startStop_controlsRunner() {
        jobs.start();
        assertTrue(jobs.runner().isRunning());
        assertEquals(300_000, jobs.runner().getIntervalMs());

        jobs.stop();
        assertFalse(jobs.runner().isRunning());
    }

    @Test
    void runOnce_reportsSuccess() {
        assertTrue(jobs.runner().runOnce().ok());
        assertEquals(1, jobs.runner().getRunCount());
    }
}
