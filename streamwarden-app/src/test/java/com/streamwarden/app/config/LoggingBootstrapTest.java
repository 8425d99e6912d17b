package com.streamwarden.app.config;

import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.logging.LogLevel;
import com.streamwarden.common.logging.SubsystemLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LoggingSystem;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingBootstrapTest {

    @AfterEach
    void reset() {
        SubsystemLogger.setSubsystemFilter();
        LoggingSystem.get(getClass().getClassLoader())
                .setLogLevel(LoggingBootstrap.ROOT_LOGGER, org.springframework.boot.logging.LogLevel.DEBUG);
    }

    private static WardenConfig config(String level, List<String> subsystems) {
        WardenConfig config = new WardenConfig();
        WardenConfig.LoggingConfig logging = new WardenConfig.LoggingConfig();
        logging.setLevel(level);
        logging.setSubsystems(subsystems);
        config.setLogging(logging);
        return config;
    }

    @Test
    void init_appliesLevelToStreamwardenLoggers() {
        new LoggingBootstrap(config("warning", null)).init();

        assertTrue(LoggerFactory.getLogger("streamwarden.moderation.engine").isWarnEnabled());
        assertFalse(LoggerFactory.getLogger("streamwarden.moderation.engine").isInfoEnabled());
    }

    @Test
    void init_appliesSubsystemFilter() {
        new LoggingBootstrap(config("debug", List.of("moderation"))).init();

        assertTrue(SubsystemLogger.create("moderation/engine").shouldLog());
        assertFalse(SubsystemLogger.create("permission/resolver").shouldLog());
    }

    @Test
    void init_unknownLevel_fallsBackToInfo() {
        new LoggingBootstrap(config("loud", List.of())).init();

        assertTrue(LoggerFactory.getLogger("streamwarden.permission").isInfoEnabled());
        assertFalse(LoggerFactory.getLogger("streamwarden.permission").isDebugEnabled());
        assertTrue(SubsystemLogger.create("permission/resolver").shouldLog());
    }

    @ParameterizedTest
    @EnumSource(LogLevel.class)
    void everyLevel_mapsToSpringLevel(LogLevel level) {
        assertEquals(level.name(), LoggingBootstrap.toSpringLevel(level).name());
    }
}
