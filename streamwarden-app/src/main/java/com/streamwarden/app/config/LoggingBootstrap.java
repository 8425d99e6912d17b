package com.streamwarden.app.config;

import com.streamwarden.common.config.WardenConfig;
import com.streamwarden.common.logging.LogLevel;
import com.streamwarden.common.logging.SubsystemLogger;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Applies the {@code logging} section of the config file: the level of the
 * {@code streamwarden} loggers and the subsystem filter.
 */
@Slf4j
@Component
public class LoggingBootstrap {

    static final String ROOT_LOGGER = "streamwarden";

    private final WardenConfig config;

    public LoggingBootstrap(WardenConfig config) {
        this.config = config;
    }

    @PostConstruct
    public void init() {
        WardenConfig.LoggingConfig logging = config.getLogging();
        LogLevel level = LogLevel.normalize(logging.getLevel(), LogLevel.INFO);
        LoggingSystem.get(getClass().getClassLoader())
                .setLogLevel(ROOT_LOGGER, toSpringLevel(level));

        List<String> subsystems = logging.getSubsystems();
        SubsystemLogger.setSubsystemFilter(subsystems == null ? new String[0] : subsystems.toArray(new String[0]));
        log.info("Logging level {} for {}, subsystems: {}", level, ROOT_LOGGER,
                subsystems == null || subsystems.isEmpty() ? "all" : subsystems);
    }

    static org.springframework.boot.logging.LogLevel toSpringLevel(LogLevel level) {
        return org.springframework.boot.logging.LogLevel.valueOf(level.name());
    }
}
