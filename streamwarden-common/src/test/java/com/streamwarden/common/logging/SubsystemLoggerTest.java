package com.streamwarden.common.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    @AfterEach
    void clearFilter() {
        SubsystemLogger.setSubsystemFilter();
    }

    @Test
    void child_extendsSubsystemPathAndLoggerName() {
        SubsystemLogger log = SubsystemLogger.create("moderation").child("engine");
        assertEquals("moderation/engine", log.getSubsystem());
        assertEquals("streamwarden.moderation.engine", log.getSlf4jLogger().getName());
    }

    @Test
    void formatMessage_includesChannelAndMeta() {
        SubsystemLogger log = SubsystemLogger.create("moderation").forChannel("1234");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("user", "42");
        meta.put("seconds", 600);

        assertEquals("[moderation #1234] Timed out {user=42, seconds=600}",
                log.formatMessage("Timed out", meta));
        assertEquals("[moderation #1234] plain", log.formatMessage("plain", null));
    }

    @Test
    void subsystemFilter_matchesPrefixes() {
        SubsystemLogger.setSubsystemFilter("permission", " ");
        assertTrue(SubsystemLogger.create("permission").shouldLog());
        assertTrue(SubsystemLogger.create("permission/resolver").shouldLog());
        assertFalse(SubsystemLogger.create("permissions").shouldLog());
        assertFalse(SubsystemLogger.create("moderation").shouldLog());
    }

    @Test
    void emptyFilter_logsEverything() {
        SubsystemLogger.setSubsystemFilter((String[]) null);
        assertTrue(SubsystemLogger.create("anything").shouldLog());
        SubsystemLogger.create("anything").info("still works", Map.of("k", "v"));
    }

    @Test
    void logLevel_normalizeAndOrdering() {
        assertEquals(LogLevel.WARN, LogLevel.normalize("Warning"));
        assertEquals(LogLevel.OFF, LogLevel.normalize("silent"));
        assertEquals(LogLevel.INFO, LogLevel.normalize("bogus"));
        assertEquals(LogLevel.DEBUG, LogLevel.normalize(null, LogLevel.DEBUG));

        assertTrue(LogLevel.ERROR.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.DEBUG.isEnabledFor(LogLevel.INFO));
        assertFalse(LogLevel.ERROR.isEnabledFor(LogLevel.OFF));
    }
}
