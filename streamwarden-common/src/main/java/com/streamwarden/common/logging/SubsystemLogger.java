package com.streamwarden.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * SLF4J wrapper that tags every line with a subsystem path and, optionally, the
 * channel it concerns.
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("moderation");
 * log.forChannel("1234").info("Timed out user", Map.of("user", "42", "seconds", 600));
 * </pre>
 *
 * The SLF4J logger name is {@code streamwarden.<subsystem>} with slashes turned
 * into dots, so levels can be tuned per subsystem in logback.xml.
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";
    static final String MDC_CHANNEL = "channel";
    private static final List<String> subsystemFilters = new CopyOnWriteArrayList<>();

    private final String subsystem;
    private final String channelId;
    private final Logger logger;

    private SubsystemLogger(String subsystem, String channelId) {
        this.subsystem = subsystem;
        this.channelId = channelId;
        this.logger = LoggerFactory.getLogger("streamwarden." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem, null);
    }

    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name, channelId);
    }

    /**
     * Same subsystem, bound to one channel.
     */
    public SubsystemLogger forChannel(String channelId) {
        return new SubsystemLogger(subsystem, channelId);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    public void trace(String message) {
        emit(LogLevel.TRACE, message, null, null);
    }

    public void debug(String message) {
        emit(LogLevel.DEBUG, message, null, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta, null);
    }

    public void info(String message) {
        emit(LogLevel.INFO, message, null, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta, null);
    }

    public void warn(String message) {
        emit(LogLevel.WARN, message, null, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta, null);
    }

    public void error(String message, Throwable t) {
        emit(LogLevel.ERROR, message, null, t);
    }

    public void error(String message, Map<String, Object> meta, Throwable t) {
        emit(LogLevel.ERROR, message, meta, t);
    }

    // -----------------------------------------------------------------------
    // Subsystem filter
    // -----------------------------------------------------------------------

    /**
     * Only subsystems matching one of the prefixes will log. Null or empty clears
     * the filter.
     */
    public static void setSubsystemFilter(String... filters) {
        subsystemFilters.clear();
        if (filters != null) {
            Arrays.stream(filters)
                    .filter(s -> s != null)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(subsystemFilters::add);
        }
    }

    public boolean shouldLog() {
        if (subsystemFilters.isEmpty()) {
            return true;
        }
        return subsystemFilters.stream().anyMatch(
                prefix -> subsystem.equals(prefix) || subsystem.startsWith(prefix + "/"));
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    private void emit(LogLevel level, String message, Map<String, Object> meta, Throwable t) {
        if (!shouldLog())
            return;
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            if (channelId != null) {
                MDC.put(MDC_CHANNEL, channelId);
            }
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted, t);
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
            MDC.remove(MDC_CHANNEL);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem);
        if (channelId != null) {
            sb.append(" #").append(channelId);
        }
        sb.append("] ").append(message);
        if (meta != null && !meta.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (var entry : meta.entrySet()) {
                if (!first)
                    sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
            sb.append("}");
        }
        return sb.toString();
    }
}
