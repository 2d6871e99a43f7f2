package com.attribute.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tags every log line of one resolution invocation through the SLF4J MDC.
 * Closing the context restores the values the keys held before it was opened,
 * so contexts may nest.
 *
 * <pre>
 * try (LogContext ignored = LogContext.forResolution(id, "ROUTE", "entity")) {
 *     log.info("Resolved {} animals", count);
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String ATTRIBUTE = "attribute";
    public static final String OPERATION = "operation";

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * @param correlationId id shared by the invocation's log lines
     * @param attribute     attribute being resolved, e.g. ROUTE
     * @param level         "entity" or "group"
     */
    public static LogContext forResolution(String correlationId, String attribute, String level) {
        return new LogContext()
                .with(CORRELATION_ID, correlationId)
                .with(ATTRIBUTE, attribute)
                .with(OPERATION, "resolve-" + level);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
