package com.curation.integrity.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCheck(runId)) {
 *     log.info("check.completed name={} failures={}", name, count);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for one consistency checker run.
     */
    public static LogContext forCheck(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("checkRunId", runId);
        ctx.put("operation", "check");
        return ctx;
    }

    /**
     * Context for quality evaluation of one record.
     */
    public static LogContext forRecord(String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("recordId", recordId);
        ctx.put("operation", "quality");
        return ctx;
    }

    /**
     * Context for one status change of a record.
     */
    public static LogContext forTransition(String recordId, String from, String to) {
        LogContext ctx = new LogContext();
        ctx.put("recordId", recordId);
        ctx.put("fromStatus", from);
        ctx.put("toStatus", to);
        ctx.put("operation", "transition");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
