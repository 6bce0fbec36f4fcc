package com.relationship.scoring.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Keys are removed on close; keys set by an enclosing context are restored.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forAssessment(correlationId, recordId)) {
 *     log.info("assessment.completed recordId={} stage={}", recordId, stage);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previousValues = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a single-record assessment.
     */
    public static LogContext forAssessment(String correlationId, String recordId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("recordId", recordId);
        ctx.put("operation", "assess");
        return ctx;
    }

    /**
     * Context for a batch of assessments.
     */
    public static LogContext forBatch(String batchId, int size) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("batchSize", Integer.toString(size));
        ctx.put("operation", "batch");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        previousValues.add(MDC.get(key));
        MDC.put(key, value != null ? value : "");
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String previous = previousValues.get(i);
            if (previous != null) {
                MDC.put(keys.get(i), previous);
            } else {
                MDC.remove(keys.get(i));
            }
        }
        keys.clear();
        previousValues.clear();
    }
}
