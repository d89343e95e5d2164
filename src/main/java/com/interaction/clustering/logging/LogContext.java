package com.interaction.clustering.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and, on close, restores whatever values they had before,
 * so a nested context never strips keys an enclosing one set.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forIteration(runId, 3, "merchant")) {
 *     log.info("propagation.phase.completed changed={}", changed);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context covering a whole clustering run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "cluster");
        return ctx;
    }

    /**
     * Creates a log context for one pipeline stage (ingest, seed, resolve, collect).
     */
    public static LogContext forStage(String runId, String stage) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for one half-phase of a propagation iteration.
     */
    public static LogContext forIteration(String runId, int iteration, String phase) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("stage", "propagate");
        ctx.put("iteration", Integer.toString(iteration));
        ctx.put("phase", phase);
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (Map.Entry<String, String> e : previous.entrySet()) {
            if (e.getValue() == null) {
                MDC.remove(e.getKey());
            } else {
                MDC.put(e.getKey(), e.getValue());
            }
        }
        previous.clear();
    }
}
