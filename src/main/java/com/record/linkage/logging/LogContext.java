package com.record.linkage.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forPass(runId, "3")) {
 *     log.info("pass.completed pass={} rows={}", passName, rows);
 * } // MDC entries are automatically cleared
 * </pre>
 *
 * <p>MDC is thread-local: worker threads do not see the coordinator's entries.</p>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole matching run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "match");
        return ctx;
    }

    /**
     * Creates a log context for one blocking pass.
     */
    public static LogContext forPass(String runId, String passName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("pass", passName);
        ctx.put("operation", "block");
        return ctx;
    }

    /**
     * Creates a log context for scoring one chunk on a worker thread.
     */
    public static LogContext forChunk(String passName, int sequence) {
        LogContext ctx = new LogContext();
        ctx.put("pass", passName);
        ctx.put("chunk", Integer.toString(sequence));
        ctx.put("operation", "score");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
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
