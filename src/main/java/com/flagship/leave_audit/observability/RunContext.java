package com.flagship.leave_audit.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Run id propagation for log lines.
 *
 * Each audit run gets a short id placed in the MDC under {@link #RUN_ID_MDC_KEY}, so
 * every log statement of the run can be tied together.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";

    private RunContext() {
        // Utility class
    }

    /**
     * Starts a run: generates a run id and puts it in the MDC.
     */
    public static String start() {
        String runId = generateRunId();
        MDC.put(RUN_ID_MDC_KEY, runId);
        return runId;
    }

    public static String getRunId() {
        return MDC.get(RUN_ID_MDC_KEY);
    }

    /**
     * Removes the run id. Call when the run ends, successfully or not.
     */
    public static void clear() {
        MDC.remove(RUN_ID_MDC_KEY);
    }

    /**
     * Uses a shorter format for readability in logs.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
