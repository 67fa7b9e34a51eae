package com.patina.orchestrator.logging;

import org.slf4j.MDC;

/**
 * MDC keys carried by every log line of a run: {@code runId}, {@code nodeId}, {@code attempt}.
 * Both the plain-text (dev) and JSON (prod) layouts print them.
 */
public final class MdcContext {

    public static final String RUN_ID  = "runId";
    public static final String NODE_ID = "nodeId";
    public static final String ATTEMPT = "attempt";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setNode(String runId, String nodeId, int attempt) {
        MDC.put(RUN_ID, runId);
        MDC.put(NODE_ID, nodeId);
        MDC.put(ATTEMPT, String.valueOf(attempt));
    }

    public static void clearNode() {
        MDC.remove(NODE_ID);
        MDC.remove(ATTEMPT);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(NODE_ID);
        MDC.remove(ATTEMPT);
    }
}
