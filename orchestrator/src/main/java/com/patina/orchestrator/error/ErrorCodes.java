package com.patina.orchestrator.error;

import java.util.Set;

/**
 * Stable error codes, grouped by {@link com.patina.orchestrator.model.ErrorKind}.
 */
public final class ErrorCodes {

    private ErrorCodes() {}

    // CODE
    public static final String PLAN_INVALID    = "PLAN_INVALID";
    public static final String STATIC_REJECTED = "STATIC_REJECTED";
    public static final String SYNTAX_ERROR    = "SYNTAX_ERROR";
    public static final String RUNTIME_ERROR   = "RUNTIME_ERROR";
    public static final String BAD_RESULT      = "BAD_RESULT";

    // POLICY
    public static final String CAPABILITY_DENIED = "CAPABILITY_DENIED";
    public static final String WRITE_NOT_APPROVED = "WRITE_NOT_APPROVED";
    public static final String RATE_LIMITED      = "RATE_LIMITED";
    public static final String MANIFEST_MISSING  = "MANIFEST_MISSING";
    public static final String MANIFEST_INVALID  = "MANIFEST_INVALID";

    // BUDGET
    public static final String CPU_LIMIT        = "CPU_LIMIT";
    public static final String OP_LIMIT         = "OP_LIMIT";
    public static final String MEM_LIMIT        = "MEM_LIMIT";
    public static final String OUTPUT_LIMIT     = "OUTPUT_LIMIT";
    public static final String DEPTH_LIMIT      = "DEPTH_LIMIT";
    public static final String COLLECTION_LIMIT = "COLLECTION_LIMIT";
    public static final String TOOL_CALL_LIMIT  = "TOOL_CALL_LIMIT";
    public static final String RUN_LIMIT        = "RUN_LIMIT";

    // SANDBOX
    public static final String PROC_CRASH         = "PROC_CRASH";
    public static final String SPAWN_FAILED       = "SPAWN_FAILED";
    public static final String CANCELLED          = "CANCELLED";
    public static final String ENGINE_UNAVAILABLE = "ENGINE_UNAVAILABLE";

    // TOOL (upstream codes are passed through as-is)
    public static final String UNAVAILABLE      = "UNAVAILABLE";
    public static final String TIMEOUT          = "TIMEOUT";
    public static final String UNKNOWN_SERVER   = "UNKNOWN_SERVER";
    public static final String NOT_FOUND        = "NOT_FOUND";
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
    public static final String UNAUTHORIZED     = "UNAUTHORIZED";
    public static final String FORBIDDEN        = "FORBIDDEN";
    public static final String BAD_RESPONSE     = "BAD_RESPONSE";

    /** Upstream tool codes that are never retried, whatever the server claims. */
    public static final Set<String> NON_RETRIABLE_TOOL_CODES =
            Set.of(NOT_FOUND, INVALID_ARGUMENT, UNAUTHORIZED, FORBIDDEN);
}
