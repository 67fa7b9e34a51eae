package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource usage reported by an engine for one execution.
 * operationCount counts host-boundary operations (tool calls and log calls);
 * the interpreter's statement counter itself is only observable as a limit.
 */
public record ExecutionMetrics(
        @JsonProperty("cpu_ms")          long cpuMs,
        @JsonProperty("mem_mb")          long memMb,
        @JsonProperty("operation_count") long operationCount,
        @JsonProperty("tool_call_count") int  toolCallCount) {

    public static final ExecutionMetrics ZERO = new ExecutionMetrics(0, 0, 0, 0);
}
