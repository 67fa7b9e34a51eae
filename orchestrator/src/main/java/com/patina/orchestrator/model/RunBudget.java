package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run-level limits checked by the executor before every dispatch.
 *
 * @param maxNodes       node executions allowed (retries and approvals excluded)
 * @param wallClockMs    total run duration
 * @param maxToolCalls   tool invocations across all nodes
 * @param maxConcurrency nodes in flight at the same time
 */
public record RunBudget(
        @JsonProperty("max_nodes")       int  maxNodes,
        @JsonProperty("wall_clock_ms")   long wallClockMs,
        @JsonProperty("max_tool_calls")  int  maxToolCalls,
        @JsonProperty("max_concurrency") int  maxConcurrency) {

    public RunBudget {
        if (maxNodes <= 0 || wallClockMs <= 0 || maxToolCalls < 0 || maxConcurrency <= 0) {
            throw new IllegalArgumentException("run budget limits must be positive");
        }
    }

    public static RunBudget defaults() {
        return new RunBudget(32, 120_000, 64, 4);
    }
}
