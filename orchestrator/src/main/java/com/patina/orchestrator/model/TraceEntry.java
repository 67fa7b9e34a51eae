package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the run trace. Errors are recorded verbatim (already redacted).
 */
public record TraceEntry(
        @JsonProperty("seq")     long              seq,
        @JsonProperty("at")      Instant           at,
        @JsonProperty("plan_id") String            planId,
        @JsonProperty("node_id") String            nodeId,
        @JsonProperty("event")   Event             event,
        @JsonProperty("detail")  String            detail,
        @JsonProperty("error")   OrchestratorError error) {

    public enum Event {
        PLANNED,
        DISPATCHED,
        CACHE_HIT,
        AWAITING_APPROVAL,
        SUCCEEDED,
        FAILED,
        RETRYING,
        SKIPPED,
        REPLANNED,
        RUN_ABORTED,
        CANCELLED
    }
}
