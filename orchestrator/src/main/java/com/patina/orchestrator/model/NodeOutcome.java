package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Terminal (or current) result of one node inside a run.
 *
 * @param completionSeq order in which the node reached a terminal state (0 while not terminal)
 */
public record NodeOutcome(
        @JsonProperty("node_id")        String            nodeId,
        @JsonProperty("plan_id")        String            planId,
        @JsonProperty("state")          NodeState         state,
        @JsonProperty("envelope")       ResultEnvelope    envelope,
        @JsonProperty("error")          OrchestratorError error,
        @JsonProperty("attempts")       int               attempts,
        @JsonProperty("from_cache")     boolean           fromCache,
        @JsonProperty("started_at")     Instant           startedAt,
        @JsonProperty("finished_at")    Instant           finishedAt,
        @JsonProperty("completion_seq") long              completionSeq) {

    public static NodeOutcome pending(String nodeId, String planId) {
        return new NodeOutcome(nodeId, planId, NodeState.PENDING, null, null, 0, false, null, null, 0);
    }

    public NodeOutcome withState(NodeState newState) {
        return new NodeOutcome(nodeId, planId, newState, envelope, error, attempts, fromCache,
                startedAt, finishedAt, completionSeq);
    }
}
