package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact record of one run, produced by the Reducer.
 *
 * {@code summary} is deterministic for identical plans and inputs; it never
 * contains timestamps, durations or cache provenance, so {@code summaryHash}
 * can be compared across runs.
 */
public record RunSummary(
        @JsonProperty("run_id")            String               runId,
        @JsonProperty("goal")              String               goal,
        @JsonProperty("status")            RunStatus            status,
        @JsonProperty("summary")           String               summary,
        @JsonProperty("summary_hash")      String               summaryHash,
        @JsonProperty("artifacts")         List<ArtifactHandle> artifacts,
        @JsonProperty("state")             Map<String, Object>  state,
        @JsonProperty("nodes")             List<NodeOutcome>    nodes,
        @JsonProperty("trace")             List<TraceEntry>     trace,
        @JsonProperty("terminating_error") OrchestratorError    terminatingError,
        @JsonProperty("plan_hashes")       List<String>         planHashes) {

    public RunSummary {
        artifacts   = artifacts == null ? List.of() : List.copyOf(artifacts);
        nodes       = nodes == null ? List.of() : List.copyOf(nodes);
        trace       = trace == null ? List.of() : List.copyOf(trace);
        planHashes  = planHashes == null ? List.of() : List.copyOf(planHashes);
        state       = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public NodeOutcome node(String nodeId) {
        return nodes.stream().filter(n -> n.nodeId().equals(nodeId)).findFirst().orElse(null);
    }
}
