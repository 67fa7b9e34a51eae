package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The sole return type of a sandbox engine.
 *
 * Serialized size never exceeds the unit's {@code maxOutputBytes}; the
 * EnvelopeSizer moves oversized summaries and state values into the
 * artifact store before an envelope leaves the engine.
 */
public record ResultEnvelope(
        @JsonProperty("summary")       String              summary,
        @JsonProperty("artifacts")     List<ArtifactHandle> artifacts,
        @JsonProperty("state_updates") Map<String, Object> stateUpdates,
        @JsonProperty("metrics")       ExecutionMetrics    metrics) {

    public ResultEnvelope {
        summary      = summary == null ? "" : summary;
        artifacts    = artifacts == null ? List.of() : List.copyOf(artifacts);
        stateUpdates = stateUpdates == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(stateUpdates));
        metrics      = metrics == null ? ExecutionMetrics.ZERO : metrics;
    }

    public static ResultEnvelope of(String summary) {
        return new ResultEnvelope(summary, List.of(), Map.of(), ExecutionMetrics.ZERO);
    }
}
