package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable DAG of NodeSpecs produced by the planner.
 *
 * A re-plan never mutates a Plan: it produces a successor whose
 * {@code supersedes} names this plan and whose {@code supersededBy} maps
 * the failed node id to the ids that replace it. Nodes of the successor may
 * depend on ids in {@code carriedOver}, i.e. nodes that already SUCCEEDED
 * under an earlier plan of the same run.
 *
 * @param planHash SHA-256 of the canonical serialization of all NodeSpecs, sorted by id
 */
public record Plan(
        @JsonProperty("plan_id")       String                    planId,
        @JsonProperty("goal")          String                    goal,
        @JsonProperty("nodes")         List<NodeSpec>            nodes,
        @JsonProperty("plan_hash")     String                    planHash,
        @JsonProperty("carried_over")  Set<String>               carriedOver,
        @JsonProperty("supersedes")    String                    supersedes,
        @JsonProperty("superseded_by") Map<String, List<String>> supersededBy) {

    public Plan {
        nodes        = List.copyOf(nodes);
        carriedOver  = carriedOver == null ? Set.of() : Set.copyOf(carriedOver);
        supersededBy = supersededBy == null ? Map.of() : Map.copyOf(supersededBy);
    }

    public Optional<NodeSpec> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    @JsonIgnore
    public boolean isReplan() {
        return supersedes != null;
    }
}
