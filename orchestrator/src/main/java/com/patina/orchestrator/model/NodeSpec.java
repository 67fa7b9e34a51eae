package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One node of a Plan.
 *
 * @param id          unique within the run (re-planned nodes get fresh ids)
 * @param dependsOn   ids this node waits for, in declaration order
 * @param kind        WORK or APPROVAL
 * @param unit        the work to run; null for APPROVAL nodes
 * @param budget      per-node budget (mirrors {@code unit.budget()} for WORK nodes)
 * @param idempotent  safe to run twice; enables exactly one automatic retry
 * @param mutating    the node's state_updates write external state, so it is gated by approval
 * @param description short operator-facing description
 */
public record NodeSpec(
        @JsonProperty("id")          String        id,
        @JsonProperty("depends_on")  List<String>  dependsOn,
        @JsonProperty("kind")        NodeKind      kind,
        @JsonProperty("unit")        ExecutionUnit unit,
        @JsonProperty("budget")      Budget        budget,
        @JsonProperty("idempotent")  boolean       idempotent,
        @JsonProperty("mutating")    boolean       mutating,
        @JsonProperty("description") String        description) {

    public NodeSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("node id is required");
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        if (kind == NodeKind.WORK && unit == null) {
            throw new IllegalArgumentException("WORK node '" + id + "' needs an execution unit");
        }
        if (budget == null) {
            budget = unit != null ? unit.budget() : Budget.defaults();
        }
    }

    public static NodeSpec work(String id, List<String> dependsOn, ExecutionUnit unit,
                                boolean idempotent, boolean mutating, String description) {
        return new NodeSpec(id, dependsOn, NodeKind.WORK, unit, unit.budget(),
                idempotent, mutating, description);
    }

    public static NodeSpec approval(String id, List<String> dependsOn, String description) {
        return new NodeSpec(id, dependsOn, NodeKind.APPROVAL, null, Budget.defaults(),
                false, false, description);
    }

    @JsonIgnore
    public boolean isApproval() {
        return kind == NodeKind.APPROVAL;
    }

    public NodeSpec withDependsOn(List<String> deps) {
        return new NodeSpec(id, deps, kind, unit, budget, idempotent, mutating, description);
    }

    public NodeSpec withUnit(ExecutionUnit newUnit) {
        return new NodeSpec(id, dependsOn, kind, newUnit, newUnit.budget(), idempotent, mutating, description);
    }
}
