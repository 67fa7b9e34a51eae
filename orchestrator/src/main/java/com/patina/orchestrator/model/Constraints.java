package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Explicit constraints a caller attaches to a goal.
 *
 * @param budget          ceiling for every node budget
 * @param runBudget       run-level limits
 * @param disallowedTools tool URI patterns the plan must not use, on top of the manifest
 * @param maxNodes        node count ceiling for the plan, approval nodes included
 * @param draft           optional pre-structured plan; when present the planner
 *                        shapes and validates it instead of asking the completion client
 */
public record Constraints(
        @JsonProperty("budget")           Budget       budget,
        @JsonProperty("run_budget")       RunBudget    runBudget,
        @JsonProperty("disallowed_tools") List<String> disallowedTools,
        @JsonProperty("max_nodes")        int          maxNodes,
        @JsonProperty("draft")            PlanDraft    draft) {

    public Constraints {
        budget          = budget == null ? Budget.defaults() : budget;
        runBudget       = runBudget == null ? RunBudget.defaults() : runBudget;
        disallowedTools = disallowedTools == null ? List.of() : List.copyOf(disallowedTools);
        maxNodes        = maxNodes <= 0 ? runBudget.maxNodes() : maxNodes;
    }

    public static Constraints defaults() {
        return new Constraints(null, null, null, 0, null);
    }

    public static Constraints withDraft(PlanDraft draft) {
        return new Constraints(null, null, null, 0, draft);
    }

    public Constraints withRunBudget(RunBudget newRunBudget) {
        return new Constraints(budget, newRunBudget, disallowedTools, maxNodes, draft);
    }
}
