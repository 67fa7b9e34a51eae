package com.patina.orchestrator.planner;

import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.PlanDraft;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a draft into NodeSpecs.
 *
 * <ul>
 *   <li>Linear chains of pure transform steps (no tools, no writes) become one
 *       SCRIPT node that keeps the last step's id.</li>
 *   <li>Every mutating step gets an {@code approve-<id>} APPROVAL node in front of it.</li>
 *   <li>Budgets are clamped to the ceiling.</li>
 * </ul>
 */
final class PlanShaper {

    static final String APPROVAL_PREFIX = "approve-";

    private PlanShaper() {}

    static List<NodeSpec> shape(PlanDraft draft, Budget ceiling) {
        if (draft == null || draft.steps().isEmpty()) {
            throw OrchestratorException.planInvalid("plan draft has no steps");
        }
        for (PlanDraft.Step step : draft.steps()) {
            if (step.id() == null || step.id().isBlank()) {
                throw OrchestratorException.planInvalid("every step needs an id");
            }
            if (!step.isToolCall() && (step.code() == null || step.code().isBlank())) {
                throw OrchestratorException.planInvalid("step '" + step.id() + "' has neither code nor tool");
            }
        }

        rejectCycles(draft.steps());

        List<NodeSpec> nodes = new ArrayList<>();
        for (PlanDraft.Step step : fuse(draft.steps())) {
            Budget budget = (step.budget() == null ? ceiling : step.budget()).clampTo(ceiling);
            ExecutionUnit unit = step.isToolCall()
                    ? ExecutionUnit.toolCall(step.tool(), step.args(), step.stateKey(), budget)
                    : ExecutionUnit.script(step.code(), step.params(), step.tools(), budget);
            List<String> deps = new ArrayList<>(step.dependsOn());
            if (step.mutating()) {
                String approvalId = APPROVAL_PREFIX + step.id();
                nodes.add(NodeSpec.approval(approvalId, step.dependsOn(),
                        "approve writes of " + step.id()));
                deps.add(approvalId);
            }
            nodes.add(NodeSpec.work(step.id(), deps, unit, step.idempotent(), step.mutating(),
                    step.description()));
        }
        return nodes;
    }

    /** Fusion would swallow a cycle of pure steps, so cycles are caught on the raw draft. */
    private static void rejectCycles(List<PlanDraft.Step> steps) {
        Set<String> ids = new HashSet<>();
        steps.forEach(step -> ids.add(step.id()));
        Map<String, List<String>> dependsOn = new LinkedHashMap<>();
        for (PlanDraft.Step step : steps) {
            dependsOn.put(step.id(), step.dependsOn().stream().filter(ids::contains).toList());
        }
        PlanValidator.topologicalOrder(dependsOn, Set.of());
    }

    // ------------------------------------------------------------------
    // Fusion of pure transform chains
    // ------------------------------------------------------------------

    static List<PlanDraft.Step> fuse(List<PlanDraft.Step> steps) {
        Map<String, PlanDraft.Step> byId = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (PlanDraft.Step step : steps) {
            byId.put(step.id(), step);
            for (String dep : step.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(step.id());
            }
        }

        // successor.get(a) == b when a -> b is a fusable link
        Map<String, String> successor = new HashMap<>();
        Map<String, String> predecessor = new HashMap<>();
        for (PlanDraft.Step step : steps) {
            if (!step.isPureTransform() || step.dependsOn().size() != 1) {
                continue;
            }
            PlanDraft.Step prev = byId.get(step.dependsOn().get(0));
            if (prev != null && prev.isPureTransform()
                    && dependents.getOrDefault(prev.id(), List.of()).size() == 1) {
                successor.put(prev.id(), step.id());
                predecessor.put(step.id(), prev.id());
            }
        }
        if (successor.isEmpty()) {
            return steps;
        }

        List<PlanDraft.Step> out = new ArrayList<>();
        for (PlanDraft.Step step : steps) {
            if (predecessor.containsKey(step.id())) {
                continue;
            }
            if (!successor.containsKey(step.id())) {
                out.add(step);
                continue;
            }
            List<PlanDraft.Step> chain = new ArrayList<>();
            for (String id = step.id(); id != null; id = successor.get(id)) {
                chain.add(byId.get(id));
            }
            out.add(fuseChain(chain));
        }
        return out;
    }

    private static PlanDraft.Step fuseChain(List<PlanDraft.Step> chain) {
        PlanDraft.Step first = chain.get(0);
        PlanDraft.Step last  = chain.get(chain.size() - 1);
        Map<String, Object> params = new LinkedHashMap<>();
        StringBuilder code = new StringBuilder("""
                const __norm = (r) => (r === undefined || r === null) ? { summary: '' }
                    : (typeof r === 'string' ? { summary: r } : r);
                const __deps = Object.assign({}, input.deps);
                const __out = { summary: '', state_updates: {}, artifacts: [] };
                """);
        for (PlanDraft.Step step : chain) {
            params.put(step.id(), step.params());
            String key = jsString(step.id());
            code.append("{\n")
                .append("  const __r = __norm((function (input, tools, log) {\n")
                .append(step.code())
                .append("\n  })({ params: input.params[").append(key).append("] || {}, deps: __deps }, tools, log));\n")
                .append("  __deps[").append(key).append("] = { summary: __r.summary || '', state_updates: __r.state_updates || {} };\n")
                .append("  Object.assign(__out.state_updates, __r.state_updates || {});\n")
                .append("  __out.artifacts = __out.artifacts.concat(__r.artifacts || []);\n")
                .append("  __out.summary = __r.summary || '';\n")
                .append("}\n");
        }
        code.append("return __out;");
        String description = "fused " + String.join(" > ", chain.stream().map(PlanDraft.Step::id).toList());
        boolean idempotent = chain.stream().allMatch(PlanDraft.Step::idempotent);
        return new PlanDraft.Step(last.id(), description, first.dependsOn(), code.toString(), null, null, null,
                params, List.of(), idempotent, false, first.budget() != null ? first.budget() : last.budget());
    }

    private static String jsString(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
