package com.patina.orchestrator.planner;

import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.CapabilityRequest;
import com.patina.orchestrator.policy.PolicyDecision;
import com.patina.orchestrator.policy.PolicyGate;
import com.patina.orchestrator.policy.ToolPatterns;
import com.patina.orchestrator.sandbox.SandboxEngineRegistry;
import com.patina.orchestrator.tool.ToolServerRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Structural and feasibility checks on a candidate plan. Every failure is CODE/PLAN_INVALID.
 */
@Component
public class PlanValidator {

    private final PolicyGate            policyGate;
    private final ToolServerRegistry    servers;
    private final SandboxEngineRegistry engines;

    public PlanValidator(PolicyGate policyGate, ToolServerRegistry servers, SandboxEngineRegistry engines) {
        this.policyGate = policyGate;
        this.servers    = servers;
        this.engines    = engines;
    }

    /**
     * Ids unique, dependencies known (in the plan or among {@code satisfied}),
     * no cycles, at most {@code maxNodes} nodes.
     */
    public void validateStructure(List<NodeSpec> nodes, Set<String> satisfied, int maxNodes) {
        if (nodes.isEmpty()) {
            throw OrchestratorException.planInvalid("plan has no nodes");
        }
        if (nodes.size() > maxNodes) {
            throw OrchestratorException.planInvalid(
                    "plan has " + nodes.size() + " nodes, limit is " + maxNodes);
        }
        Set<String> ids = new HashSet<>();
        for (NodeSpec node : nodes) {
            if (!ids.add(node.id())) {
                throw OrchestratorException.planInvalid("duplicate node id '" + node.id() + "'");
            }
            if (satisfied.contains(node.id())) {
                throw OrchestratorException.planInvalid("node id '" + node.id() + "' is already used in this run");
            }
        }
        for (NodeSpec node : nodes) {
            for (String dep : node.dependsOn()) {
                if (!ids.contains(dep) && !satisfied.contains(dep)) {
                    throw OrchestratorException.planInvalid(
                            "node '" + node.id() + "' depends on unknown node '" + dep + "'");
                }
            }
        }
        topologicalOrder(nodes, satisfied);
    }

    /**
     * Every tool a WORK node may call must be allowed by the manifest, not
     * disallowed by the caller, served by a registered server and exposable
     * by the node's engine.
     */
    public void validateFeasibility(List<NodeSpec> nodes, CapabilityManifest manifest,
                                    Collection<String> disallowedTools) {
        for (NodeSpec node : nodes) {
            if (node.isApproval()) {
                continue;
            }
            if (engines.find(node.unit().engine()).isEmpty()) {
                throw OrchestratorException.planInvalid(
                        "node '" + node.id() + "' needs the unavailable " + node.unit().engine() + " engine");
            }
            for (String tool : node.unit().allowedTools()) {
                if (ToolPatterns.matchesAny(disallowedTools, tool)) {
                    throw OrchestratorException.planInvalid(
                            "node '" + node.id() + "' uses disallowed tool " + tool);
                }
                PolicyDecision decision = policyGate.decide(CapabilityRequest.staticCheck(tool), manifest, null);
                if (!decision.allowed()) {
                    throw OrchestratorException.planInvalid(
                            "node '" + node.id() + "' needs " + tool + ": " + decision.reason());
                }
                if (!servers.isReachable(tool)) {
                    throw OrchestratorException.planInvalid(
                            "node '" + node.id() + "' needs " + tool + ", which no tool server provides");
                }
                if (!engines.canExpose(node.unit().engine(), tool)) {
                    throw OrchestratorException.planInvalid(
                            node.unit().engine() + " engine cannot expose " + tool + " to node '" + node.id() + "'");
                }
            }
        }
    }

    /**
     * Kahn's algorithm with ties broken by ascending id. Dependencies in
     * {@code satisfied} count as already done.
     *
     * @throws OrchestratorException CODE/PLAN_INVALID on a cycle
     */
    public static List<String> topologicalOrder(Collection<NodeSpec> nodes, Set<String> satisfied) {
        Map<String, List<String>> dependsOn = new LinkedHashMap<>();
        for (NodeSpec node : nodes) {
            dependsOn.put(node.id(), node.dependsOn());
        }
        return topologicalOrder(dependsOn, satisfied);
    }

    /** Same ordering over a plain id to dependency-ids map. */
    static List<String> topologicalOrder(Map<String, List<String>> dependsOn, Set<String> satisfied) {
        Map<String, Integer> indegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        dependsOn.forEach((id, deps) -> {
            indegree.putIfAbsent(id, 0);
            for (String dep : deps) {
                if (satisfied.contains(dep)) {
                    continue;
                }
                indegree.merge(id, 1, Integer::sum);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(id);
            }
        });
        PriorityQueue<String> ready = new PriorityQueue<>();
        indegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : dependents.getOrDefault(id, List.of())) {
                if (indegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (order.size() != indegree.size()) {
            List<String> stuck = indegree.keySet().stream().filter(id -> !order.contains(id)).sorted().toList();
            throw OrchestratorException.planInvalid("dependency cycle among " + stuck);
        }
        return order;
    }
}
