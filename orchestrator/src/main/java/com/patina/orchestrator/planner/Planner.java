package com.patina.orchestrator.planner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.cache.ContentHasher;
import com.patina.orchestrator.claude.CompletionClient;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.Constraints;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.PlanDraft;
import com.patina.orchestrator.policy.CapabilityManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns a goal into a validated {@link Plan}.
 *
 * Drafting is either skipped (the caller supplied a {@link PlanDraft}) or
 * delegated to the {@link CompletionClient}. Shaping and validation are the
 * same for both paths:
 * <ol>
 *   <li>fuse linear chains of pure transform steps into one SCRIPT node</li>
 *   <li>put an APPROVAL node in front of every mutating node</li>
 *   <li>clamp every budget to the constraint budget</li>
 *   <li>check structure (ids, dependencies, cycles, size) and feasibility
 *       (manifest, disallowed tools, reachable servers, engine surface)</li>
 * </ol>
 * Tool schemas are not resolved here; the tool client loads them on first use.
 */
@Component
public class Planner {

    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    private final PlanValidator                    validator;
    private final SystemPrompts                    prompts;
    private final ObjectProvider<CompletionClient> completionClient;
    private final ObjectMapper                     objectMapper;

    public Planner(PlanValidator validator,
                   SystemPrompts prompts,
                   ObjectProvider<CompletionClient> completionClient,
                   ObjectMapper objectMapper) {
        this.validator        = validator;
        this.prompts          = prompts;
        this.completionClient = completionClient;
        this.objectMapper     = objectMapper;
    }

    /**
     * @throws OrchestratorException CODE/PLAN_INVALID when no valid plan can be produced
     */
    public Plan plan(String goal, Constraints constraints, CapabilityManifest manifest) {
        PlanDraft draft = constraints.draft() != null
                ? constraints.draft()
                : draftFromClient(prompts.planner(manifest), "GOAL:\n" + goal, constraints)
                        .orElseThrow(() -> OrchestratorException.planInvalid(
                                "no plan draft supplied and no completion client configured"));

        List<NodeSpec> nodes = PlanShaper.shape(draft, constraints.budget());
        validator.validateStructure(nodes, Set.of(), constraints.maxNodes());
        validator.validateFeasibility(nodes, manifest, constraints.disallowedTools());

        Plan plan = assemble(goal, nodes, Set.of(), null, Map.of());
        log.info("Planned {} with {} nodes (hash {})", plan.planId(), nodes.size(), shortHash(plan));
        return plan;
    }

    /**
     * Successor of {@code previous} after {@code failedNodeId} failed.
     *
     * The failed node and its transitive dependents are handed back to the
     * completion client as remaining work; nodes that already SUCCEEDED in
     * the run are carried over as satisfied dependencies. New node ids never
     * collide with ids already used in the run.
     *
     * @param remainingBudget ceiling for every node of the successor
     * @param outcomes        every outcome recorded so far in the run, by node id
     * @return empty when there is no completion client or it proposes no steps;
     *         the failed node's dependents are then dropped
     * @throws OrchestratorException CODE/PLAN_INVALID when the proposed successor is invalid
     */
    public Optional<Plan> replan(Plan previous,
                                 String failedNodeId,
                                 Budget remainingBudget,
                                 Map<String, NodeOutcome> outcomes,
                                 CapabilityManifest manifest,
                                 Constraints constraints) {
        Set<String> excluded  = excludedBy(previous, failedNodeId);
        Set<String> satisfied = new TreeSet<>();
        outcomes.forEach((id, outcome) -> {
            if (outcome.state() == NodeState.SUCCEEDED) {
                satisfied.add(id);
            }
        });

        String request = replanRequest(previous, failedNodeId, excluded, outcomes);
        Optional<PlanDraft> answer = draftFromClient(prompts.replanner(manifest), request, constraints)
                .filter(d -> !d.steps().isEmpty());
        if (answer.isEmpty()) {
            log.info("No successor for {} after {} failed; dependents are dropped", previous.planId(), failedNodeId);
            return Optional.empty();
        }

        Set<String> reserved = new HashSet<>(outcomes.keySet());
        previous.nodes().forEach(n -> reserved.add(n.id()));
        PlanDraft draft = withFreshIds(answer.get(), reserved, satisfied);

        Budget ceiling = constraints.budget().clampTo(remainingBudget);
        List<NodeSpec> nodes = PlanShaper.shape(draft, ceiling);
        validator.validateStructure(nodes, satisfied, constraints.maxNodes());
        validator.validateFeasibility(nodes, manifest, constraints.disallowedTools());

        Set<String> carried = new TreeSet<>();
        nodes.forEach(n -> n.dependsOn().stream().filter(satisfied::contains).forEach(carried::add));
        List<String> replacements = nodes.stream().map(NodeSpec::id).sorted().toList();

        Plan successor = assemble(previous.goal(), nodes, carried, previous.planId(),
                Map.of(failedNodeId, replacements));
        log.info("Re-planned {} -> {} after {} failed: {} new nodes, {} carried over",
                previous.planId(), successor.planId(), failedNodeId, nodes.size(), carried.size());
        return Optional.of(successor);
    }

    /** {@code failedNodeId} plus every node of {@code plan} that transitively depends on it. */
    public static Set<String> excludedBy(Plan plan, String failedNodeId) {
        Map<String, List<String>> dependents = new HashMap<>();
        for (NodeSpec node : plan.nodes()) {
            for (String dep : node.dependsOn()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
        }
        Set<String> excluded = new TreeSet<>();
        Deque<String> todo = new ArrayDeque<>(List.of(failedNodeId));
        while (!todo.isEmpty()) {
            String id = todo.pop();
            if (excluded.add(id)) {
                todo.addAll(dependents.getOrDefault(id, List.of()));
            }
        }
        return excluded;
    }

    // ------------------------------------------------------------------
    // Drafting
    // ------------------------------------------------------------------

    private Optional<PlanDraft> draftFromClient(String systemPrompt, String userPrompt, Constraints constraints) {
        CompletionClient client = completionClient.getIfAvailable();
        if (client == null) {
            return Optional.empty();
        }
        String response = client.complete(systemPrompt, userPrompt, constraints);
        String json = ResponseParser.extractPlan(response)
                .orElseThrow(() -> OrchestratorException.planInvalid("completion reply contains no <plan> block"));
        try {
            return Optional.of(objectMapper.readValue(json, PlanDraft.class));
        } catch (JsonProcessingException e) {
            throw OrchestratorException.planInvalid("plan draft is not valid JSON: " + e.getOriginalMessage());
        }
    }

    private static String replanRequest(Plan previous, String failedNodeId, Set<String> excluded,
                                        Map<String, NodeOutcome> outcomes) {
        StringBuilder sb = new StringBuilder("GOAL:\n").append(previous.goal()).append("\n\nCOMPLETED STEPS:\n");
        outcomes.values().stream()
                .filter(o -> o.state() == NodeState.SUCCEEDED)
                .sorted(Comparator.comparing(NodeOutcome::nodeId))
                .forEach(o -> sb.append("  ").append(o.nodeId()).append(": ")
                        .append(o.envelope() == null ? "" : o.envelope().summary()).append("\n"));
        NodeOutcome failed = outcomes.get(failedNodeId);
        sb.append("\nFAILED STEP: ").append(failedNodeId);
        if (failed != null && failed.error() != null) {
            sb.append(" (").append(failed.error().label()).append(": ").append(failed.error().message()).append(")");
        }
        sb.append("\n\nREMAINING STEPS TO REPLACE:\n");
        for (String id : excluded) {
            previous.node(id).ifPresent(n -> sb.append("  ").append(id).append(": ")
                    .append(n.description() == null ? "" : n.description()).append("\n"));
        }
        return sb.toString();
    }

    /**
     * Renames steps whose id (or approval id) is already taken in the run and
     * rewrites dependencies on renamed steps. Dependencies on satisfied nodes
     * are left alone.
     */
    static PlanDraft withFreshIds(PlanDraft draft, Set<String> reserved, Set<String> satisfied) {
        Set<String> taken = new HashSet<>(reserved);
        Map<String, String> renamed = new HashMap<>();
        for (PlanDraft.Step step : draft.steps()) {
            if (step.id() == null) {
                continue;
            }
            String id = step.id();
            for (int n = 2; taken.contains(id) || taken.contains(PlanShaper.APPROVAL_PREFIX + id); n++) {
                id = step.id() + "-r" + n;
            }
            taken.add(id);
            if (!id.equals(step.id())) {
                renamed.put(step.id(), id);
            }
        }
        if (renamed.isEmpty()) {
            return draft;
        }
        List<PlanDraft.Step> steps = new ArrayList<>();
        for (PlanDraft.Step step : draft.steps()) {
            List<String> deps = new ArrayList<>(new LinkedHashSet<>(step.dependsOn().stream()
                    .map(d -> satisfied.contains(d) ? d : renamed.getOrDefault(d, d))
                    .toList()));
            steps.add(new PlanDraft.Step(renamed.getOrDefault(step.id(), step.id()), step.description(), deps,
                    step.code(), step.tool(), step.args(), step.stateKey(), step.params(), step.tools(),
                    step.idempotent(), step.mutating(), step.budget()));
        }
        return new PlanDraft(steps);
    }

    // ------------------------------------------------------------------
    // Hashing
    // ------------------------------------------------------------------

    private static Plan assemble(String goal, List<NodeSpec> nodes, Set<String> carriedOver,
                                 String supersedes, Map<String, List<String>> supersededBy) {
        String hash = planHash(nodes);
        return new Plan("plan-" + hash.substring(0, 12), goal, nodes, hash, carriedOver, supersedes, supersededBy);
    }

    /** SHA-256 of the canonical JSON of all nodes sorted by id. */
    public static String planHash(List<NodeSpec> nodes) {
        List<NodeSpec> sorted = nodes.stream().sorted(Comparator.comparing(NodeSpec::id)).toList();
        return ContentHasher.hash(sorted);
    }

    private static String shortHash(Plan plan) {
        return plan.planHash().substring(0, 12);
    }
}
