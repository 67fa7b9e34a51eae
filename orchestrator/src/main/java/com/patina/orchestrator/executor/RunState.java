package com.patina.orchestrator.executor;

import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.TraceEntry;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Mutable state of one run: every node of every plan executed so far,
 * their outcomes, the accumulated state map and the trace.
 *
 * Only the executor's coordinator thread writes; the lock exists so status
 * readers get a consistent snapshot. A node's {@code stateUpdates} are
 * merged here when it completes, before any dependent can become READY.
 */
public class RunState {

    private final Clock clock;

    private final List<Plan>               plans     = new ArrayList<>();
    private final Map<String, NodeSpec>    nodes     = new LinkedHashMap<>();
    private final Map<String, Plan>        planOf    = new LinkedHashMap<>();
    private final Map<String, NodeOutcome> outcomes  = new LinkedHashMap<>();
    private final Map<String, Object>      state     = new LinkedHashMap<>();
    private final List<TraceEntry>         trace     = new ArrayList<>();
    private final Set<String>              superseded = new TreeSet<>();

    private long completionSeq;
    private long traceSeq;

    public RunState(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Writes (coordinator thread only)
    // ------------------------------------------------------------------

    synchronized void addPlan(Plan plan) {
        plans.add(plan);
        for (NodeSpec node : plan.nodes()) {
            nodes.put(node.id(), node);
            planOf.put(node.id(), plan);
            outcomes.put(node.id(), NodeOutcome.pending(node.id(), plan.planId()));
        }
    }

    synchronized void update(NodeOutcome outcome) {
        outcomes.put(outcome.nodeId(), outcome);
    }

    /** Record a terminal outcome, stamping its completion order and merging its state updates. */
    synchronized NodeOutcome complete(NodeOutcome outcome) {
        NodeOutcome stamped = new NodeOutcome(outcome.nodeId(), outcome.planId(), outcome.state(),
                outcome.envelope(), outcome.error(), outcome.attempts(), outcome.fromCache(),
                outcome.startedAt(), outcome.finishedAt() != null ? outcome.finishedAt() : clock.instant(),
                ++completionSeq);
        outcomes.put(stamped.nodeId(), stamped);
        if (stamped.state() == NodeState.SUCCEEDED && stamped.envelope() != null) {
            state.putAll(stamped.envelope().stateUpdates());
        }
        return stamped;
    }

    synchronized void markSuperseded(String nodeId) {
        superseded.add(nodeId);
    }

    synchronized void trace(String planId, String nodeId, TraceEntry.Event event,
                            String detail, OrchestratorError error) {
        trace.add(new TraceEntry(++traceSeq, clock.instant(), planId, nodeId, event, detail, error));
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    public synchronized NodeSpec node(String nodeId) {
        return nodes.get(nodeId);
    }

    public synchronized Plan planOf(String nodeId) {
        return planOf.get(nodeId);
    }

    public synchronized NodeOutcome outcome(String nodeId) {
        return outcomes.get(nodeId);
    }

    public synchronized List<Plan> plans() {
        return List.copyOf(plans);
    }

    public synchronized List<NodeSpec> nodes() {
        return List.copyOf(nodes.values());
    }

    public synchronized List<NodeOutcome> outcomes() {
        return List.copyOf(outcomes.values());
    }

    public synchronized Map<String, NodeOutcome> outcomesById() {
        return new LinkedHashMap<>(outcomes);
    }

    public synchronized Map<String, Object> state() {
        return new LinkedHashMap<>(state);
    }

    public synchronized List<TraceEntry> trace() {
        return List.copyOf(trace);
    }

    public synchronized Set<String> superseded() {
        return new TreeSet<>(superseded);
    }

    /** Ids of PENDING nodes whose dependencies all SUCCEEDED, ascending. */
    synchronized List<String> readyIds() {
        List<String> ready = new ArrayList<>();
        outcomes.forEach((id, outcome) -> {
            if (outcome.state() == NodeState.PENDING && nodes.get(id).dependsOn().stream()
                    .allMatch(dep -> outcomes.get(dep).state() == NodeState.SUCCEEDED)) {
                ready.add(id);
            }
        });
        ready.sort(null);
        return ready;
    }

    /** Ids of nodes that are not terminal yet, ascending. */
    synchronized List<String> openIds() {
        return outcomes.values().stream()
                .filter(o -> !o.state().isTerminal())
                .map(NodeOutcome::nodeId)
                .sorted()
                .toList();
    }

    /** Every node that transitively depends on {@code nodeId}, ascending. */
    synchronized Set<String> dependentsOf(String nodeId) {
        Set<String> found = new TreeSet<>();
        Deque<String> todo = new ArrayDeque<>(List.of(nodeId));
        while (!todo.isEmpty()) {
            String current = todo.pop();
            for (NodeSpec node : nodes.values()) {
                if (node.dependsOn().contains(current) && found.add(node.id())) {
                    todo.push(node.id());
                }
            }
        }
        return found;
    }
}
