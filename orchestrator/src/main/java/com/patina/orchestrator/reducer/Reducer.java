package com.patina.orchestrator.reducer;

import com.patina.orchestrator.cache.ContentHasher;
import com.patina.orchestrator.executor.ExecutionReport;
import com.patina.orchestrator.model.ArtifactHandle;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.planner.PlanValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds an {@link ExecutionReport} into a {@link RunSummary}.
 *
 * <ul>
 *   <li>State: every SUCCEEDED node's {@code stateUpdates}, applied in
 *       topological order with ties by id; later writes win.</li>
 *   <li>Artifacts: concatenated in the same order, without duplicates.</li>
 *   <li>Summary: one line per node, {@code "<id>: <STATE> <summary or error>"},
 *       cut at whole lines to the character budget with a {@code "+N more"} line.</li>
 * </ul>
 * The summary never contains timestamps, durations or cache provenance, so
 * identical runs produce identical {@code summaryHash} values.
 */
@Component
public class Reducer {

    private final int summaryCharBudget;

    public Reducer(@Value("${patina.reducer.summary-char-budget:4000}") int summaryCharBudget) {
        this.summaryCharBudget = summaryCharBudget;
    }

    public RunSummary reduce(String runId, String goal, ExecutionReport report) {
        Map<String, NodeOutcome> outcomes = new LinkedHashMap<>();
        report.outcomes().forEach(o -> outcomes.put(o.nodeId(), o));
        List<String> order = PlanValidator.topologicalOrder(report.nodes(), Set.of());

        Map<String, Object> state = new LinkedHashMap<>();
        Set<ArtifactHandle> artifacts = new LinkedHashSet<>();
        List<String> lines = new ArrayList<>();
        for (String id : order) {
            NodeOutcome outcome = outcomes.get(id);
            if (outcome == null) {
                continue;
            }
            if (outcome.state() == NodeState.SUCCEEDED && outcome.envelope() != null) {
                state.putAll(outcome.envelope().stateUpdates());
                artifacts.addAll(outcome.envelope().artifacts());
            }
            lines.add(line(outcome));
        }
        if (report.terminatingError() != null) {
            lines.add("run: " + report.terminatingError().label() + " " + report.terminatingError().message());
        }

        String summary = bound(lines, summaryCharBudget);
        List<String> planHashes = report.plans().stream().map(Plan::planHash).toList();
        return new RunSummary(runId, goal, report.status(), summary, ContentHasher.sha256Hex(summary),
                new ArrayList<>(artifacts), state, orderedOutcomes(order, outcomes), report.trace(),
                report.terminatingError(), planHashes);
    }

    private static String line(NodeOutcome outcome) {
        StringBuilder sb = new StringBuilder(outcome.nodeId()).append(": ").append(outcome.state());
        if (outcome.error() != null) {
            sb.append(' ').append(outcome.error().label());
        } else if (outcome.envelope() != null && !outcome.envelope().summary().isBlank()) {
            sb.append(' ').append(outcome.envelope().summary().strip().replace('\n', ' '));
        }
        return sb.toString();
    }

    /** Whole lines up to {@code budget} characters, then {@code "+N more"} for the dropped ones. */
    static String bound(List<String> lines, int budget) {
        StringBuilder out = new StringBuilder();
        int kept = 0;
        for (String line : lines) {
            int needed = line.length() + (out.length() == 0 ? 0 : 1);
            if (out.length() + needed > budget) {
                break;
            }
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append(line);
            kept++;
        }
        int dropped = lines.size() - kept;
        if (dropped > 0) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append('+').append(dropped).append(" more");
        }
        return out.toString();
    }

    private static List<NodeOutcome> orderedOutcomes(List<String> order, Map<String, NodeOutcome> outcomes) {
        List<NodeOutcome> ordered = new ArrayList<>();
        for (String id : order) {
            NodeOutcome outcome = outcomes.get(id);
            if (outcome != null) {
                ordered.add(outcome);
            }
        }
        return ordered;
    }
}
