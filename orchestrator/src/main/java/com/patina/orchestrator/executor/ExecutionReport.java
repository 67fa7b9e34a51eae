package com.patina.orchestrator.executor;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.RunStatus;
import com.patina.orchestrator.model.TraceEntry;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What the executor hands back when a run's DAG is done: every node of
 * every plan, their outcomes, the run state and the terminating error (null
 * unless the run was aborted).
 *
 * @param superseded nodes replaced by a re-plan; they do not count against the run's status
 */
public record ExecutionReport(
        List<Plan>          plans,
        List<NodeSpec>      nodes,
        List<NodeOutcome>   outcomes,
        Map<String, Object> state,
        List<TraceEntry>    trace,
        Set<String>         superseded,
        OrchestratorError   terminatingError) {

    static ExecutionReport of(RunState runState, OrchestratorError terminatingError) {
        return new ExecutionReport(runState.plans(), runState.nodes(), runState.outcomes(), runState.state(),
                runState.trace(), runState.superseded(), terminatingError);
    }

    public RunStatus status() {
        if (terminatingError != null) {
            return terminatingError.is(ErrorKind.SANDBOX, ErrorCodes.CANCELLED) ? RunStatus.CANCELLED : RunStatus.FAILED;
        }
        boolean allDone = outcomes.stream()
                .filter(o -> !superseded.contains(o.nodeId()))
                .allMatch(o -> o.state() == NodeState.SUCCEEDED);
        return allDone ? RunStatus.SUCCEEDED : RunStatus.PARTIAL;
    }
}
