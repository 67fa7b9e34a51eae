package com.patina.orchestrator.executor;

import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.RunBudget;
import com.patina.orchestrator.tool.ToolCallQuota;

import java.time.Clock;
import java.util.Optional;

/**
 * Run-level limits, checked before every dispatch: node executions, total
 * wall clock and tool calls. Retries and approval nodes are not counted as
 * executions.
 */
class RunBudgetTracker {

    private final RunBudget     budget;
    private final ToolCallQuota quota;
    private final Clock         clock;
    private final long          startedAt;

    private int nodesExecuted;

    RunBudgetTracker(RunBudget budget, ToolCallQuota quota, Clock clock) {
        this.budget    = budget;
        this.quota     = quota;
        this.clock     = clock;
        this.startedAt = clock.millis();
    }

    void recordDispatch() {
        nodesExecuted++;
    }

    int nodesExecuted() {
        return nodesExecuted;
    }

    long elapsedMs() {
        return clock.millis() - startedAt;
    }

    long remainingMs() {
        return budget.wallClockMs() - elapsedMs();
    }

    /** Share of the run wall clock still available, in [0.1, 1]. */
    double remainingFraction() {
        double fraction = (double) remainingMs() / budget.wallClockMs();
        return Math.max(0.1, Math.min(1.0, fraction));
    }

    /** Why {@code next} may not be dispatched, or empty when it may. */
    Optional<String> breach(NodeSpec next) {
        if (nodesExecuted >= budget.maxNodes()) {
            return Optional.of("run node budget of " + budget.maxNodes() + " executions exhausted");
        }
        if (remainingMs() <= 0) {
            return Optional.of("run wall clock of " + budget.wallClockMs() + " ms exhausted");
        }
        if (quota.exhausted() && next.unit() != null && !next.unit().allowedTools().isEmpty()) {
            return Optional.of("run tool call budget of " + quota.max() + " calls exhausted");
        }
        return Optional.empty();
    }
}
