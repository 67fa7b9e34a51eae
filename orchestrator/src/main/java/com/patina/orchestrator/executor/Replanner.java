package com.patina.orchestrator.executor;

import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.planner.Planner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Asks the planner for a successor plan after a node failed, at most
 * {@code patina.executor.max-replans} times per run. The successor's node
 * budgets are the constraint budget reduced to the share of run wall clock
 * that is left.
 */
@Component
public class Replanner {

    private static final Logger log = LoggerFactory.getLogger(Replanner.class);

    private final Planner planner;
    private final int     maxReplans;

    public Replanner(Planner planner, @Value("${patina.executor.max-replans:2}") int maxReplans) {
        this.planner    = planner;
        this.maxReplans = maxReplans;
    }

    /**
     * @param replansSoFar      successors already produced in this run
     * @param remainingFraction share of the run wall clock still available
     * @return empty when the re-plan limit is reached, the planner has no
     *         answer, or its answer is not a valid plan
     */
    public Optional<Plan> replan(RunContext ctx, String failedNodeId, int replansSoFar, double remainingFraction) {
        if (replansSoFar >= maxReplans) {
            log.info("Re-plan limit of {} reached; not replacing {}", maxReplans, failedNodeId);
            return Optional.empty();
        }
        Plan previous = ctx.state().planOf(failedNodeId);
        Budget remaining = ctx.constraints().budget().reducedBy(remainingFraction);
        try {
            return planner.replan(previous, failedNodeId, remaining, ctx.state().outcomesById(),
                    ctx.manifest(), ctx.constraints());
        } catch (OrchestratorException e) {
            log.warn("Re-plan after {} failed rejected: {}", failedNodeId, e.getMessage());
            return Optional.empty();
        }
    }

    public int maxReplans() {
        return maxReplans;
    }
}
