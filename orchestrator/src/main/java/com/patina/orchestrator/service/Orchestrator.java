package com.patina.orchestrator.service;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.executor.DagExecutor;
import com.patina.orchestrator.executor.ExecutionReport;
import com.patina.orchestrator.executor.RunContext;
import com.patina.orchestrator.executor.RunState;
import com.patina.orchestrator.logging.MdcContext;
import com.patina.orchestrator.model.Constraints;
import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.RunStatus;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.planner.Planner;
import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.ManifestLoader;
import com.patina.orchestrator.reducer.Reducer;
import com.patina.orchestrator.sandbox.SandboxEngineRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for runs.
 *
 * <p>{@link #start} performs the fatal pre-run checks synchronously, then
 * hands the run to a bounded run pool where it goes through:
 * <ol>
 *   <li>plan (PLANNING)</li>
 *   <li>execute, re-planning on failure inside the executor (RUNNING)</li>
 *   <li>reduce to a RunSummary</li>
 *   <li>persist through the {@link RunSummaryStore} and log one summary line</li>
 * </ol>
 * In-flight runs live in memory; finished runs are read back from the store.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    /** Returned by {@link #start}. */
    public record RunHandle(String runId, RunStatus status) {}

    private final ManifestLoader        manifestLoader;
    private final SandboxEngineRegistry engines;
    private final Planner               planner;
    private final DagExecutor           executor;
    private final Reducer               reducer;
    private final RunSummaryStore       store;
    private final Clock                 clock;
    private final ExecutorService       runPool;

    private final Map<String, ActiveRun> active = new ConcurrentHashMap<>();

    public Orchestrator(ManifestLoader manifestLoader,
                        SandboxEngineRegistry engines,
                        Planner planner,
                        DagExecutor executor,
                        Reducer reducer,
                        RunSummaryStore store,
                        Clock clock,
                        @Value("${patina.orchestrator.run-pool-size:4}") int runPoolSize) {
        this.manifestLoader = manifestLoader;
        this.engines        = engines;
        this.planner        = planner;
        this.executor       = executor;
        this.reducer        = reducer;
        this.store          = store;
        this.clock          = clock;
        AtomicInteger threads = new AtomicInteger();
        this.runPool = Executors.newFixedThreadPool(runPoolSize, r -> {
            Thread t = new Thread(r, "patina-run-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Accept a goal and schedule its run.
     *
     * @throws OrchestratorException POLICY/MANIFEST_MISSING or MANIFEST_INVALID when the manifest
     *         cannot be loaded, SANDBOX/ENGINE_UNAVAILABLE when no script worker can be launched;
     *         no node runs in either case
     */
    public RunHandle start(String goal, Constraints constraints) {
        Constraints effective = constraints == null ? Constraints.defaults() : constraints;
        CapabilityManifest manifest = manifestLoader.loadConfigured();
        engines.requireLive(EngineKind.SCRIPT);

        String runId = "run-" + UUID.randomUUID();
        ActiveRun run = new ActiveRun(new RunContext(runId, goal, effective, manifest, clock));
        active.put(runId, run);
        log.info("Run {} accepted: {} chars of goal, manifest {}", runId, goal.length(), manifest.source());
        runPool.execute(() -> execute(run));
        return new RunHandle(runId, run.status);
    }

    /** @return false when the run is unknown or already finished */
    public boolean cancel(String runId) {
        ActiveRun run = active.get(runId);
        if (run == null || run.status.isTerminal()) {
            return false;
        }
        log.info("Run {} cancel requested", runId);
        run.ctx.cancel();
        return true;
    }

    /**
     * Record an operator decision for an APPROVAL node.
     *
     * @return false when the run is not in flight or has no such approval node
     */
    public boolean decide(String runId, String nodeId, boolean approved) {
        ActiveRun run = active.get(runId);
        if (run == null || run.status.isTerminal()) {
            return false;
        }
        boolean known = run.ctx.approvals().decide(nodeId, approved);
        if (known) {
            log.info("Run {} node {} {}", runId, nodeId, approved ? "approved" : "rejected");
        }
        return known;
    }

    public boolean approve(String runId, String nodeId) {
        return decide(runId, nodeId, true);
    }

    public boolean reject(String runId, String nodeId) {
        return decide(runId, nodeId, false);
    }

    /**
     * The final summary of a finished run, or a live view (status PLANNING or
     * RUNNING, no summary text) of a run in flight.
     */
    public Optional<RunSummary> status(String runId) {
        ActiveRun run = active.get(runId);
        if (run == null) {
            return store.find(runId);
        }
        if (run.summary != null) {
            return Optional.of(run.summary);
        }
        RunState rs = run.ctx.state();
        List<String> planHashes = rs.plans().stream().map(Plan::planHash).toList();
        return Optional.of(new RunSummary(runId, run.ctx.goal(), run.status, "", null, List.of(), rs.state(),
                rs.outcomes(), rs.trace(), null, planHashes));
    }

    @PreDestroy
    public void shutdown() {
        active.values().forEach(run -> run.ctx.cancel());
        runPool.shutdown();
    }

    // ------------------------------------------------------------------
    // Run body (run pool)
    // ------------------------------------------------------------------

    private void execute(ActiveRun run) {
        RunContext ctx = run.ctx;
        MdcContext.setRun(ctx.runId());
        RunSummary summary;
        try {
            Plan plan = planner.plan(ctx.goal(), ctx.constraints(), ctx.manifest());
            run.status = RunStatus.RUNNING;
            ExecutionReport report = executor.run(ctx, plan);
            summary = reducer.reduce(ctx.runId(), ctx.goal(), report);
        } catch (OrchestratorException e) {
            log.warn("Run {} failed before execution: {}", ctx.runId(), e.getMessage());
            summary = reducer.reduce(ctx.runId(), ctx.goal(), notExecuted(e.getError()));
        } catch (RuntimeException e) {
            log.error("Run {} crashed", ctx.runId(), e);
            summary = reducer.reduce(ctx.runId(), ctx.goal(), notExecuted(OrchestratorError.of(
                    ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH,
                    "orchestrator error: " + e.getClass().getSimpleName())));
        }
        finish(run, summary);
        MdcContext.clear();
    }

    private void finish(ActiveRun run, RunSummary summary) {
        run.summary = summary;
        run.status  = summary.status();
        long succeeded = summary.nodes().stream().filter(n -> n.state() == NodeState.SUCCEEDED).count();
        log.info("Run {} {}: {}/{} nodes succeeded, {} plans, summaryHash={}, error={}",
                summary.runId(), summary.status(), succeeded, summary.nodes().size(), summary.planHashes().size(),
                summary.summaryHash(), summary.terminatingError() == null ? "none" : summary.terminatingError().label());
        try {
            store.save(summary);
            active.remove(summary.runId());
        } catch (RuntimeException e) {
            // The summary stays served from memory.
            log.error("Could not persist run {}: {}", summary.runId(), e.getMessage(), e);
        }
    }

    private static ExecutionReport notExecuted(OrchestratorError error) {
        return new ExecutionReport(List.of(), List.of(), List.of(), Map.of(), List.of(), Set.of(), error);
    }

    private static final class ActiveRun {
        final RunContext ctx;
        volatile RunStatus  status = RunStatus.PLANNING;
        volatile RunSummary summary;

        ActiveRun(RunContext ctx) {
            this.ctx = ctx;
        }
    }
}
