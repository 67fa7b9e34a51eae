package com.patina.orchestrator.executor;

import com.patina.orchestrator.cache.ResultCache;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.logging.MdcContext;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.NodeKind;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.OrchestratorError;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.model.TraceEntry.Event;
import com.patina.orchestrator.policy.PolicyGate;
import com.patina.orchestrator.sandbox.SandboxEngineRegistry;
import com.patina.orchestrator.sandbox.SandboxInvocation;
import com.patina.orchestrator.tool.ToolClient;
import com.patina.orchestrator.tool.ToolScope;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a plan's DAG to completion.
 *
 * <p>One coordinator (the calling thread) owns the run's {@link RunState}:
 * <ol>
 *   <li>dispatch every READY node, ascending id, up to {@code maxConcurrency}
 *       WORK nodes at a time on a per-run pool, after checking run limits;</li>
 *   <li>wait for a completion message from the pool (or an approval decision);</li>
 *   <li>record the outcome, merge its state updates, then retry, skip
 *       dependents or queue the failure for a re-plan;</li>
 *   <li>when nothing is running and nothing is ready, ask the {@link Replanner}
 *       for successors of queued failures, else finish.</li>
 * </ol>
 * Pool threads never touch RunState; they only compute and post a {@link Completion}.
 *
 * <p>Per node, on a pool thread: PolicyGate check of the unit, result cache
 * lookup, engine execution, cache store.
 * <pre>
 *   patina.node.cache{result="hit|miss"}
 *   observation "patina.node"
 * </pre>
 */
@Component
public class DagExecutor {

    private static final Logger log = LoggerFactory.getLogger(DagExecutor.class);

    private static final long POLL_MS = 200;

    private final SandboxEngineRegistry engines;
    private final PolicyGate            policyGate;
    private final ToolClient            toolClient;
    private final ResultCache           resultCache;
    private final Replanner             replanner;
    private final MeterRegistry         meterRegistry;
    private final ObservationRegistry   observations;
    private final Clock                 clock;
    private final long                  approvalTimeoutMs;
    private final long                  drainTimeoutMs;

    public DagExecutor(SandboxEngineRegistry engines,
                       PolicyGate policyGate,
                       ToolClient toolClient,
                       ResultCache resultCache,
                       Replanner replanner,
                       MeterRegistry meterRegistry,
                       ObservationRegistry observations,
                       Clock clock,
                       @Value("${patina.executor.approval-timeout-ms:0}") long approvalTimeoutMs,
                       @Value("${patina.executor.drain-timeout-ms:10000}") long drainTimeoutMs) {
        this.engines           = engines;
        this.policyGate        = policyGate;
        this.toolClient        = toolClient;
        this.resultCache       = resultCache;
        this.replanner         = replanner;
        this.meterRegistry     = meterRegistry;
        this.observations      = observations;
        this.clock             = clock;
        this.approvalTimeoutMs = approvalTimeoutMs;
        this.drainTimeoutMs    = drainTimeoutMs;
    }

    /**
     * Execute {@code plan} within {@code ctx}. Never throws for node or run
     * failures; they end up in the report.
     */
    public ExecutionReport run(RunContext ctx, Plan plan) {
        return new Coordinator(ctx).run(plan);
    }

    /** Result of one node attempt, posted from a pool thread (or an approval decision) to the coordinator. */
    record Completion(String nodeId, int attempt, ResultEnvelope envelope, OrchestratorError error,
                      boolean fromCache, Instant startedAt, Instant finishedAt) {

        static Completion success(String nodeId, int attempt, ResultEnvelope envelope, boolean fromCache,
                                  Instant startedAt, Instant finishedAt) {
            return new Completion(nodeId, attempt, envelope, null, fromCache, startedAt, finishedAt);
        }

        static Completion failure(String nodeId, int attempt, OrchestratorError error,
                                  Instant startedAt, Instant finishedAt) {
            return new Completion(nodeId, attempt, null, error, false, startedAt, finishedAt);
        }
    }

    private record Attempt(ResultEnvelope envelope, boolean fromCache) {}

    // ------------------------------------------------------------------
    // Coordinator: one per run, confined to the calling thread
    // ------------------------------------------------------------------

    private final class Coordinator {

        private final RunContext                ctx;
        private final RunState                  rs;
        private final RunBudgetTracker          tracker;
        private final ExecutorService           pool;
        private final BlockingQueue<Completion> completions     = new LinkedBlockingQueue<>();
        private final Set<String>               runningWork     = new HashSet<>();
        private final Set<String>               awaitingApproval = new HashSet<>();
        private final TreeSet<String>           awaitingReplan  = new TreeSet<>();

        private int               replans;
        private OrchestratorError terminating;

        Coordinator(RunContext ctx) {
            this.ctx     = ctx;
            this.rs      = ctx.state();
            this.tracker = new RunBudgetTracker(ctx.constraints().runBudget(), ctx.quota(), clock);
            AtomicInteger threads = new AtomicInteger();
            this.pool = Executors.newFixedThreadPool(ctx.constraints().runBudget().maxConcurrency(), r -> {
                Thread t = new Thread(r, "patina-" + ctx.runId() + "-node-" + threads.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }

        ExecutionReport run(Plan plan) {
            MdcContext.setRun(ctx.runId());
            try {
                addPlan(plan);
                loop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abort(OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "executor interrupted"),
                        Event.CANCELLED);
            } finally {
                shutdown();
                MdcContext.clear();
            }
            return ExecutionReport.of(rs, terminating);
        }

        private void loop() throws InterruptedException {
            while (true) {
                if (ctx.isCancelled()) {
                    abort(OrchestratorError.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "run cancelled by operator"),
                            Event.CANCELLED);
                    return;
                }
                Optional<String> breach = dispatchReady();
                if (breach.isPresent()) {
                    abort(runLimit(breach.get()), Event.RUN_ABORTED);
                    return;
                }
                if (runningWork.isEmpty() && awaitingApproval.isEmpty()) {
                    if (replanQueued()) {
                        continue;
                    }
                    return;
                }
                long remaining = tracker.remainingMs();
                if (remaining <= 0) {
                    abort(runLimit("run wall clock of " + ctx.constraints().runBudget().wallClockMs()
                            + " ms exhausted"), Event.RUN_ABORTED);
                    return;
                }
                Completion done = completions.poll(Math.min(remaining, POLL_MS), TimeUnit.MILLISECONDS);
                if (done != null && handle(done)) {
                    return;
                }
            }
        }

        // ------------------------------------------------------------------
        // Dispatch
        // ------------------------------------------------------------------

        private Optional<String> dispatchReady() {
            int maxConcurrency = ctx.constraints().runBudget().maxConcurrency();
            for (String id : rs.readyIds()) {
                NodeSpec node = rs.node(id);
                if (node.isApproval()) {
                    awaitApproval(node);
                    continue;
                }
                if (runningWork.size() >= maxConcurrency) {
                    continue;
                }
                Optional<String> breach = tracker.breach(node);
                if (breach.isPresent()) {
                    return breach;
                }
                tracker.recordDispatch();
                dispatch(node, 1);
            }
            return Optional.empty();
        }

        private void dispatch(NodeSpec node, int attempt) {
            Plan plan = rs.planOf(node.id());
            NodeOutcome previous = rs.outcome(node.id());
            Instant startedAt = previous.startedAt() != null ? previous.startedAt() : clock.instant();
            rs.update(new NodeOutcome(node.id(), plan.planId(), NodeState.RUNNING, null, null, attempt,
                    false, startedAt, null, 0));
            rs.trace(plan.planId(), node.id(), Event.DISPATCHED,
                    node.unit().engine() + " attempt " + attempt, null);

            Map<String, ResultEnvelope> deps = new TreeMap<>();
            for (String dep : node.dependsOn()) {
                deps.put(dep, rs.outcome(dep).envelope());
            }
            runningWork.add(node.id());
            String planHash = plan.planHash();
            pool.execute(() -> completions.add(execute(node, attempt, planHash, deps)));
        }

        private void awaitApproval(NodeSpec node) {
            Plan plan = rs.planOf(node.id());
            rs.update(new NodeOutcome(node.id(), plan.planId(), NodeState.RUNNING, null, null, 1,
                    false, clock.instant(), null, 0));
            rs.trace(plan.planId(), node.id(), Event.AWAITING_APPROVAL, node.description(), null);
            awaitingApproval.add(node.id());
            log.info("Node {} waits for operator approval", node.id());

            long timeout = approvalTimeoutMs > 0
                    ? Math.min(approvalTimeoutMs, tracker.remainingMs())
                    : tracker.remainingMs();
            Instant startedAt = clock.instant();
            CompletableFuture<Boolean> decision = ctx.approvals().awaiting(node.id());
            decision.copy()
                    .orTimeout(Math.max(1, timeout), TimeUnit.MILLISECONDS)
                    .whenComplete((approved, ex) -> {
                        if (ex == null && Boolean.TRUE.equals(approved)) {
                            completions.add(Completion.success(node.id(), 1, ResultEnvelope.of("approved"),
                                    false, startedAt, clock.instant()));
                        } else {
                            String reason = ex instanceof TimeoutException
                                    ? "no approval within " + timeout + " ms"
                                    : "write rejected by operator";
                            completions.add(Completion.failure(node.id(), 1, OrchestratorError.of(ErrorKind.POLICY,
                                    ErrorCodes.WRITE_NOT_APPROVED, reason), startedAt, clock.instant()));
                        }
                    });
        }

        // ------------------------------------------------------------------
        // Completion path
        // ------------------------------------------------------------------

        /** @return true when the run must stop */
        private boolean handle(Completion done) {
            String id = done.nodeId();
            runningWork.remove(id);
            awaitingApproval.remove(id);
            NodeSpec node = rs.node(id);
            String planId = rs.planOf(id).planId();

            if (done.error() == null) {
                NodeOutcome outcome = rs.complete(new NodeOutcome(id, planId, NodeState.SUCCEEDED, done.envelope(),
                        null, done.attempt(), done.fromCache(), done.startedAt(), done.finishedAt(), 0));
                if (done.fromCache()) {
                    rs.trace(planId, id, Event.CACHE_HIT, null, null);
                }
                rs.trace(planId, id, Event.SUCCEEDED, describe(outcome.envelope()), null);
                log.info("Node {} SUCCEEDED (attempt {}{})", id, done.attempt(), done.fromCache() ? ", cached" : "");
                return false;
            }

            OrchestratorError error = done.error();
            if (shouldRetry(node, done.attempt(), error)) {
                rs.trace(planId, id, Event.RETRYING, "attempt " + done.attempt() + " failed", error);
                log.warn("Node {} failed with {}, retrying once", id, error.label());
                dispatch(node, done.attempt() + 1);
                return false;
            }

            rs.complete(new NodeOutcome(id, planId, NodeState.FAILED, null, error, done.attempt(), false,
                    done.startedAt(), done.finishedAt(), 0));
            rs.trace(planId, id, Event.FAILED, null, error);
            log.warn("Node {} FAILED: {}", id, error.label());

            if (error.is(ErrorKind.BUDGET, ErrorCodes.TOOL_CALL_LIMIT) && ctx.quota().exhausted()) {
                abort(runLimit("run tool call budget of " + ctx.quota().max() + " calls exhausted"),
                        Event.RUN_ABORTED);
                return true;
            }
            if (node.kind() == NodeKind.WORK && error.kind() != ErrorKind.POLICY
                    && !error.is(ErrorKind.SANDBOX, ErrorCodes.CANCELLED)) {
                awaitingReplan.add(id);
            } else {
                skipDependents(id, "dependency " + id + " failed");
            }
            return false;
        }

        private boolean shouldRetry(NodeSpec node, int attempt, OrchestratorError error) {
            if (attempt > 1 || !node.idempotent() || ctx.isCancelled()) {
                return false;
            }
            if (error.kind() == ErrorKind.TOOL && ErrorCodes.NON_RETRIABLE_TOOL_CODES.contains(error.code())) {
                return false;
            }
            if (error.is(ErrorKind.BUDGET, ErrorCodes.TOOL_CALL_LIMIT)) {
                return false;
            }
            return error.retriable() || error.kind() == ErrorKind.BUDGET;
        }

        /** @return true when a successor plan was added */
        private boolean replanQueued() {
            while (!awaitingReplan.isEmpty()) {
                String failed = awaitingReplan.pollFirst();
                Optional<Plan> successor = replanner.replan(ctx, failed, replans, tracker.remainingFraction());
                if (successor.isEmpty()) {
                    skipDependents(failed, "dependency " + failed + " failed");
                    continue;
                }
                replans++;
                Plan next = successor.get();
                rs.markSuperseded(failed);
                for (String dependent : rs.dependentsOf(failed)) {
                    if (!rs.outcome(dependent).state().isTerminal()) {
                        rs.markSuperseded(dependent);
                        skip(dependent, "superseded by " + next.planId());
                    }
                }
                addPlan(next);
                rs.trace(next.planId(), failed, Event.REPLANNED,
                        next.supersedes() + " -> " + next.planId() + ": " + next.supersededBy().get(failed), null);
                return true;
            }
            return false;
        }

        private void addPlan(Plan plan) {
            rs.addPlan(plan);
            plan.nodes().stream().filter(NodeSpec::isApproval).forEach(n -> ctx.approvals().expect(n.id()));
            rs.trace(plan.planId(), null, Event.PLANNED,
                    plan.nodes().size() + " nodes, hash " + plan.planHash(), null);
        }

        private void skipDependents(String nodeId, String reason) {
            for (String dependent : rs.dependentsOf(nodeId)) {
                if (!rs.outcome(dependent).state().isTerminal()) {
                    skip(dependent, reason);
                }
            }
        }

        private void skip(String nodeId, String reason) {
            NodeOutcome current = rs.outcome(nodeId);
            rs.complete(new NodeOutcome(nodeId, current.planId(), NodeState.SKIPPED, null, null,
                    current.attempts(), false, current.startedAt(), clock.instant(), 0));
            rs.trace(current.planId(), nodeId, Event.SKIPPED, reason, null);
        }

        // ------------------------------------------------------------------
        // Abort and shutdown
        // ------------------------------------------------------------------

        private void abort(OrchestratorError error, Event event) {
            if (terminating == null) {
                terminating = error;
            }
            ctx.signal().cancel();
            ctx.approvals().closeAll();
            rs.trace(null, null, event, null, error);
            log.warn("Run {} aborted: {}", ctx.runId(), error.label());
            for (String id : rs.openIds()) {
                skip(id, error.label());
            }
            runningWork.clear();
            awaitingApproval.clear();
            awaitingReplan.clear();
        }

        private void shutdown() {
            pool.shutdown();
            try {
                if (!pool.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Node threads of run {} still busy after {} ms; interrupting", ctx.runId(), drainTimeoutMs);
                    pool.shutdownNow();
                }
            } catch (InterruptedException e) {
                pool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        private OrchestratorError runLimit(String message) {
            return OrchestratorError.of(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT, message);
        }

        // ------------------------------------------------------------------
        // Node execution (pool threads)
        // ------------------------------------------------------------------

        private Completion execute(NodeSpec node, int attempt, String planHash, Map<String, ResultEnvelope> deps) {
            MdcContext.setNode(ctx.runId(), node.id(), attempt);
            Instant startedAt = clock.instant();
            try {
                Attempt result = Observation.createNotStarted("patina.node", observations)
                        .lowCardinalityKeyValue("engine", node.unit().engine().name().toLowerCase())
                        .highCardinalityKeyValue("node.id", node.id())
                        .observe(() -> attempt(node, attempt, planHash, deps));
                return Completion.success(node.id(), attempt, result.envelope(), result.fromCache(),
                        startedAt, clock.instant());
            } catch (OrchestratorException e) {
                return Completion.failure(node.id(), attempt, e.getError(), startedAt, clock.instant());
            } catch (RuntimeException e) {
                log.error("Unexpected error in node {}", node.id(), e);
                return Completion.failure(node.id(), attempt, OrchestratorError.of(ErrorKind.SANDBOX,
                        ErrorCodes.PROC_CRASH, "unexpected error: " + e.getClass().getSimpleName()),
                        startedAt, clock.instant());
            } finally {
                MdcContext.clear();
            }
        }

        private Attempt attempt(NodeSpec node, int attempt, String planHash, Map<String, ResultEnvelope> deps) {
            ExecutionUnit unit = node.unit();
            policyGate.checkUnit(unit, ctx.manifest());

            // writes always reach the tool
            String key = null;
            if (!node.mutating()) {
                Map<String, Object> cacheInputs = new LinkedHashMap<>();
                cacheInputs.put("params", unit.params());
                cacheInputs.put("deps", deps);
                key = ResultCache.key(planHash, node.id(), cacheInputs,
                        toolClient.schemaVersions(unit.allowedTools()));
                Optional<ResultEnvelope> cached = resultCache.get(key);
                meterRegistry.counter("patina.node.cache", "result", cached.isPresent() ? "hit" : "miss").increment();
                if (cached.isPresent()) {
                    return new Attempt(cached.get(), true);
                }
            }

            ToolScope scope = new ToolScope(ctx.runId(), node.id(), unit.allowedTools(), ctx.manifest(),
                    ctx.rateWindow(), ctx.quota());
            SandboxInvocation invocation = new SandboxInvocation(ctx.runId(), node.id(), attempt,
                    scriptInput(unit, deps), toolClient.bind(scope), ctx.signal());
            ResultEnvelope envelope = engines.execute(unit, invocation);
            if (key != null) {
                resultCache.put(key, envelope);
            }
            return new Attempt(envelope, false);
        }
    }

    /** {@code {"params": ..., "deps": {id: {"summary", "state_updates"}}}} */
    static Map<String, Object> scriptInput(ExecutionUnit unit, Map<String, ResultEnvelope> deps) {
        Map<String, Object> depView = new TreeMap<>();
        deps.forEach((id, env) -> {
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("summary", env == null ? "" : env.summary());
            view.put("state_updates", env == null ? Map.of() : env.stateUpdates());
            depView.put(id, view);
        });
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("params", unit.params());
        input.put("deps", depView);
        return input;
    }

    private static String describe(ResultEnvelope envelope) {
        return envelope.summary().length() + " chars, " + envelope.stateUpdates().size() + " state keys, "
                + envelope.artifacts().size() + " artifacts";
    }
}
