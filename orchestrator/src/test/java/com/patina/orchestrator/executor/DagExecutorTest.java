package com.patina.orchestrator.executor;

import com.patina.orchestrator.cache.ResultCache;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.Constraints;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionMetrics;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.NodeOutcome;
import com.patina.orchestrator.model.NodeSpec;
import com.patina.orchestrator.model.NodeState;
import com.patina.orchestrator.model.Plan;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.model.RunBudget;
import com.patina.orchestrator.model.RunStatus;
import com.patina.orchestrator.model.RunSummary;
import com.patina.orchestrator.model.TraceEntry;
import com.patina.orchestrator.model.TraceEntry.Event;
import com.patina.orchestrator.planner.Planner;
import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.ManifestEntry;
import com.patina.orchestrator.policy.PolicyGate;
import com.patina.orchestrator.reducer.Reducer;
import com.patina.orchestrator.sandbox.SandboxEngineRegistry;
import com.patina.orchestrator.sandbox.SandboxInvocation;
import com.patina.orchestrator.tool.ToolClient;
import com.patina.orchestrator.tool.ToolInvoker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Timeout(30)
class DagExecutorTest {

    CapabilityManifest manifest = CapabilityManifest.of(List.of(ManifestEntry.of("mcp://fs.*")), List.of());

    SandboxEngineRegistry engines    = mock(SandboxEngineRegistry.class);
    ToolClient            toolClient = mock(ToolClient.class);
    Replanner             replanner  = mock(Replanner.class);
    ResultCache           cache      = new ResultCache();
    SimpleMeterRegistry   meters     = new SimpleMeterRegistry();
    Clock                 clock      = Clock.systemUTC();

    /** Node ids in the order the engine saw them. */
    List<String> executed = new CopyOnWriteArrayList<>();

    DagExecutor executor;

    @BeforeEach
    void setUp() {
        when(toolClient.schemaVersions(any())).thenReturn(Map.of());
        when(toolClient.bind(any())).thenReturn(ToolInvoker.none());
        when(replanner.replan(any(), anyString(), anyInt(), anyDouble())).thenReturn(Optional.empty());
        executor = newExecutor(0);
    }

    private DagExecutor newExecutor(long approvalTimeoutMs) {
        return new DagExecutor(engines, new PolicyGate(meters), toolClient, cache, replanner, meters,
                ObservationRegistry.NOOP, clock, approvalTimeoutMs, 5_000);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static NodeSpec work(String id, List<String> deps, boolean idempotent) {
        return NodeSpec.work(id, deps, ExecutionUnit.script("return '" + id + "';", Map.of("node", id),
                List.of(), Budget.defaults()), idempotent, false, null);
    }

    private static Plan plan(NodeSpec... nodes) {
        List<NodeSpec> list = List.of(nodes);
        String hash = Planner.planHash(list);
        return new Plan("plan-" + hash.substring(0, 12), "goal", list, hash, null, null, null);
    }

    private RunContext context(Constraints constraints) {
        return new RunContext("run-test", "goal", constraints, manifest, clock);
    }

    private RunContext context() {
        return context(Constraints.defaults());
    }

    private interface NodeBehaviour {
        ResultEnvelope run(SandboxInvocation invocation, int calls);
    }

    /** Route engine calls by node id; nodes without a behaviour succeed with their id as summary. */
    private void engineDoes(Map<String, NodeBehaviour> behaviours) {
        Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        when(engines.execute(any(), any())).thenAnswer(inv -> {
            SandboxInvocation invocation = inv.getArgument(1);
            String id = invocation.nodeId();
            executed.add(id);
            int n = calls.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();
            NodeBehaviour behaviour = behaviours.get(id);
            if (behaviour == null) {
                return new ResultEnvelope(id, List.of(), Map.of(id + "_done", true), ExecutionMetrics.ZERO);
            }
            return behaviour.run(invocation, n);
        });
    }

    private static List<Event> events(ExecutionReport report, String nodeId) {
        return report.trace().stream().filter(t -> nodeId.equals(t.nodeId())).map(TraceEntry::event).toList();
    }

    private static NodeOutcome outcome(ExecutionReport report, String nodeId) {
        return report.outcomes().stream().filter(o -> o.nodeId().equals(nodeId)).findFirst().orElseThrow();
    }

    // ------------------------------------------------------------------
    // Ordering and state
    // ------------------------------------------------------------------

    @Test
    void run_dependentSeesDependencyStateAndRunsAfterIt() {
        AtomicReference<Map<String, Object>> seenInput = new AtomicReference<>();
        engineDoes(Map.of(
                "a", (inv, n) -> new ResultEnvelope("read 2 files", List.of(), Map.of("files", 2), ExecutionMetrics.ZERO),
                "b", (inv, n) -> {
                    seenInput.set(inv.input());
                    return ResultEnvelope.of("ok");
                }));

        ExecutionReport report = executor.run(context(), plan(work("a", List.of(), false), work("b", List.of("a"), false)));

        assertThat(report.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(executed).containsExactly("a", "b");
        assertThat(outcome(report, "b").completionSeq()).isGreaterThan(outcome(report, "a").completionSeq());
        assertThat(report.state()).containsEntry("files", 2);
        @SuppressWarnings("unchecked")
        Map<String, Object> deps = (Map<String, Object>) seenInput.get().get("deps");
        assertThat(deps.get("a")).isEqualTo(Map.of("summary", "read 2 files", "state_updates", Map.of("files", 2)));
        assertThat(events(report, "a")).containsExactly(Event.DISPATCHED, Event.SUCCEEDED);
        assertThat(report.trace().get(0).event()).isEqualTo(Event.PLANNED);
    }

    @Test
    void run_independentNodesAllRun() {
        engineDoes(Map.of());

        ExecutionReport report = executor.run(context(),
                plan(work("c", List.of(), false), work("a", List.of(), false), work("b", List.of(), false)));

        assertThat(report.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(executed).containsExactlyInAnyOrder("a", "b", "c");
        assertThat(report.state()).containsKeys("a_done", "b_done", "c_done");
    }

    // ------------------------------------------------------------------
    // Retry
    // ------------------------------------------------------------------

    @Test
    void run_idempotentNodeIsRetriedOnceOnRetriableError() {
        engineDoes(Map.of("a", (inv, n) -> {
            if (n == 1) {
                throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.UNAVAILABLE, "server busy");
            }
            return ResultEnvelope.of("second time lucky");
        }));

        ExecutionReport report = executor.run(context(), plan(work("a", List.of(), true)));

        assertThat(report.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(outcome(report, "a").attempts()).isEqualTo(2);
        assertThat(events(report, "a")).containsExactly(Event.DISPATCHED, Event.RETRYING, Event.DISPATCHED,
                Event.SUCCEEDED);
    }

    @Test
    void run_idempotentNodeFailingTwice_isFailed() {
        engineDoes(Map.of("a", (inv, n) -> {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.UNAVAILABLE, "server down");
        }));

        ExecutionReport report = executor.run(context(), plan(work("a", List.of(), true), work("b", List.of("a"), false)));

        assertThat(executed).containsExactly("a", "a");
        assertThat(outcome(report, "a").state()).isEqualTo(NodeState.FAILED);
        assertThat(outcome(report, "b").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
    }

    @Test
    void run_nonIdempotentNodeIsNeverRetried() {
        engineDoes(Map.of("a", (inv, n) -> {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.UNAVAILABLE, "server busy");
        }));

        ExecutionReport report = executor.run(context(), plan(work("a", List.of(), false)));

        assertThat(executed).containsExactly("a");
        assertThat(outcome(report, "a").state()).isEqualTo(NodeState.FAILED);
        assertThat(outcome(report, "a").error().code()).isEqualTo(ErrorCodes.UNAVAILABLE);
    }

    @Test
    void run_nonRetriableToolCode_isNotRetried() {
        engineDoes(Map.of("a", (inv, n) -> {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.NOT_FOUND, "gone");
        }));

        executor.run(context(), plan(work("a", List.of(), true)));

        assertThat(executed).containsExactly("a");
    }

    // ------------------------------------------------------------------
    // Cache
    // ------------------------------------------------------------------

    @Test
    void run_secondRunOfSamePlanIsServedFromCache() {
        engineDoes(Map.of());
        Plan plan = plan(work("a", List.of(), false), work("b", List.of("a"), false));

        ExecutionReport first = executor.run(context(), plan);
        ExecutionReport second = executor.run(context(), plan);

        assertThat(executed).containsExactly("a", "b");
        assertThat(outcome(second, "a").fromCache()).isTrue();
        assertThat(events(second, "b")).contains(Event.CACHE_HIT);
        assertThat(second.state()).isEqualTo(first.state());
        assertThat(meters.get("patina.node.cache").tag("result", "hit").counter().count()).isEqualTo(2);
    }

    @Test
    void run_freshExecutionsOfSamePlan_reduceToSameSummaryHash() {
        engineDoes(Map.of("list", (invocation, calls) -> new ResultEnvelope("3 files", List.of(),
                Map.of("files", List.of("a.txt", "b.txt", "c.txt")), ExecutionMetrics.ZERO)));
        Plan plan = fetchThenSummarise("mcp://fs.list");
        Reducer reducer = new Reducer(4000);

        RunSummary first = reducer.reduce("run-test", "goal", executor.run(context(), plan));
        cache.clear();
        RunSummary second = reducer.reduce("run-test", "goal", newExecutor(0).run(context(), plan));

        assertThat(executed).containsExactly("list", "summarise", "list", "summarise");
        assertThat(second.summary()).isEqualTo(first.summary());
        assertThat(second.summaryHash()).isEqualTo(first.summaryHash());
    }

    // ------------------------------------------------------------------
    // Policy and approvals
    // ------------------------------------------------------------------

    /** list (tool call) -> summarise (script, depends on list). */
    private static Plan fetchThenSummarise(String listTool) {
        NodeSpec list = NodeSpec.work("list", List.of(), ExecutionUnit.toolCall(listTool, Map.of("dir", "/data"),
                "files", Budget.defaults()), true, false, null);
        return plan(list, work("summarise", List.of("list"), false));
    }

    @Test
    void run_deniedToolOnUpstreamNode_skipsItsDependent() {
        engineDoes(Map.of());

        ExecutionReport report = executor.run(context(), fetchThenSummarise("mcp://net.fetch"));

        assertThat(executed).isEmpty();
        assertThat(outcome(report, "list").error().is(ErrorKind.POLICY, ErrorCodes.CAPABILITY_DENIED)).isTrue();
        assertThat(outcome(report, "summarise").state()).isEqualTo(NodeState.SKIPPED);
    }

    @Test
    void run_unitWithUngrantedTool_failsWithoutEngineOrReplan() {
        NodeSpec shell = NodeSpec.work("sh", List.of(), ExecutionUnit.script("return 1;", Map.of(),
                List.of("mcp://shell.exec"), Budget.defaults()), true, false, null);
        engineDoes(Map.of());

        ExecutionReport report = executor.run(context(), plan(shell));

        assertThat(executed).isEmpty();
        assertThat(outcome(report, "sh").error().is(ErrorKind.POLICY, ErrorCodes.CAPABILITY_DENIED)).isTrue();
        verify(replanner, never()).replan(any(), anyString(), anyInt(), anyDouble());
    }

    private Plan gatedWrite() {
        NodeSpec write = NodeSpec.work("w", List.of("approve-w"), ExecutionUnit.script("return 'written';",
                Map.of(), List.of(), Budget.defaults()), false, true, null);
        return plan(NodeSpec.approval("approve-w", List.of(), "approve writes of w"), write);
    }

    private static Thread decideWhenExpected(RunContext ctx, String nodeId, boolean approved) {
        Thread operator = new Thread(() -> {
            try {
                while (!ctx.approvals().decide(nodeId, approved)) {
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        operator.start();
        return operator;
    }

    @Test
    void run_approvedWrite_runs() throws Exception {
        engineDoes(Map.of());
        RunContext ctx = context();
        Thread operator = decideWhenExpected(ctx, "approve-w", true);

        ExecutionReport report = executor.run(ctx, gatedWrite());
        operator.join();

        assertThat(report.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(executed).containsExactly("w");
        assertThat(events(report, "approve-w")).containsExactly(Event.AWAITING_APPROVAL, Event.SUCCEEDED);
    }

    @Test
    void run_approvedWriteInEveryRun_reachesEngineEveryTime() throws Exception {
        engineDoes(Map.of());

        for (int i = 0; i < 2; i++) {
            RunContext ctx = context();
            Thread operator = decideWhenExpected(ctx, "approve-w", true);
            ExecutionReport report = executor.run(ctx, gatedWrite());
            operator.join();

            assertThat(outcome(report, "w").fromCache()).isFalse();
        }

        assertThat(executed).containsExactly("w", "w");
        assertThat(cache.size()).isZero();
    }

    @Test
    void run_rejectedWrite_isSkipped() throws Exception {
        engineDoes(Map.of());
        RunContext ctx = context();
        Thread operator = decideWhenExpected(ctx, "approve-w", false);

        ExecutionReport report = executor.run(ctx, gatedWrite());
        operator.join();

        assertThat(executed).isEmpty();
        NodeOutcome approval = outcome(report, "approve-w");
        assertThat(approval.error().is(ErrorKind.POLICY, ErrorCodes.WRITE_NOT_APPROVED)).isTrue();
        assertThat(outcome(report, "w").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
    }

    @Test
    void run_undecidedApproval_timesOut() {
        engineDoes(Map.of());

        ExecutionReport report = newExecutor(200).run(context(), gatedWrite());

        assertThat(outcome(report, "approve-w").error().message()).contains("no approval within");
        assertThat(outcome(report, "w").state()).isEqualTo(NodeState.SKIPPED);
    }

    // ------------------------------------------------------------------
    // Run limits and cancellation
    // ------------------------------------------------------------------

    @Test
    void run_nodeBudgetExhausted_abortsWithRunLimit() {
        engineDoes(Map.of());
        Constraints constraints = Constraints.defaults().withRunBudget(new RunBudget(1, 60_000, 10, 2));

        ExecutionReport report = executor.run(context(constraints),
                plan(work("a", List.of(), false), work("b", List.of("a"), false)));

        assertThat(report.status()).isEqualTo(RunStatus.FAILED);
        assertThat(report.terminatingError().is(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT)).isTrue();
        assertThat(outcome(report, "a").state()).isEqualTo(NodeState.SUCCEEDED);
        assertThat(outcome(report, "b").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(report.trace()).extracting(TraceEntry::event).contains(Event.RUN_ABORTED);
    }

    @Test
    void run_toolQuotaSpent_blocksToolUsingNodes() {
        engineDoes(Map.of());
        NodeSpec reader = NodeSpec.work("r", List.of(), ExecutionUnit.script("return 1;", Map.of(),
                List.of("mcp://fs.read"), Budget.defaults()), false, false, null);
        Constraints constraints = Constraints.defaults().withRunBudget(new RunBudget(10, 60_000, 0, 2));

        ExecutionReport report = executor.run(context(constraints), plan(reader));

        assertThat(executed).isEmpty();
        assertThat(report.terminatingError().is(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT)).isTrue();
    }

    @Test
    void run_runWallClockExhausted_abortsWithRunLimit() {
        engineDoes(Map.of("slow", (inv, n) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ResultEnvelope.of("late");
        }));
        Constraints constraints = Constraints.defaults().withRunBudget(new RunBudget(10, 300, 10, 2));

        ExecutionReport report = executor.run(context(constraints), plan(work("slow", List.of(), false)));

        assertThat(report.terminatingError().is(ErrorKind.BUDGET, ErrorCodes.RUN_LIMIT)).isTrue();
        assertThat(outcome(report, "slow").state()).isEqualTo(NodeState.SKIPPED);
    }

    @Test
    void run_cancel_skipsOpenNodesAndEndsCancelled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        engineDoes(Map.of("a", (inv, n) -> {
            started.countDown();
            CountDownLatch cancelled = new CountDownLatch(1);
            inv.cancel().onCancel(cancelled::countDown);
            try {
                cancelled.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "run cancelled");
        }));
        RunContext ctx = context();
        Thread operator = new Thread(() -> {
            try {
                started.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ctx.cancel();
        });
        operator.start();

        ExecutionReport report = executor.run(ctx, plan(work("a", List.of(), false), work("b", List.of("a"), false)));
        operator.join();

        assertThat(report.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(outcome(report, "a").state()).isIn(NodeState.SKIPPED, NodeState.FAILED);
        assertThat(outcome(report, "b").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(report.trace()).extracting(TraceEntry::event).contains(Event.CANCELLED);
    }

    // ------------------------------------------------------------------
    // Re-planning
    // ------------------------------------------------------------------

    @Test
    void run_failedNodeIsReplacedBySuccessorPlan() {
        engineDoes(Map.of("a", (inv, n) -> {
            throw OrchestratorException.of(ErrorKind.CODE, ErrorCodes.RUNTIME_ERROR, "TypeError: x is undefined");
        }));
        Plan original = plan(work("a", List.of(), false), work("b", List.of("a"), false));
        NodeSpec replacement = work("a-r2", List.of(), false);
        String hash = Planner.planHash(List.of(replacement));
        Plan successor = new Plan("plan-" + hash.substring(0, 12), "goal", List.of(replacement), hash,
                null, original.planId(), Map.of("a", List.of("a-r2")));
        when(replanner.replan(any(), eq("a"), eq(0), anyDouble())).thenReturn(Optional.of(successor));

        ExecutionReport report = executor.run(context(), original);

        assertThat(executed).containsExactly("a", "a-r2");
        assertThat(report.plans()).extracting(Plan::planId).containsExactly(original.planId(), successor.planId());
        assertThat(report.superseded()).containsExactlyInAnyOrder("a", "b");
        assertThat(outcome(report, "b").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(outcome(report, "a-r2").state()).isEqualTo(NodeState.SUCCEEDED);
        assertThat(report.status()).isEqualTo(RunStatus.SUCCEEDED);
        assertThat(events(report, "a")).contains(Event.REPLANNED);
    }

    @Test
    void run_noSuccessor_skipsDependents() {
        engineDoes(Map.of("a", (inv, n) -> {
            throw OrchestratorException.of(ErrorKind.CODE, ErrorCodes.RUNTIME_ERROR, "boom");
        }));

        ExecutionReport report = executor.run(context(),
                plan(work("a", List.of(), false), work("b", List.of("a"), false), work("c", List.of(), false)));

        verify(replanner).replan(any(), eq("a"), eq(0), anyDouble());
        assertThat(outcome(report, "b").state()).isEqualTo(NodeState.SKIPPED);
        assertThat(outcome(report, "c").state()).isEqualTo(NodeState.SUCCEEDED);
        assertThat(report.status()).isEqualTo(RunStatus.PARTIAL);
    }
}
