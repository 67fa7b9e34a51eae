package com.patina.orchestrator.executor;

import com.patina.orchestrator.model.Constraints;
import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.RunRateWindow;
import com.patina.orchestrator.sandbox.CancellationSignal;
import com.patina.orchestrator.tool.ToolCallQuota;

import java.time.Clock;

/**
 * Everything one run owns: its manifest and constraints (passed in
 * explicitly, never read from global configuration), its rate window and
 * tool call quota, the approval gate, the cancellation signal and the
 * mutable {@link RunState}.
 */
public class RunContext {

    private final String             runId;
    private final String             goal;
    private final Constraints        constraints;
    private final CapabilityManifest manifest;
    private final RunRateWindow      rateWindow;
    private final ToolCallQuota      quota;
    private final ApprovalGate       approvals = new ApprovalGate();
    private final CancellationSignal cancel    = new CancellationSignal();
    private final RunState           state;

    private volatile boolean cancelRequested;

    public RunContext(String runId, String goal, Constraints constraints, CapabilityManifest manifest, Clock clock) {
        this.runId       = runId;
        this.goal        = goal;
        this.constraints = constraints;
        this.manifest    = manifest;
        this.rateWindow  = new RunRateWindow(clock);
        this.quota       = new ToolCallQuota(constraints.runBudget().maxToolCalls());
        this.state       = new RunState(clock);
    }

    /** Operator cancellation: the executor notices it on its next loop turn. */
    public void cancel() {
        cancelRequested = true;
        cancel.cancel();
    }

    public boolean isCancelled() {
        return cancelRequested;
    }

    public String runId()                  { return runId; }
    public String goal()                   { return goal; }
    public Constraints constraints()       { return constraints; }
    public CapabilityManifest manifest()   { return manifest; }
    public RunRateWindow rateWindow()      { return rateWindow; }
    public ToolCallQuota quota()           { return quota; }
    public ApprovalGate approvals()        { return approvals; }
    public CancellationSignal signal()     { return cancel; }
    public RunState state()                { return state; }
}
