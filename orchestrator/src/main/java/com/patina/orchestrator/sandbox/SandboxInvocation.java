package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.tool.ToolInvoker;

import java.util.Map;

/**
 * Per-execution context handed to an engine.
 *
 * @param input  {@code {"params": ..., "deps": {depId: {"summary", "state_updates"}}}}
 * @param tools  tool client bound to the unit's allowed tools; the only way out of the sandbox
 * @param cancel fires when the run is cancelled
 */
public record SandboxInvocation(
        String              runId,
        String              nodeId,
        int                 attempt,
        Map<String, Object> input,
        ToolInvoker         tools,
        CancellationSignal  cancel) {

    public SandboxInvocation {
        input  = input == null ? Map.of() : input;
        tools  = tools == null ? ToolInvoker.none() : tools;
        cancel = cancel == null ? new CancellationSignal() : cancel;
    }
}
