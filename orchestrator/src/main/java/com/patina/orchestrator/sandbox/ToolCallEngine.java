package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.artifact.EnvelopeSizer;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionMetrics;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs TOOL_CALL units: exactly one declared tool call, in the host JVM,
 * with no user code involved. The call still goes through the bound
 * ToolInvoker and therefore through the PolicyGate.
 *
 * <p>Unit params: {@code tool} (URI), {@code args} (object), optional
 * {@code state_key} receiving the tool's data (defaults to the node id).
 */
@Component
public class ToolCallEngine implements SandboxEngine {

    private final EnvelopeSizer envelopeSizer;

    public ToolCallEngine(EnvelopeSizer envelopeSizer) {
        this.envelopeSizer = envelopeSizer;
    }

    @Override
    public EngineKind kind() {
        return EngineKind.TOOL_CALL;
    }

    @Override
    public Set<String> capabilities() {
        return Set.of("*");
    }

    @Override
    public SandboxHealth health() {
        return new SandboxHealth(EngineKind.TOOL_CALL, true, 0, 0, "in-process");
    }

    @Override
    @SuppressWarnings("unchecked")
    public ResultEnvelope execute(ExecutionUnit unit, SandboxInvocation invocation) {
        if (invocation.cancel().isCancelled()) {
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "run cancelled");
        }
        if (!(unit.params().get("tool") instanceof String tool) || tool.isBlank()) {
            throw OrchestratorException.planInvalid("tool call unit without a tool");
        }
        Object rawArgs = unit.params().getOrDefault("args", Map.of());
        if (!(rawArgs instanceof Map<?, ?>)) {
            throw OrchestratorException.planInvalid("tool call args must be an object");
        }
        String stateKey = unit.params().get("state_key") instanceof String key ? key : invocation.nodeId();

        long started = System.nanoTime();
        ToolResult result = invocation.tools().call(tool, (Map<String, Object>) rawArgs);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        Map<String, Object> state = new LinkedHashMap<>();
        state.put(stateKey, result.data());
        ResultEnvelope envelope = new ResultEnvelope("called " + tool, List.of(), state,
                new ExecutionMetrics(elapsedMs, 0, 1, 1));
        return envelopeSizer.fit(envelope, unit.budget().maxOutputBytes());
    }
}
