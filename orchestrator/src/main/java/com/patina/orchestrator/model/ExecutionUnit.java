package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One unit of sandboxed work, owned by exactly one NodeSpec.
 *
 * @param engine       engine variant that must run the unit
 * @param code         script body for SCRIPT units; ignored by TOOL_CALL units
 * @param params       parameter mapping handed to the script as {@code input.params}
 * @param allowedTools tool URIs this unit may call; a subset of the manifest's grants
 * @param budget       per-node resource ceiling
 */
public record ExecutionUnit(
        @JsonProperty("engine")        EngineKind          engine,
        @JsonProperty("code")          String              code,
        @JsonProperty("params")        Map<String, Object> params,
        @JsonProperty("allowed_tools") List<String>        allowedTools,
        @JsonProperty("budget")        Budget              budget) {

    public ExecutionUnit {
        if (engine == null) {
            throw new IllegalArgumentException("engine is required");
        }
        params       = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        budget       = budget == null ? Budget.defaults() : budget;
    }

    public static ExecutionUnit script(String code, Map<String, Object> params,
                                       List<String> allowedTools, Budget budget) {
        return new ExecutionUnit(EngineKind.SCRIPT, code, params, allowedTools, budget);
    }

    /** A unit whose only effect is one call of {@code toolUri} with {@code args}. */
    public static ExecutionUnit toolCall(String toolUri, Map<String, Object> args,
                                         String stateKey, Budget budget) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("tool", toolUri);
        params.put("args", args == null ? Map.of() : args);
        if (stateKey != null) {
            params.put("state_key", stateKey);
        }
        return new ExecutionUnit(EngineKind.TOOL_CALL, null, params, List.of(toolUri), budget);
    }

    public ExecutionUnit withBudget(Budget newBudget) {
        return new ExecutionUnit(engine, code, params, allowedTools, newBudget);
    }

    public ExecutionUnit withAllowedTools(List<String> tools) {
        return new ExecutionUnit(engine, code, params, tools, budget);
    }
}
