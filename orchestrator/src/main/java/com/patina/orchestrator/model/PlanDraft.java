package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Unshaped plan, either written by the completion client inside a
 * {@code <plan>} tag or supplied directly by an automation caller.
 * The planner turns it into a validated Plan.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlanDraft(@JsonProperty("steps") List<Step> steps) {

    public PlanDraft {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * One proposed step. A step with a {@code tool} and no {@code code}
     * becomes a TOOL_CALL unit; everything else is a SCRIPT unit.
     *
     * @param tools    tool URIs a script step may call
     * @param stateKey for tool steps: state key receiving the tool's data
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Step(
            @JsonProperty("id")          String              id,
            @JsonProperty("description") String              description,
            @JsonProperty("depends_on")  List<String>        dependsOn,
            @JsonProperty("code")        String              code,
            @JsonProperty("tool")        String              tool,
            @JsonProperty("args")        Map<String, Object> args,
            @JsonProperty("state_key")   String              stateKey,
            @JsonProperty("params")      Map<String, Object> params,
            @JsonProperty("tools")       List<String>        tools,
            @JsonProperty("idempotent")  boolean             idempotent,
            @JsonProperty("mutating")    boolean             mutating,
            @JsonProperty("budget")      Budget              budget) {

        public Step {
            dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
            tools     = tools == null ? List.of() : List.copyOf(tools);
            args      = args == null ? Map.of() : args;
            params    = params == null ? Map.of() : params;
        }

        @JsonIgnore
        public boolean isToolCall() {
            return tool != null && !tool.isBlank() && (code == null || code.isBlank());
        }

        /** A script step with no tools and no external writes. */
        @JsonIgnore
        public boolean isPureTransform() {
            return !isToolCall() && tools.isEmpty() && !mutating;
        }

        public static Step script(String id, String code, List<String> dependsOn, List<String> tools) {
            return new Step(id, null, dependsOn, code, null, null, null, null, tools, false, false, null);
        }

        public static Step toolCall(String id, String tool, Map<String, Object> args, String stateKey,
                                    List<String> dependsOn) {
            return new Step(id, null, dependsOn, null, tool, args, stateKey, null, null, true, false, null);
        }

        public Step idempotent(boolean value) {
            return new Step(id, description, dependsOn, code, tool, args, stateKey, params, tools,
                    value, mutating, budget);
        }

        public Step mutating(boolean value) {
            return new Step(id, description, dependsOn, code, tool, args, stateKey, params, tools,
                    idempotent, value, budget);
        }

        public Step withBudget(Budget value) {
            return new Step(id, description, dependsOn, code, tool, args, stateKey, params, tools,
                    idempotent, mutating, value);
        }

        public Step withTools(List<String> value) {
            return new Step(id, description, dependsOn, code, tool, args, stateKey, params, value,
                    idempotent, mutating, budget);
        }
    }
}
