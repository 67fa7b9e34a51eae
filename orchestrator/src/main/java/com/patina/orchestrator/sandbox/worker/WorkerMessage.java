package com.patina.orchestrator.sandbox.worker;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.ExecutionMetrics;
import com.patina.orchestrator.model.OrchestratorError;

import java.util.Map;

/**
 * One line of the newline-delimited JSON protocol between the engine and a worker.
 *
 * <pre>
 *   parent -> worker   run          {code, input, budget}
 *   worker -> parent   tool_call    {id, tool, args}
 *   parent -> worker   tool_result  {id, data}
 *   parent -> worker   tool_error   {id, error}
 *   worker -> parent   result       {result, metrics}
 *   worker -> parent   error        {error, metrics}
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerMessage(
        @JsonProperty("type")    String              type,
        @JsonProperty("id")      String              id,
        @JsonProperty("code")    String              code,
        @JsonProperty("input")   Map<String, Object> input,
        @JsonProperty("budget")  Budget              budget,
        @JsonProperty("tool")    String              tool,
        @JsonProperty("args")    Map<String, Object> args,
        @JsonProperty("data")    Object              data,
        @JsonProperty("result")  Map<String, Object> result,
        @JsonProperty("error")   OrchestratorError   error,
        @JsonProperty("metrics") ExecutionMetrics    metrics) {

    public static final String RUN         = "run";
    public static final String TOOL_CALL   = "tool_call";
    public static final String TOOL_RESULT = "tool_result";
    public static final String TOOL_ERROR  = "tool_error";
    public static final String RESULT      = "result";
    public static final String ERROR       = "error";

    public static WorkerMessage run(String code, Map<String, Object> input, Budget budget) {
        return new WorkerMessage(RUN, null, code, input, budget, null, null, null, null, null, null);
    }

    public static WorkerMessage toolCall(String id, String tool, Map<String, Object> args) {
        return new WorkerMessage(TOOL_CALL, id, null, null, null, tool, args, null, null, null, null);
    }

    public static WorkerMessage toolResult(String id, Object data) {
        return new WorkerMessage(TOOL_RESULT, id, null, null, null, null, null, data, null, null, null);
    }

    public static WorkerMessage toolError(String id, OrchestratorError error) {
        return new WorkerMessage(TOOL_ERROR, id, null, null, null, null, null, null, null, error, null);
    }

    public static WorkerMessage result(Map<String, Object> result, ExecutionMetrics metrics) {
        return new WorkerMessage(RESULT, null, null, null, null, null, null, null, result, null, metrics);
    }

    public static WorkerMessage error(OrchestratorError error, ExecutionMetrics metrics) {
        return new WorkerMessage(ERROR, null, null, null, null, null, null, null, null, error, metrics);
    }

    public boolean is(String expectedType) {
        return expectedType.equals(type);
    }
}
