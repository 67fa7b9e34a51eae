package com.patina.orchestrator.tool;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;

import java.util.Map;

/**
 * A tool client bound to one unit's scope. Handed to sandbox engines; the
 * only way sandboxed code reaches a tool.
 */
@FunctionalInterface
public interface ToolInvoker {

    ToolResult call(String toolUri, Map<String, Object> args);

    /** An invoker that refuses every call; for units with no tools. */
    static ToolInvoker none() {
        return (uri, args) -> {
            throw OrchestratorException.policy(ErrorCodes.CAPABILITY_DENIED,
                    uri + " is not in the unit's allowed tools");
        };
    }
}
