package com.patina.orchestrator.tool;

import java.util.Map;

/**
 * Wire access to tool servers. Implementations throw
 * {@link com.patina.orchestrator.error.OrchestratorException} of kind TOOL on failure.
 */
public interface ToolTransport {

    ToolResult invoke(ToolServer server, String toolUri, Map<String, Object> args, String accessToken);

    ToolSchema fetchSchema(ToolServer server, String toolUri, String accessToken);
}
