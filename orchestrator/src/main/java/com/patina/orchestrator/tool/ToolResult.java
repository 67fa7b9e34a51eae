package com.patina.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful reply of a tool server.
 *
 * @param data JSON-compatible value (maps, lists, strings, numbers, booleans, null)
 */
public record ToolResult(
        @JsonProperty("tool")    String tool,
        @JsonProperty("server")  String server,
        @JsonProperty("data")    Object data) {}
