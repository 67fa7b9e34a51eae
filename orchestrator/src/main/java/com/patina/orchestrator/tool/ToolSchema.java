package com.patina.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Versioned description of one tool, as published by its server.
 *
 * @param writeFields external fields a call of this tool writes; each needs a
 *                    {@code write:<field>} grant in the manifest
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolSchema(
        @JsonProperty("tool")         String              tool,
        @JsonProperty("version")      String              version,
        @JsonProperty("description")  String              description,
        @JsonProperty("input_schema") Map<String, Object> inputSchema,
        @JsonProperty("write_fields") List<String>        writeFields) {

    public ToolSchema {
        inputSchema = inputSchema == null ? Map.of() : inputSchema;
        writeFields = writeFields == null ? List.of() : List.copyOf(writeFields);
    }

    public static ToolSchema readOnly(String tool, String version) {
        return new ToolSchema(tool, version, null, Map.of(), List.of());
    }
}
