package com.patina.orchestrator.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * JSON-over-HTTP access to tool servers.
 *
 * <pre>
 *   POST {base}/tools/invoke          {"tool": uri, "args": {...}}  -> {"data": ...}
 *   GET  {base}/tools/schema?tool=uri                               -> ToolSchema
 *   error body                        {"code": "...", "message": "...", "retriable": bool}
 * </pre>
 *
 * Uses java.net.http.HttpClient directly, like the Claude client, so every
 * header on the wire is explicit. Request and response bodies are never logged.
 */
@Component
public class HttpToolTransport implements ToolTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpToolTransport.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Duration     requestTimeout;

    public HttpToolTransport(ObjectMapper objectMapper,
                             @Value("${patina.tools.request-timeout-ms:30000}") long requestTimeoutMs) {
        this.json           = objectMapper;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ToolResult invoke(ToolServer server, String toolUri, Map<String, Object> args, String accessToken) {
        String body = toJson(Map.of("tool", toolUri, "args", args == null ? Map.of() : args));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(server.baseUrl() + "/tools/invoke"))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + accessToken)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        JsonNode reply = send(request, toolUri);
        try {
            Object data = json.treeToValue(reply.get("data"), Object.class);
            return new ToolResult(toolUri, server.name(), data);
        } catch (JsonProcessingException e) {
            throw OrchestratorException.of(ErrorKind.TOOL, ErrorCodes.BAD_RESPONSE,
                    "unreadable reply from " + server.name() + " for " + toolUri);
        }
    }

    @Override
    public ToolSchema fetchSchema(ToolServer server, String toolUri, String accessToken) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(server.baseUrl() + "/tools/schema?tool="
                        + URLEncoder.encode(toolUri, StandardCharsets.UTF_8)))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + accessToken)
                .GET()
                .build();
        JsonNode reply = send(request, toolUri);
        try {
            ToolSchema schema = json.treeToValue(reply, ToolSchema.class);
            log.info("Fetched schema for {} from {} v{}", toolUri, server.name(), schema.version());
            return schema;
        } catch (JsonProcessingException e) {
            throw OrchestratorException.of(ErrorKind.TOOL, ErrorCodes.BAD_RESPONSE,
                    "unreadable schema from " + server.name() + " for " + toolUri);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private JsonNode send(HttpRequest request, String toolUri) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.TIMEOUT,
                    "tool server timed out for " + toolUri);
        } catch (IOException e) {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.UNAVAILABLE,
                    "tool server unreachable for " + toolUri + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED,
                    "interrupted while calling " + toolUri);
        }

        JsonNode body = parse(response.body());
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return body;
        }
        throw upstreamError(status, body, toolUri);
    }

    private OrchestratorException upstreamError(int status, JsonNode body, String toolUri) {
        String code = body.hasNonNull("code") ? body.get("code").asText() : defaultCode(status);
        String message = body.hasNonNull("message") ? body.get("message").asText() : "HTTP " + status;
        boolean retriable = body.has("retriable")
                ? body.get("retriable").asBoolean()
                : status == 429 || status >= 500;
        if (ErrorCodes.NON_RETRIABLE_TOOL_CODES.contains(code)) {
            retriable = false;
        }
        String detail = toolUri + ": " + message;
        return retriable
                ? OrchestratorException.retriable(ErrorKind.TOOL, code, detail)
                : OrchestratorException.of(ErrorKind.TOOL, code, detail);
    }

    private static String defaultCode(int status) {
        return switch (status) {
            case 400, 422 -> ErrorCodes.INVALID_ARGUMENT;
            case 401 -> ErrorCodes.UNAUTHORIZED;
            case 403 -> ErrorCodes.FORBIDDEN;
            case 404 -> ErrorCodes.NOT_FOUND;
            case 408, 504 -> ErrorCodes.TIMEOUT;
            default -> ErrorCodes.UNAVAILABLE;
        };
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return json.createObjectNode();
        }
        try {
            return json.readTree(body);
        } catch (JsonProcessingException e) {
            return json.createObjectNode();
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw OrchestratorException.of(ErrorKind.TOOL, ErrorCodes.INVALID_ARGUMENT,
                    "tool arguments are not serializable: " + e.getOriginalMessage());
        }
    }
}
