package com.patina.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.error.Redactor;
import com.patina.orchestrator.model.Constraints;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.OrchestratorError;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API, used by the planner.
 *
 * Only created when {@code anthropic.api-key} is set; without it, runs must
 * supply a pre-structured plan draft.
 *
 * Raw HttpClient instead of an SDK: the endpoint is a plain REST call and
 * every header on the wire stays visible.
 */
@Component
@ConditionalOnProperty(prefix = "anthropic", name = "api-key")
public class ClaudeClient implements CompletionClient {

    /** A single message; role is "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        /** Text of the first text block. */
        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No text block in response"));
        }
    }

    private static final String API_URL = "https://api.anthropic.com/v1/messages";
    private static final String API_VER = "2023-06-01";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       model;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        @Value("${anthropic.model:claude-sonnet-4-5}") String model,
                        ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.model  = model;
        this.json   = objectMapper;
        this.http   = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, Constraints constraints) {
        int maxTokens = Math.max(256, constraints.budget().tokenCap());
        return complete(model, systemPrompt, List.of(new Message("user", userPrompt)), maxTokens);
    }

    /**
     * One Messages API call.
     *
     * @return the assistant's text content
     * @throws ClaudeApiException on a non-200 reply
     */
    public String complete(String model, String systemPrompt, List<Message> messages, int maxTokens) {
        try {
            String requestBody = json.writeValueAsString(Map.of(
                    "model",      model,
                    "max_tokens", maxTokens,
                    "system",     systemPrompt,
                    "messages",   messages
            ));

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(Duration.ofSeconds(60))
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }
            return json.readValue(response.body(), MessagesResponse.class).firstText();

        } catch (ClaudeApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.CANCELLED, "planning interrupted");
        } catch (Exception e) {
            throw OrchestratorException.retriable(ErrorKind.TOOL, ErrorCodes.UNAVAILABLE,
                    "Claude API call failed: " + e.getMessage());
        }
    }

    public static class ClaudeApiException extends OrchestratorException {
        private final int statusCode;

        public ClaudeApiException(int statusCode, String body) {
            super(OrchestratorError.of(ErrorKind.TOOL,
                    statusCode == 429 || statusCode >= 500 ? ErrorCodes.UNAVAILABLE : ErrorCodes.INVALID_ARGUMENT,
                    Redactor.defaultRules()
                            .redact("Claude API error %d: %s".formatted(statusCode, body))));
            this.statusCode = statusCode;
        }

        public int statusCode() { return statusCode; }
    }
}
