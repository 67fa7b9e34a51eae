package com.patina.orchestrator.api.dto;

import com.patina.orchestrator.model.OrchestratorError;

/**
 * Error body of every failed request. {@code message} is already redacted.
 */
public record ErrorResponse(String kind, String code, boolean retriable, String message) {

    public static ErrorResponse from(OrchestratorError error) {
        return new ErrorResponse(error.kind().name(), error.code(), error.retriable(), error.message());
    }
}
