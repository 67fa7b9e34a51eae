package com.patina.orchestrator.api;

import com.patina.orchestrator.api.dto.ErrorResponse;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.error.Redactor;
import com.patina.orchestrator.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Renders errors as {@code {kind, code, retriable, message}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> orchestrator(OrchestratorException e) {
        log.warn("Request failed: {}", e.getMessage());
        return ResponseEntity.status(statusFor(e.getKind(), e.getCode())).body(ErrorResponse.from(e.getError()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException e) {
        String code = e.getStatusCode().value() == 404 ? ErrorCodes.NOT_FOUND : ErrorCodes.INVALID_ARGUMENT;
        return ResponseEntity.status(e.getStatusCode()).body(new ErrorResponse("REQUEST", code, false,
                Redactor.defaultRules().redact(e.getReason())));
    }

    static HttpStatus statusFor(ErrorKind kind, String code) {
        if (ErrorCodes.MANIFEST_MISSING.equals(code) || ErrorCodes.MANIFEST_INVALID.equals(code)
                || ErrorCodes.ENGINE_UNAVAILABLE.equals(code)) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return switch (kind) {
            case POLICY -> HttpStatus.FORBIDDEN;
            case CODE   -> HttpStatus.UNPROCESSABLE_ENTITY;
            case BUDGET -> HttpStatus.TOO_MANY_REQUESTS;
            case TOOL, SANDBOX -> HttpStatus.BAD_GATEWAY;
        };
    }
}
