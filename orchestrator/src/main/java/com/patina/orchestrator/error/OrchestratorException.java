package com.patina.orchestrator.error;

import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.OrchestratorError;

/**
 * Thrown when planning, policy, a sandbox engine or a tool call fails in a
 * way the executor records against a node or a run.
 *
 * Unchecked so callers only catch it where they have a recovery strategy;
 * everything else propagates to the executor's completion path.
 * The message is redacted on construction.
 */
public class OrchestratorException extends RuntimeException {

    private final OrchestratorError error;

    public OrchestratorException(OrchestratorError error) {
        super("[" + error.label() + "] " + error.message());
        this.error = error;
    }

    public OrchestratorException(OrchestratorError error, Throwable cause) {
        super("[" + error.label() + "] " + error.message(), cause);
        this.error = error;
    }

    public static OrchestratorException of(ErrorKind kind, String code, String message) {
        return new OrchestratorException(
                OrchestratorError.of(kind, code, Redactor.defaultRules().redact(message)));
    }

    public static OrchestratorException of(ErrorKind kind, String code, String message, Throwable cause) {
        return new OrchestratorException(
                OrchestratorError.of(kind, code, Redactor.defaultRules().redact(message)), cause);
    }

    public static OrchestratorException retriable(ErrorKind kind, String code, String message) {
        return new OrchestratorException(
                OrchestratorError.retriable(kind, code, Redactor.defaultRules().redact(message)));
    }

    public static OrchestratorException policy(String code, String message) {
        return of(ErrorKind.POLICY, code, message);
    }

    public static OrchestratorException budget(String code, String message) {
        return of(ErrorKind.BUDGET, code, message);
    }

    public static OrchestratorException planInvalid(String message) {
        return of(ErrorKind.CODE, ErrorCodes.PLAN_INVALID, message);
    }

    public OrchestratorError getError() { return error; }

    public ErrorKind getKind() { return error.kind(); }

    public String getCode() { return error.code(); }
}
