package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Typed error recorded against a node or a run.
 *
 * The message is always redacted before it is stored here, so it is safe to
 * render directly to an operator. Raw tool payloads, secrets and script
 * source never end up in this record.
 *
 * @param kind      top-level category
 * @param code      stable machine-readable code, e.g. "CAPABILITY_DENIED" or "CPU_LIMIT"
 * @param retriable whether a retry may succeed (only meaningful for TOOL errors)
 * @param message   redacted, human-readable detail
 */
public record OrchestratorError(
        @JsonProperty("kind")      ErrorKind kind,
        @JsonProperty("code")      String    code,
        @JsonProperty("retriable") boolean   retriable,
        @JsonProperty("message")   String    message) {

    public static OrchestratorError of(ErrorKind kind, String code, String message) {
        return new OrchestratorError(kind, code, false, message);
    }

    public static OrchestratorError retriable(ErrorKind kind, String code, String message) {
        return new OrchestratorError(kind, code, true, message);
    }

    /** "KIND/CODE", the form used in traces and summaries. */
    @JsonIgnore
    public String label() {
        return kind + "/" + code;
    }

    public boolean is(ErrorKind kind, String code) {
        return this.kind == kind && this.code.equals(code);
    }
}
