package com.patina.orchestrator.api.dto;

import com.patina.orchestrator.model.RunStatus;
import com.patina.orchestrator.service.Orchestrator.RunHandle;

/**
 * Response body for POST /runs and POST /runs/{id}/cancel.
 */
public record RunResponse(String runId, RunStatus status) {

    public static RunResponse from(RunHandle handle) {
        return new RunResponse(handle.runId(), handle.status());
    }
}
