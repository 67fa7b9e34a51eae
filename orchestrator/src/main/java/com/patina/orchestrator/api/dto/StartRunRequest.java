package com.patina.orchestrator.api.dto;

import com.patina.orchestrator.model.Constraints;

/**
 * Request body for POST /runs.
 *
 * Required: goal
 * Optional: constraints; omitted fields take their defaults. Without a
 *   configured completion client, constraints.draft must carry the plan.
 */
public record StartRunRequest(String goal, Constraints constraints) {

    public StartRunRequest {
        if (constraints == null) constraints = Constraints.defaults();
    }
}
