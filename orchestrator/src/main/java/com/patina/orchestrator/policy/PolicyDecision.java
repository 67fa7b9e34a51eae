package com.patina.orchestrator.policy;

import com.patina.orchestrator.error.ErrorCodes;

/**
 * Outcome of {@link PolicyGate#decide}.
 *
 * @param code POLICY error code for denials, null when allowed
 */
public record PolicyDecision(boolean allowed, String reason, String code) {

    public static PolicyDecision allow(String reason) {
        return new PolicyDecision(true, reason, null);
    }

    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, reason, ErrorCodes.CAPABILITY_DENIED);
    }

    public static PolicyDecision rateLimited(String reason) {
        return new PolicyDecision(false, reason, ErrorCodes.RATE_LIMITED);
    }
}
