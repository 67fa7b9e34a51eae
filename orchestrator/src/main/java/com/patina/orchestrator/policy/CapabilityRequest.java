package com.patina.orchestrator.policy;

import java.util.Set;

/**
 * A question put to the PolicyGate: may this tool be used, writing these fields?
 *
 * @param consumeRate false for static checks that must not spend the run's rate budget
 */
public record CapabilityRequest(String toolUri, Set<String> writeFields, boolean consumeRate) {

    public CapabilityRequest {
        writeFields = writeFields == null ? Set.of() : Set.copyOf(writeFields);
    }

    public static CapabilityRequest staticCheck(String toolUri) {
        return new CapabilityRequest(toolUri, Set.of(), false);
    }

    public static CapabilityRequest call(String toolUri) {
        return new CapabilityRequest(toolUri, Set.of(), true);
    }

    public static CapabilityRequest write(String toolUri, Set<String> fields) {
        return new CapabilityRequest(toolUri, fields, false);
    }
}
