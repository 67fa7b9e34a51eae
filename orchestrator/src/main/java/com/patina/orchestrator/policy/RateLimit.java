package com.patina.orchestrator.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

/** At most {@code maxCalls} calls within any {@code windowMs} window. */
public record RateLimit(
        @JsonProperty("max_calls") int  maxCalls,
        @JsonProperty("window_ms") long windowMs) {

    public RateLimit {
        if (maxCalls <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("rate limit must be positive: " + maxCalls + "/" + windowMs + "ms");
        }
    }
}
