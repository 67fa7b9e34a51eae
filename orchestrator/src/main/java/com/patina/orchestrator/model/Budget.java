package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-node resource ceiling, enforced by the sandbox engine.
 *
 * @param cpuMs             CPU time for the script, milliseconds
 * @param memMb             heap ceiling of the worker process, at least {@link #MIN_MEM_MB}
 * @param maxOps            interpreter statement limit
 * @param maxOutputBytes    ceiling on the serialized ResultEnvelope
 * @param tokenCap          completion tokens a node may spend through collaborators
 * @param wallClockMs       watchdog deadline for the whole node
 * @param maxCallDepth      nesting depth of script function calls
 * @param maxCollectionSize entries in any array/object crossing the host boundary
 * @param maxStringLength   characters in any string crossing the host boundary
 */
public record Budget(
        @JsonProperty("cpu_ms")              long cpuMs,
        @JsonProperty("mem_mb")              int  memMb,
        @JsonProperty("max_ops")             long maxOps,
        @JsonProperty("max_output_bytes")    int  maxOutputBytes,
        @JsonProperty("token_cap")           int  tokenCap,
        @JsonProperty("wall_clock_ms")       long wallClockMs,
        @JsonProperty("max_call_depth")      int  maxCallDepth,
        @JsonProperty("max_collection_size") int  maxCollectionSize,
        @JsonProperty("max_string_length")   int  maxStringLength) {

    /** Smallest heap a script worker JVM starts with. */
    public static final int MIN_MEM_MB = 128;

    public Budget {
        if (cpuMs <= 0 || memMb <= 0 || maxOps <= 0 || maxOutputBytes <= 0 || wallClockMs <= 0
                || maxCallDepth <= 0 || maxCollectionSize <= 0 || maxStringLength <= 0) {
            throw new IllegalArgumentException("budget limits must be positive");
        }
        if (memMb < MIN_MEM_MB) {
            throw new IllegalArgumentException("memMb must be at least " + MIN_MEM_MB + ", was " + memMb);
        }
        if (tokenCap < 0) {
            throw new IllegalArgumentException("tokenCap must not be negative");
        }
    }

    public static Budget defaults() {
        return new Budget(2_000, 256, 1_000_000, 64 * 1024, 4_096,
                10_000, 256, 10_000, 1_000_000);
    }

    /** Component-wise minimum: this budget may never exceed the ceiling. */
    public Budget clampTo(Budget ceiling) {
        return new Budget(
                Math.min(cpuMs, ceiling.cpuMs),
                Math.min(memMb, ceiling.memMb),
                Math.min(maxOps, ceiling.maxOps),
                Math.min(maxOutputBytes, ceiling.maxOutputBytes),
                Math.min(tokenCap, ceiling.tokenCap),
                Math.min(wallClockMs, ceiling.wallClockMs),
                Math.min(maxCallDepth, ceiling.maxCallDepth),
                Math.min(maxCollectionSize, ceiling.maxCollectionSize),
                Math.min(maxStringLength, ceiling.maxStringLength));
    }

    /**
     * Scale time and operation limits by {@code fraction} (0 &lt; fraction &le; 1).
     * Memory and size limits are kept: a smaller heap rarely helps a re-plan.
     */
    public Budget reducedBy(double fraction) {
        if (fraction <= 0 || fraction > 1) {
            throw new IllegalArgumentException("fraction must be in (0, 1]: " + fraction);
        }
        return new Budget(
                Math.max(1, (long) (cpuMs * fraction)),
                memMb,
                Math.max(1, (long) (maxOps * fraction)),
                maxOutputBytes,
                (int) (tokenCap * fraction),
                Math.max(1, (long) (wallClockMs * fraction)),
                maxCallDepth,
                maxCollectionSize,
                maxStringLength);
    }
}
