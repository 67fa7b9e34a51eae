package com.patina.orchestrator.sandbox;

/**
 * Why the watchdog ended a worker. The first cause recorded wins.
 */
public enum TerminationCause {
    /** The worker finished and was reaped normally. */
    COMPLETED,
    /** The node's wall-clock deadline passed. */
    WALL_CLOCK,
    /** The run was cancelled. */
    CANCELLED,
    /** The worker wrote something that is not a valid protocol message. */
    PROTOCOL_VIOLATION,
    /** The worker wrote more output than the engine accepts. */
    OUTPUT_OVERFLOW
}
