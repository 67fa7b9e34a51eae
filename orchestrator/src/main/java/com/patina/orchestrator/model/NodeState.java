package com.patina.orchestrator.model;

/**
 * Execution state of one plan node.
 *
 * Transitions:
 *   PENDING → READY     (every dependency SUCCEEDED)
 *   READY   → RUNNING   (dispatched)
 *   RUNNING → SUCCEEDED | FAILED
 *   PENDING → SKIPPED   (a dependency FAILED or was SKIPPED, the run was
 *                        cancelled, or a re-plan superseded the node)
 */
public enum NodeState {
    PENDING,
    READY,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }
}
