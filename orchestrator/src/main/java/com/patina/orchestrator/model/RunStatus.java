package com.patina.orchestrator.model;

/**
 * Lifecycle of one run.
 *
 *   PLANNING → RUNNING → SUCCEEDED   every node succeeded
 *                      → PARTIAL     finished, but some nodes failed or were skipped
 *                      → FAILED      aborted by a run-level error (plan invalid, run budget)
 *                      → CANCELLED   cancelled by the operator
 */
public enum RunStatus {
    PLANNING,
    RUNNING,
    SUCCEEDED,
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PLANNING && this != RUNNING;
    }
}
