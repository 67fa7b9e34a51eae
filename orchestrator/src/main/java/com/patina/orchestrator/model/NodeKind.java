package com.patina.orchestrator.model;

/**
 * WORK nodes dispatch an ExecutionUnit; APPROVAL nodes have no side effects
 * and succeed only when an operator approves the write they guard.
 */
public enum NodeKind {
    WORK,
    APPROVAL
}
