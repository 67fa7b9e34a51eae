package com.patina.orchestrator.model;

/**
 * Top-level classification of every failure the core can report.
 *
 *   TOOL   : a remote tool failed; retriable or not by the tool's own error code
 *   CODE   : script runtime error, syntax/static rejection, invalid plan
 *   POLICY : capability denied, write without approval, rate limited
 *   BUDGET : any per-node or per-run limit breach
 *   SANDBOX: worker crash, protocol violation, watchdog kill, cancellation
 */
public enum ErrorKind {
    TOOL,
    CODE,
    POLICY,
    BUDGET,
    SANDBOX
}
