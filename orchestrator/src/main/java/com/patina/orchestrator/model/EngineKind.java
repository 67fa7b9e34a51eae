package com.patina.orchestrator.model;

/**
 * Which sandbox engine variant must run an ExecutionUnit.
 *
 * SCRIPT   : a JavaScript payload run by a separate worker process
 *            with OS and interpreter limits applied.
 * TOOL_CALL: a single declared tool call issued from the host JVM;
 *            no guest code runs at all.
 */
public enum EngineKind {
    SCRIPT,
    TOOL_CALL
}
