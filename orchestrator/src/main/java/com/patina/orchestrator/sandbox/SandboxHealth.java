package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.model.EngineKind;

/**
 * Liveness of one engine.
 *
 * @param idleWorkers worker slots free right now
 */
public record SandboxHealth(EngineKind engine, boolean live, int activeWorkers, int idleWorkers, String detail) {}
