package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.ResultEnvelope;

import java.util.Set;

/**
 * Executes one ExecutionUnit with no ambient privileges.
 *
 * Implementations are Spring {@code @Component}s and are collected by
 * {@link SandboxEngineRegistry}; adding a backend only requires a new bean.
 */
public interface SandboxEngine {

    EngineKind kind();

    /**
     * Run the unit and return its envelope.
     *
     * @throws com.patina.orchestrator.error.OrchestratorException on any failure,
     *         including budget breaches (BUDGET/*) and cancellation (SANDBOX/CANCELLED)
     */
    ResultEnvelope execute(ExecutionUnit unit, SandboxInvocation invocation);

    SandboxHealth health();

    /** Tool URI globs this engine can expose to a unit. */
    Set<String> capabilities();
}
