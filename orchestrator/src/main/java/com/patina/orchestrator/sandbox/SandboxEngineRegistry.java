package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.ResultEnvelope;
import com.patina.orchestrator.policy.ToolPatterns;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All {@link SandboxEngine} beans, keyed by {@link EngineKind}.
 *
 * <p>Responsibilities:
 * <ol>
 *   <li>Lookup by kind ({@link #get}).</li>
 *   <li>Metrics-instrumented execution ({@link #execute}); every call is timed
 *       without per-engine boilerplate.</li>
 *   <li>Capability documentation for the planner's system prompt ({@link #describeCapabilities}).</li>
 * </ol>
 */
@Component
public class SandboxEngineRegistry {

    private static final Logger log = LoggerFactory.getLogger(SandboxEngineRegistry.class);

    private final Map<EngineKind, SandboxEngine> engines = new EnumMap<>(EngineKind.class);
    private final MeterRegistry meterRegistry;

    public SandboxEngineRegistry(List<SandboxEngine> allEngines, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (SandboxEngine engine : allEngines) {
            engines.put(engine.kind(), engine);
            log.info("Registered sandbox engine {} exposing {}", engine.kind(), engine.capabilities());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<SandboxEngine> find(EngineKind kind) {
        return Optional.ofNullable(engines.get(kind));
    }

    public SandboxEngine get(EngineKind kind) {
        return find(kind).orElseThrow(() -> OrchestratorException.of(ErrorKind.SANDBOX,
                ErrorCodes.ENGINE_UNAVAILABLE, "no sandbox engine for " + kind));
    }

    /** True when the engine for {@code kind} exists and can expose {@code toolUri}. */
    public boolean canExpose(EngineKind kind, String toolUri) {
        return find(kind).map(e -> ToolPatterns.matchesAny(e.capabilities(), toolUri)).orElse(false);
    }

    /** Fails with SANDBOX/ENGINE_UNAVAILABLE unless the engine exists and reports itself live. */
    public void requireLive(EngineKind kind) {
        SandboxHealth health = get(kind).health();
        if (!health.live()) {
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.ENGINE_UNAVAILABLE,
                    kind + " engine unavailable: " + health.detail());
        }
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented execution
    // ------------------------------------------------------------------

    /**
     * Execute a unit on its engine.
     * <pre>
     *   patina.node.duration{engine, outcome="success|&lt;error kind&gt;"}
     * </pre>
     */
    public ResultEnvelope execute(ExecutionUnit unit, SandboxInvocation invocation) {
        SandboxEngine engine = get(unit.engine());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return engine.execute(unit, invocation);
        } catch (OrchestratorException e) {
            outcome = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            outcome = "sandbox";
            throw OrchestratorException.of(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH,
                    "unexpected error in " + unit.engine() + " engine: " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("patina.node.duration",
                    "engine", unit.engine().name().toLowerCase(), "outcome", outcome));
        }
    }

    // ------------------------------------------------------------------
    // Capability documentation
    // ------------------------------------------------------------------

    /** The engines block of the planner's system prompt. */
    public String describeCapabilities() {
        StringBuilder sb = new StringBuilder("ENGINES:\n");
        engines.forEach((kind, engine) -> sb.append("  ")
                .append(kind)
                .append(" exposes ")
                .append(engine.capabilities().stream().sorted().toList())
                .append("\n"));
        return sb.toString();
    }
}
