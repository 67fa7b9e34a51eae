package com.patina.orchestrator.sandbox;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.EngineKind;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionUnit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SandboxEngineRegistryTest {

    SimpleMeterRegistry   meterRegistry = new SimpleMeterRegistry();
    SandboxEngine         script        = mock(SandboxEngine.class);
    SandboxEngineRegistry registry;

    @BeforeEach
    void setUp() {
        when(script.kind()).thenReturn(EngineKind.SCRIPT);
        when(script.capabilities()).thenReturn(Set.of("mcp://fs.*"));
        registry = new SandboxEngineRegistry(List.of(script), meterRegistry);
    }

    @Test
    void requireLive_missingEngine_isEngineUnavailable() {
        assertThatThrownBy(() -> registry.requireLive(EngineKind.TOOL_CALL))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.SANDBOX, ErrorCodes.ENGINE_UNAVAILABLE)).isTrue());
    }

    @Test
    void requireLive_deadEngine_isEngineUnavailable() {
        when(script.health()).thenReturn(new SandboxHealth(EngineKind.SCRIPT, false, 0, 0, "no java"));

        assertThatThrownBy(() -> registry.requireLive(EngineKind.SCRIPT))
                .hasMessageContaining("no java");
    }

    @Test
    void canExpose_followsEngineCapabilities() {
        assertThat(registry.canExpose(EngineKind.SCRIPT, "mcp://fs.read")).isTrue();
        assertThat(registry.canExpose(EngineKind.SCRIPT, "mcp://mail.send")).isFalse();
        assertThat(registry.canExpose(EngineKind.TOOL_CALL, "mcp://fs.read")).isFalse();
    }

    @Test
    void execute_unexpectedExceptionBecomesProcCrash() {
        when(script.execute(any(), any())).thenThrow(new IllegalStateException("boom"));
        ExecutionUnit unit = ExecutionUnit.script("return 1;", Map.of(), List.of(), Budget.defaults());

        assertThatThrownBy(() -> registry.execute(unit, new SandboxInvocation("r", "n", 1, null, null, null)))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.SANDBOX, ErrorCodes.PROC_CRASH)).isTrue());
        assertThat(meterRegistry.get("patina.node.duration").tag("outcome", "sandbox").timer().count())
                .isEqualTo(1);
    }

    @Test
    void describeCapabilities_listsEngines() {
        assertThat(registry.describeCapabilities()).contains("SCRIPT exposes [mcp://fs.*]");
    }
}
