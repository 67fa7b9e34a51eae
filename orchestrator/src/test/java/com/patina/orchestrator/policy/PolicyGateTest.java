package com.patina.orchestrator.policy;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.model.ExecutionUnit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyGateTest {

    SimpleMeterRegistry meters;
    PolicyGate          gate;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        gate   = new PolicyGate(meters);
    }

    // ------------------------------------------------------------------
    // Allow / deny
    // ------------------------------------------------------------------

    @Test
    void noAllowEntry_isDenied_evenWithEmptyDenyList() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(), List.of());

        PolicyDecision decision = gate.decide(CapabilityRequest.call("mcp://fs.read"), manifest, new RunRateWindow());

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.code()).isEqualTo(ErrorCodes.CAPABILITY_DENIED);
    }

    @Test
    void denyEntry_winsOverAllowGlob() {
        CapabilityManifest manifest = CapabilityManifest.of(
                List.of(ManifestEntry.of("mcp://*")),
                List.of(ManifestEntry.of("mcp://shell.*")));

        assertThat(gate.decide(CapabilityRequest.call("mcp://shell.exec"), manifest, null).allowed()).isFalse();
        assertThat(gate.decide(CapabilityRequest.call("mcp://fs.read"), manifest, null).allowed()).isTrue();
    }

    @Test
    void missingManifest_isDenied() {
        assertThat(gate.decide(CapabilityRequest.staticCheck("mcp://fs.read"), null, null).allowed()).isFalse();
    }

    @Test
    void decisions_areCounted() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(ManifestEntry.of("mcp://fs.read")), List.of());

        gate.decide(CapabilityRequest.staticCheck("mcp://fs.read"), manifest, null);
        gate.decide(CapabilityRequest.staticCheck("mcp://fs.write"), manifest, null);

        assertThat(meters.counter("patina.policy.decisions", "decision", "allow").count()).isEqualTo(1.0);
        assertThat(meters.counter("patina.policy.decisions", "decision", "deny").count()).isEqualTo(1.0);
    }

    // ------------------------------------------------------------------
    // Write scopes
    // ------------------------------------------------------------------

    @Test
    void write_needsExplicitQualifier() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(
                new ManifestEntry("mcp://tracker.*", Set.of("write:issue.*"), null)), List.of());

        assertThat(gate.decide(CapabilityRequest.write("mcp://tracker.update", Set.of("issue.labels")),
                manifest, null).allowed()).isTrue();
        assertThat(gate.decide(CapabilityRequest.write("mcp://tracker.update", Set.of("project.name")),
                manifest, null).allowed()).isFalse();
    }

    @Test
    void write_wildcardGrant_canBeNarrowedByDenyQualifier() {
        CapabilityManifest manifest = CapabilityManifest.of(
                List.of(new ManifestEntry("mcp://tracker.*", Set.of("write:*"), null)),
                List.of(new ManifestEntry("mcp://tracker.*", Set.of("write:secrets.*"), null)));

        assertThat(gate.decide(CapabilityRequest.write("mcp://tracker.update", Set.of("issue.title")),
                manifest, null).allowed()).isTrue();
        assertThat(gate.decide(CapabilityRequest.write("mcp://tracker.update", Set.of("secrets.token")),
                manifest, null).allowed()).isFalse();
    }

    // ------------------------------------------------------------------
    // Rate limits
    // ------------------------------------------------------------------

    @Test
    void rateLimit_isPerRunWindow() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(
                new ManifestEntry("mcp://search.*", Set.of(), new RateLimit(2, 60_000))), List.of());
        Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        RunRateWindow window = new RunRateWindow(fixed);

        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window).allowed()).isTrue();
        assertThat(gate.decide(CapabilityRequest.call("mcp://search.code"), manifest, window).allowed()).isTrue();
        PolicyDecision third = gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window);
        assertThat(third.allowed()).isFalse();
        assertThat(third.code()).isEqualTo(ErrorCodes.RATE_LIMITED);

        // A fresh run starts with an empty window.
        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, new RunRateWindow(fixed))
                .allowed()).isTrue();
    }

    @Test
    void rateLimit_denialOnOneEntry_spendsNoSlotOnTheOthers() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(
                new ManifestEntry("mcp://search.*", Set.of(), new RateLimit(5, 60_000)),
                new ManifestEntry("mcp://search.web", Set.of(), new RateLimit(1, 60_000))), List.of());
        RunRateWindow window = new RunRateWindow();

        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window).allowed()).isTrue();
        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window).allowed()).isFalse();
        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window).allowed()).isFalse();

        assertThat(window.callsInWindow("mcp://search.*")).isEqualTo(1);
        assertThat(window.callsInWindow("mcp://search.web")).isEqualTo(1);
    }

    @Test
    void staticCheck_doesNotSpendRateBudget() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(
                new ManifestEntry("mcp://search.*", Set.of(), new RateLimit(1, 60_000))), List.of());
        RunRateWindow window = new RunRateWindow();

        gate.decide(CapabilityRequest.staticCheck("mcp://search.web"), manifest, window);
        gate.decide(CapabilityRequest.staticCheck("mcp://search.web"), manifest, window);

        assertThat(window.callsInWindow("mcp://search.*")).isZero();
        assertThat(gate.decide(CapabilityRequest.call("mcp://search.web"), manifest, window).allowed()).isTrue();
    }

    // ------------------------------------------------------------------
    // Unit and call checks
    // ------------------------------------------------------------------

    @Test
    void checkUnit_rejectsUnitWithDeniedTool() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(ManifestEntry.of("mcp://fs.read")), List.of());
        ExecutionUnit unit = ExecutionUnit.script("return 1;", Map.of(),
                List.of("mcp://fs.read", "mcp://fs.write"), Budget.defaults());

        assertThatThrownBy(() -> gate.checkUnit(unit, manifest))
                .isInstanceOfSatisfying(OrchestratorException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.POLICY);
                    assertThat(e.getCode()).isEqualTo(ErrorCodes.CAPABILITY_DENIED);
                });
    }

    @Test
    void checkCall_toolOutsideUnitAllowedTools_isDenied_evenIfManifestAllowsIt() {
        CapabilityManifest manifest = CapabilityManifest.of(List.of(ManifestEntry.of("mcp://*")), List.of());

        assertThatThrownBy(() -> gate.checkCall("mcp://fs.read", List.of("mcp://search.web"), manifest,
                new RunRateWindow()))
                .isInstanceOf(OrchestratorException.class)
                .hasMessageContaining("POLICY/CAPABILITY_DENIED");
    }
}
