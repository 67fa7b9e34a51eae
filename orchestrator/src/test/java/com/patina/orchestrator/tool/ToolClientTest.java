package com.patina.orchestrator.tool;

import com.patina.orchestrator.cache.SchemaCache;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.policy.CapabilityManifest;
import com.patina.orchestrator.policy.ManifestEntry;
import com.patina.orchestrator.policy.PolicyGate;
import com.patina.orchestrator.policy.RateLimit;
import com.patina.orchestrator.policy.RunRateWindow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolClientTest {

    ToolServer fs = new ToolServer("fs", "http://fs.local", "mcp://fs.", "3", AuthMode.CLIENT_MANAGED);
    ToolServer tracker = new ToolServer("tracker", "http://tracker.local", "mcp://tracker.", "1", null);

    ToolTransport             transport = mock(ToolTransport.class);
    ApplicationEventPublisher events    = mock(ApplicationEventPublisher.class);
    SimpleMeterRegistry       meters    = new SimpleMeterRegistry();
    SchemaCache               schemas   = new SchemaCache();
    ToolClient                client;

    CapabilityManifest manifest = CapabilityManifest.of(
            List.of(ManifestEntry.of("mcp://fs.*"),
                    new ManifestEntry("mcp://tracker.*", Set.of("write:issue.labels"), null)),
            List.of(ManifestEntry.of("mcp://fs.delete")));

    @BeforeEach
    void setUp() {
        client = new ToolClient(ToolServerRegistry.of(fs, tracker), transport, new AuthCoordinator(), schemas,
                new PolicyGate(meters), meters, events);
        when(transport.fetchSchema(any(), anyString(), anyString()))
                .thenAnswer(inv -> ToolSchema.readOnly(inv.getArgument(1), "3"));
        when(transport.invoke(any(), anyString(), anyMap(), anyString()))
                .thenAnswer(inv -> new ToolResult(inv.getArgument(1), "fs", "data"));
    }

    private ToolScope scope(List<String> allowed, ToolCallQuota quota) {
        return new ToolScope("run-1", "node", allowed, manifest, new RunRateWindow(), quota);
    }

    // ------------------------------------------------------------------
    // Policy
    // ------------------------------------------------------------------

    @Test
    void invoke_allowedCall_reachesTransport() {
        ToolResult result = client.invoke("mcp://fs.read", Map.of("path", "a"), scope(List.of("mcp://fs.read"), null));

        assertThat(result.data()).isEqualTo("data");
        verify(transport).invoke(eq(fs), eq("mcp://fs.read"), eq(Map.of("path", "a")), anyString());
        assertThat(meters.get("patina.tool.calls").tag("status", "ok").counter().count()).isEqualTo(1);
    }

    @Test
    void invoke_outsideUnitAllowedTools_neverReachesTransport() {
        assertThatThrownBy(() -> client.invoke("mcp://fs.write", Map.of(), scope(List.of("mcp://fs.read"), null)))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.POLICY, ErrorCodes.CAPABILITY_DENIED)).isTrue());

        verify(transport, never()).invoke(any(), anyString(), anyMap(), anyString());
        verify(transport, never()).fetchSchema(any(), anyString(), anyString());
    }

    @Test
    void invoke_manifestDeny_neverReachesTransport() {
        assertThatThrownBy(() -> client.invoke("mcp://fs.delete", Map.of(), scope(List.of("mcp://fs.*"), null)))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.POLICY));

        verify(transport, never()).invoke(any(), anyString(), anyMap(), anyString());
    }

    @Test
    void invoke_writeOutsideGrantedFields_isDenied() {
        when(transport.fetchSchema(eq(tracker), eq("mcp://tracker.close"), anyString()))
                .thenReturn(new ToolSchema("mcp://tracker.close", "1", null, Map.of(), List.of("issue.state")));

        assertThatThrownBy(() -> client.invoke("mcp://tracker.close", Map.of(),
                scope(List.of("mcp://tracker.close"), null)))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.POLICY));
        verify(transport, never()).invoke(any(), anyString(), anyMap(), anyString());
    }

    @Test
    void invoke_writeWithinGrantedFields_isAllowed() {
        when(transport.fetchSchema(eq(tracker), eq("mcp://tracker.label"), anyString()))
                .thenReturn(new ToolSchema("mcp://tracker.label", "1", null, Map.of(), List.of("issue.labels")));

        client.invoke("mcp://tracker.label", Map.of(), scope(List.of("mcp://tracker.label"), null));

        verify(transport).invoke(eq(tracker), eq("mcp://tracker.label"), anyMap(), anyString());
    }

    @Test
    void invoke_rateLimitedEntry_deniesOnceWindowIsFull() {
        CapabilityManifest limited = CapabilityManifest.of(
                List.of(new ManifestEntry("mcp://fs.*", Set.of(), new RateLimit(1, 60_000))), List.of());
        ToolScope scope = new ToolScope("run-1", "n", List.of("mcp://fs.*"), limited, new RunRateWindow(), null);

        client.invoke("mcp://fs.read", Map.of(), scope);

        assertThatThrownBy(() -> client.invoke("mcp://fs.read", Map.of(), scope))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.POLICY, ErrorCodes.RATE_LIMITED)).isTrue());
    }

    // ------------------------------------------------------------------
    // Quota, schemas and servers
    // ------------------------------------------------------------------

    @Test
    void invoke_quotaSpent_isToolCallLimit() {
        ToolScope scope = scope(List.of("mcp://fs.*"), new ToolCallQuota(1));

        client.invoke("mcp://fs.read", Map.of(), scope);

        assertThatThrownBy(() -> client.invoke("mcp://fs.stat", Map.of(), scope))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.BUDGET, ErrorCodes.TOOL_CALL_LIMIT)).isTrue());
        verify(transport, times(1)).invoke(any(), anyString(), anyMap(), anyString());
    }

    @Test
    void invoke_schemaFetchedOncePerServerVersion() {
        ToolScope scope = scope(List.of("mcp://fs.read"), null);

        client.invoke("mcp://fs.read", Map.of(), scope);
        client.invoke("mcp://fs.read", Map.of(), scope);

        verify(transport, times(1)).fetchSchema(eq(fs), eq("mcp://fs.read"), anyString());
        assertThat(schemas.get("fs", "3", "mcp://fs.read")).isPresent();
    }

    @Test
    void invoke_unknownServer_isToolError() {
        CapabilityManifest open = CapabilityManifest.of(List.of(ManifestEntry.of("mcp://*")), List.of());
        ToolScope scope = new ToolScope("run-1", "n", List.of("mcp://*"), open, new RunRateWindow(), null);

        assertThatThrownBy(() -> client.invoke("mcp://mail.send", Map.of(), scope))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getError().is(ErrorKind.TOOL, ErrorCodes.UNKNOWN_SERVER)).isTrue());
    }

    @Test
    void schemaVersions_needsNoNetwork() {
        Map<String, String> versions = client.schemaVersions(List.of("mcp://fs.read", "mcp://mail.send"));

        assertThat(versions).containsEntry("mcp://fs.read", "fs@3").containsEntry("mcp://mail.send", "unknown");
        verify(transport, never()).fetchSchema(any(), anyString(), anyString());
    }

    @Test
    void bind_routesThroughInvoke() {
        ToolInvoker invoker = client.bind(scope(List.of("mcp://fs.read"), null));

        assertThat(invoker.call("mcp://fs.read", Map.of()).data()).isEqualTo("data");
        verify(events).publishEvent(ToolEvent.connected(fs));
    }
}
