package com.patina.orchestrator.tool;

import com.patina.orchestrator.cache.SchemaCache;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ErrorKind;
import com.patina.orchestrator.policy.CapabilityRequest;
import com.patina.orchestrator.policy.PolicyGate;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Policy-checked access to external tools.
 *
 * <p>Every invocation runs, in order:
 * <ol>
 *   <li>PolicyGate: the URI must be in the unit's allowed tools and allowed by the manifest
 *       (this also spends the run's rate budget);</li>
 *   <li>server resolution and credential negotiation;</li>
 *   <li>schema lookup through the SchemaCache, then a write-scope check for the
 *       fields the tool declares it writes;</li>
 *   <li>the run-wide tool call quota;</li>
 *   <li>the transport call.</li>
 * </ol>
 * A failure in steps 1 to 4 never reaches the network for the invocation itself.
 *
 * <pre>
 *   patina.tool.calls{tool, status="ok|&lt;error code&gt;"}
 * </pre>
 */
@Component
public class ToolClient {

    private static final Logger log = LoggerFactory.getLogger(ToolClient.class);

    private final ToolServerRegistry        registry;
    private final ToolTransport             transport;
    private final AuthCoordinator           auth;
    private final SchemaCache               schemaCache;
    private final PolicyGate                policyGate;
    private final MeterRegistry             meterRegistry;
    private final ApplicationEventPublisher events;
    private final Set<String>               connected = ConcurrentHashMap.newKeySet();

    public ToolClient(ToolServerRegistry registry,
                      ToolTransport transport,
                      AuthCoordinator auth,
                      SchemaCache schemaCache,
                      PolicyGate policyGate,
                      MeterRegistry meterRegistry,
                      ApplicationEventPublisher events) {
        this.registry      = registry;
        this.transport     = transport;
        this.auth          = auth;
        this.schemaCache   = schemaCache;
        this.policyGate    = policyGate;
        this.meterRegistry = meterRegistry;
        this.events        = events;
    }

    // ------------------------------------------------------------------
    // Invocation
    // ------------------------------------------------------------------

    public ToolResult invoke(String toolUri, Map<String, Object> args, ToolScope scope) {
        String status = "ok";
        try {
            policyGate.checkCall(toolUri, scope.allowedTools(), scope.manifest(), scope.rateWindow());

            ToolServer server = server(toolUri);
            String token = connect(server);

            ToolSchema schema = schemaCache.getOrLoad(server.name(), server.version(), toolUri,
                    () -> transport.fetchSchema(server, toolUri, token));
            if (!schema.writeFields().isEmpty()) {
                policyGate.require(CapabilityRequest.write(toolUri, new LinkedHashSet<>(schema.writeFields())),
                        scope.manifest(), null);
            }

            if (!scope.quota().tryAcquire()) {
                throw OrchestratorException.budget(ErrorCodes.TOOL_CALL_LIMIT,
                        "run tool call limit of " + scope.quota().max() + " reached");
            }

            log.debug("Invoking {} on {}", toolUri, server.name());
            ToolResult result = transport.invoke(server, toolUri, args, token);
            events.publishEvent(ToolEvent.invoked(server, toolUri, status));
            return result;
        } catch (OrchestratorException e) {
            status = e.getCode().toLowerCase();
            registry.resolve(toolUri).ifPresent(s -> events.publishEvent(ToolEvent.invoked(s, toolUri, e.getCode())));
            throw e;
        } finally {
            meterRegistry.counter("patina.tool.calls", "tool", toolUri, "status", status).increment();
        }
    }

    /** Bind this client to one unit's scope. */
    public ToolInvoker bind(ToolScope scope) {
        return (toolUri, args) -> invoke(toolUri, args, scope);
    }

    // ------------------------------------------------------------------
    // Schemas
    // ------------------------------------------------------------------

    /** Resolve (and cache) the schema of one tool. Needs no policy decision: schemas carry no data. */
    public ToolSchema schema(String toolUri) {
        ToolServer server = server(toolUri);
        String token = connect(server);
        return schemaCache.getOrLoad(server.name(), server.version(), toolUri,
                () -> transport.fetchSchema(server, toolUri, token));
    }

    /**
     * {@code server@version} for each tool, without any network access.
     * Unreachable tools map to {@code unknown}.
     */
    public Map<String, String> schemaVersions(Iterable<String> toolUris) {
        Map<String, String> versions = new TreeMap<>();
        for (String uri : toolUris) {
            versions.put(uri, registry.resolve(uri).map(ToolServer::versionLabel).orElse("unknown"));
        }
        return versions;
    }

    public boolean isReachable(String toolUri) {
        return registry.isReachable(toolUri);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private ToolServer server(String toolUri) {
        return registry.resolve(toolUri).orElseThrow(() -> OrchestratorException.of(ErrorKind.TOOL,
                ErrorCodes.UNKNOWN_SERVER, "no tool server registered for " + toolUri));
    }

    private String connect(ToolServer server) {
        AuthState state = auth.negotiate(server.name(), server.authMode());
        if (connected.add(server.name())) {
            log.info("Connected to tool server '{}' [{}]", server.name(), server.authMode());
            events.publishEvent(ToolEvent.connected(server));
        }
        return state.accessToken();
    }
}
