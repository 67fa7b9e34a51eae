package com.patina.orchestrator.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool servers known to this process, resolved by longest matching URI prefix.
 */
@Component
public class ToolServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolServerRegistry.class);

    private final Map<String, ToolServer> servers = new ConcurrentHashMap<>();

    public ToolServerRegistry(ToolServersProperties properties) {
        properties.servers().forEach(s -> register(s.toToolServer()));
    }

    public static ToolServerRegistry of(ToolServer... initial) {
        ToolServerRegistry registry = new ToolServerRegistry(new ToolServersProperties(List.of()));
        for (ToolServer server : initial) {
            registry.register(server);
        }
        return registry;
    }

    public void register(ToolServer server) {
        servers.put(server.name(), server);
        log.info("Registered tool server '{}' v{} for {} [{}]",
                server.name(), server.version(), server.uriPrefix(), server.authMode());
    }

    public Optional<ToolServer> resolve(String toolUri) {
        return servers.values().stream()
                .filter(s -> s.serves(toolUri))
                .max(Comparator.comparingInt((ToolServer s) -> s.uriPrefix().length())
                        .thenComparing(ToolServer::name, Comparator.reverseOrder()));
    }

    public boolean isReachable(String toolUri) {
        return resolve(toolUri).isPresent();
    }

    /** Registered servers sorted by name. */
    public List<ToolServer> servers() {
        return servers.values().stream().sorted(Comparator.comparing(ToolServer::name)).toList();
    }
}
