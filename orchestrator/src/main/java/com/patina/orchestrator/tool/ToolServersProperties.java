package com.patina.orchestrator.tool;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * {@code patina.tools.servers[*]} from application.yml.
 */
@ConfigurationProperties(prefix = "patina.tools")
public record ToolServersProperties(List<Server> servers) {

    public ToolServersProperties {
        servers = servers == null ? List.of() : List.copyOf(servers);
    }

    public record Server(String name, String baseUrl, String uriPrefix, String version, AuthMode authMode) {

        public ToolServer toToolServer() {
            return new ToolServer(name, baseUrl, uriPrefix, version, authMode);
        }
    }
}
