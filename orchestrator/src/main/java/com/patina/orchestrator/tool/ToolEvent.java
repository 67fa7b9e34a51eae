package com.patina.orchestrator.tool;

/**
 * Published as a Spring application event on connection and after every invocation.
 * Carries no payloads.
 */
public record ToolEvent(Type type, String server, String tool, AuthMode mode, String outcome) {

    public enum Type { CONNECTED, INVOKED }

    public static ToolEvent connected(ToolServer server) {
        return new ToolEvent(Type.CONNECTED, server.name(), null, server.authMode(), "ok");
    }

    public static ToolEvent invoked(ToolServer server, String tool, String outcome) {
        return new ToolEvent(Type.INVOKED, server.name(), tool, server.authMode(), outcome);
    }
}
