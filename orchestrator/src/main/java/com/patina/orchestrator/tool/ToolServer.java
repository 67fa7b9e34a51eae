package com.patina.orchestrator.tool;

/**
 * One registered tool server.
 *
 * @param uriPrefix tool URIs starting with this prefix are served here, e.g. {@code mcp://fs.}
 * @param version   schema version the server publishes; part of every cache key
 */
public record ToolServer(String name, String baseUrl, String uriPrefix, String version, AuthMode authMode) {

    public ToolServer {
        if (name == null || name.isBlank() || uriPrefix == null || uriPrefix.isBlank()) {
            throw new IllegalArgumentException("tool server needs a name and a uri prefix");
        }
        version  = version == null || version.isBlank() ? "1" : version;
        authMode = authMode == null ? AuthMode.SERVER_MANAGED : authMode;
    }

    public boolean serves(String toolUri) {
        return toolUri.startsWith(uriPrefix);
    }

    /** {@code name@version}, the schema version label used in cache keys. */
    public String versionLabel() {
        return name + "@" + version;
    }
}
