package com.patina.orchestrator.cache;

import com.patina.orchestrator.tool.ToolSchema;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Tool schemas keyed by {@code server@version}. A version is immutable, so
 * entries never expire; a server bump simply produces a new key.
 */
@Component
public class SchemaCache {

    private final Map<String, ToolSchema> schemas = new ConcurrentHashMap<>();

    public static String key(String server, String version, String toolUri) {
        return server + "@" + version + "#" + toolUri;
    }

    public Optional<ToolSchema> get(String server, String version, String toolUri) {
        return Optional.ofNullable(schemas.get(key(server, version, toolUri)));
    }

    /** Return the cached schema or load, store and return it. The loader runs at most once per key. */
    public ToolSchema getOrLoad(String server, String version, String toolUri, Supplier<ToolSchema> loader) {
        return schemas.computeIfAbsent(key(server, version, toolUri), k -> loader.get());
    }

    public int size() {
        return schemas.size();
    }
}
