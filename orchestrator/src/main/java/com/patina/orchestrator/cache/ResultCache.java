package com.patina.orchestrator.cache;

import com.patina.orchestrator.model.ResultEnvelope;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Content-addressed cache of node results.
 *
 * Values are stored as canonical JSON bytes and decoded on every hit, so a
 * cached envelope is byte-identical to the one that was stored. Concurrent
 * writers of the same key never lose a write (last writer wins); two runs
 * may still compute the same entry twice. Entries expire after a TTL and the
 * oldest are evicted past the entry cap.
 */
@Component
public class ResultCache {

    static final int      DEFAULT_MAX_ENTRIES = 10_000;
    static final Duration DEFAULT_TTL         = Duration.ofHours(6);

    private final BoundedStore<byte[]> entries;

    public ResultCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_TTL, Clock.systemUTC());
    }

    @Autowired
    public ResultCache(@Value("${patina.cache.result.max-entries:10000}") int maxEntries,
                       @Value("${patina.cache.result.ttl:PT6H}") Duration ttl,
                       Clock clock) {
        this.entries = new BoundedStore<>(maxEntries, ttl, clock);
    }

    /**
     * Cache key for one node execution.
     *
     * @param inputs         the unit's params plus the direct dependencies' envelopes
     * @param schemaVersions tool URI to {@code server@version} for every tool the unit may call
     */
    public static String key(String planHash, String nodeId, Object inputs, Map<String, String> schemaVersions) {
        Map<String, Object> material = new LinkedHashMap<>();
        material.put("plan_hash", planHash);
        material.put("node_id", nodeId);
        material.put("inputs", inputs);
        material.put("schema_versions", schemaVersions == null ? Map.of() : schemaVersions);
        return ContentHasher.hash(material);
    }

    public Optional<ResultEnvelope> get(String key) {
        byte[] bytes = entries.get(key).orElse(null);
        if (bytes == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(ContentHasher.mapper().readValue(bytes, ResultEnvelope.class));
        } catch (IOException e) {
            // An entry that no longer decodes is dropped and treated as a miss.
            entries.remove(key, bytes);
            return Optional.empty();
        }
    }

    public void put(String key, ResultEnvelope envelope) {
        byte[] bytes = ContentHasher.canonicalBytes(envelope);
        entries.merge(key, bytes, (previous, latest) -> latest);
    }

    public Optional<byte[]> rawBytes(String key) {
        return entries.get(key).map(byte[]::clone);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
