package com.patina.orchestrator.artifact;

import com.patina.orchestrator.cache.BoundedStore;
import com.patina.orchestrator.cache.ContentHasher;
import com.patina.orchestrator.model.ArtifactHandle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Process-local artifact store. Identical content is stored once; blobs
 * expire after a TTL and the oldest are evicted past the entry cap.
 */
@Component
public class InMemoryArtifactStore implements ArtifactStore {

    private final BoundedStore<byte[]> blobs;

    public InMemoryArtifactStore() {
        this(1_000, Duration.ofHours(24), Clock.systemUTC());
    }

    @Autowired
    public InMemoryArtifactStore(@Value("${patina.artifacts.max-entries:1000}") int maxEntries,
                                 @Value("${patina.artifacts.ttl:PT24H}") Duration ttl,
                                 Clock clock) {
        this.blobs = new BoundedStore<>(maxEntries, ttl, clock);
    }

    @Override
    public ArtifactHandle put(byte[] content, String contentType) {
        String uri = URI_PREFIX + ContentHasher.sha256Hex(content);
        blobs.merge(uri, content.clone(), (stored, latest) -> stored);
        return new ArtifactHandle(uri, contentType == null ? "application/octet-stream" : contentType,
                content.length);
    }

    @Override
    public Optional<byte[]> get(String uri) {
        return blobs.get(uri).map(byte[]::clone);
    }

    public int size() {
        return blobs.size();
    }
}
