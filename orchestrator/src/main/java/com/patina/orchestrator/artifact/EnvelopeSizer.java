package com.patina.orchestrator.artifact;

import com.patina.orchestrator.cache.ContentHasher;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.ArtifactHandle;
import com.patina.orchestrator.model.ResultEnvelope;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps a ResultEnvelope within its byte ceiling.
 *
 * Oversized state values are moved to the artifact store first (largest
 * first), each replaced by its artifact URI; then the summary, replaced by
 * a one-line pointer. If the envelope is still too large the node fails
 * with BUDGET/OUTPUT_LIMIT.
 */
@Component
public class EnvelopeSizer {

    private final ArtifactStore artifactStore;
    private final int           hardCeilingBytes;

    public EnvelopeSizer(ArtifactStore artifactStore,
                         @Value("${patina.envelope.max-bytes:1048576}") int hardCeilingBytes) {
        this.artifactStore    = artifactStore;
        this.hardCeilingBytes = hardCeilingBytes;
    }

    public ResultEnvelope fit(ResultEnvelope envelope, int maxOutputBytes) {
        int limit = Math.min(maxOutputBytes, hardCeilingBytes);
        if (size(envelope) <= limit) {
            return envelope;
        }

        List<ArtifactHandle> artifacts = new ArrayList<>(envelope.artifacts());
        Map<String, Object> state = new LinkedHashMap<>(envelope.stateUpdates());
        List<String> keysBySize = state.keySet().stream()
                .sorted(Comparator.comparingInt((String k) -> ContentHasher.canonicalBytes(state.get(k)).length)
                        .reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .toList();

        ResultEnvelope current = envelope;
        for (String key : keysBySize) {
            ArtifactHandle handle = artifactStore.put(ContentHasher.canonicalBytes(state.get(key)), "application/json");
            state.put(key, handle.uri());
            artifacts.add(handle);
            current = new ResultEnvelope(envelope.summary(), artifacts, state, envelope.metrics());
            if (size(current) <= limit) {
                return current;
            }
        }

        ArtifactHandle summaryHandle = artifactStore.put(
                envelope.summary().getBytes(StandardCharsets.UTF_8), "text/plain");
        artifacts.add(summaryHandle);
        current = new ResultEnvelope("summary stored as " + summaryHandle.uri(), artifacts, state, envelope.metrics());
        if (size(current) <= limit) {
            return current;
        }
        throw OrchestratorException.budget(ErrorCodes.OUTPUT_LIMIT,
                "result envelope of " + size(current) + " bytes exceeds " + limit + " bytes");
    }

    public static int size(ResultEnvelope envelope) {
        return ContentHasher.canonicalBytes(envelope).length;
    }
}
