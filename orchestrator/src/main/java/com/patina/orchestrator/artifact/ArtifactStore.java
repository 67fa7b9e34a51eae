package com.patina.orchestrator.artifact;

import com.patina.orchestrator.model.ArtifactHandle;

import java.util.Optional;

/**
 * Content-addressed store for payloads that are kept out of result envelopes.
 */
public interface ArtifactStore {

    String URI_PREFIX = "artifact://sha256/";

    ArtifactHandle put(byte[] content, String contentType);

    Optional<byte[]> get(String uri);
}
