package com.patina.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to a payload kept out of band in the artifact store.
 *
 * @param uri         {@code artifact://sha256/<hex>}, derived from the content hash
 * @param contentType declared MIME type
 * @param sizeBytes   payload size
 */
public record ArtifactHandle(
        @JsonProperty("uri")          String uri,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("size_bytes")   long   sizeBytes) {}
