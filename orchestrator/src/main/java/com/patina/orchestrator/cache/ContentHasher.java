package com.patina.orchestrator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Canonical JSON and SHA-256 hashing.
 *
 * Canonical means: map keys and record properties sorted, no insignificant
 * whitespace, ISO-8601 timestamps. Two equal values always produce the same
 * bytes, which is what plan hashes, cache keys and summary hashes rely on.
 */
public final class ContentHasher {

    private static final JsonMapper CANONICAL = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .addModule(new JavaTimeModule())
            .build();

    private ContentHasher() {}

    /** The mapper used for canonical bytes; also reads them back. */
    public static JsonMapper mapper() {
        return CANONICAL;
    }

    public static byte[] canonicalBytes(Object value) {
        try {
            return CANONICAL.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static String canonicalJson(Object value) {
        return new String(canonicalBytes(value), StandardCharsets.UTF_8);
    }

    public static String hash(Object value) {
        return sha256Hex(canonicalBytes(value));
    }

    public static String sha256Hex(String text) {
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
