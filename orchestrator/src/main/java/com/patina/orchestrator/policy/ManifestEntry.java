package com.patina.orchestrator.policy;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * One allow or deny line of a capability manifest.
 *
 * @param pattern    glob over tool URIs ({@code *} any run of characters, {@code ?} one character)
 * @param qualifiers extra grants such as {@code write:issue.labels} or {@code write:*}
 * @param rateLimit  optional per-run rate limit for calls matched by this entry
 */
public record ManifestEntry(String pattern, Set<String> qualifiers, RateLimit rateLimit) {

    public static final String WRITE_PREFIX = "write:";

    public ManifestEntry {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("manifest entry needs a pattern");
        }
        qualifiers = qualifiers == null ? Set.of() : Set.copyOf(qualifiers);
    }

    public static ManifestEntry of(String pattern) {
        return new ManifestEntry(pattern, Set.of(), null);
    }

    public boolean matches(String toolUri) {
        return ToolPatterns.matches(pattern, toolUri);
    }

    /** Field globs granted for writing, without the {@code write:} prefix. */
    public Set<String> writeScopes() {
        return qualifiers.stream()
                .filter(q -> q.startsWith(WRITE_PREFIX))
                .map(q -> q.substring(WRITE_PREFIX.length()))
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean grantsWrite(String field) {
        return writeScopes().stream().anyMatch(scope -> ToolPatterns.matches(scope, field));
    }
}
