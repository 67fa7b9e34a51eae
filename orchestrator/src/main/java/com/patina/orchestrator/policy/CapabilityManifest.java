package com.patina.orchestrator.policy;

import java.util.List;
import java.util.Optional;

/**
 * Allow and deny lists governing which tools a run may touch.
 * Loaded once per run and never mutated afterwards.
 *
 * @param source where the manifest came from, for diagnostics only
 */
public record CapabilityManifest(List<ManifestEntry> allow, List<ManifestEntry> deny, String source) {

    public CapabilityManifest {
        allow = allow == null ? List.of() : List.copyOf(allow);
        deny  = deny == null ? List.of() : List.copyOf(deny);
    }

    public static CapabilityManifest of(List<ManifestEntry> allow, List<ManifestEntry> deny) {
        return new CapabilityManifest(allow, deny, "inline");
    }

    /** A deny entry with no qualifiers matching the URI. */
    public Optional<ManifestEntry> fullDeny(String toolUri) {
        return deny.stream()
                .filter(e -> e.qualifiers().isEmpty() && e.matches(toolUri))
                .findFirst();
    }

    public List<ManifestEntry> denyEntries(String toolUri) {
        return deny.stream().filter(e -> e.matches(toolUri)).toList();
    }

    public List<ManifestEntry> allowEntries(String toolUri) {
        return allow.stream().filter(e -> e.matches(toolUri)).toList();
    }
}
