package com.patina.orchestrator.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads the capability manifest file.
 *
 * Format:
 * <pre>
 * {
 *   "allow": ["mcp://fs.read",
 *             {"pattern": "mcp://tracker.*", "qualifiers": ["write:issue.*"],
 *              "rate_limit": {"max_calls": 5, "window_ms": 1000}}],
 *   "deny":  ["mcp://shell.*"]
 * }
 * </pre>
 *
 * A missing file is POLICY/MANIFEST_MISSING; a malformed one POLICY/MANIFEST_INVALID.
 * Both are fatal for the run before any node executes.
 */
@Component
public class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private final ObjectMapper objectMapper;
    private final String       configuredPath;

    public ManifestLoader(ObjectMapper objectMapper,
                          @Value("${patina.manifest.path:}") String configuredPath) {
        this.objectMapper   = objectMapper;
        this.configuredPath = configuredPath;
    }

    /** Load the manifest named by {@code patina.manifest.path}. */
    public CapabilityManifest loadConfigured() {
        if (configuredPath == null || configuredPath.isBlank()) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_MISSING,
                    "patina.manifest.path is not configured");
        }
        return load(Path.of(configuredPath));
    }

    public CapabilityManifest load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_MISSING,
                    "capability manifest not found: " + path);
        }
        try {
            CapabilityManifest manifest = parse(objectMapper.readTree(path.toFile()), path.toString());
            log.info("Loaded capability manifest {} ({} allow, {} deny)",
                    path, manifest.allow().size(), manifest.deny().size());
            return manifest;
        } catch (IOException e) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID,
                    "cannot read capability manifest " + path + ": " + e.getMessage());
        }
    }

    public CapabilityManifest parse(String json) {
        try {
            return parse(objectMapper.readTree(json), "inline");
        } catch (IOException e) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID,
                    "malformed capability manifest: " + e.getMessage());
        }
    }

    private CapabilityManifest parse(JsonNode root, String source) {
        if (root == null || !root.isObject()) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID,
                    "capability manifest must be a JSON object");
        }
        return new CapabilityManifest(entries(root.get("allow")), entries(root.get("deny")), source);
    }

    private List<ManifestEntry> entries(JsonNode array) {
        List<ManifestEntry> out = new ArrayList<>();
        if (array == null || array.isNull()) {
            return out;
        }
        if (!array.isArray()) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID, "allow/deny must be arrays");
        }
        for (JsonNode node : array) {
            out.add(entry(node));
        }
        return out;
    }

    private ManifestEntry entry(JsonNode node) {
        try {
            if (node.isTextual()) {
                return ManifestEntry.of(node.asText());
            }
            if (!node.isObject() || !node.hasNonNull("pattern")) {
                throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID,
                        "manifest entry must be a string or an object with a pattern");
            }
            Set<String> qualifiers = new LinkedHashSet<>();
            JsonNode q = node.get("qualifiers");
            if (q != null && q.isArray()) {
                q.forEach(v -> qualifiers.add(v.asText()));
            }
            RateLimit rateLimit = null;
            JsonNode rl = node.get("rate_limit");
            if (rl != null && rl.isObject()) {
                rateLimit = new RateLimit(rl.path("max_calls").asInt(), rl.path("window_ms").asLong());
            }
            return new ManifestEntry(node.get("pattern").asText(), qualifiers, rateLimit);
        } catch (IllegalArgumentException e) {
            throw OrchestratorException.policy(ErrorCodes.MANIFEST_INVALID, e.getMessage());
        }
    }
}
