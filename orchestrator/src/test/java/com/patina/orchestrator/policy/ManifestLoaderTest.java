package com.patina.orchestrator.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManifestLoaderTest {

    @TempDir Path dir;

    ManifestLoader loader = new ManifestLoader(new ObjectMapper(), "");

    @Test
    void parse_acceptsStringAndObjectEntries() {
        CapabilityManifest manifest = loader.parse("""
                {"allow": ["mcp://fs.read",
                           {"pattern": "mcp://tracker.*", "qualifiers": ["write:issue.*"],
                            "rate_limit": {"max_calls": 5, "window_ms": 1000}}],
                 "deny": ["mcp://shell.*"]}
                """);

        assertThat(manifest.allow()).hasSize(2);
        ManifestEntry tracker = manifest.allow().get(1);
        assertThat(tracker.grantsWrite("issue.labels")).isTrue();
        assertThat(tracker.rateLimit()).isEqualTo(new RateLimit(5, 1000));
        assertThat(manifest.fullDeny("mcp://shell.exec")).isPresent();
    }

    @Test
    void load_missingFile_isManifestMissing() {
        assertThatThrownBy(() -> loader.load(dir.resolve("absent.json")))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.MANIFEST_MISSING));
    }

    @Test
    void loadConfigured_withoutPath_isManifestMissing() {
        assertThatThrownBy(() -> loader.loadConfigured())
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.MANIFEST_MISSING));
    }

    @Test
    void load_malformedFile_isManifestInvalid() throws Exception {
        Path file = Files.writeString(dir.resolve("manifest.json"), "{\"allow\": \"mcp://fs.read\"}");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.MANIFEST_INVALID));
    }

    @Test
    void load_configuredPath_readsFile() throws Exception {
        Path file = Files.writeString(dir.resolve("manifest.json"), "{\"allow\": [\"mcp://fs.*\"]}");

        CapabilityManifest manifest = new ManifestLoader(new ObjectMapper(), file.toString()).loadConfigured();

        assertThat(manifest.allowEntries("mcp://fs.list")).hasSize(1);
        assertThat(manifest.source()).isEqualTo(file.toString());
    }

    @Test
    void parse_invalidRateLimit_isManifestInvalid() {
        assertThatThrownBy(() -> loader.parse("""
                {"allow": [{"pattern": "mcp://x", "rate_limit": {"max_calls": 0, "window_ms": 10}}]}
                """))
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.MANIFEST_INVALID));
    }
}
