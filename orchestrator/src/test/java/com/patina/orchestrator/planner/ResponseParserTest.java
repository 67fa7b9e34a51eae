package com.patina.orchestrator.planner;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ResponseParser is a pure utility class, so these tests need no Spring
 * context and no mocks.
 */
class ResponseParserTest {

    // ------------------------------------------------------------------
    // <plan> tag
    // ------------------------------------------------------------------

    @Test
    void extractPlan_withPlanTag_returnsJson() {
        String response = """
                I will read the file, then count its lines.
                <plan>
                {"steps": [{"id": "fetch", "tool": "mcp://fs.read"}]}
                </plan>
                """;

        Optional<String> plan = ResponseParser.extractPlan(response);

        assertThat(plan).contains("{\"steps\": [{\"id\": \"fetch\", \"tool\": \"mcp://fs.read\"}]}");
    }

    @Test
    void extractPlan_tagWinsOverFence() {
        String response = """
                ```json
                {"steps": []}
                ```
                <plan>{"steps": [{"id": "a"}]}</plan>
                """;

        assertThat(ResponseParser.extractPlan(response)).hasValueSatisfying(p -> assertThat(p).contains("\"a\""));
    }

    @Test
    void extractPlan_emptyTag_returnsEmpty() {
        assertThat(ResponseParser.extractPlan("<plan>   </plan>")).isEmpty();
    }

    // ------------------------------------------------------------------
    // Fenced fallback
    // ------------------------------------------------------------------

    @Test
    void extractPlan_withJsonFence_returnsJson() {
        String response = """
                Here is the plan:
                ```json
                {"steps": [{"id": "a", "code": "return 1;"}]}
                ```
                """;

        assertThat(ResponseParser.extractPlan(response)).hasValueSatisfying(p -> assertThat(p).startsWith("{\"steps\""));
    }

    @Test
    void extractPlan_withUnlabelledFence_returnsJson() {
        String response = """
                ```
                {"steps": []}
                ```
                """;

        assertThat(ResponseParser.extractPlan(response)).contains("{\"steps\": []}");
    }

    @Test
    void extractPlan_withNoPlan_returnsEmpty() {
        assertThat(ResponseParser.extractPlan("I cannot plan this.")).isEmpty();
        assertThat(ResponseParser.extractPlan(null)).isEmpty();
    }
}
