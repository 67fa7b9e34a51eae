package com.patina.orchestrator.planner;

import com.patina.orchestrator.error.ErrorCodes;
import com.patina.orchestrator.error.OrchestratorException;
import com.patina.orchestrator.model.Budget;
import com.patina.orchestrator.model.ExecutionUnit;
import com.patina.orchestrator.model.NodeSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlanValidatorTest {

    PlanValidator validator = PlannerFixtures.validator();

    private static NodeSpec script(String id, List<String> deps, List<String> tools) {
        return NodeSpec.work(id, deps, ExecutionUnit.script("return 1;", Map.of(), tools, Budget.defaults()),
                false, false, null);
    }

    private static void assertPlanInvalid(Runnable check, String messagePart) {
        assertThatThrownBy(check::run)
                .isInstanceOfSatisfying(OrchestratorException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCodes.PLAN_INVALID))
                .hasMessageContaining(messagePart);
    }

    // ------------------------------------------------------------------
    // Structure
    // ------------------------------------------------------------------

    @Test
    void validateStructure_validDag_passes() {
        List<NodeSpec> nodes = List.of(script("a", List.of(), List.of()), script("b", List.of("a"), List.of()));

        assertThatCode(() -> validator.validateStructure(nodes, Set.of(), 10)).doesNotThrowAnyException();
    }

    @Test
    void validateStructure_duplicateId_isInvalid() {
        List<NodeSpec> nodes = List.of(script("a", List.of(), List.of()), script("a", List.of(), List.of()));

        assertPlanInvalid(() -> validator.validateStructure(nodes, Set.of(), 10), "duplicate node id 'a'");
    }

    @Test
    void validateStructure_unknownDependency_isInvalid() {
        List<NodeSpec> nodes = List.of(script("b", List.of("ghost"), List.of()));

        assertPlanInvalid(() -> validator.validateStructure(nodes, Set.of(), 10), "unknown node 'ghost'");
    }

    @Test
    void validateStructure_satisfiedDependency_isKnown() {
        List<NodeSpec> nodes = List.of(script("b2", List.of("a"), List.of()));

        assertThatCode(() -> validator.validateStructure(nodes, Set.of("a"), 10)).doesNotThrowAnyException();
    }

    @Test
    void validateStructure_reusedRunId_isInvalid() {
        List<NodeSpec> nodes = List.of(script("a", List.of(), List.of()));

        assertPlanInvalid(() -> validator.validateStructure(nodes, Set.of("a"), 10), "already used");
    }

    @Test
    void validateStructure_cycle_isInvalid() {
        List<NodeSpec> nodes = List.of(
                script("a", List.of("c"), List.of()),
                script("b", List.of("a"), List.of()),
                script("c", List.of("b"), List.of()),
                script("d", List.of(), List.of()));

        assertPlanInvalid(() -> validator.validateStructure(nodes, Set.of(), 10), "cycle among [a, b, c]");
    }

    @Test
    void validateStructure_tooManyNodes_isInvalid() {
        List<NodeSpec> nodes = List.of(script("a", List.of(), List.of()), script("b", List.of(), List.of()));

        assertPlanInvalid(() -> validator.validateStructure(nodes, Set.of(), 1), "limit is 1");
    }

    @Test
    void topologicalOrder_breaksTiesByAscendingId() {
        List<NodeSpec> nodes = List.of(
                script("z", List.of(), List.of()),
                script("m", List.of("z"), List.of()),
                script("a", List.of(), List.of()),
                script("b", List.of("a", "z"), List.of()));

        assertThat(PlanValidator.topologicalOrder(nodes, Set.of())).containsExactly("a", "z", "b", "m");
    }

    // ------------------------------------------------------------------
    // Feasibility
    // ------------------------------------------------------------------

    @Test
    void validateFeasibility_allowedReachableTool_passes() {
        List<NodeSpec> nodes = List.of(script("a", List.of(), List.of("mcp://fs.read")),
                NodeSpec.approval("approve-a", List.of(), "approve"));

        assertThatCode(() -> validator.validateFeasibility(nodes, PlannerFixtures.MANIFEST, List.of()))
                .doesNotThrowAnyException();
    }

    @Test
    void validateFeasibility_manifestDenied_isInvalid() {
        List<NodeSpec> nodes = List.of(script("rm", List.of(), List.of("mcp://fs.delete")));

        assertPlanInvalid(() -> validator.validateFeasibility(nodes, PlannerFixtures.MANIFEST, List.of()),
                "needs mcp://fs.delete");
    }

    @Test
    void validateFeasibility_callerDisallowed_isInvalid() {
        List<NodeSpec> nodes = List.of(script("w", List.of(), List.of("mcp://fs.write")));

        assertPlanInvalid(() -> validator.validateFeasibility(nodes, PlannerFixtures.MANIFEST, List.of("mcp://fs.w*")),
                "disallowed tool mcp://fs.write");
    }

    @Test
    void validateFeasibility_noServer_isInvalid() {
        List<NodeSpec> nodes = List.of(script("t", List.of(), List.of("mcp://tracker.list")));

        assertPlanInvalid(() -> validator.validateFeasibility(nodes, PlannerFixtures.MANIFEST, List.of()),
                "no tool server provides");
    }
}
