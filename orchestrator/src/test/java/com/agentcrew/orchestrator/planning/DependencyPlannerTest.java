package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.conflict.KeywordScopePredictor;
import com.agentcrew.orchestrator.conflict.TaskContextExtractor;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.agentcrew.orchestrator.conflict.TestUnits.dependsOn;
import static com.agentcrew.orchestrator.conflict.TestUnits.unit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DependencyPlannerTest {

    private final TaskContextExtractor extractor = new TaskContextExtractor(new KeywordScopePredictor());
    private final DependencyPlanner    planner   = new DependencyPlanner(extractor, 3);

    @Test
    void validateAndOrder_placesEveryUnitAfterItsDependencies() {
        WorkUnit a = unit("a", "Tweak copy");
        WorkUnit b = dependsOn(unit("b", "Rename labels"), "a");
        WorkUnit c = dependsOn(unit("c", "Adjust spacing"), "b");
        WorkUnit d = unit("d", "Bump version");

        ExecutionPlan plan = planner.validateAndOrder(List.of(c, b, a, d));

        assertThat(plan.order()).containsExactlyInAnyOrder("a", "b", "c", "d");
        assertThat(plan.order().indexOf("a")).isLessThan(plan.order().indexOf("b"));
        assertThat(plan.order().indexOf("b")).isLessThan(plan.order().indexOf("c"));
    }

    @Test
    void validateAndOrder_groupsIndependentUnitsAndSplitsOnDependency() {
        WorkUnit a = unit("a", "Tweak copy");
        WorkUnit b = dependsOn(unit("b", "Rename labels"), "a");
        WorkUnit c = dependsOn(unit("c", "Adjust spacing"), "b");
        WorkUnit d = unit("d", "Bump version");

        ExecutionPlan plan = planner.validateAndOrder(List.of(a, b, c, d));

        assertThat(plan.order()).containsExactly("a", "d", "b", "c");
        assertThat(plan.groups()).containsExactly(List.of("a", "d"), List.of("b"), List.of("c"));
        assertThat(plan.estimatedMinutes()).isEqualTo(180);   // three groups of 60-minute units
    }

    @Test
    void validateAndOrder_capsGroupSize() {
        List<WorkUnit> units = List.of(
                unit("a", "x"), unit("b", "x"), unit("c", "x"), unit("d", "x"), unit("e", "x"));

        ExecutionPlan plan = planner.validateAndOrder(units);

        assertThat(plan.groups()).containsExactly(List.of("a", "b", "c"), List.of("d", "e"));
    }

    @Test
    void validateAndOrder_cycle_isReportedNeverDropped() {
        WorkUnit a = dependsOn(unit("a", "Tweak copy"), "b");
        WorkUnit b = dependsOn(unit("b", "Rename labels"), "a");
        WorkUnit c = unit("c", "Adjust spacing");

        assertThatThrownBy(() -> planner.validateAndOrder(List.of(a, b, c)))
                .isInstanceOfSatisfying(DependencyCycleException.class,
                        e -> assertThat(e.getCycleNodes()).containsExactlyInAnyOrder("a", "b"));
    }

    @Test
    void validateAndOrder_dependencyOutsideBatch_isIgnored() {
        WorkUnit a = dependsOn(unit("a", "Tweak copy"), "already-merged");

        ExecutionPlan plan = planner.validateAndOrder(List.of(a));

        assertThat(plan.order()).containsExactly("a");
        assertThat(plan.groups()).containsExactly(List.of("a"));
    }

    @Test
    void constructor_rejectsEmptyGroups() {
        assertThatThrownBy(() -> new DependencyPlanner(extractor, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
