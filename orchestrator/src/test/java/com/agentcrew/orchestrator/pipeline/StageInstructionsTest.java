package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.TaskType;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StageInstructionsTest {

    private final StageInstructions instructions = new StageInstructions();

    @Test
    void forStage_substitutesUnitFields() {
        WorkUnit unit = new WorkUnit("u1", "Add promo banner", "Show it on the home page",
                TaskType.ENHANCEMENT, Complexity.COMPLEX);
        unit.setExplicitFiles(Set.of("src/banner.js"));

        assertThat(instructions.forStage(AgentRole.PRODUCT_MANAGER, unit))
                .contains("TASK: Add promo banner")
                .contains("Show it on the home page")
                .contains("TYPE: enhancement, COMPLEXITY: complex");
        assertThat(instructions.forStage(AgentRole.SENIOR_DEVELOPER, unit))
                .contains("src/banner.js")
                .doesNotContain("{{");
    }

    @Test
    void forStage_everyRoleHasItsOwnTemplate() {
        WorkUnit unit = new WorkUnit("u1", "Tweak copy", null, TaskType.FEATURE, Complexity.SIMPLE);

        for (AgentRole role : AgentRole.values()) {
            assertThat(instructions.forStage(role, unit)).doesNotContain("{{").contains("TASK: Tweak copy");
        }
        assertThat(instructions.forStage(AgentRole.TECH_LEAD, unit)).contains("(none declared)");
        assertThat(instructions.forStage(AgentRole.PRODUCT_MANAGER, unit))
                .isNotEqualTo(instructions.forStage(AgentRole.QA_ENGINEER, unit));
    }
}
