package com.agentcrew.orchestrator.pipeline;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Instructions sent to the code-generation engine for each pipeline stage.
 *
 * Each template tells the engine which role it plays and what that role
 * hands on to the next stage. The unit's own text is substituted in;
 * earlier stages' outputs travel separately as context.
 */
@Component
public class StageInstructions {

    public String forStage(AgentRole role, WorkUnit unit) {
        String template = switch (role) {
            case PRODUCT_MANAGER   -> PRODUCT_MANAGER_TEMPLATE;
            case PROJECT_MANAGER   -> PROJECT_MANAGER_TEMPLATE;
            case TECH_LEAD         -> TECH_LEAD_TEMPLATE;
            case SENIOR_DEVELOPER  -> SENIOR_DEVELOPER_TEMPLATE;
            case JUNIOR_DEVELOPER  -> JUNIOR_DEVELOPER_TEMPLATE;
            case QA_ENGINEER       -> QA_ENGINEER_TEMPLATE;
        };
        return template
                .replace("{{TITLE}}", unit.getTitle())
                .replace("{{DESCRIPTION}}", unit.getDescription() == null ? "" : unit.getDescription())
                .replace("{{TYPE}}", unit.getType().name().toLowerCase())
                .replace("{{COMPLEXITY}}", unit.getComplexity().name().toLowerCase())
                .replace("{{FILES}}", files(unit));
    }

    private static String files(WorkUnit unit) {
        if (unit.getExplicitFiles().isEmpty()) {
            return "(none declared)";
        }
        return unit.getExplicitFiles().stream()
                .map(f -> "  - " + f)
                .collect(Collectors.joining("\n"));
    }

    // ------------------------------------------------------------------
    // Role templates
    // ------------------------------------------------------------------

    private static final String PRODUCT_MANAGER_TEMPLATE = """
            You are the product manager for this unit of work.

            TASK: {{TITLE}}
            TYPE: {{TYPE}}, COMPLEXITY: {{COMPLEXITY}}

            {{DESCRIPTION}}

            Write the user-facing requirements and acceptance criteria.
            Do not change any code. Keep it to what the developers need to know.
            """;

    private static final String PROJECT_MANAGER_TEMPLATE = """
            You are the project manager for this unit of work.

            TASK: {{TITLE}}

            {{DESCRIPTION}}

            Using the requirements from the product manager, break the work into
            ordered steps, name the risks, and list anything that blocks it.
            Do not change any code.
            """;

    private static final String TECH_LEAD_TEMPLATE = """
            You are the tech lead for this unit of work.

            TASK: {{TITLE}}
            FILES DECLARED BY THE REQUESTER:
            {{FILES}}

            {{DESCRIPTION}}

            Decide the technical approach: which files and modules change, which
            interfaces are added or altered, and how the change is tested.
            Do not change any code.
            """;

    private static final String SENIOR_DEVELOPER_TEMPLATE = """
            You are the senior developer for this unit of work.

            TASK: {{TITLE}}
            FILES DECLARED BY THE REQUESTER:
            {{FILES}}

            {{DESCRIPTION}}

            Implement the tech lead's design. You own the branch you are working on;
            commit every change to it. Keep the change focused on this task and
            report the files you changed.
            """;

    private static final String JUNIOR_DEVELOPER_TEMPLATE = """
            You are the junior developer for this unit of work.

            TASK: {{TITLE}}
            FILES DECLARED BY THE REQUESTER:
            {{FILES}}

            {{DESCRIPTION}}

            Finish the remaining implementation work the senior developer left:
            documentation, small fixes and cleanup. Commit to the branch you are
            working on and report the files you changed.
            """;

    private static final String QA_ENGINEER_TEMPLATE = """
            You are the QA engineer for this unit of work.

            TASK: {{TITLE}}

            {{DESCRIPTION}}

            Verify the implementation against the acceptance criteria. Run the
            tests, list any that fail, and state clearly whether the work is
            ready to merge. Do not change any code.
            """;
}
