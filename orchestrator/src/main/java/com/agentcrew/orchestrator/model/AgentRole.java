package com.agentcrew.orchestrator.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * The six agent types, in pipeline order.
 *
 * An agent type is both a pipeline stage and the key of a branch reservation:
 * at most one reservation exists per (repository, agent type).
 * Only roles that mutate code take a reservation when their stage runs.
 */
public enum AgentRole {

    // Clarifies requirements and acceptance criteria.
    PRODUCT_MANAGER("product-manager", false, 5, 6, Set.of("requirements", "analysis")),

    // Breaks the work down and plans the sequence.
    PROJECT_MANAGER("project-manager", false, 5, 3, Set.of("planning", "coordination")),

    // Architecture and technical design; writes no code itself.
    TECH_LEAD("tech-lead", false, 10, 5, Set.of("architecture", "design", "complex-features")),

    // Implements complex changes on a reserved branch.
    SENIOR_DEVELOPER("senior-developer", true, 30, 4, Set.of("complex-features", "review", "integration")),

    // Implements simple changes and UI work on a reserved branch.
    JUNIOR_DEVELOPER("junior-developer", true, 15, 1, Set.of("simple-features", "ui", "testing")),

    // Verifies the result; read-only access to the repository.
    QA_ENGINEER("qa-engineer", false, 20, 2, Set.of("testing", "validation", "quality-assurance"));

    private final String      label;
    private final boolean     mutatesCode;
    private final int         baseWaitMinutes;
    private final int         hierarchyRank;
    private final Set<String> capabilities;

    AgentRole(String label, boolean mutatesCode, int baseWaitMinutes, int hierarchyRank, Set<String> capabilities) {
        this.label           = label;
        this.mutatesCode     = mutatesCode;
        this.baseWaitMinutes = baseWaitMinutes;
        this.hierarchyRank   = hierarchyRank;
        this.capabilities    = capabilities;
    }

    public String      label()           { return label; }
    public boolean     mutatesCode()     { return mutatesCode; }
    public int         baseWaitMinutes() { return baseWaitMinutes; }
    public int         hierarchyRank()   { return hierarchyRank; }
    public Set<String> capabilities()    { return capabilities; }

    public static Optional<AgentRole> fromLabel(String label) {
        return Arrays.stream(values())
                .filter(r -> r.label.equalsIgnoreCase(label) || r.name().equalsIgnoreCase(label))
                .findFirst();
    }

    /** Default agent for a unit that was submitted without one. */
    public static AgentRole defaultFor(Complexity complexity, TaskType type) {
        boolean verification = type == TaskType.TESTING || type == TaskType.COMPLIANCE;
        return switch (complexity) {
            case SIMPLE            -> JUNIOR_DEVELOPER;
            case MODERATE          -> verification ? QA_ENGINEER : JUNIOR_DEVELOPER;
            case COMPLEX, EXPERT   -> verification ? QA_ENGINEER : SENIOR_DEVELOPER;
        };
    }
}
