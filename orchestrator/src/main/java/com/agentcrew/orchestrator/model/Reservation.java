package com.agentcrew.orchestrator.model;

import java.time.Duration;
import java.time.Instant;

/**
 * A branch lock: the claim of one unit of work on a (repository, agent type) pair.
 * Lives only in memory, inside the reservation manager.
 */
public record Reservation(
        RepositoryRef repository,
        AgentRole     agentType,
        String        branchName,
        WorkUnit      unit,
        TaskContext   context,
        Instant       createdAt
) {
    public String unitId() {
        return unit.getId();
    }

    public Duration age(Instant now) {
        return Duration.between(createdAt, now);
    }
}
