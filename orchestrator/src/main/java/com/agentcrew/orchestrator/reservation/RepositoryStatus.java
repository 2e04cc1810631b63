package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.model.AgentRole;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Read-only monitoring snapshot of one repository. */
public record RepositoryStatus(
        String                  repository,
        List<ActiveReservation> activeReservations,
        int                     queuedTasks,
        Map<AgentRole, Integer> queueDepth,
        Set<String>             filesInUse
) {
    public record ActiveReservation(
            AgentRole agentType,
            String    branchName,
            String    unitId,
            String    unitTitle,
            Instant   createdAt,
            long      ageMinutes
    ) {}
}
