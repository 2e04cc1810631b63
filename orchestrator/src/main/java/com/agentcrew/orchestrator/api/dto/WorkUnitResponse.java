package com.agentcrew.orchestrator.api.dto;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.Priority;
import com.agentcrew.orchestrator.model.TaskType;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.time.Instant;
import java.util.List;

/** Response body for the /units endpoints. */
public record WorkUnitResponse(
        String       id,
        String       title,
        String       description,
        String       repository,
        TaskType     type,
        Complexity   complexity,
        Priority     priority,
        AgentRole    assignedAgent,
        WorkStatus   status,
        List<String> dependencies,
        List<String> files,
        String       parentId,
        List<String> originIds,
        Instant      deadline,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static WorkUnitResponse from(WorkUnit u) {
        return new WorkUnitResponse(
                u.getId(),
                u.getTitle(),
                u.getDescription(),
                u.repository() == null ? null : u.repository().fullName(),
                u.getType(),
                u.getComplexity(),
                u.getPriority(),
                u.getAssignedAgent(),
                u.getStatus(),
                List.copyOf(u.getDependencies()),
                List.copyOf(u.getExplicitFiles()),
                u.getParentId(),
                List.copyOf(u.getOriginIds()),
                u.getDeadline(),
                u.getCreatedAt(),
                u.getUpdatedAt()
        );
    }
}
