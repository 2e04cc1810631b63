package com.agentcrew.orchestrator.api.dto;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.Priority;
import com.agentcrew.orchestrator.model.TaskType;

import java.time.Instant;
import java.util.List;

/**
 * Request body for POST /units.
 *
 * Required: title, repository ("owner/name")
 * Optional: everything else. type defaults to FEATURE, complexity to MODERATE,
 * priority to MEDIUM; assignedAgent is derived from complexity and type when absent.
 */
public record CreateWorkUnitRequest(
        String       title,
        String       description,
        String       repository,
        TaskType     type,
        Complexity   complexity,
        Priority     priority,
        AgentRole    assignedAgent,
        Instant      deadline,
        List<String> dependencies,
        List<String> files
) {
    public CreateWorkUnitRequest {
        if (type == null)         type = TaskType.FEATURE;
        if (complexity == null)   complexity = Complexity.MODERATE;
        if (priority == null)     priority = Priority.MEDIUM;
        if (dependencies == null) dependencies = List.of();
        if (files == null)        files = List.of();
    }
}
