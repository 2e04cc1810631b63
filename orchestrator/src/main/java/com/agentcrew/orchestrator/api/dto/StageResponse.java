package com.agentcrew.orchestrator.api.dto;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.PipelineStage;
import com.agentcrew.orchestrator.model.StageState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a pipeline stage returned by GET /units/{id}/stages.
 * branchName and pullRequestUrl are only set on code-mutating stages.
 */
public record StageResponse(
        UUID         id,
        int          position,
        AgentRole    role,
        StageState   state,
        String       branchName,
        String       pullRequestUrl,
        List<String> filesChanged,
        String       output,
        String       error,
        Instant      startedAt,
        Instant      finishedAt
) {
    public static StageResponse from(PipelineStage s) {
        return new StageResponse(
                s.getId(),
                s.getPosition(),
                s.getRole(),
                s.getState(),
                s.getBranchName(),
                s.getPullRequestUrl(),
                List.copyOf(s.getFilesChanged()),
                s.getOutput(),
                s.getError(),
                s.getStartedAt(),
                s.getFinishedAt()
        );
    }
}
