package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.conflict.ResolutionStrategy;

import java.util.List;

/** What the batch planner did about one overlapping pair. */
public record AppliedResolution(
        ResolutionStrategy strategy,
        List<String>       unitIds,
        boolean            resolved,
        String             detail
) {
    public AppliedResolution {
        unitIds = List.copyOf(unitIds);
    }
}
