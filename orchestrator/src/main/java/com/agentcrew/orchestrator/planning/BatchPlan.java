package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.conflict.OverlapReport;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.List;

/**
 * Outcome of planning a batch: the units as they will run (with added
 * sequencing edges and merged units), what was changed, and the order.
 */
public record BatchPlan(
        List<WorkUnit>          units,
        OverlapReport           overlaps,
        List<AppliedResolution> resolutions,
        ExecutionPlan           plan
) {
    public BatchPlan {
        units       = List.copyOf(units);
        resolutions = List.copyOf(resolutions);
    }
}
