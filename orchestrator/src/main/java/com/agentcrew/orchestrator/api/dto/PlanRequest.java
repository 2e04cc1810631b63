package com.agentcrew.orchestrator.api.dto;

import java.util.List;

/** Request body for POST /plans: ids of PENDING units to plan as one batch. */
public record PlanRequest(List<String> unitIds, Boolean allowMerge) {

    public PlanRequest {
        if (unitIds == null)    unitIds = List.of();
        if (allowMerge == null) allowMerge = Boolean.TRUE;
    }
}
