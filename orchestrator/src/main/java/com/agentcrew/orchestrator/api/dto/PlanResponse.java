package com.agentcrew.orchestrator.api.dto;

import com.agentcrew.orchestrator.conflict.RiskLevel;
import com.agentcrew.orchestrator.conflict.UnitOverlap;
import com.agentcrew.orchestrator.planning.AppliedResolution;
import com.agentcrew.orchestrator.planning.BatchPlan;

import java.util.List;

public record PlanResponse(
        List<String>            order,
        List<List<String>>      groups,
        long                    estimatedMinutes,
        RiskLevel               riskLevel,
        List<UnitOverlap>       overlaps,
        List<AppliedResolution> resolutions,
        List<WorkUnitResponse>  units
) {
    public static PlanResponse from(BatchPlan plan) {
        return new PlanResponse(
                plan.plan().order(),
                plan.plan().groups(),
                plan.plan().estimatedMinutes(),
                plan.overlaps().riskLevel(),
                plan.overlaps().overlaps(),
                plan.resolutions(),
                plan.units().stream().map(WorkUnitResponse::from).toList()
        );
    }
}
