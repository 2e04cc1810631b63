package com.agentcrew.orchestrator.conflict;

import java.util.List;

public record OverlapReport(List<UnitOverlap> overlaps, RiskLevel riskLevel) {

    public OverlapReport {
        overlaps = List.copyOf(overlaps);
    }

    public boolean hasOverlaps() {
        return !overlaps.isEmpty();
    }
}
