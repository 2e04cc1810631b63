package com.agentcrew.orchestrator.api.dto;

/** Request body for POST /admin/branches/force-release. */
public record ForceReleaseRequest(String branchName, String reason) {

    public ForceReleaseRequest {
        if (reason == null || reason.isBlank()) reason = "operator request";
    }
}
