package com.agentcrew.orchestrator.api.dto;

/** Request body for POST /admin/emergency-cleanup. */
public record EmergencyCleanupRequest(Long olderThanMinutes) {

    public EmergencyCleanupRequest {
        if (olderThanMinutes == null) olderThanMinutes = 30L;
    }
}
