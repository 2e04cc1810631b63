package com.agentcrew.orchestrator.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

/** Overall risk of running a batch as submitted. */
public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
