package com.agentcrew.orchestrator.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a unit of work cannot run right now.
 * The compatibility checker reports them in declaration order of the first four.
 */
public enum ConflictCategory {
    FILE_OVERLAP,
    DEPENDENCY_CONFLICT,
    MODULE_OVERLAP,
    AGENT_BUSY,
    CONCEPTUAL_CONFLICT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
