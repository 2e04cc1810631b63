package com.agentcrew.orchestrator.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

/** Ordered LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL. */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Severity only ever escalates when several categories apply to the same pair. */
    public Severity escalate(Severity other) {
        return other != null && other.compareTo(this) > 0 ? other : this;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
