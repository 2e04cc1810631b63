package com.agentcrew.orchestrator.model;

/** Declared priority tier. Ordered LOW &lt; MEDIUM &lt; HIGH &lt; CRITICAL. */
public enum Priority {
    LOW(-20),
    MEDIUM(0),
    HIGH(20),
    CRITICAL(40);

    private final int scoreModifier;

    Priority(int scoreModifier) {
        this.scoreModifier = scoreModifier;
    }

    public int scoreModifier() { return scoreModifier; }

    public static Priority max(Priority a, Priority b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
