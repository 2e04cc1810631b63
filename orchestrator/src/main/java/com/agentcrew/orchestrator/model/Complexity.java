package com.agentcrew.orchestrator.model;

/**
 * Ordered complexity tiers: SIMPLE &lt; MODERATE &lt; COMPLEX &lt; EXPERT.
 * Declaration order is significant; {@link #max} relies on it.
 */
public enum Complexity {
    SIMPLE(30, -10),
    MODERATE(60, 0),
    COMPLEX(120, 10),
    EXPERT(180, 20);

    private final int baseMinutes;
    private final int priorityModifier;

    Complexity(int baseMinutes, int priorityModifier) {
        this.baseMinutes      = baseMinutes;
        this.priorityModifier = priorityModifier;
    }

    public int baseMinutes()      { return baseMinutes; }
    public int priorityModifier() { return priorityModifier; }

    public boolean isAtLeast(Complexity other) {
        return compareTo(other) >= 0;
    }

    public static Complexity max(Complexity a, Complexity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
