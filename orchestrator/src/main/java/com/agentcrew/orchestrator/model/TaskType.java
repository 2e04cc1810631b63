package com.agentcrew.orchestrator.model;

/**
 * Category label of a unit of work.
 * Carries the duration multiplier and priority modifier used by the scheduler.
 */
public enum TaskType {
    FEATURE(1.0, 0),
    BUG(0.7, 30),
    ENHANCEMENT(0.8, -10),
    DOCUMENTATION(0.3, -20),
    TESTING(0.5, 0),
    COMPLIANCE(1.0, 0),
    SECURITY(1.0, 40);

    private final double durationMultiplier;
    private final int    priorityModifier;

    TaskType(double durationMultiplier, int priorityModifier) {
        this.durationMultiplier = durationMultiplier;
        this.priorityModifier   = priorityModifier;
    }

    public double durationMultiplier() { return durationMultiplier; }
    public int    priorityModifier()   { return priorityModifier; }
}
