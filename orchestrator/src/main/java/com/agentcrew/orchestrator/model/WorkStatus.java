package com.agentcrew.orchestrator.model;

/**
 * Lifecycle of a unit of work as it moves through the pipeline.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS | CANCELLED
 *   IN_PROGRESS → COMPLETED | FAILED | CANCELLED
 *   COMPLETED, FAILED, CANCELLED are terminal.
 */
public enum WorkStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(WorkStatus next) {
        return switch (this) {
            case PENDING     -> next == IN_PROGRESS || next == CANCELLED;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }
}
