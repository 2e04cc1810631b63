package com.agentcrew.orchestrator.model;

/**
 * State of one pipeline stage.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS
 *   IN_PROGRESS → COMPLETED | FAILED
 */
public enum StageState {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(StageState next) {
        return switch (this) {
            case PENDING     -> next == IN_PROGRESS;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
