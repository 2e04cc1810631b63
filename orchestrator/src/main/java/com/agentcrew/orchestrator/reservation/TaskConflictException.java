package com.agentcrew.orchestrator.reservation;

import com.agentcrew.orchestrator.conflict.CompatibilityResult;

/**
 * A reservation was refused because the unit conflicts with active work.
 * Expected and non-fatal: callers hand the result to the resolution engine.
 */
public class TaskConflictException extends RuntimeException {

    private final CompatibilityResult result;

    public TaskConflictException(CompatibilityResult result) {
        super("Unit " + result.context().unitId() + " conflicts (" + result.reason().wireName()
                + ") with " + result.conflictingUnitIds());
        this.result = result;
    }

    public CompatibilityResult getResult() {
        return result;
    }
}
