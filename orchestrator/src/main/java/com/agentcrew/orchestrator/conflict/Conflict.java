package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.Set;

/**
 * One detected conflict between a candidate unit and one offending unit.
 *
 * {@code reservation} is the offending unit's active reservation when the
 * conflict was found against live repository state, and null when it came
 * from analysing a batch of units that are not running yet.
 */
public record Conflict(
        ConflictCategory category,
        Severity         severity,
        WorkUnit         unit,
        Set<String>      sharedFiles,
        Set<String>      sharedModules,
        Reservation      reservation
) {
    public Conflict {
        sharedFiles   = Set.copyOf(sharedFiles);
        sharedModules = Set.copyOf(sharedModules);
    }

    public String unitId() {
        return unit.getId();
    }
}
