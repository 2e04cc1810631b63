package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.Set;

/**
 * Predicts what a unit of work will touch before it runs.
 *
 * Implementations may be as rough as keyword matching or as precise as a
 * static analysis of the repository; the compatibility checker and the
 * resolution engine only see the resulting sets.
 */
public interface AffectedScopePredictor {

    /** File paths or path prefixes the unit is expected to modify. */
    Set<String> predictAffectedFiles(WorkUnit unit);

    /** Business modules (e.g. {@code user-service}) the unit is expected to modify. */
    Set<String> predictAffectedModules(WorkUnit unit);
}
