package com.agentcrew.orchestrator.conflict;

import java.util.Set;

/** Every way two units of a batch overlap, with the escalated severity. */
public record UnitOverlap(
        String                firstId,
        String                secondId,
        Set<ConflictCategory> categories,
        Severity              severity,
        Set<String>           sharedFiles,
        Set<String>           sharedModules,
        double                similarity
) {
    public UnitOverlap {
        categories    = Set.copyOf(categories);
        sharedFiles   = Set.copyOf(sharedFiles);
        sharedModules = Set.copyOf(sharedModules);
    }

    public boolean has(ConflictCategory category) {
        return categories.contains(category);
    }
}
