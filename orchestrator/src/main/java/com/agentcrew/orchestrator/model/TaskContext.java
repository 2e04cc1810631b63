package com.agentcrew.orchestrator.model;

import java.util.Set;

/**
 * Structural fingerprint of a unit of work, used only for conflict prediction.
 * Derived on demand from a {@link WorkUnit}; never persisted.
 */
public record TaskContext(
        String      unitId,
        Set<String> files,
        Set<String> modules,
        Set<String> dependencies,
        Set<String> blocks,
        int         estimatedMinutes
) {
    public TaskContext {
        files        = Set.copyOf(files);
        modules      = Set.copyOf(modules);
        dependencies = Set.copyOf(dependencies);
        blocks       = Set.copyOf(blocks);
    }
}
