package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.TaskContext;

import java.util.List;

/**
 * Outcome of a compatibility check. {@code reason} and {@code conflicts}
 * are only set when the unit is not compatible.
 */
public record CompatibilityResult(
        boolean          compatible,
        ConflictCategory reason,
        List<Conflict>   conflicts,
        TaskContext      context
) {
    public CompatibilityResult {
        conflicts = List.copyOf(conflicts);
    }

    public static CompatibilityResult compatible(TaskContext context) {
        return new CompatibilityResult(true, null, List.of(), context);
    }

    public static CompatibilityResult conflict(ConflictCategory reason, List<Conflict> conflicts, TaskContext context) {
        return new CompatibilityResult(false, reason, conflicts, context);
    }

    public List<String> conflictingUnitIds() {
        return conflicts.stream().map(Conflict::unitId).toList();
    }
}
