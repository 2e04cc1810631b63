package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.Priority;
import com.agentcrew.orchestrator.model.TaskType;
import com.agentcrew.orchestrator.model.WorkUnit;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the derived units the resolution strategies hand back:
 * merged units and split parts. Inputs are never modified.
 */
public final class UnitMerger {

    private UnitMerger() {}

    /**
     * Combine two units into one.
     * Complexity and priority escalate to the higher of the two, the agent is
     * the higher-ranked one, and the originals are recorded in {@code originIds}.
     */
    public static WorkUnit merge(WorkUnit a, WorkUnit b) {
        TaskType type = a.getType() == b.getType() ? a.getType() : TaskType.FEATURE;
        WorkUnit merged = new WorkUnit(
                "merged_" + a.getId() + "_" + b.getId(),
                "Combined: " + a.getTitle() + " & " + b.getTitle(),
                "Merged units to avoid duplicate work:\n1. " + describe(a) + "\n2. " + describe(b),
                type,
                Complexity.max(a.getComplexity(), b.getComplexity()));
        merged.setPriority(Priority.max(a.getPriority(), b.getPriority()));
        merged.setAssignedAgent(higherRanked(a.effectiveAgent(), b.effectiveAgent()));
        merged.setRepository(a.repository() != null ? a.repository() : b.repository());
        merged.setDeadline(earliest(a.getDeadline(), b.getDeadline()));

        Set<String> deps = union(a.getDependencies(), b.getDependencies());
        deps.remove(a.getId());
        deps.remove(b.getId());
        merged.setDependencies(deps);
        merged.setBlocks(union(a.getBlocks(), b.getBlocks()));
        merged.setExplicitFiles(union(a.getExplicitFiles(), b.getExplicitFiles()));
        merged.setOriginIds(new LinkedHashSet<>(List.of(a.getId(), b.getId())));
        return merged;
    }

    /** A part of {@code parent} carrying the given files; inherits everything else. */
    public static WorkUnit part(WorkUnit parent, int index, String titleSuffix, Complexity complexity,
                                Set<String> files, Set<String> dependencies) {
        WorkUnit part = new WorkUnit(
                parent.getId() + "-part" + index,
                parent.getTitle() + " (" + titleSuffix + ")",
                parent.getDescription(),
                parent.getType(),
                complexity);
        part.setPriority(parent.getPriority());
        part.setAssignedAgent(parent.getAssignedAgent());
        part.setRepository(parent.repository());
        part.setDeadline(parent.getDeadline());
        part.setParentId(parent.getId());
        part.setBlocks(parent.getBlocks());
        part.setExplicitFiles(files);
        part.setDependencies(dependencies);
        return part;
    }

    public static AgentRole higherRanked(AgentRole a, AgentRole b) {
        return a.hierarchyRank() >= b.hierarchyRank() ? a : b;
    }

    private static String describe(WorkUnit unit) {
        return unit.getDescription() == null ? unit.getTitle() : unit.getTitle() + ": " + unit.getDescription();
    }

    private static Instant earliest(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isBefore(b) ? a : b;
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> out = new LinkedHashSet<>(a);
        out.addAll(b);
        return out;
    }
}
