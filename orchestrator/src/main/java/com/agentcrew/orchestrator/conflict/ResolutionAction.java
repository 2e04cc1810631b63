package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.planning.DependencyEdge;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Payload of a resolved conflict: what the caller has to do to apply it.
 * One record per kind of remedy.
 */
public sealed interface ResolutionAction {

    /** Run after the given units; edges added to the candidate's dependencies. */
    record AddDependencies(Set<String> dependsOn, long estimatedDelayMinutes) implements ResolutionAction {}

    /** Replace the candidate by these sub-units. */
    record SplitUnit(List<WorkUnit> subUnits) implements ResolutionAction {}

    /** The candidate goes first; the named units are queued behind it. */
    record Preempt(List<String> preemptedUnitIds,
                   int candidateScore,
                   Map<String, Integer> conflictingScores) implements ResolutionAction {}

    record QueuePlacement(int queuePosition, long estimatedWaitMinutes) implements ResolutionAction {}

    record Reassign(AgentRole from, AgentRole to, Set<String> matchedCapabilities) implements ResolutionAction {}

    record Merge(WorkUnit merged, List<String> originalIds, double similarity) implements ResolutionAction {}

    /** Units may share a module because each stays in its own layer. */
    record LayerSeparation(Map<String, ArchitecturalLayer> layers) implements ResolutionAction {}

    record InterfaceContract(List<String> executionOrder,
                             List<InterfaceDefinition> interfaces) implements ResolutionAction {}

    record InterfaceDefinition(String name,
                               String module,
                               String providerUnitId,
                               String consumerUnitId,
                               List<String> coordinationPoints) {}

    record Restructure(List<DependencyEdge> demotedEdges, List<String> newOrder) implements ResolutionAction {}

    record WaitForDependencies(List<PendingDependency> blocking, long estimatedDelayMinutes) implements ResolutionAction {}

    record PendingDependency(String unitId, String title, WorkStatus status, long estimatedRemainingMinutes) {}

    record ParallelExecution(List<String> parallelUnitIds, List<String> coordinationPoints) implements ResolutionAction {}

    record CapacitySplit(List<WorkUnit> subUnits, Map<String, AgentRole> assignments) implements ResolutionAction {}

    record Coordination(String leadUnitId,
                        List<String> relatedUnitIds,
                        Set<String> sharedKeywords,
                        List<String> integrationPoints) implements ResolutionAction {}
}
