package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.conflict.ResolutionAction.*;
import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Complexity;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.TaskContext;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import com.agentcrew.orchestrator.planning.DependencyEdge;
import com.agentcrew.orchestrator.planning.DependencyGraph;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses a remedy for a detected conflict.
 *
 * One handler per {@link ConflictCategory}; each tries its strategies in a
 * fixed order and returns the first that applies. Handlers never throw:
 * a failure inside a handler is logged and turned into an unresolved
 * result carrying fallback options for an operator.
 */
@Component
public class ConflictResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolutionEngine.class);

    public static final double MERGE_THRESHOLD = 0.7;

    private static final List<String> INTERFACE_COORDINATION_POINTS =
            List.of("data_flow", "api_contracts", "shared_components");

    // Used when nothing is known about the blocking work: a moderate feature.
    private static final long DEFAULT_REMAINING_MINUTES = 60;

    private final TaskContextExtractor extractor;
    private final PriorityCalculator   priorities;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;

    public ConflictResolutionEngine(TaskContextExtractor extractor,
                                    PriorityCalculator priorities,
                                    MeterRegistry meterRegistry,
                                    Clock clock) {
        this.extractor     = extractor;
        this.priorities    = priorities;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * @param agentType the agent type the candidate wants to run as
     * @param view      live state of the repository, or null when resolving within a batch
     */
    public Resolution resolve(WorkUnit unit,
                              AgentRole agentType,
                              ConflictCategory category,
                              List<Conflict> conflicts,
                              ActiveWorkView view,
                              ResolutionOptions options) {
        Resolution resolution;
        if (conflicts.isEmpty()) {
            resolution = Resolution.unresolved(category, fallbackSuggestion(category));
        } else {
            try {
                resolution = switch (category) {
                    case FILE_OVERLAP        -> resolveFileOverlap(unit, agentType, conflicts, view, options);
                    case MODULE_OVERLAP      -> resolveModuleOverlap(unit, conflicts, options);
                    case DEPENDENCY_CONFLICT -> resolveDependencyConflict(unit, conflicts, view);
                    case AGENT_BUSY          -> resolveAgentBusy(unit, agentType, conflicts, view, options);
                    case CONCEPTUAL_CONFLICT -> resolveConceptualConflict(unit, conflicts, options);
                };
            } catch (RuntimeException e) {
                log.warn("Resolving {} for unit {} failed, escalating to manual intervention",
                        category.wireName(), unit.getId(), e);
                resolution = Resolution.unresolved(category, fallbackSuggestion(category));
            }
        }

        meterRegistry.counter("agentcrew.conflicts.resolved",
                        "category", category.wireName(),
                        "strategy", resolution.strategy().wireName(),
                        "resolved", String.valueOf(resolution.resolved()))
                .increment();
        log.info("Conflict {} for unit {} against {} -> {}",
                category.wireName(), unit.getId(),
                conflicts.stream().map(Conflict::unitId).toList(),
                resolution.strategy().wireName());
        return resolution;
    }

    // ------------------------------------------------------------------
    // file_overlap: sequence, split, preempt, queue
    // ------------------------------------------------------------------

    private Resolution resolveFileOverlap(WorkUnit unit, AgentRole agentType, List<Conflict> conflicts,
                                          ActiveWorkView view, ResolutionOptions options) {
        List<String> conflictIds = ids(conflicts);
        Set<String> sharedFiles = new LinkedHashSet<>();
        conflicts.forEach(c -> sharedFiles.addAll(c.sharedFiles()));

        // both sequencing and the split's integration part make the unit wait on the conflicts
        boolean canWait = !activeGraph(unit, view).wouldCreateCycle(unit.getId(), conflictIds);
        boolean sequenceable = conflicts.stream()
                .allMatch(c -> c.sharedFiles().size() <= 1 || c.unit().getType() != unit.getType());
        if (sequenceable && canWait) {
            return Resolution.resolved(ConflictCategory.FILE_OVERLAP, ResolutionStrategy.SEQUENCE_AFTER_CONFLICTS,
                    new AddDependencies(new LinkedHashSet<>(conflictIds), maxRemainingMinutes(conflicts)),
                    "Run after " + conflictIds + " finish with " + sharedFiles);
        }

        if (canWait && options.allowSplit() && unit.getComplexity() != Complexity.SIMPLE) {
            TaskContext context = extractor.extract(unit);
            Set<String> independent = new LinkedHashSet<>(context.files());
            independent.removeAll(sharedFiles);
            if (!independent.isEmpty()) {
                Complexity partComplexity = lower(unit.getComplexity());
                WorkUnit first = UnitMerger.part(unit, 1, "independent changes", partComplexity,
                        independent, unit.getDependencies());
                Set<String> integrationDeps = new LinkedHashSet<>(unit.getDependencies());
                integrationDeps.addAll(conflictIds);
                integrationDeps.add(first.getId());
                WorkUnit second = UnitMerger.part(unit, 2, "integration", partComplexity,
                        sharedFiles, integrationDeps);
                return Resolution.resolved(ConflictCategory.FILE_OVERLAP, ResolutionStrategy.SPLIT_TASK,
                        new SplitUnit(List.of(first, second)),
                        "Start the independent part now, integrate after " + conflictIds);
            }
        }

        int candidateScore = priorities.score(unit);
        Map<String, Integer> scores = new LinkedHashMap<>();
        conflicts.forEach(c -> scores.put(c.unitId(), priorities.score(c.unit())));
        if (scores.values().stream().allMatch(score -> candidateScore > score)) {
            return Resolution.resolved(ConflictCategory.FILE_OVERLAP, ResolutionStrategy.PREEMPT_LOWER_PRIORITY,
                    new Preempt(conflictIds, candidateScore, scores),
                    "Priority " + candidateScore + " outranks " + scores.values());
        }

        return Resolution.resolved(ConflictCategory.FILE_OVERLAP, ResolutionStrategy.INTELLIGENT_QUEUE,
                new QueuePlacement(queuePosition(view, agentType), maxRemainingMinutes(conflicts)),
                "Queue until " + conflictIds + " release " + sharedFiles);
    }

    // ------------------------------------------------------------------
    // module_overlap: layer separation, merge, sequential with interface
    // ------------------------------------------------------------------

    private Resolution resolveModuleOverlap(WorkUnit unit, List<Conflict> conflicts, ResolutionOptions options) {
        Optional<ArchitecturalLayer> own = Keywords.layerOf(unit);
        if (own.isPresent()) {
            Map<String, ArchitecturalLayer> layers = new LinkedHashMap<>();
            layers.put(unit.getId(), own.get());
            boolean separable = true;
            for (Conflict c : conflicts) {
                Optional<ArchitecturalLayer> other = Keywords.layerOf(c.unit());
                if (other.isEmpty() || other.get() == own.get()) {
                    separable = false;
                    break;
                }
                layers.put(c.unitId(), other.get());
            }
            if (separable) {
                return Resolution.resolved(ConflictCategory.MODULE_OVERLAP, ResolutionStrategy.LAYER_SEPARATION,
                        new LayerSeparation(layers), "Work in separate layers of the shared module");
            }
        }

        if (options.allowMerge() && conflicts.size() == 1) {
            WorkUnit other = conflicts.get(0).unit();
            double similarity = Keywords.similarity(unit, other);
            if (similarity >= MERGE_THRESHOLD) {
                return Resolution.resolved(ConflictCategory.MODULE_OVERLAP, ResolutionStrategy.MERGE_RELATED_TASKS,
                        new Merge(UnitMerger.merge(other, unit), List.of(other.getId(), unit.getId()), similarity),
                        "Units are near duplicates; merge them");
            }
        }

        List<String> order = new ArrayList<>(ids(conflicts));
        order.add(unit.getId());
        List<InterfaceDefinition> interfaces = new ArrayList<>();
        for (Conflict c : conflicts) {
            for (String module : c.sharedModules()) {
                interfaces.add(new InterfaceDefinition(
                        module + "_" + c.unitId() + "_interface", module, c.unitId(), unit.getId(),
                        INTERFACE_COORDINATION_POINTS));
            }
        }
        return Resolution.resolved(ConflictCategory.MODULE_OVERLAP, ResolutionStrategy.SEQUENTIAL_WITH_INTERFACE,
                new InterfaceContract(order, interfaces),
                "Run sequentially, agreeing on the module interface first");
    }

    // ------------------------------------------------------------------
    // dependency_conflict: break cycles, wait, or run in parallel
    // ------------------------------------------------------------------

    private Resolution resolveDependencyConflict(WorkUnit unit, List<Conflict> conflicts, ActiveWorkView view) {
        DependencyGraph graph = activeGraph(unit, view);
        Optional<List<String>> cycle = graph.findCycle();
        if (cycle.isPresent()) {
            List<DependencyEdge> demoted = new ArrayList<>();
            while (cycle.isPresent()) {
                List<String> path = cycle.get();
                int own = path.indexOf(unit.getId());
                DependencyEdge edge = own >= 0
                        ? new DependencyEdge(path.get(own), path.get((own + 1) % path.size()))
                        : new DependencyEdge(path.get(path.size() - 1), path.get(0));
                graph.removeEdge(edge.from(), edge.to());
                demoted.add(edge);
                cycle = graph.findCycle();
            }
            return Resolution.resolved(ConflictCategory.DEPENDENCY_CONFLICT,
                    ResolutionStrategy.RESOLVE_CIRCULAR_DEPENDENCIES,
                    new Restructure(demoted, graph.topologicalOrder()),
                    "Demote " + demoted + " to soft ordering hints");
        }

        List<PendingDependency> pending = new ArrayList<>();
        long delay = 0;
        for (Conflict c : conflicts) {
            if (c.unit().getStatus() != WorkStatus.COMPLETED) {
                long remaining = remainingMinutes(c);
                pending.add(new PendingDependency(c.unitId(), c.unit().getTitle(), c.unit().getStatus(), remaining));
                delay = Math.max(delay, remaining);
            }
        }
        if (!pending.isEmpty()) {
            return Resolution.resolved(ConflictCategory.DEPENDENCY_CONFLICT, ResolutionStrategy.WAIT_FOR_DEPENDENCIES,
                    new WaitForDependencies(pending, delay),
                    "Wait about " + delay + " minutes for dependencies to complete");
        }

        List<String> parallel = new ArrayList<>(ids(conflicts));
        parallel.add(unit.getId());
        return Resolution.resolved(ConflictCategory.DEPENDENCY_CONFLICT, ResolutionStrategy.PARALLEL_EXECUTION,
                new ParallelExecution(parallel, List.of("shared_state_sync", "result_handoff")),
                "Dependencies are complete; run in parallel");
    }

    // ------------------------------------------------------------------
    // agent_busy: reassign, capacity split, queue
    // ------------------------------------------------------------------

    private Resolution resolveAgentBusy(WorkUnit unit, AgentRole agentType, List<Conflict> conflicts,
                                        ActiveWorkView view, ResolutionOptions options) {
        Set<String> needs = Keywords.requirementTags(unit);
        AgentRole best = null;
        Set<String> bestMatch = Set.of();
        for (AgentRole role : AgentRole.values()) {
            // alternates must be able to do the same kind of work
            if (role == agentType || role.mutatesCode() != agentType.mutatesCode() || isBusy(view, role)) {
                continue;
            }
            Set<String> match = new LinkedHashSet<>(role.capabilities());
            match.retainAll(needs);
            if (match.size() > bestMatch.size()) {
                best = role;
                bestMatch = match;
            }
        }
        if (best != null) {
            return Resolution.resolved(ConflictCategory.AGENT_BUSY, ResolutionStrategy.REASSIGN_TO_AVAILABLE_AGENT,
                    new Reassign(agentType, best, bestMatch),
                    "Hand over to " + best.label() + " (" + bestMatch + ")");
        }

        if (options.allowSplit() && unit.getComplexity().isAtLeast(Complexity.COMPLEX)) {
            Optional<AgentRole> helper = Arrays.stream(AgentRole.values())
                    .filter(r -> r != agentType && r.mutatesCode() && !isBusy(view, r))
                    .findFirst();
            if (helper.isPresent()) {
                List<String> files = unit.getExplicitFiles().stream().sorted().toList();
                int half = (files.size() + 1) / 2;
                WorkUnit core = UnitMerger.part(unit, 1, "core implementation", lower(unit.getComplexity()),
                        new LinkedHashSet<>(files.subList(0, half)), unit.getDependencies());
                core.setAssignedAgent(agentType);
                WorkUnit supporting = UnitMerger.part(unit, 2, "supporting changes", Complexity.SIMPLE,
                        new LinkedHashSet<>(files.subList(half, files.size())), unit.getDependencies());
                supporting.setAssignedAgent(helper.get());
                Map<String, AgentRole> assignments = new LinkedHashMap<>();
                assignments.put(core.getId(), agentType);
                assignments.put(supporting.getId(), helper.get());
                return Resolution.resolved(ConflictCategory.AGENT_BUSY, ResolutionStrategy.SPLIT_FOR_AGENT_CAPACITY,
                        new CapacitySplit(List.of(core, supporting), assignments),
                        "Split the work between " + agentType.label() + " and " + helper.get().label());
            }
        }

        Reservation busy = conflicts.get(0).reservation();
        double elapsed = busy == null ? 0.0
                : Duration.between(busy.createdAt(), clock.instant()).toMillis() / 60_000.0;
        long wait = (long) Math.ceil(Math.max(0.0, agentType.baseWaitMinutes() - elapsed));
        return Resolution.resolved(ConflictCategory.AGENT_BUSY, ResolutionStrategy.WORKLOAD_BALANCED_QUEUE,
                new QueuePlacement(queuePosition(view, agentType), wait),
                "Queue for " + agentType.label() + ", about " + wait + " minutes");
    }

    // ------------------------------------------------------------------
    // conceptual_conflict: merge or coordinate
    // ------------------------------------------------------------------

    private Resolution resolveConceptualConflict(WorkUnit unit, List<Conflict> conflicts, ResolutionOptions options) {
        WorkUnit other = conflicts.get(0).unit();
        double similarity = Keywords.similarity(unit, other);
        if (options.allowMerge() && conflicts.size() == 1 && similarity >= MERGE_THRESHOLD) {
            return Resolution.resolved(ConflictCategory.CONCEPTUAL_CONFLICT, ResolutionStrategy.MERGE_CONCEPTUAL_TASKS,
                    new Merge(UnitMerger.merge(unit, other), List.of(unit.getId(), other.getId()), similarity),
                    "Units describe the same work; merge them");
        }

        WorkUnit lead = unit;
        int leadScore = priorities.score(unit);
        for (Conflict c : conflicts) {
            int score = priorities.score(c.unit());
            if (score > leadScore) {
                lead = c.unit();
                leadScore = score;
            }
        }
        List<String> related = new ArrayList<>();
        Set<String> sharedKeywords = new LinkedHashSet<>();
        Set<String> integrationPoints = new LinkedHashSet<>();
        if (lead != unit) {
            related.add(unit.getId());
        }
        for (Conflict c : conflicts) {
            if (c.unit() != lead) {
                related.add(c.unitId());
            }
            sharedKeywords.addAll(Keywords.sharedKeywords(unit, c.unit()));
            c.sharedModules().forEach(m -> integrationPoints.add("module:" + m));
            Set<String> areas = Keywords.featureAreas(unit);
            areas.retainAll(Keywords.featureAreas(c.unit()));
            areas.forEach(a -> integrationPoints.add("feature_area:" + a));
        }
        if (integrationPoints.isEmpty()) {
            integrationPoints.add("shared_terminology");
        }
        return Resolution.resolved(ConflictCategory.CONCEPTUAL_CONFLICT, ResolutionStrategy.COORDINATE_RELATED_FEATURES,
                new Coordination(lead.getId(), related, sharedKeywords, new ArrayList<>(integrationPoints)),
                lead.getId() + " leads; others integrate through " + integrationPoints);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String fallbackSuggestion(ConflictCategory category) {
        return switch (category) {
            case FILE_OVERLAP        -> "Wait for the conflicting units to finish or split the unit by file";
            case MODULE_OVERLAP      -> "Coordinate the module changes through an agreed interface";
            case DEPENDENCY_CONFLICT -> "Complete the blocking dependencies first or restructure the dependency graph";
            case AGENT_BUSY          -> "Queue the unit or assign it to another agent type";
            case CONCEPTUAL_CONFLICT -> "Review the related units and merge or coordinate them manually";
        };
    }

    /** Dependency graph of every active unit plus the candidate. */
    private static DependencyGraph activeGraph(WorkUnit unit, ActiveWorkView view) {
        DependencyGraph graph = new DependencyGraph();
        if (view != null) {
            view.reservations().forEach(r -> graph.addNode(r.unitId(), r.unit().getDependencies()));
        }
        graph.addNode(unit.getId(), unit.getDependencies());
        return graph;
    }

    private long maxRemainingMinutes(List<Conflict> conflicts) {
        return conflicts.stream().mapToLong(this::remainingMinutes).max().orElse(DEFAULT_REMAINING_MINUTES);
    }

    private long remainingMinutes(Conflict conflict) {
        Reservation r = conflict.reservation();
        if (r == null) {
            return extractor.estimateMinutes(conflict.unit());
        }
        long elapsed = Duration.between(r.createdAt(), clock.instant()).toMinutes();
        return Math.max(0, r.context().estimatedMinutes() - elapsed);
    }

    private static int queuePosition(ActiveWorkView view, AgentRole agentType) {
        return view == null ? 1 : view.queueDepth(agentType) + 1;
    }

    private static boolean isBusy(ActiveWorkView view, AgentRole role) {
        return view != null && view.reservationFor(role).isPresent();
    }

    private static Complexity lower(Complexity complexity) {
        return complexity == Complexity.SIMPLE ? Complexity.SIMPLE : Complexity.values()[complexity.ordinal() - 1];
    }

    private static List<String> ids(List<Conflict> conflicts) {
        return conflicts.stream().map(Conflict::unitId).toList();
    }
}
