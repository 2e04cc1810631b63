package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.conflict.ArchitecturalLayer;
import com.agentcrew.orchestrator.conflict.ConflictCategory;
import com.agentcrew.orchestrator.conflict.ConflictResolutionEngine;
import com.agentcrew.orchestrator.conflict.Keywords;
import com.agentcrew.orchestrator.conflict.OverlapAnalyzer;
import com.agentcrew.orchestrator.conflict.OverlapReport;
import com.agentcrew.orchestrator.conflict.PriorityCalculator;
import com.agentcrew.orchestrator.conflict.ResolutionOptions;
import com.agentcrew.orchestrator.conflict.ResolutionStrategy;
import com.agentcrew.orchestrator.conflict.UnitMerger;
import com.agentcrew.orchestrator.conflict.UnitOverlap;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Plans a batch of units before any of them runs.
 *
 * Steps:
 *  1. Pairwise overlap analysis.
 *  2. Near-duplicate pairs are merged (when allowed) unless the merged unit
 *     would close a dependency cycle through the units between them.
 *  3. File and module overlaps get a sequencing edge: the lower-priority unit
 *     waits for the higher one, the later one for the earlier on a tie.
 *     Module overlaps in separable layers are left parallel.
 *     An edge is only added when cycle detection shows it is safe.
 *  4. {@link DependencyPlanner#validateAndOrder} on the result.
 *
 * Added edges are written onto the units' dependency sets. Overlaps found
 * for a merged-away original apply to the unit it was merged into.
 */
@Component
public class BatchPlanner {

    private static final Logger log = LoggerFactory.getLogger(BatchPlanner.class);

    private final OverlapAnalyzer    analyzer;
    private final DependencyPlanner  planner;
    private final PriorityCalculator priorities;

    public BatchPlanner(OverlapAnalyzer analyzer, DependencyPlanner planner, PriorityCalculator priorities) {
        this.analyzer   = analyzer;
        this.planner    = planner;
        this.priorities = priorities;
    }

    /**
     * @throws DependencyCycleException if the declared dependencies already form a cycle
     */
    public BatchPlan plan(List<WorkUnit> units, ResolutionOptions options) {
        OverlapReport report = analyzer.analyze(units);

        // id -> unit, in submission order; merged units take the place of the first original
        Map<String, WorkUnit> working = new LinkedHashMap<>();
        units.forEach(u -> working.put(u.getId(), u));
        Map<String, Integer> submissionOrder = new LinkedHashMap<>();
        for (int i = 0; i < units.size(); i++) {
            submissionOrder.put(units.get(i).getId(), i);
        }

        List<AppliedResolution> applied = new ArrayList<>();
        // original id -> id of the unit it was merged into
        Map<String, String> mergedInto = new HashMap<>();

        if (options.allowMerge()) {
            for (UnitOverlap overlap : report.overlaps()) {
                if (overlap.has(ConflictCategory.CONCEPTUAL_CONFLICT) && overlap.similarity() >= ConflictResolutionEngine.MERGE_THRESHOLD
                        && working.containsKey(overlap.firstId()) && working.containsKey(overlap.secondId())) {
                    merge(working, submissionOrder, mergedInto, overlap, applied);
                }
            }
        }

        for (UnitOverlap overlap : report.overlaps()) {
            boolean files   = overlap.has(ConflictCategory.FILE_OVERLAP);
            boolean modules = overlap.has(ConflictCategory.MODULE_OVERLAP);
            WorkUnit a = working.get(mergedInto.getOrDefault(overlap.firstId(), overlap.firstId()));
            WorkUnit b = working.get(mergedInto.getOrDefault(overlap.secondId(), overlap.secondId()));
            if ((!files && !modules) || a == null || b == null || a == b) {
                continue;
            }
            if (!files && separableLayers(a, b)) {
                applied.add(new AppliedResolution(ResolutionStrategy.LAYER_SEPARATION,
                        List.of(a.getId(), b.getId()), true, "Shared modules " + overlap.sharedModules()
                        + " are touched in different layers"));
                continue;
            }
            sequence(a, b, working, submissionOrder, overlap, applied);
        }

        List<WorkUnit> finalUnits = new ArrayList<>(working.values());
        ExecutionPlan plan = planner.validateAndOrder(finalUnits);
        log.info("Batch of {} units planned: {} overlaps (risk {}), {} resolutions applied",
                units.size(), report.overlaps().size(), report.riskLevel().wireName(), applied.size());
        return new BatchPlan(finalUnits, report, applied, plan);
    }

    private void sequence(WorkUnit a, WorkUnit b, Map<String, WorkUnit> working, Map<String, Integer> submissionOrder,
                          UnitOverlap overlap, List<AppliedResolution> applied) {
        List<String> pair = List.of(a.getId(), b.getId());
        if (a.getDependencies().contains(b.getId()) || b.getDependencies().contains(a.getId())) {
            return;   // already ordered
        }

        int scoreA = priorities.score(a);
        int scoreB = priorities.score(b);
        boolean aWaits = scoreA != scoreB
                ? scoreA < scoreB
                : submissionOrder.getOrDefault(a.getId(), 0) > submissionOrder.getOrDefault(b.getId(), 0);
        WorkUnit waiter = aWaits ? a : b;
        WorkUnit leader = aWaits ? b : a;

        DependencyGraph graph = DependencyGraph.of(working.values());
        if (graph.wouldCreateCycle(waiter.getId(), List.of(leader.getId()))) {
            WorkUnit swap = waiter;
            waiter = leader;
            leader = swap;
            if (graph.wouldCreateCycle(waiter.getId(), List.of(leader.getId()))) {
                applied.add(new AppliedResolution(ResolutionStrategy.MANUAL_INTERVENTION, pair, false,
                        "Sequencing either way would create a dependency cycle"));
                return;
            }
        }

        waiter.getDependencies().add(leader.getId());
        applied.add(new AppliedResolution(ResolutionStrategy.SEQUENCE_AFTER_CONFLICTS, pair, true,
                waiter.getId() + " runs after " + leader.getId() + " (files " + overlap.sharedFiles()
                + ", modules " + overlap.sharedModules() + ")"));
    }

    private void merge(Map<String, WorkUnit> working, Map<String, Integer> submissionOrder,
                       Map<String, String> mergedInto, UnitOverlap overlap, List<AppliedResolution> applied) {
        WorkUnit a = working.get(overlap.firstId());
        WorkUnit b = working.get(overlap.secondId());
        List<String> pair = List.of(a.getId(), b.getId());
        WorkUnit merged = UnitMerger.merge(a, b);

        // a -> x -> b collapses into merged -> x -> merged
        Optional<List<String>> cycle = mergedGraph(working, a, b, merged).findCycle();
        if (cycle.isPresent()) {
            applied.add(new AppliedResolution(ResolutionStrategy.MERGE_CONCEPTUAL_TASKS, pair, false,
                    "Not merged: the merged unit would close the dependency cycle " + cycle.get()
                    + "; the units stay ordered through their dependencies"));
            return;
        }

        // Rebuild the map so the merged unit keeps the first original's position.
        Map<String, WorkUnit> rebuilt = new LinkedHashMap<>();
        for (WorkUnit u : working.values()) {
            if (u == a) {
                rebuilt.put(merged.getId(), merged);
            } else if (u != b) {
                rebuilt.put(u.getId(), u);
            }
        }
        working.clear();
        working.putAll(rebuilt);
        submissionOrder.put(merged.getId(), submissionOrder.getOrDefault(a.getId(), 0));
        mergedInto.put(a.getId(), merged.getId());
        mergedInto.put(b.getId(), merged.getId());

        for (WorkUnit u : working.values()) {
            Set<String> deps = u.getDependencies();
            if (u != merged && (deps.remove(a.getId()) | deps.remove(b.getId()))) {
                deps.add(merged.getId());
            }
        }

        applied.add(new AppliedResolution(ResolutionStrategy.MERGE_CONCEPTUAL_TASKS, pair, true,
                String.format("Merged into %s (similarity %.2f)", merged.getId(), overlap.similarity())));
    }

    /** The batch's graph as it would be with {@code a} and {@code b} replaced by {@code merged}. */
    private static DependencyGraph mergedGraph(Map<String, WorkUnit> working, WorkUnit a, WorkUnit b,
                                               WorkUnit merged) {
        DependencyGraph graph = new DependencyGraph();
        for (WorkUnit u : working.values()) {
            if (u == a) {
                graph.addNode(merged.getId(), merged.getDependencies());
            } else if (u != b) {
                Set<String> deps = new LinkedHashSet<>(u.getDependencies());
                if (deps.remove(a.getId()) | deps.remove(b.getId())) {
                    deps.add(merged.getId());
                }
                graph.addNode(u.getId(), deps);
            }
        }
        return graph;
    }

    private static boolean separableLayers(WorkUnit a, WorkUnit b) {
        Optional<ArchitecturalLayer> la = Keywords.layerOf(a);
        Optional<ArchitecturalLayer> lb = Keywords.layerOf(b);
        return la.isPresent() && lb.isPresent() && la.get() != lb.get();
    }
}
