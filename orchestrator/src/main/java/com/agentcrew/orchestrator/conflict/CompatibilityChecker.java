package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.AgentRole;
import com.agentcrew.orchestrator.model.Reservation;
import com.agentcrew.orchestrator.model.TaskContext;
import com.agentcrew.orchestrator.model.WorkStatus;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a unit of work can start on a repository right now.
 *
 * Checks run in a fixed precedence and the first one that triggers is reported:
 *   1. file overlap with another active unit
 *   2. a declared dependency that is active and not completed
 *   3. module overlap with another active unit
 *   4. the requested agent type already holds a reservation
 * Callers re-check after a partial resolution to discover the next category.
 */
@Component
public class CompatibilityChecker {

    private final TaskContextExtractor extractor;

    public CompatibilityChecker(TaskContextExtractor extractor) {
        this.extractor = extractor;
    }

    public CompatibilityResult check(WorkUnit unit, AgentRole agentType, ActiveWorkView view) {
        TaskContext context = extractor.extract(unit);

        List<Conflict> conflicts = fileOverlaps(unit, context, view);
        if (!conflicts.isEmpty()) {
            return CompatibilityResult.conflict(ConflictCategory.FILE_OVERLAP, conflicts, context);
        }
        conflicts = dependencyConflicts(unit, view);
        if (!conflicts.isEmpty()) {
            return CompatibilityResult.conflict(ConflictCategory.DEPENDENCY_CONFLICT, conflicts, context);
        }
        conflicts = moduleOverlaps(unit, context, view);
        if (!conflicts.isEmpty()) {
            return CompatibilityResult.conflict(ConflictCategory.MODULE_OVERLAP, conflicts, context);
        }
        Optional<Reservation> busy = view.reservationFor(agentType)
                .filter(r -> !r.unitId().equals(unit.getId()));
        if (busy.isPresent()) {
            Reservation r = busy.get();
            Conflict conflict = new Conflict(ConflictCategory.AGENT_BUSY, Severity.MEDIUM,
                    r.unit(), Set.of(), Set.of(), r);
            return CompatibilityResult.conflict(ConflictCategory.AGENT_BUSY, List.of(conflict), context);
        }
        return CompatibilityResult.compatible(context);
    }

    // ------------------------------------------------------------------
    // Individual checks
    // ------------------------------------------------------------------

    private List<Conflict> fileOverlaps(WorkUnit unit, TaskContext context, ActiveWorkView view) {
        // claimant id -> files it shares with the candidate
        Map<String, Set<String>> shared = new LinkedHashMap<>();
        for (String file : context.files()) {
            for (String claimant : view.claimantsOf(file)) {
                if (!claimant.equals(unit.getId())) {
                    shared.computeIfAbsent(claimant, k -> new LinkedHashSet<>()).add(file);
                }
            }
        }
        List<Conflict> conflicts = new ArrayList<>();
        shared.forEach((claimant, files) -> view.activeUnit(claimant).ifPresent(r ->
                conflicts.add(new Conflict(ConflictCategory.FILE_OVERLAP, fileSeverity(files.size()),
                        r.unit(), files, Set.of(), r))));
        return conflicts;
    }

    private List<Conflict> dependencyConflicts(WorkUnit unit, ActiveWorkView view) {
        List<Conflict> conflicts = new ArrayList<>();
        for (String dependencyId : unit.getDependencies()) {
            view.activeUnit(dependencyId)
                    .filter(r -> r.unit().getStatus() != WorkStatus.COMPLETED)
                    .ifPresent(r -> {
                        boolean circular = r.unit().getDependencies().contains(unit.getId());
                        conflicts.add(new Conflict(ConflictCategory.DEPENDENCY_CONFLICT,
                                circular ? Severity.CRITICAL : Severity.HIGH,
                                r.unit(), Set.of(), Set.of(), r));
                    });
        }
        return conflicts;
    }

    private List<Conflict> moduleOverlaps(WorkUnit unit, TaskContext context, ActiveWorkView view) {
        List<Conflict> conflicts = new ArrayList<>();
        for (Reservation r : view.reservations()) {
            if (r.unitId().equals(unit.getId())) {
                continue;
            }
            Set<String> modules = new LinkedHashSet<>(context.modules());
            modules.retainAll(r.context().modules());
            if (!modules.isEmpty()) {
                conflicts.add(new Conflict(ConflictCategory.MODULE_OVERLAP, Severity.HIGH,
                        r.unit(), Set.of(), modules, r));
            }
        }
        return conflicts;
    }

    static Severity fileSeverity(int sharedFiles) {
        if (sharedFiles > 3) return Severity.HIGH;
        if (sharedFiles > 1) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
