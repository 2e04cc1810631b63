package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.TaskContext;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Pairwise overlap analysis of a batch of units that have not started yet.
 *
 * Unlike {@link CompatibilityChecker}, which stops at the first category,
 * this collects every category per pair and escalates the severity.
 */
@Component
public class OverlapAnalyzer {

    static final double SIMILARITY_THRESHOLD = 0.4;

    private final TaskContextExtractor extractor;

    public OverlapAnalyzer(TaskContextExtractor extractor) {
        this.extractor = extractor;
    }

    public OverlapReport analyze(List<WorkUnit> units) {
        List<TaskContext> contexts = units.stream().map(extractor::extract).toList();
        List<UnitOverlap> overlaps = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            for (int j = i + 1; j < units.size(); j++) {
                analyzePair(units.get(i), contexts.get(i), units.get(j), contexts.get(j))
                        .ifPresent(overlaps::add);
            }
        }
        return new OverlapReport(overlaps, riskOf(overlaps));
    }

    Optional<UnitOverlap> analyzePair(WorkUnit a, TaskContext ca, WorkUnit b, TaskContext cb) {
        Set<ConflictCategory> categories = EnumSet.noneOf(ConflictCategory.class);
        Severity severity = Severity.LOW;

        Set<String> files = new LinkedHashSet<>(ca.files());
        files.retainAll(cb.files());
        if (!files.isEmpty()) {
            categories.add(ConflictCategory.FILE_OVERLAP);
            severity = severity.escalate(CompatibilityChecker.fileSeverity(files.size()));
        }

        Set<String> modules = new LinkedHashSet<>(ca.modules());
        modules.retainAll(cb.modules());
        if (!modules.isEmpty()) {
            categories.add(ConflictCategory.MODULE_OVERLAP);
            severity = severity.escalate(Severity.HIGH);
        }

        double similarity = Keywords.similarity(a, b);
        if (similarity > SIMILARITY_THRESHOLD || Keywords.sharesConceptualPattern(a, b)) {
            categories.add(ConflictCategory.CONCEPTUAL_CONFLICT);
            severity = severity.escalate(similarity > 0.7 ? Severity.HIGH
                    : similarity > 0.5 ? Severity.MEDIUM : Severity.LOW);
        }

        boolean aOnB = a.getDependencies().contains(b.getId());
        boolean bOnA = b.getDependencies().contains(a.getId());
        Set<String> sharedDeps = new LinkedHashSet<>(a.getDependencies());
        sharedDeps.retainAll(b.getDependencies());
        if (aOnB || bOnA || !sharedDeps.isEmpty()) {
            categories.add(ConflictCategory.DEPENDENCY_CONFLICT);
            Severity dep = aOnB && bOnA ? Severity.CRITICAL : (aOnB || bOnA) ? Severity.HIGH : Severity.MEDIUM;
            severity = severity.escalate(dep);
        }

        if (categories.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new UnitOverlap(a.getId(), b.getId(), categories, severity, files, modules, similarity));
    }

    static RiskLevel riskOf(List<UnitOverlap> overlaps) {
        if (overlaps.isEmpty()) return RiskLevel.NONE;
        long critical = overlaps.stream().filter(o -> o.severity() == Severity.CRITICAL).count();
        long high     = overlaps.stream().filter(o -> o.severity() == Severity.HIGH).count();
        long medium   = overlaps.stream().filter(o -> o.severity() == Severity.MEDIUM).count();
        if (critical > 0) return RiskLevel.CRITICAL;
        if (high > 2)     return RiskLevel.HIGH;
        if (high > 0 || medium > 3) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
