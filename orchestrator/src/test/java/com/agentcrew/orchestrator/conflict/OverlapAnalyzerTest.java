package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.WorkUnit;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.agentcrew.orchestrator.conflict.TestUnits.dependsOn;
import static com.agentcrew.orchestrator.conflict.TestUnits.unit;
import static org.assertj.core.api.Assertions.assertThat;

class OverlapAnalyzerTest {

    private final OverlapAnalyzer analyzer =
            new OverlapAnalyzer(new TaskContextExtractor(new KeywordScopePredictor()));

    @Test
    void analyze_reportsOnlyPairsThatOverlap() {
        WorkUnit u1 = unit("u1", "Tweak copy", "a.js");
        WorkUnit u2 = unit("u2", "Rename labels", "a.js", "b.js");
        WorkUnit u3 = unit("u3", "Adjust spacing", "c.js");

        OverlapReport report = analyzer.analyze(List.of(u1, u2, u3));

        assertThat(report.overlaps()).singleElement().satisfies(o -> {
            assertThat(o.firstId()).isEqualTo("u1");
            assertThat(o.secondId()).isEqualTo("u2");
            assertThat(o.categories()).containsExactly(ConflictCategory.FILE_OVERLAP);
            assertThat(o.sharedFiles()).containsExactly("a.js");
            assertThat(o.severity()).isEqualTo(Severity.LOW);
        });
        assertThat(report.riskLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void analyze_collectsEveryCategoryAndEscalatesSeverity() {
        WorkUnit a = unit("a", "Payment refund flow");
        WorkUnit b = unit("b", "Payment refund flow");

        OverlapReport report = analyzer.analyze(List.of(a, b));

        UnitOverlap overlap = report.overlaps().get(0);
        assertThat(overlap.categories())
                .containsExactlyInAnyOrder(ConflictCategory.MODULE_OVERLAP, ConflictCategory.CONCEPTUAL_CONFLICT);
        assertThat(overlap.severity()).isEqualTo(Severity.HIGH);
        assertThat(overlap.similarity()).isEqualTo(1.0);
        assertThat(report.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void analyze_mutualDependency_isCritical() {
        WorkUnit a = dependsOn(unit("a", "Tweak copy"), "b");
        WorkUnit b = dependsOn(unit("b", "Rename labels"), "a");

        OverlapReport report = analyzer.analyze(List.of(a, b));

        assertThat(report.overlaps().get(0).categories()).contains(ConflictCategory.DEPENDENCY_CONFLICT);
        assertThat(report.overlaps().get(0).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.riskLevel()).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void analyze_sharedExternalDependency_isMedium() {
        WorkUnit a = dependsOn(unit("a", "Tweak copy"), "base");
        WorkUnit b = dependsOn(unit("b", "Rename labels"), "base");

        UnitOverlap overlap = analyzer.analyze(List.of(a, b)).overlaps().get(0);

        assertThat(overlap.categories()).containsExactly(ConflictCategory.DEPENDENCY_CONFLICT);
        assertThat(overlap.severity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    void riskOf_countsSeverities() {
        assertThat(OverlapAnalyzer.riskOf(List.of())).isEqualTo(RiskLevel.NONE);
        assertThat(OverlapAnalyzer.riskOf(Collections.nCopies(3, overlap(Severity.HIGH)))).isEqualTo(RiskLevel.HIGH);
        assertThat(OverlapAnalyzer.riskOf(Collections.nCopies(2, overlap(Severity.HIGH)))).isEqualTo(RiskLevel.MEDIUM);
        assertThat(OverlapAnalyzer.riskOf(Collections.nCopies(4, overlap(Severity.MEDIUM)))).isEqualTo(RiskLevel.MEDIUM);
        assertThat(OverlapAnalyzer.riskOf(Collections.nCopies(3, overlap(Severity.MEDIUM)))).isEqualTo(RiskLevel.LOW);
    }

    private static UnitOverlap overlap(Severity severity) {
        return new UnitOverlap("a", "b", Set.of(ConflictCategory.FILE_OVERLAP), severity, Set.of("f"), Set.of(), 0.0);
    }
}
