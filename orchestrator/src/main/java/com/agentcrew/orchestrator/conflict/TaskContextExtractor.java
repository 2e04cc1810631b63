package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.TaskContext;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

/**
 * Derives a {@link TaskContext} from a unit of work.
 * Deterministic and side-effect free; the scope guess is delegated to an {@link AffectedScopePredictor}.
 */
@Component
public class TaskContextExtractor {

    private final AffectedScopePredictor predictor;

    public TaskContextExtractor(AffectedScopePredictor predictor) {
        this.predictor = predictor;
    }

    public TaskContext extract(WorkUnit unit) {
        return new TaskContext(
                unit.getId(),
                predictor.predictAffectedFiles(unit),
                predictor.predictAffectedModules(unit),
                unit.getDependencies(),
                unit.getBlocks(),
                estimateMinutes(unit));
    }

    /** Complexity base minutes scaled by the type multiplier, rounded. */
    public int estimateMinutes(WorkUnit unit) {
        return (int) Math.round(unit.getComplexity().baseMinutes() * unit.getType().durationMultiplier());
    }
}
