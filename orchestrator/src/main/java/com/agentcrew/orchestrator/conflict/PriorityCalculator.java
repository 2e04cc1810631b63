package com.agentcrew.orchestrator.conflict;

import com.agentcrew.orchestrator.model.WorkUnit;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 0-100 priority score used for preemption and batch sequencing.
 *
 * Starts at 50 and adds the priority-tier, complexity and type modifiers,
 * a deadline bonus (+30 under a day, +20 under three, +10 under seven)
 * and +5 for every unit this one blocks.
 */
@Component
public class PriorityCalculator {

    private static final int BASE_SCORE = 50;

    private final Clock clock;

    public PriorityCalculator(Clock clock) {
        this.clock = clock;
    }

    public int score(WorkUnit unit) {
        int score = BASE_SCORE
                + unit.getPriority().scoreModifier()
                + unit.getComplexity().priorityModifier()
                + unit.getType().priorityModifier()
                + deadlineBonus(unit.getDeadline())
                + 5 * unit.getBlocks().size();
        return Math.max(0, Math.min(100, score));
    }

    private int deadlineBonus(Instant deadline) {
        if (deadline == null) {
            return 0;
        }
        Duration left = Duration.between(clock.instant(), deadline);
        if (left.compareTo(Duration.ofDays(1)) < 0) return 30;
        if (left.compareTo(Duration.ofDays(3)) < 0) return 20;
        if (left.compareTo(Duration.ofDays(7)) < 0) return 10;
        return 0;
    }
}
