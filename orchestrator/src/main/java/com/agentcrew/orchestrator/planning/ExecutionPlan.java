package com.agentcrew.orchestrator.planning;

import java.util.List;

/**
 * A topologically valid order for a batch plus its partition into groups
 * that may run in parallel. Every id appears in exactly one group.
 *
 * {@code estimatedMinutes} is the sum over groups of each group's longest unit.
 */
public record ExecutionPlan(List<String> order, List<List<String>> groups, long estimatedMinutes) {

    public ExecutionPlan {
        order  = List.copyOf(order);
        groups = groups.stream().map(List::copyOf).toList();
    }
}
