package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.conflict.TaskContextExtractor;
import com.agentcrew.orchestrator.model.WorkUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orders a batch of units by their declared dependencies and groups
 * independent units into parallel batches.
 *
 * A cycle is always reported as {@link DependencyCycleException}; it is
 * never broken silently. Dependencies on ids outside the batch are treated
 * as external and do not affect the order.
 */
@Component
public class DependencyPlanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyPlanner.class);

    private final TaskContextExtractor extractor;
    private final int                  maxGroupSize;

    public DependencyPlanner(TaskContextExtractor extractor,
                             @Value("${agentcrew.planning.max-group-size:3}") int maxGroupSize) {
        if (maxGroupSize < 1) {
            throw new IllegalArgumentException("max-group-size must be at least 1 but was " + maxGroupSize);
        }
        this.extractor    = extractor;
        this.maxGroupSize = maxGroupSize;
    }

    /**
     * @throws DependencyCycleException if the declared dependencies form a cycle
     */
    public ExecutionPlan validateAndOrder(List<WorkUnit> units) {
        DependencyGraph graph = DependencyGraph.of(units);
        List<String> order = graph.topologicalOrder();

        // Greedy grouping: close the current group when it is full or when the
        // next unit depends on something already in it.
        List<List<String>> groups = new ArrayList<>();
        List<String> current = new ArrayList<>();
        for (String id : order) {
            Set<String> deps = graph.internalDependencies(id);
            boolean dependsOnCurrent = current.stream().anyMatch(deps::contains);
            if (!current.isEmpty() && (dependsOnCurrent || current.size() >= maxGroupSize)) {
                groups.add(current);
                current = new ArrayList<>();
            }
            current.add(id);
        }
        if (!current.isEmpty()) {
            groups.add(current);
        }

        Map<String, WorkUnit> byId = units.stream()
                .collect(Collectors.toMap(WorkUnit::getId, Function.identity(), (a, b) -> a));
        long minutes = groups.stream()
                .mapToLong(group -> group.stream()
                        .mapToLong(id -> extractor.estimateMinutes(byId.get(id)))
                        .max().orElse(0))
                .sum();

        log.info("Planned {} units into {} groups (~{} min)", order.size(), groups.size(), minutes);
        return new ExecutionPlan(order, groups, minutes);
    }
}
