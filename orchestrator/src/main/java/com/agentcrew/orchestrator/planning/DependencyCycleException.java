package com.agentcrew.orchestrator.planning;

import java.util.List;

/**
 * A batch of units cannot be ordered because its dependencies form a cycle.
 * Carries every node left unprocessed by the topological sort.
 */
public class DependencyCycleException extends RuntimeException {

    private final List<String> cycleNodes;

    public DependencyCycleException(List<String> cycleNodes) {
        super("Dependency cycle detected among units " + cycleNodes);
        this.cycleNodes = List.copyOf(cycleNodes);
    }

    public List<String> getCycleNodes() {
        return cycleNodes;
    }
}
