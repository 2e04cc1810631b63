package com.agentcrew.orchestrator.planning;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DependencyGraphTest {

    @Test
    void findCycle_returnsPathInDependencyDirection() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("c", "a");

        assertThat(graph.findCycle()).hasValue(List.of("a", "b", "c"));
    }

    @Test
    void wouldCreateCycle_doesNotModifyTheGraph() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("b", "a");

        assertThat(graph.wouldCreateCycle("a", List.of("b"))).isTrue();
        assertThat(graph.wouldCreateCycle("c", List.of("a"))).isFalse();
        assertThat(graph.findCycle()).isEmpty();
        assertThat(graph.internalDependencies("a")).isEmpty();
    }

    @Test
    void removeEdge_breaksCycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");

        graph.removeEdge("b", "a");

        assertThat(graph.topologicalOrder()).containsExactly("b", "a");
    }
}
