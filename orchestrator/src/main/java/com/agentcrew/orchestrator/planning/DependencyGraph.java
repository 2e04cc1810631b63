package com.agentcrew.orchestrator.planning;

import com.agentcrew.orchestrator.model.WorkUnit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable "depends on" graph over unit ids.
 *
 * Edges pointing at ids that are not nodes of the graph are kept on the
 * node but ignored by ordering and cycle detection: they refer to work
 * outside the batch.
 */
public class DependencyGraph {

    // node -> ids it depends on; insertion order drives deterministic output
    private final Map<String, Set<String>> dependsOn = new LinkedHashMap<>();

    public static DependencyGraph of(Collection<WorkUnit> units) {
        DependencyGraph graph = new DependencyGraph();
        for (WorkUnit unit : units) {
            graph.addNode(unit.getId(), unit.getDependencies());
        }
        return graph;
    }

    public void addNode(String id, Collection<String> dependencies) {
        dependsOn.computeIfAbsent(id, k -> new LinkedHashSet<>()).addAll(dependencies);
    }

    public void addEdge(String from, String to) {
        dependsOn.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        dependsOn.computeIfAbsent(to, k -> new LinkedHashSet<>());
    }

    public void removeEdge(String from, String to) {
        Set<String> deps = dependsOn.get(from);
        if (deps != null) {
            deps.remove(to);
        }
    }

    public boolean contains(String id) {
        return dependsOn.containsKey(id);
    }

    public Set<String> nodes() {
        return dependsOn.keySet();
    }

    /** Dependencies of {@code id} that are nodes of this graph. */
    public Set<String> internalDependencies(String id) {
        Set<String> internal = new LinkedHashSet<>();
        for (String dep : dependsOn.getOrDefault(id, Set.of())) {
            if (dependsOn.containsKey(dep)) {
                internal.add(dep);
            }
        }
        return internal;
    }

    public DependencyGraph copy() {
        DependencyGraph copy = new DependencyGraph();
        dependsOn.forEach(copy::addNode);
        return copy;
    }

    public boolean wouldCreateCycle(String from, Collection<String> to) {
        DependencyGraph trial = copy();
        to.forEach(target -> trial.addEdge(from, target));
        return trial.findCycle().isPresent();
    }

    // ------------------------------------------------------------------
    // Ordering
    // ------------------------------------------------------------------

    /**
     * Kahn's algorithm: dependencies come before their dependents.
     *
     * @throws DependencyCycleException naming every node that could not be ordered
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (String node : dependsOn.keySet()) {
            Set<String> deps = internalDependencies(node);
            inDegree.put(node, deps.size());
            for (String dep : deps) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node);
            }
        }

        Deque<String> ready = new ArrayDeque<>();
        for (String node : dependsOn.keySet()) {
            if (inDegree.get(node) == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String dependent : dependents.getOrDefault(node, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < dependsOn.size()) {
            List<String> stuck = dependsOn.keySet().stream()
                    .filter(node -> inDegree.get(node) > 0)
                    .toList();
            throw new DependencyCycleException(stuck);
        }
        return order;
    }

    /**
     * One cycle as a node path [n0, n1, ..., nk] where each node depends on
     * the next and nk depends on n0.
     */
    public Optional<List<String>> findCycle() {
        Map<String, Integer> color = new HashMap<>();   // absent = unvisited, 1 = on stack, 2 = done
        for (String start : dependsOn.keySet()) {
            if (!color.containsKey(start)) {
                List<String> path = new ArrayList<>();
                Optional<List<String>> cycle = visit(start, color, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<List<String>> visit(String node, Map<String, Integer> color, List<String> path) {
        color.put(node, 1);
        path.add(node);
        for (String dep : internalDependencies(node)) {
            Integer c = color.get(dep);
            if (c == null) {
                Optional<List<String>> cycle = visit(dep, color, path);
                if (cycle.isPresent()) {
                    return cycle;
                }
            } else if (c == 1) {
                return Optional.of(new ArrayList<>(path.subList(path.indexOf(dep), path.size())));
            }
        }
        path.remove(path.size() - 1);
        color.put(node, 2);
        return Optional.empty();
    }
}
