package com.spreadsheet.transpiler.models;

import java.util.*;

/**
 * Directed graph of cell references.
 * An edge A -> B means "A's expression references B".
 * <p>
 * Both adjacencies keep insertion order, so every traversal over the graph
 * (cycle breaking, sequencing, reporting) is deterministic for a given sheet.
 * Adding an edge also registers its target as a vertex, which keeps the
 * vertex set closed: every referenced cell is also a key.
 */
public class DependencyGraph {

    // Forward adjacency: "sourceCell" -> setOfCellsReferenced
    private final Map<CellId, Set<CellId>> forward = new LinkedHashMap<>();
    // Reverse adjacency: "targetCell" -> setOfCellsThatReferenceIt
    private final Map<CellId, Set<CellId>> reverse = new LinkedHashMap<>();

    /**
     * Registers a vertex without edges. No-op if already present.
     */
    public void addVertex(CellId cellId) {
        forward.computeIfAbsent(cellId, k -> new LinkedHashSet<>());
        reverse.computeIfAbsent(cellId, k -> new LinkedHashSet<>());
    }

    /**
     * Adds 'source' -> 'target' in the forward graph and
     * 'target' -> 'source' in the reverse graph.
     */
    public void addDependency(CellId source, CellId target) {
        addVertex(source);
        addVertex(target);
        forward.get(source).add(target);
        reverse.get(target).add(source);
    }

    /**
     * Removes a single edge from both adjacencies.
     * Returns false if the edge was not present.
     */
    public boolean removeDependency(CellId source, CellId target) {
        Set<CellId> targets = forward.get(source);
        if (targets == null || !targets.remove(target)) {
            return false;
        }
        reverse.get(target).remove(source);
        return true;
    }

    public boolean hasDependency(CellId source, CellId target) {
        return forward.getOrDefault(source, Collections.emptySet()).contains(target);
    }

    public boolean containsVertex(CellId cellId) {
        return forward.containsKey(cellId);
    }

    /**
     * Cells that 'cellId' references directly.
     */
    public Set<CellId> dependenciesOf(CellId cellId) {
        return Collections.unmodifiableSet(forward.getOrDefault(cellId, Collections.emptySet()));
    }

    /**
     * Cells that reference 'cellId' directly.
     */
    public Set<CellId> dependantsOf(CellId cellId) {
        return Collections.unmodifiableSet(reverse.getOrDefault(cellId, Collections.emptySet()));
    }

    /**
     * All vertices, in insertion order.
     */
    public Set<CellId> vertices() {
        return Collections.unmodifiableSet(forward.keySet());
    }

    public List<DependencyEdge> edges() {
        List<DependencyEdge> edges = new ArrayList<>();
        forward.forEach((source, targets) -> targets.forEach(t -> edges.add(new DependencyEdge(source, t))));
        return edges;
    }

    public int edgeCount() {
        return forward.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Vertices that nothing references (no incoming edge).
     */
    public List<CellId> roots() {
        List<CellId> roots = new ArrayList<>();
        for (CellId vertex : forward.keySet()) {
            if (reverse.get(vertex).isEmpty()) {
                roots.add(vertex);
            }
        }
        return roots;
    }

    /**
     * A new graph with every edge flipped; vertex order is kept.
     */
    public DependencyGraph reversed() {
        DependencyGraph flipped = new DependencyGraph();
        forward.keySet().forEach(flipped::addVertex);
        forward.forEach((source, targets) -> targets.forEach(t -> flipped.addDependency(t, source)));
        return flipped;
    }

    public DependencyGraph copy() {
        DependencyGraph copy = new DependencyGraph();
        forward.keySet().forEach(copy::addVertex);
        forward.forEach((source, targets) -> targets.forEach(t -> copy.addDependency(source, t)));
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DependencyGraph)) {
            return false;
        }
        DependencyGraph that = (DependencyGraph) o;
        return forward.equals(that.forward);
    }

    @Override
    public int hashCode() {
        return forward.hashCode();
    }

    @Override
    public String toString() {
        return forward.toString();
    }
}
