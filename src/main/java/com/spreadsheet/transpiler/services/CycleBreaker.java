package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.DependencyEdge;
import com.spreadsheet.transpiler.models.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Removes circular references from a dependency graph, in place.
 * <p>
 * A depth-first search runs from every unvisited vertex (insertion order, neighbors
 * in insertion order). Each vertex is UNVISITED, IN_PROGRESS while it is on the
 * search path, then FINISHED. Every edge found pointing at an IN_PROGRESS vertex
 * closes a cycle and is scheduled for removal; the scheduled edges are only deleted
 * once the whole traversal is done.
 * <p>
 * This is not a minimum feedback edge set: which edges go depends on the traversal
 * order, and a cycle is only broken where this particular search meets it. Callers
 * must treat the sequencing that follows as best effort.
 */
@Service
public class CycleBreaker {

    private static final Logger log = LoggerFactory.getLogger(CycleBreaker.class);

    private enum State {
        UNVISITED,
        IN_PROGRESS,
        FINISHED
    }

    /**
     * Breaks cycles and returns the removed edges, in the order they were found.
     */
    public List<DependencyEdge> breakCycles(DependencyGraph graph) {
        Map<CellId, State> states = new HashMap<>();
        Set<DependencyEdge> cycleEdges = new LinkedHashSet<>();

        for (CellId vertex : new ArrayList<>(graph.vertices())) {
            if (states.getOrDefault(vertex, State.UNVISITED) == State.UNVISITED) {
                search(graph, vertex, states, cycleEdges);
            }
        }

        for (DependencyEdge edge : cycleEdges) {
            graph.removeDependency(edge.getSource(), edge.getTarget());
            log.warn("Circular reference: removed dependency {} -> {}", edge.getSource(), edge.getTarget());
        }
        return new ArrayList<>(cycleEdges);
    }

    // Iterative so that long reference chains cannot overflow the call stack
    private void search(DependencyGraph graph, CellId start,
                        Map<CellId, State> states, Set<DependencyEdge> cycleEdges) {
        Deque<CellId> path = new ArrayDeque<>();
        Deque<Iterator<CellId>> pending = new ArrayDeque<>();

        states.put(start, State.IN_PROGRESS);
        path.push(start);
        pending.push(graph.dependenciesOf(start).iterator());

        while (!path.isEmpty()) {
            CellId vertex = path.peek();
            Iterator<CellId> neighbors = pending.peek();
            if (!neighbors.hasNext()) {
                states.put(vertex, State.FINISHED);
                path.pop();
                pending.pop();
                continue;
            }
            CellId neighbor = neighbors.next();
            State state = states.getOrDefault(neighbor, State.UNVISITED);
            if (state == State.IN_PROGRESS) {
                cycleEdges.add(new DependencyEdge(vertex, neighbor));
            } else if (state == State.UNVISITED) {
                states.put(neighbor, State.IN_PROGRESS);
                path.push(neighbor);
                pending.push(graph.dependenciesOf(neighbor).iterator());
            }
        }
    }
}
