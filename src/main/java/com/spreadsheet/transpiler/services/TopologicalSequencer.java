package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Orders cells so that each one comes after every cell it references.
 * <p>
 * Kahn's algorithm: a cell's count is the number of its dependencies not yet
 * emitted. Cells with a zero count are dependency leaves and go first, through a
 * FIFO queue seeded in vertex order; emitting a cell decrements the count of each
 * cell that references it.
 * <p>
 * If the queue runs dry before every cell is out, a cycle survived the cycle
 * breaker. From then on the remaining cells are force-emitted one at a time,
 * always the one with the smallest current count (earliest vertex on ties),
 * decrementing dependants as usual. This always terminates with every cell
 * exactly once, but the cells on the residual cycle are not guaranteed to see
 * their dependencies defined first.
 */
@Service
public class TopologicalSequencer {

    private static final Logger log = LoggerFactory.getLogger(TopologicalSequencer.class);

    /**
     * @param graph dependency graph, possibly with residual cycles
     * @param cells cells to order; graph vertices missing here are added after them
     */
    public List<CellId> sequence(DependencyGraph graph, Collection<CellId> cells) {
        Set<CellId> vertices = new LinkedHashSet<>(cells);
        vertices.addAll(graph.vertices());

        Map<CellId, Integer> pendingCount = new HashMap<>();
        for (CellId vertex : vertices) {
            pendingCount.put(vertex, graph.dependenciesOf(vertex).size());
        }

        List<CellId> order = new ArrayList<>(vertices.size());
        Set<CellId> emitted = new HashSet<>();
        Deque<CellId> queue = new ArrayDeque<>();
        for (CellId vertex : vertices) {
            if (pendingCount.get(vertex) == 0) {
                queue.add(vertex);
            }
        }

        while (!queue.isEmpty()) {
            CellId vertex = queue.poll();
            order.add(vertex);
            emitted.add(vertex);
            for (CellId dependant : graph.dependantsOf(vertex)) {
                int count = pendingCount.merge(dependant, -1, Integer::sum);
                if (count == 0) {
                    queue.add(dependant);
                }
            }
        }

        if (order.size() < vertices.size()) {
            log.warn("Residual circular reference among {} cells; forcing remaining definitions by fewest pending dependencies",
                    vertices.size() - order.size());
            forceRemaining(graph, vertices, pendingCount, emitted, order);
        }
        return order;
    }

    private void forceRemaining(DependencyGraph graph, Set<CellId> vertices, Map<CellId, Integer> pendingCount,
                                Set<CellId> emitted, List<CellId> order) {
        List<CellId> remaining = new ArrayList<>();
        for (CellId vertex : vertices) {
            if (!emitted.contains(vertex)) {
                remaining.add(vertex);
            }
        }
        while (!remaining.isEmpty()) {
            CellId next = remaining.get(0);
            for (CellId candidate : remaining) {
                if (pendingCount.get(candidate) < pendingCount.get(next)) {
                    next = candidate;
                }
            }
            remaining.remove(next);
            order.add(next);
            emitted.add(next);
            log.debug("Forced definition of {} with {} pending dependencies", next, pendingCount.get(next));
            for (CellId dependant : graph.dependantsOf(next)) {
                pendingCount.merge(dependant, -1, Integer::sum);
            }
        }
    }
}
