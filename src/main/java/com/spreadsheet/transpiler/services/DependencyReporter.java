package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.evaluation.EvaluationResult;
import com.spreadsheet.transpiler.evaluation.ExpressionEvaluator;
import com.spreadsheet.transpiler.exceptions.CellNotFoundException;
import com.spreadsheet.transpiler.models.CellDeclaration;
import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.Conversion;
import com.spreadsheet.transpiler.models.DependencyGraph;
import com.spreadsheet.transpiler.models.DependencyNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds trees of what a cell depends on, or of what depends on it,
 * labelled with each cell's expression and computed value.
 * <p>
 * The trees follow the graph as extracted from the sheet, so circular
 * references are still visible here. A cell already on the path from the root
 * is added once more, marked circular, and not expanded further.
 * <p>
 * Within one tree a cell's dependencies are listed only the first time it
 * appears. Later occurrences of a cell that has dependencies are marked
 * repeated and left unexpanded, so shared sub-dependencies keep the tree
 * linear in the size of the graph.
 */
@Service
public class DependencyReporter {

    private static final Logger log = LoggerFactory.getLogger(DependencyReporter.class);

    public enum Direction {
        /** Follow references: cell -> cells it uses. */
        DEPENDENCIES,
        /** Follow references backwards: cell -> cells that use it. */
        DEPENDANTS
    }

    private final ExpressionEvaluator evaluator;

    public DependencyReporter(ExpressionEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param start root cell, or null for every root of the graph in that direction
     */
    public List<DependencyNode> report(Conversion conversion, Direction direction, CellId start) {
        DependencyGraph graph = direction == Direction.DEPENDENCIES
                ? conversion.getExtractedGraph()
                : conversion.getExtractedGraph().reversed();

        List<CellId> roots;
        if (start != null) {
            if (!conversion.getDeclarations().containsKey(start) && !graph.containsVertex(start)) {
                throw new CellNotFoundException("Cell " + start + " is not part of the converted sheet");
            }
            roots = List.of(start);
        } else {
            roots = graph.roots();
        }

        Map<CellId, EvaluationResult> values = new HashMap<>();
        List<DependencyNode> trees = new ArrayList<>(roots.size());
        for (CellId root : roots) {
            DependencyNode node = node(conversion, root, values, false, false);
            expand(conversion, graph, node, values);
            trees.add(node);
        }
        return trees;
    }

    // Iterative depth-first walk; children keep the order of the graph's edges
    private void expand(Conversion conversion, DependencyGraph graph, DependencyNode root,
                        Map<CellId, EvaluationResult> values) {
        Set<CellId> activePath = new HashSet<>();
        Set<CellId> expanded = new HashSet<>();
        Deque<DependencyNode> path = new ArrayDeque<>();
        Deque<Iterator<CellId>> pending = new ArrayDeque<>();

        activePath.add(root.getCellId());
        expanded.add(root.getCellId());
        path.push(root);
        pending.push(graph.dependenciesOf(root.getCellId()).iterator());

        while (!path.isEmpty()) {
            DependencyNode parent = path.peek();
            Iterator<CellId> children = pending.peek();
            if (!children.hasNext()) {
                activePath.remove(parent.getCellId());
                path.pop();
                pending.pop();
                continue;
            }
            CellId next = children.next();
            if (activePath.contains(next)) {
                log.warn("Circular dependency involving {} (reached again from {})", next, parent.getCellId());
                parent.addChild(node(conversion, next, values, true, false));
                continue;
            }
            if (expanded.contains(next) && !graph.dependenciesOf(next).isEmpty()) {
                parent.addChild(node(conversion, next, values, false, true));
                continue;
            }
            DependencyNode child = node(conversion, next, values, false, false);
            parent.addChild(child);
            expanded.add(next);
            activePath.add(next);
            path.push(child);
            pending.push(graph.dependenciesOf(next).iterator());
        }
    }

    private DependencyNode node(Conversion conversion, CellId cellId, Map<CellId, EvaluationResult> values,
                                boolean circular, boolean repeated) {
        CellDeclaration declaration = conversion.getDeclarations().get(cellId);
        String expression = declaration == null ? "" : declaration.getExpression();
        EvaluationResult result = values.computeIfAbsent(cellId,
                id -> evaluator.evaluate(conversion.getProgram(), id.toString()));
        return new DependencyNode(cellId, expression,
                result.getValue().orElse(null), result.getError().orElse(null), circular, repeated);
    }
}
