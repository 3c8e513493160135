package com.spreadsheet.transpiler.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a dependency (or dependant) tree:
 * - the cell and its translated expression
 * - its computed value, or the evaluation error when there is none
 * - circular: the cell is already on the path from the root, so it is not expanded again
 * - repeated: the cell was already expanded earlier in the same tree
 */
public class DependencyNode {
    private final CellId cellId;
    private final String expression;
    private final Double value;
    private final String error;
    private final boolean circular;
    private final boolean repeated;
    private final List<DependencyNode> children = new ArrayList<>();

    public DependencyNode(CellId cellId, String expression, Double value, String error, boolean circular) {
        this(cellId, expression, value, error, circular, false);
    }

    public DependencyNode(CellId cellId, String expression, Double value, String error,
                          boolean circular, boolean repeated) {
        this.cellId = cellId;
        this.expression = expression;
        this.value = value;
        this.error = error;
        this.circular = circular;
        this.repeated = repeated;
    }

    public CellId getCellId() {
        return cellId;
    }

    public String getExpression() {
        return expression;
    }

    // null when the value could not be computed
    public Double getValue() {
        return value;
    }

    public String getError() {
        return error;
    }

    public boolean isCircular() {
        return circular;
    }

    public boolean isRepeated() {
        return repeated;
    }

    public List<DependencyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(DependencyNode child) {
        children.add(child);
    }
}
