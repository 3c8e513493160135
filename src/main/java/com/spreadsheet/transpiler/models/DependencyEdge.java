package com.spreadsheet.transpiler.models;

import java.util.Objects;

/**
 * A single "source references target" relation in the dependency graph.
 */
public final class DependencyEdge {
    private final CellId source;
    private final CellId target;

    public DependencyEdge(CellId source, CellId target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public CellId getSource() {
        return source;
    }

    public CellId getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DependencyEdge)) {
            return false;
        }
        DependencyEdge that = (DependencyEdge) o;
        return source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + "->" + target;
    }
}
