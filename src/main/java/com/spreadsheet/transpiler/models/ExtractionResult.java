package com.spreadsheet.transpiler.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of one pass over a sheet:
 * - declarations: cell -> translated declaration (defined cells first, then zero defaults)
 * - graph: cell -> cells it references
 * - originalFormulas: formula cell -> formula text as written in the sheet ("=A1+B1")
 */
public class ExtractionResult {
    private final Map<CellId, CellDeclaration> declarations;
    private final DependencyGraph graph;
    private final Map<CellId, String> originalFormulas;

    public ExtractionResult(Map<CellId, CellDeclaration> declarations,
                            DependencyGraph graph,
                            Map<CellId, String> originalFormulas) {
        this.declarations = Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
        this.graph = graph;
        this.originalFormulas = Collections.unmodifiableMap(new LinkedHashMap<>(originalFormulas));
    }

    public Map<CellId, CellDeclaration> getDeclarations() {
        return declarations;
    }

    /**
     * The graph is handed forward and mutated in place by the cycle breaker.
     */
    public DependencyGraph getGraph() {
        return graph;
    }

    public Map<CellId, String> getOriginalFormulas() {
        return originalFormulas;
    }
}
