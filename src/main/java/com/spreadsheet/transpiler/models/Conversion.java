package com.spreadsheet.transpiler.models;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Everything one sheet conversion produced:
 * - a unique ID (used by the REST store)
 * - the program text and the definition order it follows
 * - the declarations and original formulas per cell
 * - the dependency graph as extracted (cycles included) and as sequenced (cycles broken)
 * - the dependencies removed to break cycles
 */
public class Conversion {

    // Generates unique IDs for new conversions
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    private final long id;
    private final String program;
    private final List<CellId> definitionOrder;
    private final Map<CellId, CellDeclaration> declarations;
    private final Map<CellId, String> originalFormulas;
    private final DependencyGraph extractedGraph;
    private final DependencyGraph sequencedGraph;
    private final List<DependencyEdge> removedDependencies;

    public Conversion(String program,
                      List<CellId> definitionOrder,
                      ExtractionResult extraction,
                      DependencyGraph extractedGraph,
                      List<DependencyEdge> removedDependencies) {
        this.id = ID_GENERATOR.getAndIncrement();
        this.program = program;
        this.definitionOrder = List.copyOf(definitionOrder);
        this.declarations = extraction.getDeclarations();
        this.originalFormulas = extraction.getOriginalFormulas();
        this.extractedGraph = extractedGraph;
        this.sequencedGraph = extraction.getGraph();
        this.removedDependencies = List.copyOf(removedDependencies);
    }

    public long getId() {
        return id;
    }

    public String getProgram() {
        return program;
    }

    public List<CellId> getDefinitionOrder() {
        return definitionOrder;
    }

    public Map<CellId, CellDeclaration> getDeclarations() {
        return declarations;
    }

    public Map<CellId, String> getOriginalFormulas() {
        return originalFormulas;
    }

    /**
     * The graph as read from the sheet, before any circular reference was removed.
     */
    public DependencyGraph getExtractedGraph() {
        return extractedGraph;
    }

    /**
     * The graph the definition order was computed from.
     */
    public DependencyGraph getSequencedGraph() {
        return sequencedGraph;
    }

    public List<DependencyEdge> getRemovedDependencies() {
        return removedDependencies;
    }

    public boolean hasCircularReferences() {
        return !removedDependencies.isEmpty();
    }
}
