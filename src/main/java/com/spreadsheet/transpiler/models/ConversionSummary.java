package com.spreadsheet.transpiler.models;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON view of a conversion, for example:
 * {
 *   "id": 1,
 *   "program": "var A1 = 5;\nvar B1 = 10;\nvar C1 = A1+B1;",
 *   "definitionOrder": ["A1", "B1", "C1"],
 *   "removedDependencies": []
 * }
 */
public class ConversionSummary {
    private final long id;
    private final String program;
    private final List<CellId> definitionOrder;
    private final List<String> removedDependencies;

    public ConversionSummary(Conversion conversion) {
        this.id = conversion.getId();
        this.program = conversion.getProgram();
        this.definitionOrder = conversion.getDefinitionOrder();
        this.removedDependencies = new ArrayList<>();
        conversion.getRemovedDependencies().forEach(edge -> removedDependencies.add(edge.toString()));
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

    public List<String> getRemovedDependencies() {
        return removedDependencies;
    }
}
