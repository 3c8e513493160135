package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.models.CellContent;
import com.spreadsheet.transpiler.models.CellDeclaration;
import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.DependencyGraph;
import com.spreadsheet.transpiler.models.ExtractionResult;
import com.spreadsheet.transpiler.readers.RawCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks a sheet's cells and produces, in one pass:
 * 1) a declaration per defined cell (numbers as literals, "=..." text translated),
 * 2) the dependency graph of formula cell -> referenced cells,
 * 3) the original formula text of every formula cell.
 * Afterwards every referenced cell that the sheet never defines gets a zero declaration,
 * so the graph's vertex set and the declarations cover the same cells.
 */
@Service
public class CellExtractor {

    private static final Logger log = LoggerFactory.getLogger(CellExtractor.class);

    /** Leading character that marks a text cell as a formula. */
    public static final String FORMULA_MARKER = "=";

    private final ExpressionTranslator translator;
    private final ReferenceScanner scanner;

    public CellExtractor(ExpressionTranslator translator, ReferenceScanner scanner) {
        this.translator = translator;
        this.scanner = scanner;
    }

    /**
     * Classifies a raw sheet value: numbers are literals, text starting with
     * the formula marker is a formula, everything else is empty.
     */
    public static CellContent classify(Object value) {
        if (value instanceof Number) {
            return CellContent.literal(((Number) value).doubleValue());
        }
        if (value instanceof String && ((String) value).startsWith(FORMULA_MARKER)) {
            return CellContent.formula(((String) value).substring(FORMULA_MARKER.length()));
        }
        return CellContent.empty();
    }

    public ExtractionResult extract(List<RawCell> cells) {
        Map<CellId, CellDeclaration> declarations = new LinkedHashMap<>();
        Map<CellId, String> originalFormulas = new LinkedHashMap<>();
        DependencyGraph graph = new DependencyGraph();
        Set<CellId> defined = new LinkedHashSet<>();

        for (RawCell cell : cells) {
            CellContent content = classify(cell.getValue());
            if (content.isEmpty()) {
                continue;
            }
            CellId cellId = CellId.of(cell.getColumn(), cell.getRow());
            graph.addVertex(cellId);
            defined.add(cellId);

            if (content.getKind() == CellContent.Kind.LITERAL) {
                declarations.put(cellId, CellDeclaration.literal(cellId, content.getNumber()));
                continue;
            }

            String formula = content.getFormula();
            originalFormulas.put(cellId, content.toString());
            String expression = translator.translate(formula);
            declarations.put(cellId, CellDeclaration.formula(cellId, expression));

            for (CellId reference : references(formula)) {
                graph.addDependency(cellId, reference);
            }
            log.debug("{}: {} -> {}", cellId, formula, expression);
        }

        // Referenced but never defined: default to zero, in order of first appearance
        int defaulted = 0;
        for (CellId vertex : graph.vertices()) {
            if (!defined.contains(vertex)) {
                declarations.put(vertex, CellDeclaration.undefinedReference(vertex));
                defaulted++;
            }
        }

        log.info("Extracted {} declarations ({} formulas, {} undefined references defaulted to zero), {} dependencies",
                declarations.size(), originalFormulas.size(), defaulted, graph.edgeCount());
        return new ExtractionResult(declarations, graph, originalFormulas);
    }

    /**
     * References written in the formula, followed by the cells a range sum
     * expands to, so every cell the translated expression mentions is a vertex.
     */
    private Set<CellId> references(String formula) {
        Set<CellId> references = new LinkedHashSet<>(scanner.scan(formula));
        references.addAll(translator.rangeSumCells(formula));
        return references;
    }
}
