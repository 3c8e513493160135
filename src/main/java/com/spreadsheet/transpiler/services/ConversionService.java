package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.config.TranspilerProperties;
import com.spreadsheet.transpiler.evaluation.EvaluationResult;
import com.spreadsheet.transpiler.evaluation.ExpressionEvaluator;
import com.spreadsheet.transpiler.evaluation.ProgramInterpreter;
import com.spreadsheet.transpiler.exceptions.CellNotFoundException;
import com.spreadsheet.transpiler.exceptions.ConversionNotFoundException;
import com.spreadsheet.transpiler.exceptions.EvaluationFailedException;
import com.spreadsheet.transpiler.exceptions.OutputWriteException;
import com.spreadsheet.transpiler.exceptions.ProgramValidationException;
import com.spreadsheet.transpiler.models.*;
import com.spreadsheet.transpiler.readers.SheetReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main business logic: runs a sheet through the conversion pipeline,
 * keeps finished conversions, and answers questions about them
 * (cell values, original formulas, dependency trees, writing the program out).
 * <p>
 * Pipeline: extract -> break cycles -> sequence -> assemble.
 * Each step runs to completion before the next one starts.
 */
@Service
public class ConversionService {

    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    // All conversions live here in memory; no persistent DB
    private final Map<Long, Conversion> conversions = new ConcurrentHashMap<>();

    private final CellExtractor extractor;
    private final CycleBreaker cycleBreaker;
    private final TopologicalSequencer sequencer;
    private final ProgramAssembler assembler;
    private final DependencyReporter reporter;
    private final ExpressionEvaluator evaluator;
    private final TranspilerProperties properties;

    @Autowired
    public ConversionService(CellExtractor extractor,
                             CycleBreaker cycleBreaker,
                             TopologicalSequencer sequencer,
                             ProgramAssembler assembler,
                             DependencyReporter reporter,
                             ExpressionEvaluator evaluator,
                             TranspilerProperties properties) {
        this.extractor = extractor;
        this.cycleBreaker = cycleBreaker;
        this.sequencer = sequencer;
        this.assembler = assembler;
        this.reporter = reporter;
        this.evaluator = evaluator;
        this.properties = properties;
    }

    /**
     * Wires the default pipeline by hand, for use outside a Spring context.
     */
    public ConversionService() {
        this(new CellExtractor(new ExpressionTranslator(), new ReferenceScanner()),
                new CycleBreaker(),
                new TopologicalSequencer(),
                new ProgramAssembler(),
                new ProgramInterpreter(),
                new TranspilerProperties());
    }

    private ConversionService(CellExtractor extractor, CycleBreaker cycleBreaker, TopologicalSequencer sequencer,
                              ProgramAssembler assembler, ExpressionEvaluator evaluator,
                              TranspilerProperties properties) {
        this(extractor, cycleBreaker, sequencer, assembler, new DependencyReporter(evaluator), evaluator, properties);
    }

    /**
     * Converts a sheet into a program and keeps the result under a new ID.
     */
    public Conversion convert(SheetReader reader) {
        ExtractionResult extraction = extractor.extract(reader.readCells());
        DependencyGraph extractedGraph = extraction.getGraph().copy();

        // Mutates extraction.getGraph() in place
        List<DependencyEdge> removed = cycleBreaker.breakCycles(extraction.getGraph());
        List<CellId> order = sequencer.sequence(extraction.getGraph(), extraction.getDeclarations().keySet());
        String program = assembler.assemble(order, extraction.getDeclarations());

        Conversion conversion = new Conversion(program, order, extraction, extractedGraph, removed);
        conversions.put(conversion.getId(), conversion);
        log.info("Conversion {}: {} statements, {} circular dependencies removed",
                conversion.getId(), order.size(), removed.size());
        return conversion;
    }

    /**
     * Retrieves a conversion by ID. Throws if not found.
     */
    public Conversion getConversion(long conversionId) {
        Conversion conversion = conversions.get(conversionId);
        if (conversion == null) {
            throw new ConversionNotFoundException("Conversion not found: " + conversionId);
        }
        return conversion;
    }

    /**
     * Runs the program and reads back one cell. Never throws for evaluation errors.
     */
    public EvaluationResult computeCell(Conversion conversion, CellId cellId) {
        EvaluationResult result = evaluator.evaluate(conversion.getProgram(), cellId.toString());
        result.getError().ifPresent(error -> log.warn("Error computing {}: {}", cellId, error));
        return result;
    }

    /**
     * Like {@link #computeCell} but for the API: unknown cells and failed
     * evaluations become exceptions.
     */
    public double requireCellValue(long conversionId, CellId cellId) {
        Conversion conversion = getConversion(conversionId);
        requireKnownCell(conversion, cellId);
        EvaluationResult result = computeCell(conversion, cellId);
        return result.getValue().orElseThrow(() -> new EvaluationFailedException(
                "Cannot compute " + cellId + ": " + result.getError().orElse("unknown error")));
    }

    /**
     * The formula of a formula cell as written in the sheet ("=A1+B1"),
     * or the number of a literal cell. Empty for anything else.
     */
    public Optional<String> originalFormula(Conversion conversion, CellId cellId) {
        String formula = conversion.getOriginalFormulas().get(cellId);
        if (formula != null) {
            return Optional.of(formula);
        }
        CellDeclaration declaration = conversion.getDeclarations().get(cellId);
        if (declaration != null && declaration.getOrigin() == CellDeclaration.Origin.LITERAL) {
            return Optional.of(declaration.getExpression());
        }
        return Optional.empty();
    }

    public String requireOriginalFormula(long conversionId, CellId cellId) {
        Conversion conversion = getConversion(conversionId);
        return originalFormula(conversion, cellId).orElseThrow(() ->
                new CellNotFoundException("Cell " + cellId + " holds no formula or value"));
    }

    public List<DependencyNode> dependencies(Conversion conversion, CellId start) {
        return reporter.report(conversion, DependencyReporter.Direction.DEPENDENCIES, start);
    }

    public List<DependencyNode> dependants(Conversion conversion, CellId start) {
        return reporter.report(conversion, DependencyReporter.Direction.DEPENDANTS, start);
    }

    /**
     * The cell the pre-write check computes: the first formula cell of the sheet.
     */
    public Optional<CellId> selfCheckCell(Conversion conversion) {
        return conversion.getOriginalFormulas().keySet().stream().findFirst();
    }

    /**
     * Writes the program to 'target'. Unless disabled, first computes the
     * self-check cell and refuses to write a program that cannot compute it.
     */
    public void writeProgram(Conversion conversion, Path target) {
        if (properties.isSelfCheckBeforeWrite()) {
            Optional<CellId> checkCell = selfCheckCell(conversion);
            if (checkCell.isPresent()) {
                EvaluationResult result = computeCell(conversion, checkCell.get());
                if (!result.isSuccess()) {
                    throw new ProgramValidationException("Error in the generated program (" + checkCell.get() + ": "
                            + result.getError().orElse("unknown error") + "). Not saving to " + target + ".");
                }
            }
        }
        try {
            Files.writeString(target, conversion.getProgram(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputWriteException("Error writing to " + target + ": " + e.getMessage(), e);
        }
        log.info("Saved program of conversion {} to {}", conversion.getId(), target);
    }

    private void requireKnownCell(Conversion conversion, CellId cellId) {
        if (!conversion.getDeclarations().containsKey(cellId)) {
            throw new CellNotFoundException("Cell " + cellId + " is not part of the converted sheet");
        }
    }
}
