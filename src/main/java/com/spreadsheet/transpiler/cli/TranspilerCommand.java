package com.spreadsheet.transpiler.cli;

import com.spreadsheet.transpiler.evaluation.EvaluationResult;
import com.spreadsheet.transpiler.exceptions.CellNotFoundException;
import com.spreadsheet.transpiler.exceptions.InvalidCellReferenceException;
import com.spreadsheet.transpiler.exceptions.OutputWriteException;
import com.spreadsheet.transpiler.exceptions.ProgramValidationException;
import com.spreadsheet.transpiler.exceptions.SheetReadException;
import com.spreadsheet.transpiler.models.CellContent;
import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.Conversion;
import com.spreadsheet.transpiler.models.DependencyNode;
import com.spreadsheet.transpiler.readers.ExcelSheetReader;
import com.spreadsheet.transpiler.services.ConversionService;
import com.spreadsheet.transpiler.services.DependencyTreeRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line front end: converts a workbook and either prints the program
 * or answers one question about it.
 * <p>
 * Exit codes: 0 on success, 1 when the workbook cannot be read, the program
 * fails its pre-write check or cannot be written, 2 for a malformed cell argument.
 */
@Command(
        name = "transpiler",
        mixinStandardHelpOptions = true,
        version = "transpiler 0.0.1",
        description = "Converts the cells of a spreadsheet into a program of ordered declarations.%n"
                + "Without options the program is printed to standard output.")
public class TranspilerCommand implements Callable<Integer> {

    /** Value of -d/-s when given without a cell: show the trees of every root cell. */
    static final String ALL_CELLS = "ALL";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "WORKBOOK", description = "Path to the .xlsx or .xls file")
    private Path workbook;

    @Option(names = {"-c", "--compute"}, paramLabel = "CELL",
            description = "Compute the value of a cell using the generated program")
    private String compute;

    @Option(names = {"-f", "--formula"}, paramLabel = "CELL",
            description = "Print the original formula or numeric value of a cell")
    private String formula;

    @Option(names = {"-o", "--output"}, paramLabel = "PATH",
            description = "Write the program to a file instead of standard output")
    private Path output;

    @Option(names = {"-d", "--show-dependencies"}, paramLabel = "CELL", arity = "0..1", fallbackValue = ALL_CELLS,
            description = "Show the dependency tree of a cell, or of every root cell if none is given")
    private String showDependencies;

    @Option(names = {"-s", "--show-dependants"}, paramLabel = "CELL", arity = "0..1", fallbackValue = ALL_CELLS,
            description = "Show the dependant tree of a cell, or of every root cell if none is given")
    private String showDependants;

    private final ConversionService conversionService;
    private final DependencyTreeRenderer renderer;
    private final int sheetIndex;

    public TranspilerCommand(ConversionService conversionService, DependencyTreeRenderer renderer, int sheetIndex) {
        this.conversionService = conversionService;
        this.renderer = renderer;
        this.sheetIndex = sheetIndex;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Conversion conversion;
        try {
            conversion = conversionService.convert(ExcelSheetReader.fromPath(workbook, sheetIndex));
        } catch (SheetReadException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            if (showDependencies != null) {
                List<DependencyNode> trees = conversionService.dependencies(conversion, optionalCell(showDependencies));
                out.print(renderer.render(trees));
            } else if (showDependants != null) {
                List<DependencyNode> trees = conversionService.dependants(conversion, optionalCell(showDependants));
                out.print(renderer.render(trees));
            } else if (formula != null) {
                CellId cellId = CellId.parse(formula);
                String original = conversionService.originalFormula(conversion, cellId).orElse("Not Found");
                out.println("The original formula/value of " + cellId + " is " + original);
            } else if (compute != null) {
                CellId cellId = CellId.parse(compute);
                EvaluationResult result = conversionService.computeCell(conversion, cellId);
                if (!result.isSuccess()) {
                    err.println("Error computing " + cellId + ": " + result.getError().orElse("unknown error"));
                }
                String value = result.getValue().map(CellContent::formatNumber).orElse("None");
                out.println("The computed value of " + cellId + " is " + value);
            } else if (output != null) {
                conversionService.writeProgram(conversion, output);
                out.println("Successfully saved program to " + output);
            } else {
                out.println(conversion.getProgram());
            }
        } catch (InvalidCellReferenceException | CellNotFoundException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (ProgramValidationException | OutputWriteException e) {
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
        out.flush();
        return EXIT_OK;
    }

    private static CellId optionalCell(String value) {
        return ALL_CELLS.equals(value) ? null : CellId.parse(value);
    }
}
