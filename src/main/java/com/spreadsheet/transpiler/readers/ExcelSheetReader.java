package com.spreadsheet.transpiler.readers;

import com.spreadsheet.transpiler.exceptions.SheetReadException;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads one sheet of an .xlsx or .xls workbook with Apache POI.
 * <p>
 * Formula cells are returned as their formula text with a leading "=",
 * never as cached results, so the converter sees what the author wrote.
 */
public class ExcelSheetReader implements SheetReader {

    private static final Logger log = LoggerFactory.getLogger(ExcelSheetReader.class);

    /** Sheet index meaning "whichever sheet the workbook marks as active". */
    public static final int ACTIVE_SHEET = -1;

    private final String sourceName;
    private final WorkbookSource source;
    private final int sheetIndex;

    @FunctionalInterface
    private interface WorkbookSource {
        InputStream open() throws IOException;
    }

    private ExcelSheetReader(String sourceName, WorkbookSource source, int sheetIndex) {
        this.sourceName = sourceName;
        this.source = source;
        this.sheetIndex = sheetIndex;
    }

    public static ExcelSheetReader fromPath(Path path, int sheetIndex) {
        return new ExcelSheetReader(path.toString(), () -> Files.newInputStream(path), sheetIndex);
    }

    public static ExcelSheetReader fromBytes(String name, byte[] content, int sheetIndex) {
        return new ExcelSheetReader(name, () -> new ByteArrayInputStream(content), sheetIndex);
    }

    @Override
    public List<RawCell> readCells() {
        try (InputStream in = source.open(); Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = selectSheet(workbook);
            List<RawCell> cells = new ArrayList<>();
            for (Row row : sheet) {
                for (Cell cell : row) {
                    cells.add(new RawCell(row.getRowNum() + 1, cell.getColumnIndex() + 1, rawValue(cell)));
                }
            }
            log.info("Read {} cells from sheet '{}' of {}", cells.size(), sheet.getSheetName(), sourceName);
            return cells;
        } catch (IOException | EncryptedDocumentException | UnsupportedFileFormatException e) {
            throw new SheetReadException("Cannot read workbook " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private Sheet selectSheet(Workbook workbook) {
        if (workbook.getNumberOfSheets() == 0) {
            throw new SheetReadException("Workbook " + sourceName + " has no sheets");
        }
        int index = sheetIndex == ACTIVE_SHEET ? workbook.getActiveSheetIndex() : sheetIndex;
        if (index < 0 || index >= workbook.getNumberOfSheets()) {
            throw new SheetReadException("Workbook " + sourceName + " has no sheet at index " + index);
        }
        return workbook.getSheetAt(index);
    }

    private static Object rawValue(Cell cell) {
        switch (cell.getCellType()) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                return cell.getStringCellValue();
            case FORMULA:
                return "=" + cell.getCellFormula();
            case BOOLEAN:
                return cell.getBooleanCellValue();
            default:
                // BLANK, ERROR
                return null;
        }
    }
}
