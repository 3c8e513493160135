package com.spreadsheet.transpiler.readers;

import com.spreadsheet.transpiler.exceptions.SheetReadException;
import com.spreadsheet.transpiler.models.Conversion;
import com.spreadsheet.transpiler.services.ConversionService;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExcelSheetReader against workbooks written with POI into a temp directory.
 */
class ExcelSheetReaderTest {

    @TempDir
    Path tempDir;

    private Path writeWorkbook(String name, Workbook workbook) throws IOException {
        Path path = tempDir.resolve(name);
        try (OutputStream out = Files.newOutputStream(path); Workbook wb = workbook) {
            wb.write(out);
        }
        return path;
    }

    private static Workbook simpleWorkbook() {
        Workbook workbook = new XSSFWorkbook();
        Sheet sheet = workbook.createSheet("Data");
        Row first = sheet.createRow(0);
        first.createCell(0).setCellValue(5);
        first.createCell(1).setCellValue(10);
        first.createCell(2).setCellFormula("A1+B1");
        Row second = sheet.createRow(1);
        second.createCell(0).setCellValue("label");
        second.createCell(1).setCellValue(true);
        return workbook;
    }

    @Test
    void testReadCellValues() throws IOException {
        Path path = writeWorkbook("simple.xlsx", simpleWorkbook());

        List<RawCell> cells = ExcelSheetReader.fromPath(path, ExcelSheetReader.ACTIVE_SHEET).readCells();

        assertEquals(5, cells.size());
        assertEquals(1, cells.get(0).getRow());
        assertEquals(1, cells.get(0).getColumn());
        assertEquals(5.0, cells.get(0).getValue());
        assertEquals(10.0, cells.get(1).getValue());
        assertEquals("=A1+B1", cells.get(2).getValue());
        assertEquals("label", cells.get(3).getValue());
        assertEquals(2, cells.get(3).getRow());
        assertEquals(Boolean.TRUE, cells.get(4).getValue());
    }

    @Test
    void testReadFromBytes() throws IOException {
        Path path = writeWorkbook("bytes.xlsx", simpleWorkbook());
        byte[] content = Files.readAllBytes(path);

        List<RawCell> cells = ExcelSheetReader.fromBytes("bytes.xlsx", content, 0).readCells();

        assertEquals("=A1+B1", cells.get(2).getValue());
    }

    @Test
    void testActiveSheetIsDefault() throws IOException {
        Workbook workbook = new XSSFWorkbook();
        workbook.createSheet("First").createRow(0).createCell(0).setCellValue(1);
        workbook.createSheet("Second").createRow(0).createCell(0).setCellValue(2);
        workbook.setActiveSheet(1);
        Path path = writeWorkbook("two-sheets.xlsx", workbook);

        assertEquals(2.0, ExcelSheetReader.fromPath(path, ExcelSheetReader.ACTIVE_SHEET).readCells().get(0).getValue());
        assertEquals(1.0, ExcelSheetReader.fromPath(path, 0).readCells().get(0).getValue());
    }

    @Test
    void testMissingSheetIndex() throws IOException {
        Path path = writeWorkbook("simple.xlsx", simpleWorkbook());

        SheetReadException e = assertThrows(SheetReadException.class,
                () -> ExcelSheetReader.fromPath(path, 3).readCells());
        assertTrue(e.getMessage().contains("no sheet at index 3"));
    }

    @Test
    void testMissingFile() {
        Path path = tempDir.resolve("nowhere.xlsx");

        assertThrows(SheetReadException.class, () -> ExcelSheetReader.fromPath(path, 0).readCells());
    }

    @Test
    void testNotAWorkbook() throws IOException {
        Path path = tempDir.resolve("notes.xlsx");
        Files.writeString(path, "this is not a spreadsheet", StandardCharsets.UTF_8);

        assertThrows(SheetReadException.class, () -> ExcelSheetReader.fromPath(path, 0).readCells());
    }

    /**
     * Formula cells reach the converter as written, not as their cached results.
     */
    @Test
    void testWorkbookConversion() throws IOException {
        Path path = writeWorkbook("simple.xlsx", simpleWorkbook());

        Conversion conversion = new ConversionService().convert(ExcelSheetReader.fromPath(path, 0));

        assertEquals("var A1 = 5;\nvar B1 = 10;\nvar C1 = A1+B1;", conversion.getProgram());
    }
}
