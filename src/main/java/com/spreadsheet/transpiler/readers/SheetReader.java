package com.spreadsheet.transpiler.readers;

import java.util.List;

/**
 * Source of sheet cells for a conversion.
 * Implementations return cells in row-major order (row by row, left to right).
 */
public interface SheetReader {

    List<RawCell> readCells();
}
