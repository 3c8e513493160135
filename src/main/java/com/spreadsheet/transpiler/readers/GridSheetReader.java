package com.spreadsheet.transpiler.readers;

import com.spreadsheet.transpiler.models.CellId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * In-memory sheet built from cell references and values,
 * e.g. {"A1": 5, "B1": 10, "C1": "=A1+B1"}.
 * Cells are handed out row-major regardless of the map's own order.
 */
public class GridSheetReader implements SheetReader {

    private static final Comparator<RawCell> ROW_MAJOR =
            Comparator.comparingInt(RawCell::getRow).thenComparingInt(RawCell::getColumn);

    private final List<RawCell> cells;

    public GridSheetReader(Map<String, ?> values) {
        List<RawCell> parsed = new ArrayList<>(values.size());
        values.forEach((reference, value) -> {
            CellId id = CellId.parse(reference);
            parsed.add(new RawCell(id.getRow(), id.getColumnIndex(), value));
        });
        parsed.sort(ROW_MAJOR);
        this.cells = List.copyOf(parsed);
    }

    @Override
    public List<RawCell> readCells() {
        return cells;
    }
}
