package com.spreadsheet.transpiler.readers;

/**
 * One cell as a sheet reader enumerates it: 1-based row and column,
 * and the raw value (a Number, a String, a Boolean, or null when empty).
 */
public class RawCell {
    private final int row;
    private final int column;
    private final Object value;

    public RawCell(int row, int column, Object value) {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Rows and columns start at 1, got row=" + row + " column=" + column);
        }
        this.row = row;
        this.column = column;
        this.value = value;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "RawCell{row=" + row + ", column=" + column + ", value=" + value + "}";
    }
}
