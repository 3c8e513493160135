package com.spreadsheet.transpiler.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.spreadsheet.transpiler.exceptions.InvalidCellReferenceException;
import org.apache.poi.ss.util.CellReference;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies a single spreadsheet cell by column letters and row number.
 * The canonical form is "LETTERS+DIGITS" (e.g. "B12"); equality, hashing and
 * ordering are all defined over that string, so "$B$12" and "B12" are the same id.
 */
public final class CellId implements Comparable<CellId> {

    // Accepts absolute markers before the column and/or the row: "$B$12", "B$12", "$B12"
    private static final Pattern REFERENCE_PATTERN = Pattern.compile("^\\$?([A-Z]+)\\$?(\\d+)$");

    private final String column;
    private final int row;
    private final String canonical;

    private CellId(String column, int row) {
        this.column = column;
        this.row = row;
        this.canonical = column + row;
    }

    /**
     * Builds an id from a column letter string and a 1-based row number.
     */
    public static CellId of(String column, int row) {
        if (column == null || column.isEmpty() || !column.chars().allMatch(c -> c >= 'A' && c <= 'Z')) {
            throw new InvalidCellReferenceException("Invalid column letters: " + column);
        }
        if (row < 1) {
            throw new InvalidCellReferenceException("Row numbers start at 1, got: " + row);
        }
        return new CellId(column, row);
    }

    /**
     * Builds an id from 1-based column and row indexes, as a sheet reader enumerates them.
     */
    public static CellId of(int columnIndex, int row) {
        if (columnIndex < 1) {
            throw new InvalidCellReferenceException("Column indexes start at 1, got: " + columnIndex);
        }
        return of(columnLetters(columnIndex), row);
    }

    /**
     * Parses a reference such as "B12" or "$B$12". Absolute markers are dropped.
     */
    @JsonCreator
    public static CellId parse(String reference) {
        if (reference == null) {
            throw new InvalidCellReferenceException("Cell reference is missing");
        }
        Matcher matcher = REFERENCE_PATTERN.matcher(reference.trim());
        if (!matcher.matches()) {
            throw new InvalidCellReferenceException("Not a cell reference: " + reference);
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new InvalidCellReferenceException("Row number out of range: " + reference);
        }
        return of(matcher.group(1), row);
    }

    /**
     * Converts column letters to a 1-based index: A=1, Z=26, AA=27.
     */
    public static int columnIndex(String columnLetters) {
        return CellReference.convertColStringToIndex(columnLetters) + 1;
    }

    /**
     * Converts a 1-based column index to its letters: 1=A, 26=Z, 27=AA.
     */
    public static String columnLetters(int columnIndex) {
        return CellReference.convertNumToColString(columnIndex - 1);
    }

    public String getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    public int getColumnIndex() {
        return columnIndex(column);
    }

    @Override
    public int compareTo(CellId other) {
        return canonical.compareTo(other.canonical);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellId)) {
            return false;
        }
        return canonical.equals(((CellId) o).canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @JsonValue
    @Override
    public String toString() {
        return canonical;
    }
}
