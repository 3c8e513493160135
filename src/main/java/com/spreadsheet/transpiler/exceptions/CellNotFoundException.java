package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when a cell is requested that the converted sheet
 * neither defines nor references.
 */
public class CellNotFoundException extends RuntimeException {
    public CellNotFoundException(String message) {
        super(message);
    }
}
