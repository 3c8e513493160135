package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when the source workbook cannot be opened or parsed.
 */
public class SheetReadException extends RuntimeException {
    public SheetReadException(String message) {
        super(message);
    }

    public SheetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
