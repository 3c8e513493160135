package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when a string cannot be read as a cell reference,
 * for example "12B" or "A0".
 */
public class InvalidCellReferenceException extends RuntimeException {
    public InvalidCellReferenceException(String message) {
        super(message);
    }
}
