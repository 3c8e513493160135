package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when the generated program cannot be written to its target path.
 */
public class OutputWriteException extends RuntimeException {
    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
