package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when a cell value is requested through the API
 * but the generated program cannot compute it.
 */
public class EvaluationFailedException extends RuntimeException {
    public EvaluationFailedException(String message) {
        super(message);
    }
}
