package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when the generated program fails its self-check
 * (the designated cell cannot be computed), so it must not be written out.
 */
public class ProgramValidationException extends RuntimeException {
    public ProgramValidationException(String message) {
        super(message);
    }
}
