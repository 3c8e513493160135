package com.spreadsheet.transpiler.exceptions;

/**
 * Thrown when attempting to access a conversion ID
 * that doesn't exist in the in-memory store.
 */
public class ConversionNotFoundException extends RuntimeException {
    public ConversionNotFoundException(String message) {
        super(message);
    }
}
