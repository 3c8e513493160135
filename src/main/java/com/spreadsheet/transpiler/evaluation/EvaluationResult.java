package com.spreadsheet.transpiler.evaluation;

import java.util.Optional;

/**
 * Outcome of reading one identifier back from an executed program:
 * either a value, or the reason there is none.
 */
public final class EvaluationResult {
    private final Double value;
    private final String error;

    private EvaluationResult(Double value, String error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult of(double value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult failure(String error) {
        return new EvaluationResult(null, error);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<Double> getValue() {
        return Optional.ofNullable(value);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return isSuccess() ? String.valueOf(value) : "error: " + error;
    }
}
