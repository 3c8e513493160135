package com.spreadsheet.transpiler.evaluation;

/**
 * Runs a generated program and reads back the value of one declared identifier.
 * Implementations never throw: failures come back as {@link EvaluationResult#failure(String)}.
 */
public interface ExpressionEvaluator {

    EvaluationResult evaluate(String program, String identifier);
}
