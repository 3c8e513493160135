package com.spreadsheet.transpiler.evaluation;

/**
 * Syntax or runtime error inside a generated program.
 * Never leaves the evaluator; it is turned into a failed {@link EvaluationResult}.
 */
class ProgramEvaluationException extends RuntimeException {
    ProgramEvaluationException(String message) {
        super(message);
    }
}
