package com.spreadsheet.transpiler.evaluation;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Variables of one program run. Created for a single evaluation and closed
 * right after it, so no state leaks from one evaluation into the next.
 */
class InterpreterScope implements AutoCloseable {

    private final Set<String> declared = new HashSet<>();
    private final Map<String, Double> values = new HashMap<>();
    private boolean closed;

    /**
     * Declares a name before any statement runs. Until assigned, it reads as NaN.
     */
    void declare(String name) {
        checkOpen();
        declared.add(name);
    }

    void assign(String name, double value) {
        checkOpen();
        declared.add(name);
        values.put(name, value);
    }

    double read(String name) {
        checkOpen();
        if (!declared.contains(name)) {
            throw new ProgramEvaluationException(name + " is not defined");
        }
        return values.getOrDefault(name, Double.NaN);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Interpreter scope already closed");
        }
    }

    @Override
    public void close() {
        declared.clear();
        values.clear();
        closed = true;
    }
}
