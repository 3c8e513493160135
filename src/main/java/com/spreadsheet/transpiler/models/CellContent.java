package com.spreadsheet.transpiler.models;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * What a sheet cell holds once classified:
 * - EMPTY: nothing usable (blank, plain text, booleans)
 * - LITERAL: a number
 * - FORMULA: formula source text, without its leading marker
 */
public final class CellContent {

    public enum Kind {
        EMPTY,
        LITERAL,
        FORMULA
    }

    private static final CellContent EMPTY = new CellContent(Kind.EMPTY, null, null);

    private final Kind kind;
    private final Double number;
    private final String formula;

    private CellContent(Kind kind, Double number, String formula) {
        this.kind = kind;
        this.number = number;
        this.formula = formula;
    }

    public static CellContent empty() {
        return EMPTY;
    }

    public static CellContent literal(double number) {
        return new CellContent(Kind.LITERAL, number, null);
    }

    public static CellContent formula(String source) {
        return new CellContent(Kind.FORMULA, null, Objects.requireNonNull(source, "source"));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public double getNumber() {
        if (kind != Kind.LITERAL) {
            throw new IllegalStateException("Not a literal cell: " + kind);
        }
        return number;
    }

    public String getFormula() {
        if (kind != Kind.FORMULA) {
            throw new IllegalStateException("Not a formula cell: " + kind);
        }
        return formula;
    }

    /**
     * Shortest decimal text that parses back to the same double,
     * with integral values written without a fraction ("5" rather than "5.0").
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            return "0";
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return formatNumber(number);
            case FORMULA:
                return "=" + formula;
            default:
                return "";
        }
    }
}
