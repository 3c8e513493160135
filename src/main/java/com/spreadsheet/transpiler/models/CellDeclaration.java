package com.spreadsheet.transpiler.models;

import java.util.Objects;

/**
 * The translated value of one cell, ready to be emitted as a program statement.
 * Literal cells carry their number, formula cells the translated expression,
 * and cells that are only referenced (never defined) a synthetic zero.
 */
public class CellDeclaration {

    /** Statement keyword of the target grammar. */
    public static final String KEYWORD = "var";

    /** Expression used for every referenced-but-undefined cell. */
    public static final String UNDEFINED_DEFAULT = "0";

    public enum Origin {
        LITERAL,
        FORMULA,
        UNDEFINED_REFERENCE
    }

    private final CellId cellId;
    private final String expression;
    private final Origin origin;

    public CellDeclaration(CellId cellId, String expression, Origin origin) {
        this.cellId = Objects.requireNonNull(cellId, "cellId");
        this.expression = Objects.requireNonNull(expression, "expression");
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public static CellDeclaration literal(CellId cellId, double value) {
        return new CellDeclaration(cellId, CellContent.formatNumber(value), Origin.LITERAL);
    }

    public static CellDeclaration formula(CellId cellId, String translated) {
        return new CellDeclaration(cellId, translated, Origin.FORMULA);
    }

    public static CellDeclaration undefinedReference(CellId cellId) {
        return new CellDeclaration(cellId, UNDEFINED_DEFAULT, Origin.UNDEFINED_REFERENCE);
    }

    public CellId getCellId() {
        return cellId;
    }

    public String getExpression() {
        return expression;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * Renders the declaration as one program line: "var B2 = A1+1;".
     */
    public String toStatement() {
        return KEYWORD + " " + cellId + " = " + expression + ";";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellDeclaration)) {
            return false;
        }
        CellDeclaration that = (CellDeclaration) o;
        return cellId.equals(that.cellId) && expression.equals(that.expression) && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cellId, expression, origin);
    }

    @Override
    public String toString() {
        return toStatement();
    }
}
