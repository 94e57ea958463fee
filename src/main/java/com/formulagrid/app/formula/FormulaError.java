package com.formulagrid.app.formula;

import java.util.Objects;

/**
 * Value produced when a formula cannot be evaluated. It is stored as a cell's value,
 * never thrown.
 */
public final class FormulaError {

    public static final String UNDEFINED_VARIABLE = "undefined variable";
    public static final String DIVISION_BY_ZERO = "division by zero";

    private final String reason;

    public FormulaError(String reason) {
        this.reason = Objects.requireNonNull(reason);
    }

    public static FormulaError undefinedVariable() {
        return new FormulaError(UNDEFINED_VARIABLE);
    }

    public static FormulaError divisionByZero() {
        return new FormulaError(DIVISION_BY_ZERO);
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FormulaError && reason.equals(((FormulaError) o).reason);
    }

    @Override
    public int hashCode() {
        return reason.hashCode();
    }

    @Override
    public String toString() {
        return "FormulaError(" + reason + ")";
    }
}
