package com.formulagrid.app.formula;

import java.util.Objects;

/**
 * Outcome of evaluating a formula: either a number or a {@link FormulaError}.
 */
public final class EvaluationResult {
    private final double value;
    private final FormulaError error;

    private EvaluationResult(double value, FormulaError error) {
        this.value = value;
        this.error = error;
    }

    public static EvaluationResult of(double value) {
        return new EvaluationResult(value, null);
    }

    public static EvaluationResult error(FormulaError error) {
        return new EvaluationResult(Double.NaN, Objects.requireNonNull(error));
    }

    public boolean isError() {
        return error != null;
    }

    public double getValue() {
        if (error != null) {
            throw new IllegalStateException("Evaluation failed: " + error.getReason());
        }
        return value;
    }

    public FormulaError getError() {
        if (error == null) {
            throw new IllegalStateException("Evaluation succeeded with " + value);
        }
        return error;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult other = (EvaluationResult) o;
        return Objects.equals(error, other.error)
                && (error != null || Double.compare(value, other.value) == 0);
    }

    @Override
    public int hashCode() {
        return error != null ? error.hashCode() : Double.hashCode(value);
    }

    @Override
    public String toString() {
        return error != null ? error.toString() : Numbers.toCanonicalString(value);
    }
}
