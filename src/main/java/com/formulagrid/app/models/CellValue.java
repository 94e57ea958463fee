package com.formulagrid.app.models;

import com.formulagrid.app.formula.FormulaError;
import com.formulagrid.app.formula.Numbers;

import java.util.Objects;

/**
 * What a cell displays: text, a number, or a {@link FormulaError}.
 */
public abstract class CellValue {

    public static final CellValue EMPTY = text("");

    private CellValue() {
    }

    public static CellValue text(String text) {
        return new TextValue(text);
    }

    public static CellValue number(double number) {
        return new NumberValue(number);
    }

    public static CellValue error(FormulaError error) {
        return new ErrorValue(error);
    }

    public boolean isNumber() {
        return false;
    }

    /**
     * @throws IllegalStateException unless {@link #isNumber()}
     */
    public double getNumber() {
        throw new IllegalStateException("Not a numeric value: " + this);
    }

    /**
     * The plain Java object for JSON output: String, Double or FormulaError.
     */
    public abstract Object toObject();

    public static final class TextValue extends CellValue {
        private final String text;

        private TextValue(String text) {
            this.text = Objects.requireNonNull(text);
        }

        @Override
        public Object toObject() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextValue && text.equals(((TextValue) o).text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }

        @Override
        public String toString() {
            return text;
        }
    }

    public static final class NumberValue extends CellValue {
        private final double number;

        private NumberValue(double number) {
            this.number = number;
        }

        @Override
        public boolean isNumber() {
            return true;
        }

        @Override
        public double getNumber() {
            return number;
        }

        @Override
        public Object toObject() {
            return number;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberValue && Double.compare(number, ((NumberValue) o).number) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(number);
        }

        @Override
        public String toString() {
            return Numbers.toCanonicalString(number);
        }
    }

    public static final class ErrorValue extends CellValue {
        private final FormulaError error;

        private ErrorValue(FormulaError error) {
            this.error = Objects.requireNonNull(error);
        }

        public FormulaError getError() {
            return error;
        }

        @Override
        public Object toObject() {
            return error;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ErrorValue && error.equals(((ErrorValue) o).error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return error.toString();
        }
    }
}
