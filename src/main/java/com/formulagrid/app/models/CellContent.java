package com.formulagrid.app.models;

import com.formulagrid.app.formula.Formula;
import com.formulagrid.app.formula.Numbers;

import java.util.Objects;

/**
 * What was typed into a cell: text, a number, or a formula.
 * The set of variants is closed; consumers handle all three through a {@link Visitor}.
 */
public abstract class CellContent {

    public static final CellContent EMPTY = text("");

    private CellContent() {
    }

    public static CellContent text(String text) {
        return new TextContent(text);
    }

    public static CellContent number(double number) {
        return new NumberContent(number);
    }

    public static CellContent formula(Formula formula) {
        return new FormulaContent(formula);
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public boolean isEmpty() {
        return false;
    }

    public boolean isFormula() {
        return false;
    }

    /**
     * Persisted form: the text verbatim, the canonical number, or "=" plus the canonical formula.
     * Feeding it back through cell assignment rebuilds equal content.
     */
    public abstract String toStringForm();

    @Override
    public String toString() {
        return toStringForm();
    }

    public interface Visitor<R> {
        R visitText(String text);

        R visitNumber(double number);

        R visitFormula(Formula formula);
    }

    public static final class TextContent extends CellContent {
        private final String text;

        private TextContent(String text) {
            this.text = Objects.requireNonNull(text);
        }

        public String getText() {
            return text;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(text);
        }

        @Override
        public boolean isEmpty() {
            return text.isEmpty();
        }

        @Override
        public String toStringForm() {
            return text;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof TextContent && text.equals(((TextContent) o).text);
        }

        @Override
        public int hashCode() {
            return text.hashCode();
        }
    }

    public static final class NumberContent extends CellContent {
        private final double number;

        private NumberContent(double number) {
            this.number = number;
        }

        public double getNumber() {
            return number;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(number);
        }

        @Override
        public String toStringForm() {
            return Numbers.toCanonicalString(number);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberContent && Double.compare(number, ((NumberContent) o).number) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(number);
        }
    }

    public static final class FormulaContent extends CellContent {
        private final Formula formula;

        private FormulaContent(Formula formula) {
            this.formula = Objects.requireNonNull(formula);
        }

        public Formula getFormula() {
            return formula;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFormula(formula);
        }

        @Override
        public boolean isFormula() {
            return true;
        }

        @Override
        public String toStringForm() {
            return "=" + formula;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FormulaContent && formula.equals(((FormulaContent) o).formula);
        }

        @Override
        public int hashCode() {
            return formula.hashCode();
        }
    }
}
