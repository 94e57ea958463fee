package com.formulagrid.app.engine;

import com.formulagrid.app.exceptions.FormulaFormatException;
import com.formulagrid.app.formula.Formula;
import com.formulagrid.app.models.CellContent;

import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Decides what a raw cell entry is: a number, a formula (leading '='), or text.
 */
final class ContentClassifier {

    // Plain signed decimals only; "NaN", "Infinity", hex and "1f"-style literals stay text
    private static final Pattern NUMBER = Pattern.compile(
            "\\s*[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?\\s*");

    private ContentClassifier() {
    }

    /**
     * @throws FormulaFormatException if the entry starts with '=' but the rest is not a formula
     */
    static CellContent classify(String content, UnaryOperator<String> normalize, Predicate<String> isValid) {
        if (NUMBER.matcher(content).matches()) {
            double number = Double.parseDouble(content.trim());
            if (!Double.isInfinite(number)) {
                return CellContent.number(number);
            }
        }
        if (content.startsWith("=")) {
            return CellContent.formula(new Formula(content.substring(1), normalize, isValid));
        }
        return CellContent.text(content);
    }
}
