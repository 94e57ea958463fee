package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.FormulaFormatException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An immutable, parsed infix arithmetic formula over non-negative numbers, variables,
 * the four binary operators and parentheses.
 * <p>
 * Parsing canonicalizes the text: whitespace is dropped, numbers are rewritten in their
 * shortest decimal form and variables pass through the normalizer. Two formulas are equal
 * exactly when their canonical token sequences are, so {@code new Formula("2.0+X7")} equals
 * {@code new Formula("2.000 + x7", String::toUpperCase, s -> true)}.
 */
public final class Formula {

    private final List<Token> tokens;
    private final String canonical;
    private final Set<String> variables;

    /**
     * Parses the formula with identity normalization and no extra validity check.
     *
     * @throws FormulaFormatException if the text is not a well-formed formula
     */
    public Formula(String formula) {
        this(formula, s -> s, s -> true);
    }

    /**
     * Parses the formula, normalizing each variable and requiring {@code isValid} to accept
     * the normalized name.
     *
     * @throws FormulaFormatException if the text is not a well-formed formula or a variable
     *                                is rejected
     */
    public Formula(String formula, UnaryOperator<String> normalize, Predicate<String> isValid) {
        this.tokens = FormulaValidator.validate(Tokenizer.lex(formula), normalize, isValid);

        StringBuilder text = new StringBuilder();
        Set<String> names = new LinkedHashSet<>();
        for (Token token : tokens) {
            text.append(token);
            if (token.isVariable()) {
                names.add(token.getVariable());
            }
        }
        this.canonical = text.toString();
        this.variables = Collections.unmodifiableSet(names);
    }

    /**
     * Distinct normalized variables, in order of first appearance.
     */
    public Set<String> getVariables() {
        return variables;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    /**
     * Evaluates the formula. Undefined variables and division by zero yield a
     * {@link FormulaError} result instead of an exception.
     */
    public EvaluationResult evaluate(VariableLookup lookup) {
        return ExpressionEvaluator.evaluate(tokens, lookup);
    }

    /**
     * The canonical form: all canonical tokens concatenated, no whitespace.
     * Parsing it again yields an equal formula.
     */
    @Override
    public String toString() {
        return canonical;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Formula)) {
            return false;
        }
        return tokens.equals(((Formula) o).tokens);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }
}
