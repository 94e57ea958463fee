package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.FormulaFormatException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Turns raw lexemes into the canonical token list of a formula, enforcing the
 * structural rules:
 * <ol>
 *   <li>at least one token;</li>
 *   <li>the first token is a number, a variable or '(';</li>
 *   <li>the last token is a number, a variable or ')';</li>
 *   <li>no prefix holds more ')' than '(';</li>
 *   <li>'(' and ')' totals match;</li>
 *   <li>after '(' or an operator comes a number, a variable or '(';</li>
 *   <li>after a number, a variable or ')' comes an operator or ')'.</li>
 * </ol>
 * Every violation is a {@link FormulaFormatException} naming the broken rule.
 */
public final class FormulaValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

    private FormulaValidator() {
    }

    /**
     * Classifies and canonicalizes the lexemes, then checks the grammar.
     *
     * @param lexemes   output of the {@link Tokenizer}
     * @param normalize applied to every variable before validation and storage
     * @param isValid   extra predicate each normalized variable must satisfy
     * @return the immutable canonical token list
     */
    public static List<Token> validate(Iterable<Lexeme> lexemes,
                                       UnaryOperator<String> normalize,
                                       Predicate<String> isValid) {
        List<Token> tokens = classify(lexemes, normalize, isValid);
        if (tokens.isEmpty()) {
            throw new FormulaFormatException("A formula needs at least one token");
        }
        checkStructure(tokens);
        return Collections.unmodifiableList(tokens);
    }

    private static List<Token> classify(Iterable<Lexeme> lexemes,
                                        UnaryOperator<String> normalize,
                                        Predicate<String> isValid) {
        List<Token> tokens = new ArrayList<>();
        for (Lexeme lexeme : lexemes) {
            switch (lexeme.getType()) {
                case LEFT_PAREN:
                case RIGHT_PAREN:
                case OPERATOR:
                    tokens.add(Token.operator(Operator.fromSymbol(lexeme.getText())));
                    break;
                case NUMBER:
                    tokens.add(Token.number(parseLiteral(lexeme.getText())));
                    break;
                case IDENTIFIER:
                    tokens.add(Token.variable(normalizeVariable(lexeme.getText(), normalize, isValid)));
                    break;
                default:
                    throw new FormulaFormatException("Unrecognized token '" + lexeme.getText() + "'");
            }
        }
        return tokens;
    }

    private static double parseLiteral(String text) {
        double value = Double.parseDouble(text);
        if (Double.isInfinite(value)) {
            throw new FormulaFormatException("Number out of range: " + text);
        }
        return value;
    }

    private static String normalizeVariable(String raw,
                                            UnaryOperator<String> normalize,
                                            Predicate<String> isValid) {
        String normalized = normalize.apply(raw);
        if (normalized == null || !IDENTIFIER.matcher(normalized).matches() || !isValid.test(normalized)) {
            throw new FormulaFormatException("Invalid variable '" + raw + "'");
        }
        return normalized;
    }

    private static void checkStructure(List<Token> tokens) {
        Token first = tokens.get(0);
        if (!(first.isOperand() || first.is(Operator.LEFT_PAREN))) {
            throw new FormulaFormatException(
                    "Starting token rule: a formula must start with a number, a variable or '(', found '" + first + "'");
        }
        Token last = tokens.get(tokens.size() - 1);
        if (!(last.isOperand() || last.is(Operator.RIGHT_PAREN))) {
            throw new FormulaFormatException(
                    "Ending token rule: a formula must end with a number, a variable or ')', found '" + last + "'");
        }

        int open = 0;
        int closed = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.is(Operator.LEFT_PAREN)) {
                open++;
            } else if (token.is(Operator.RIGHT_PAREN)) {
                closed++;
                if (closed > open) {
                    throw new FormulaFormatException(
                            "Right parentheses rule: ')' at token " + (i + 1) + " has no matching '('");
                }
            }
            if (i + 1 == tokens.size()) {
                break;
            }
            Token next = tokens.get(i + 1);
            if (token.is(Operator.LEFT_PAREN) || (token.isOperator() && token.getOperator().isBinary())) {
                if (!(next.isOperand() || next.is(Operator.LEFT_PAREN))) {
                    throw new FormulaFormatException("Parenthesis/operator following rule: '" + token
                            + "' must be followed by a number, a variable or '(', found '" + next + "'");
                }
            } else if (!(next.is(Operator.RIGHT_PAREN) || (next.isOperator() && next.getOperator().isBinary()))) {
                throw new FormulaFormatException("Extra following rule: '" + token
                        + "' must be followed by an operator or ')', found '" + next + "'");
            }
        }
        if (open != closed) {
            throw new FormulaFormatException(
                    "Balanced parentheses rule: " + open + " '(' but " + closed + " ')'");
        }
    }
}
