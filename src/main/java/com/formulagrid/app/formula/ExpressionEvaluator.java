package com.formulagrid.app.formula;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Evaluates a canonical token list with an operand stack and an operator stack.
 * Multiplicative operators are folded as soon as their right operand arrives,
 * additive ones when the next additive operator or a ')' shows up.
 * Failures come back as {@link FormulaError} values; nothing is thrown.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    /**
     * @param tokens grammar-checked tokens, as held by a {@link Formula}
     * @param lookup variable resolver; any runtime exception it throws becomes an
     *               "undefined variable" error
     */
    public static EvaluationResult evaluate(List<Token> tokens, VariableLookup lookup) {
        Deque<Double> operands = new ArrayDeque<>();
        Deque<Operator> operators = new ArrayDeque<>();

        for (Token token : tokens) {
            if (token.isOperand()) {
                double value;
                if (token.isNumber()) {
                    value = token.getNumber();
                } else {
                    try {
                        value = lookup.lookup(token.getVariable());
                    } catch (RuntimeException e) {
                        return EvaluationResult.error(FormulaError.undefinedVariable());
                    }
                }
                operands.push(value);
                if (topIsMultiplicative(operators) && !applyTop(operands, operators)) {
                    return EvaluationResult.error(FormulaError.divisionByZero());
                }
                continue;
            }

            Operator op = token.getOperator();
            switch (op) {
                case LEFT_PAREN:
                case TIMES:
                case DIVIDE:
                    operators.push(op);
                    break;
                case PLUS:
                case MINUS:
                    if (topIsAdditive(operators)) {
                        applyTop(operands, operators);
                    }
                    operators.push(op);
                    break;
                case RIGHT_PAREN:
                    if (topIsAdditive(operators)) {
                        applyTop(operands, operators);
                    }
                    operators.pop(); // the matching '('
                    if (topIsMultiplicative(operators) && !applyTop(operands, operators)) {
                        return EvaluationResult.error(FormulaError.divisionByZero());
                    }
                    break;
            }
        }

        if (!operators.isEmpty() && !applyTop(operands, operators)) {
            return EvaluationResult.error(FormulaError.divisionByZero());
        }
        return EvaluationResult.of(operands.pop());
    }

    private static boolean topIsAdditive(Deque<Operator> operators) {
        return !operators.isEmpty() && operators.peek().isAdditive();
    }

    private static boolean topIsMultiplicative(Deque<Operator> operators) {
        return !operators.isEmpty() && operators.peek().isMultiplicative();
    }

    /**
     * Pops two operands and one operator and pushes the result.
     * The operand pushed first is the left-hand side.
     *
     * @return false if the operator is '/' and the right-hand side is zero
     */
    private static boolean applyTop(Deque<Double> operands, Deque<Operator> operators) {
        double right = operands.pop();
        double left = operands.pop();
        Operator op = operators.pop();
        switch (op) {
            case PLUS:
                operands.push(left + right);
                return true;
            case MINUS:
                operands.push(left - right);
                return true;
            case TIMES:
                operands.push(left * right);
                return true;
            case DIVIDE:
                if (right == 0.0) {
                    return false;
                }
                operands.push(left / right);
                return true;
            default:
                throw new IllegalStateException("Not a binary operator: " + op);
        }
    }
}
