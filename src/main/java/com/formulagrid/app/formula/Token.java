package com.formulagrid.app.formula;

import java.util.Objects;

/**
 * An immutable, canonical formula token: a number, a normalized variable name, or an operator.
 */
public final class Token {
    private final TokenType type;
    private final double number;
    private final String variable;
    private final Operator operator;

    private Token(TokenType type, double number, String variable, Operator operator) {
        this.type = type;
        this.number = number;
        this.variable = variable;
        this.operator = operator;
    }

    public static Token number(double value) {
        return new Token(TokenType.NUMBER, value, null, null);
    }

    public static Token variable(String normalizedName) {
        return new Token(TokenType.VARIABLE, 0, Objects.requireNonNull(normalizedName), null);
    }

    public static Token operator(Operator op) {
        return new Token(TokenType.OPERATOR, 0, null, Objects.requireNonNull(op));
    }

    public TokenType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == TokenType.NUMBER;
    }

    public boolean isVariable() {
        return type == TokenType.VARIABLE;
    }

    public boolean isOperator() {
        return type == TokenType.OPERATOR;
    }

    /** True for numbers and variables, i.e. anything that yields a value. */
    public boolean isOperand() {
        return type != TokenType.OPERATOR;
    }

    public boolean is(Operator op) {
        return operator == op;
    }

    public double getNumber() {
        if (type != TokenType.NUMBER) {
            throw new IllegalStateException("Not a number token: " + this);
        }
        return number;
    }

    public String getVariable() {
        if (type != TokenType.VARIABLE) {
            throw new IllegalStateException("Not a variable token: " + this);
        }
        return variable;
    }

    public Operator getOperator() {
        if (type != TokenType.OPERATOR) {
            throw new IllegalStateException("Not an operator token: " + this);
        }
        return operator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Token)) {
            return false;
        }
        Token other = (Token) o;
        if (type != other.type) {
            return false;
        }
        switch (type) {
            case NUMBER:
                return Double.compare(number, other.number) == 0;
            case VARIABLE:
                return variable.equals(other.variable);
            default:
                return operator == other.operator;
        }
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    /**
     * Canonical text of this token; formulas concatenate these without separators.
     */
    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return Numbers.toCanonicalString(number);
            case VARIABLE:
                return variable;
            default:
                return operator.toString();
        }
    }
}
