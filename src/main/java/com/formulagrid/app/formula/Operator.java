package com.formulagrid.app.formula;

/**
 * The four arithmetic operators plus the two parentheses.
 */
public enum Operator {
    PLUS('+'),
    MINUS('-'),
    TIMES('*'),
    DIVIDE('/'),
    LEFT_PAREN('('),
    RIGHT_PAREN(')');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public boolean isAdditive() {
        return this == PLUS || this == MINUS;
    }

    public boolean isMultiplicative() {
        return this == TIMES || this == DIVIDE;
    }

    public boolean isBinary() {
        return isAdditive() || isMultiplicative();
    }

    /**
     * Maps a one-character lexeme to its operator.
     *
     * @throws IllegalArgumentException if the text is not an operator symbol
     */
    public static Operator fromSymbol(String text) {
        if (text.length() == 1) {
            for (Operator op : values()) {
                if (op.symbol == text.charAt(0)) {
                    return op;
                }
            }
        }
        throw new IllegalArgumentException("Not an operator: " + text);
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
