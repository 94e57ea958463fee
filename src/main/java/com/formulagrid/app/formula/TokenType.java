package com.formulagrid.app.formula;

/**
 * Kinds of canonical formula tokens.
 */
public enum TokenType {
    NUMBER,
    VARIABLE,
    OPERATOR
}
