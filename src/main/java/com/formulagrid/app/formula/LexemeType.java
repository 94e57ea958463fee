package com.formulagrid.app.formula;

/**
 * Raw lexeme classes produced by the {@link Tokenizer}, before any grammar check.
 */
public enum LexemeType {
    LEFT_PAREN,
    RIGHT_PAREN,
    OPERATOR,
    IDENTIFIER,
    NUMBER,
    UNRECOGNIZED
}
