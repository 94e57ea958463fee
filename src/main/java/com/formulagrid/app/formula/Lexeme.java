package com.formulagrid.app.formula;

import java.util.Objects;

/**
 * A raw piece of formula text together with the class the tokenizer matched it as.
 */
public final class Lexeme {
    private final LexemeType type;
    private final String text;

    public Lexeme(LexemeType type, String text) {
        this.type = Objects.requireNonNull(type);
        this.text = Objects.requireNonNull(text);
    }

    public LexemeType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Lexeme)) {
            return false;
        }
        Lexeme other = (Lexeme) o;
        return type == other.type && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
