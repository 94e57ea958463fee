package com.formulagrid.app.formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits formula text into lexemes. Whitespace only separates lexemes and is never returned.
 * Anything that is not a parenthesis, operator, identifier or non-negative number comes
 * back as a one-character {@link LexemeType#UNRECOGNIZED} lexeme so the validator can
 * report it.
 */
public final class Tokenizer {

    // Alternatives are prefix-disjoint: identifiers cannot start with a digit or '.'
    private static final Pattern LEXEME_PATTERN = Pattern.compile(
            "(?<lparen>\\()"
                    + "|(?<rparen>\\))"
                    + "|(?<op>[+\\-*/])"
                    + "|(?<ident>[a-zA-Z_][a-zA-Z_0-9]*)"
                    + "|(?<number>(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[eE][+-]?\\d+)?)"
                    + "|(?<space>\\s+)"
                    + "|(?<other>.)",
            Pattern.DOTALL);

    private Tokenizer() {
    }

    /**
     * Lazily lexes the given text; each iteration re-scans from the start.
     */
    public static Iterable<Lexeme> lex(String formula) {
        return () -> new LexemeIterator(formula);
    }

    /**
     * Eagerly lexes the given text into a list.
     */
    public static List<Lexeme> tokenize(String formula) {
        List<Lexeme> lexemes = new ArrayList<>();
        for (Lexeme lexeme : lex(formula)) {
            lexemes.add(lexeme);
        }
        return lexemes;
    }

    private static final class LexemeIterator implements Iterator<Lexeme> {
        private final Matcher matcher;
        private Lexeme next;

        LexemeIterator(String formula) {
            this.matcher = LEXEME_PATTERN.matcher(formula);
            advance();
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public Lexeme next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            Lexeme current = next;
            advance();
            return current;
        }

        private void advance() {
            next = null;
            while (next == null && matcher.find()) {
                if (matcher.group("space") != null) {
                    continue;
                }
                next = new Lexeme(typeOfMatch(), matcher.group());
            }
        }

        private LexemeType typeOfMatch() {
            if (matcher.group("lparen") != null) {
                return LexemeType.LEFT_PAREN;
            }
            if (matcher.group("rparen") != null) {
                return LexemeType.RIGHT_PAREN;
            }
            if (matcher.group("op") != null) {
                return LexemeType.OPERATOR;
            }
            if (matcher.group("ident") != null) {
                return LexemeType.IDENTIFIER;
            }
            if (matcher.group("number") != null) {
                return LexemeType.NUMBER;
            }
            return LexemeType.UNRECOGNIZED;
        }
    }
}
