package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula string cannot be tokenized or breaks one of the
 * structural grammar rules. Raised before any sheet state is touched.
 */
public class FormulaFormatException extends RuntimeException {
    public FormulaFormatException(String message) {
        super(message);
    }
}
