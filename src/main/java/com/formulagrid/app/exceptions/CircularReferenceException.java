package com.formulagrid.app.exceptions;

/**
 * Thrown when a formula assignment would make a cell depend on itself,
 * either directly (A1 = A1 + 1) or through a chain (A1 -> B1 -> A1).
 * The assignment is rejected and the sheet keeps its previous state.
 */
public class CircularReferenceException extends RuntimeException {
    public CircularReferenceException(String message) {
        super(message);
    }
}
