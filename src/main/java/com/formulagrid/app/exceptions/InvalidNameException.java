package com.formulagrid.app.exceptions;

/**
 * Thrown when a cell name, after normalization, is not letters followed by digits
 * or is rejected by the sheet's validity predicate.
 */
public class InvalidNameException extends RuntimeException {
    public InvalidNameException(String message) {
        super(message);
    }
}
