package com.formulagrid.app.exceptions;

/**
 * Thrown when a sheet cannot be saved to or loaded from disk:
 * I/O failures, malformed documents, version mismatches, or stored
 * cells that no longer parse.
 */
public class SpreadsheetReadWriteException extends RuntimeException {
    public SpreadsheetReadWriteException(String message) {
        super(message);
    }

    public SpreadsheetReadWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
