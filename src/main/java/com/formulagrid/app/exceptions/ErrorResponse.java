package com.formulagrid.app.exceptions;

/**
 * Body of every 4xx/5xx reply, for example:
 * {
 *   "code": "CIRCULAR_REFERENCE",
 *   "message": "Circular dependency: A1 -> B1 -> A1"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
