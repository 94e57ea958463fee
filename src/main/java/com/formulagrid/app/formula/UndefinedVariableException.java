package com.formulagrid.app.formula;

/**
 * Thrown by a {@link VariableLookup} for a name that has no numeric value.
 */
public class UndefinedVariableException extends IllegalArgumentException {
    public UndefinedVariableException(String message) {
        super(message);
    }
}
