package com.formulagrid.app.formula;

/**
 * Resolves a normalized variable name to its numeric value during evaluation.
 */
@FunctionalInterface
public interface VariableLookup {

    /**
     * Throws (typically {@link UndefinedVariableException}) when the name has no numeric
     * value; evaluation reports any runtime exception as an undefined variable.
     */
    double lookup(String name);
}
