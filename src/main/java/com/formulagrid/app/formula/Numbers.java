package com.formulagrid.app.formula;

/**
 * Canonical text for numbers, shared by formulas and the persisted cell form.
 */
public final class Numbers {

    private Numbers() {
    }

    /**
     * Shortest round-trip decimal form, without a trailing ".0" on integral values.
     * "2.0" and "2.000" both become "2"; 2.5 stays "2.5"; 1e10 becomes "1.0E10".
     */
    public static String toCanonicalString(double value) {
        String text = Double.toString(value);
        if (text.endsWith(".0")) {
            return text.substring(0, text.length() - 2);
        }
        return text;
    }
}
