package com.formulagrid.app.formula;

import com.formulagrid.app.exceptions.FormulaFormatException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    private static final UnaryOperator<String> UPPER = String::toUpperCase;

    @Test
    void testValidFormulas() {
        for (String text : Arrays.asList("1", "x", "(1)", "((a1))", "1+2*3", "a1 / (b2 - 3)", "_x_1 * 2")) {
            assertDoesNotThrow(() -> new Formula(text), text);
        }
    }

    @Test
    void testEmptyFormulaIsRejected() {
        assertThrows(FormulaFormatException.class, () -> new Formula(""));
        assertThrows(FormulaFormatException.class, () -> new Formula("   "));
    }

    /**
     * One malformed input per grammar rule.
     */
    @Test
    void testStructuralRules() {
        List<String> invalid = Arrays.asList(
                "+",        // starting token
                ")1(",      // starting token
                "1+",       // ending token
                "(1",       // balanced parentheses
                "1)",       // right parentheses
                "(1))+(2",  // right parentheses
                "()",       // following '('
                "1+*2",     // following an operator
                "(+1)",     // following '('
                "1 2",      // following a number
                "x y",      // following a variable
                "(1)(2)",   // following ')'
                "2x");      // following a number
        for (String text : invalid) {
            assertThrows(FormulaFormatException.class, () -> new Formula(text), text);
        }
    }

    @Test
    void testUnrecognizedTokenIsRejected() {
        FormulaFormatException ex = assertThrows(FormulaFormatException.class, () -> new Formula("3 $ 4"));
        assertTrue(ex.getMessage().contains("$"));
    }

    @Test
    void testRuleViolationNamesTheRule() {
        FormulaFormatException ex = assertThrows(FormulaFormatException.class, () -> new Formula("1+"));
        assertTrue(ex.getMessage().startsWith("Ending token rule"), ex.getMessage());
    }

    @Test
    void testOutOfRangeLiteralIsRejected() {
        assertThrows(FormulaFormatException.class, () -> new Formula("1e999"));
    }

    @Test
    void testValidatorRejectsVariable() {
        assertThrows(FormulaFormatException.class,
                () -> new Formula("x1 + y1", s -> s, s -> s.startsWith("x")));
    }

    @Test
    void testNormalizedVariables() {
        Formula f = new Formula("x1+Y2 * x1", UPPER, s -> true);
        assertEquals("X1+Y2*X1", f.toString());
        assertEquals(Arrays.asList("X1", "Y2"), List.copyOf(f.getVariables()));
    }

    @Test
    void testNormalizerSeesRawName() {
        Formula f = new Formula("a1", s -> "b" + s, s -> s.startsWith("b"));
        assertEquals(Set.of("ba1"), f.getVariables());
    }

    @Test
    void testNoVariables() {
        assertTrue(new Formula("1 + 2").getVariables().isEmpty());
    }

    @Test
    void testCanonicalForm() {
        assertEquals("2+x7", new Formula(" 2.000 +x7 ").toString());
        assertEquals("0.1+0.2", new Formula("0.1 + .2").toString());
        assertEquals("1.0E10*x", new Formula("1e10 * x").toString());
        assertEquals("(a-b)/2.5", new Formula("( a - b ) / 2.50").toString());
    }

    /**
     * Numerically equal literals and equivalently normalized names give equal formulas.
     */
    @Test
    void testEqualityIgnoresSpellingOfNumbersAndCase() {
        Formula a = new Formula("2.0+X7");
        Formula b = new Formula("2.000 + x7", UPPER, s -> true);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(a.toString(), b.toString());

        assertEquals(new Formula("2.0+x7", UPPER, s -> true), new Formula("2.000 + X7", UPPER, s -> true));
    }

    @Test
    void testInequality() {
        assertNotEquals(new Formula("1+2"), new Formula("2+1"));
        assertNotEquals(new Formula("x"), new Formula("X"));
        assertNotEquals(new Formula("x"), "x");
        assertNotEquals(new Formula("x"), null);
    }

    @Test
    void testCanonicalStringParsesBackToEqualFormula() {
        for (String text : Arrays.asList("1", "x + 2.50", "(a1 * (b2 - 3e2)) / .25", "1e10*x", "0.000001+y", "((z))")) {
            Formula f = new Formula(text, UPPER, s -> true);
            assertEquals(f, new Formula(f.toString(), UPPER, s -> true), text);
        }
    }

    @Test
    void testTokensAreImmutable() {
        Formula f = new Formula("1+x");
        assertThrows(UnsupportedOperationException.class, () -> f.getTokens().add(Token.number(2)));
        assertThrows(UnsupportedOperationException.class, () -> f.getVariables().add("y"));
    }
}
