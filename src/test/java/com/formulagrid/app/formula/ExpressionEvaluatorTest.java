package com.formulagrid.app.formula;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static final VariableLookup NO_VARIABLES = name -> {
        throw new UndefinedVariableException(name);
    };

    private static double eval(String formula) {
        EvaluationResult result = new Formula(formula).evaluate(NO_VARIABLES);
        assertFalse(result.isError(), () -> formula + " failed with " + result);
        return result.getValue();
    }

    private static FormulaError evalError(String formula, VariableLookup lookup) {
        EvaluationResult result = new Formula(formula).evaluate(lookup);
        assertTrue(result.isError(), () -> formula + " evaluated to " + result);
        return result.getError();
    }

    @Test
    void testSingleOperand() {
        assertEquals(5, eval("5"));
        assertEquals(2, eval("((2))"));
    }

    @Test
    void testPrecedence() {
        assertEquals(7, eval("1+2*3"));
        assertEquals(9, eval("(1+2)*3"));
        assertEquals(-9, eval("2-3*4+1"));
        assertEquals(70, eval("2*(3+4)*5"));
        assertEquals(10, eval("2.5*4"));
    }

    /**
     * The operand that arrives first is always the left-hand side.
     */
    @Test
    void testLeftToRightOperandOrder() {
        assertEquals(5, eval("7-2"));
        assertEquals(4, eval("8/2"));
        assertEquals(3, eval("10-4-3"));
        assertEquals(5, eval("100/10/2"));
        assertEquals(2, eval("1-(2-3)"));
        assertEquals(4, eval("8/(4-2)"));
    }

    @Test
    void testVariables() {
        Map<String, Double> values = new HashMap<>();
        values.put("x1", 3.0);
        values.put("y1", 0.5);
        EvaluationResult result = new Formula("x1*2 + y1").evaluate(name -> {
            Double value = values.get(name);
            if (value == null) {
                throw new UndefinedVariableException(name);
            }
            return value;
        });
        assertEquals(EvaluationResult.of(6.5), result);
    }

    @Test
    void testDivisionByZero() {
        assertEquals(FormulaError.divisionByZero(), evalError("1/0", NO_VARIABLES));
        assertEquals(FormulaError.divisionByZero(), evalError("1/(2-2)", NO_VARIABLES));
        assertEquals(FormulaError.divisionByZero(), evalError("5/x", name -> 0));
        assertEquals(FormulaError.divisionByZero(), evalError("3 + 4/0.0*2", NO_VARIABLES));
    }

    @Test
    void testZeroNumeratorIsFine() {
        assertEquals(0, eval("0/5"));
    }

    @Test
    void testUndefinedVariable() {
        assertEquals(FormulaError.undefinedVariable(), evalError("x+1", NO_VARIABLES));
        assertEquals(FormulaError.UNDEFINED_VARIABLE, evalError("2*y", NO_VARIABLES).getReason());
    }

    @Test
    void testAnyLookupFailureIsUndefined() {
        VariableLookup broken = name -> {
            throw new IllegalStateException("no such var " + name);
        };
        assertEquals(FormulaError.undefinedVariable(), evalError("x1+1", broken));
        assertEquals(EvaluationResult.error(FormulaError.undefinedVariable()),
                new Formula("2*x1").evaluate(name -> {
                    throw new NullPointerException();
                }));
    }

    @Test
    void testErrorsAreReturnedNotThrown() {
        assertDoesNotThrow(() -> new Formula("1/0").evaluate(NO_VARIABLES));
        assertDoesNotThrow(() -> new Formula("(a/b)*c").evaluate(NO_VARIABLES));
    }

    @Test
    void testErrorResultHasNoValue() {
        EvaluationResult result = new Formula("1/0").evaluate(NO_VARIABLES);
        assertThrows(IllegalStateException.class, result::getValue);
    }
}
