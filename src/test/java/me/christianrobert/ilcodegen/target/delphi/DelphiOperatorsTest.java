package me.christianrobert.ilcodegen.target.delphi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DelphiOperatorsTest {

    private final DelphiOperators operators = DelphiOperators.INSTANCE;

    @Test
    void comparisonsUnderBooleanOperatorsAreParenthesized() {
        assertTrue(operators.needsParens("and", "=", false));
        assertTrue(operators.needsParens("or", "<", true));
    }

    @Test
    void shiftsUnderBitwiseOperatorsAreParenthesized() {
        assertTrue(operators.needsParens("or", "shl", false));
        assertTrue(operators.needsParens("or", "shr", true));
        assertTrue(operators.needsParens("shl", "shr", false));
    }

    @Test
    void mixedBitwiseOperatorsAreParenthesized() {
        assertTrue(operators.needsParens("xor", "and", false));
        assertFalse(operators.needsParens("and", "and", false));
    }

    @Test
    void ordinaryArithmetic() {
        assertFalse(operators.needsParens("+", "*", false));
        assertFalse(operators.needsParens("+", "div", true));
        assertTrue(operators.needsParens("*", "-", false));
        assertTrue(operators.needsParens("-", "+", true));
    }
}
