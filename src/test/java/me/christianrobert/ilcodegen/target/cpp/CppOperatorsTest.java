package me.christianrobert.ilcodegen.target.cpp;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CppOperatorsTest {

    private final CppOperators operators = CppOperators.INSTANCE;

    @Test
    void lowerPrecedenceChildIsParenthesized() {
        assertTrue(operators.needsParens("*", "+", false));
        assertFalse(operators.needsParens("+", "*", true));
    }

    @Test
    void associativityDecidesEqualPrecedence() {
        assertFalse(operators.needsParens("-", "-", false));
        assertTrue(operators.needsParens("-", "-", true));
        assertTrue(operators.needsParens("-", "+", true));
    }

    @Test
    void comparisonsUnderComparisonsAreParenthesized() {
        assertTrue(operators.needsParens("==", "<", false));
    }

    @Test
    void compilerWarningParentheses() {
        assertTrue(operators.needsParens("|", "<<", false));
        assertTrue(operators.needsParens("|", "&", true));
        assertTrue(operators.needsParens("&", "+", false));
        assertTrue(operators.needsParens("<<", "+", true));
        assertTrue(operators.needsParens("||", "&&", false));
        assertFalse(operators.needsParens("|", "|", false));
        assertFalse(operators.needsParens("&&", "==", false));
    }

    @Test
    void unknownOperatorsAlwaysParenthesized() {
        assertTrue(operators.needsParens("+", "??", false));
        assertEquals(0, operators.precedence("??"));
    }

    @Test
    void unaryOperands() {
        assertTrue(operators.needsParensUnderUnary("+"));
        assertTrue(operators.needsParensUnderUnary("*"));
        assertEquals(15, operators.getUnaryPrecedence());
    }
}
