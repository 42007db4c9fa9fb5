package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlNode;
import org.junit.jupiter.api.Test;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ReturnAnalysisTest {

    @Test
    void valueReturnNestedInControlFlowCounts() {
        IlNode body = block(
                whileStmt(binary("<", id("i"), id("n")), block(
                        ifStmt(binary("===", index(id("data"), id("i")), num(0)), block(ret(id("i"))), null),
                        expr(update("++", id("i"), false)))),
                ret(null));

        assertTrue(ReturnAnalysis.isValueReturning(body, null));
        assertEquals(1, ReturnAnalysis.valueReturns(body).size());
    }

    @Test
    void returnInsideNestedFunctionDoesNotCount() {
        IlNode body = block(
                function("helper", null, params(), ret(num(1))),
                expr(call(arrow(params(), ret(num(2))))),
                ret(null));

        assertFalse(ReturnAnalysis.isValueReturning(body, null));
        assertTrue(ReturnAnalysis.valueReturns(body).isEmpty());
    }

    @Test
    void explicitAnnotationWins() {
        IlNode noReturns = block(expr(call(id("work"))));
        IlNode withReturn = block(ret(num(1)));

        assertTrue(ReturnAnalysis.isValueReturning(noReturns, "uint32"));
        assertFalse(ReturnAnalysis.isValueReturning(withReturn, "void"));
    }

    @Test
    void conciseArrowBodyReturnsValue() {
        assertTrue(ReturnAnalysis.isValueReturning(binary("^", id("x"), num(255)), null));
        assertFalse(ReturnAnalysis.isValueReturning(null, null));
    }

    @Test
    void bareReturnIsNotValueReturn() {
        assertFalse(ReturnAnalysis.isValueReturn(ret(null)));
        assertTrue(ReturnAnalysis.isValueReturn(ret(id("x"))));
        assertFalse(ReturnAnalysis.isValueReturn(null));
    }
}
