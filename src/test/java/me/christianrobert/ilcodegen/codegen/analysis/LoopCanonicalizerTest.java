package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlNode;
import org.junit.jupiter.api.Test;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopCanonicalizerTest {

    private static IlNode loop(IlNode init, IlNode test, IlNode update, IlNode body) {
        return forStmt(init, test, update, body);
    }

    private static IlNode emptyBody() {
        return block(expr(call(id("step"), id("i"))));
    }

    @Test
    void ascendingExclusiveLoop() {
        CountedLoop counted = LoopCanonicalizer.match(loop(
                let("i", null, num(0)),
                binary("<", id("i"), id("n")),
                update("++", id("i"), false),
                emptyBody()));

        assertNotNull(counted);
        assertEquals("i", counted.getVariable());
        assertTrue(counted.isAscending());
        assertFalse(counted.isInclusive());
        assertTrue(counted.getBound().isIdentifier("n"));
        assertNull(counted.getTypeAnnotation());
    }

    @Test
    void descendingInclusiveLoopKeepsAnnotation() {
        CountedLoop counted = LoopCanonicalizer.match(loop(
                let("i", "int32", binary("-", member(id("data"), "length"), num(1))),
                binary(">=", id("i"), num(0)),
                update("--", id("i"), true),
                emptyBody()));

        assertNotNull(counted);
        assertFalse(counted.isAscending());
        assertTrue(counted.isInclusive());
        assertEquals("int32", counted.getTypeAnnotation());
    }

    @Test
    void compoundAndExplicitIncrementsAreAccepted() {
        assertNotNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), num(16)),
                assign("+=", id("i"), num(1)), emptyBody())));
        assertNotNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<=", id("i"), num(16)),
                assign("=", id("i"), binary("+", num(1), id("i"))), emptyBody())));
        assertNotNull(LoopCanonicalizer.match(loop(
                let("i", null, num(16)), binary(">", id("i"), num(0)),
                assign("=", id("i"), binary("-", id("i"), num(1))), emptyBody())));
    }

    @Test
    void stepOtherThanOneIsRejected() {
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), num(16)),
                assign("+=", id("i"), num(2)), emptyBody())));
    }

    @Test
    void directionMismatchIsRejected() {
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), id("n")),
                update("--", id("i"), false), emptyBody())));
    }

    @Test
    void bodyAssigningVariableOrBoundIsRejected() {
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), id("n")),
                update("++", id("i"), false),
                block(expr(assign("=", id("i"), num(5)))))));
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), binary("-", id("n"), num(1))),
                update("++", id("i"), false),
                block(expr(update("--", id("n"), false))))));
    }

    @Test
    void nonSimpleBoundIsRejected() {
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), binary("<", id("i"), call(id("limit"))),
                update("++", id("i"), false), emptyBody())));
    }

    @Test
    void missingPartsAreRejected() {
        assertNull(LoopCanonicalizer.match(loop(
                null, binary("<", id("i"), id("n")), update("++", id("i"), false), emptyBody())));
        assertNull(LoopCanonicalizer.match(loop(
                let("i", null, num(0)), null, update("++", id("i"), false), emptyBody())));
        assertNull(LoopCanonicalizer.match(whileStmt(bool(true), emptyBody())));
    }

    @Test
    void boundNameOfForOfHead() {
        assertEquals("x", LoopCanonicalizer.boundName(constant("x", null, null)));
        assertEquals("y", LoopCanonicalizer.boundName(id("y")));
        assertNull(LoopCanonicalizer.boundName(num(1)));
        assertNull(LoopCanonicalizer.boundName(null));
    }
}
