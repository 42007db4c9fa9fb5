package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class SwitchGroupsTest {

    private static IlNode action(String name) {
        return expr(call(id(name)));
    }

    @Test
    void emptyCasesMergeIntoNextAndTrailingBreakIsDropped() {
        IlNode statement = switchStmt(id("x"),
                switchCase(num(1)),
                switchCase(num(2), action("a"), breakStmt()),
                switchCase(null, action("b")));

        List<SwitchGroup> groups = SwitchGroups.group(statement);

        assertEquals(2, groups.size());
        assertEquals(2, groups.get(0).getTests().size());
        assertEquals(1, groups.get(0).getBody().size());
        assertFalse(groups.get(0).isFallsThrough());
        assertTrue(groups.get(1).includesDefault());
        assertTrue(groups.get(1).getTests().isEmpty());
        assertFalse(groups.get(1).isFallsThrough());
    }

    @Test
    void unterminatedBodyFallsThrough() {
        List<SwitchGroup> groups = SwitchGroups.group(switchStmt(id("x"),
                switchCase(num(1), action("a")),
                switchCase(num(2), action("b"), breakStmt())));

        assertTrue(groups.get(0).isFallsThrough());
        assertFalse(groups.get(1).isFallsThrough());
    }

    @Test
    void returnAndThrowTerminate() {
        List<SwitchGroup> groups = SwitchGroups.group(switchStmt(id("x"),
                switchCase(num(1), ret(num(1))),
                switchCase(num(2), throwStmt(newExpr("Error", str("bad")))),
                switchCase(null, ret(num(0)))));

        assertFalse(groups.get(0).isFallsThrough());
        assertFalse(groups.get(1).isFallsThrough());
        assertEquals(1, groups.get(0).getBody().size());
    }

    @Test
    void singleBlockConsequentIsFlattened() {
        List<SwitchGroup> groups = SwitchGroups.group(switchStmt(id("x"),
                switchCase(num(1), block(action("a"), action("b"), breakStmt())),
                switchCase(null, action("c"))));

        assertEquals(2, groups.get(0).getBody().size());
        assertFalse(groups.get(0).isFallsThrough());
    }

    @Test
    void trailingEmptyCaseStillFormsGroup() {
        List<SwitchGroup> groups = SwitchGroups.group(switchStmt(id("x"),
                switchCase(num(1), action("a"), breakStmt()),
                switchCase(num(2))));

        assertEquals(2, groups.size());
        assertTrue(groups.get(1).getBody().isEmpty());
    }

    @Test
    void ordinalLiteralDetection() {
        assertTrue(SwitchGroups.allOrdinalLiterals(switchStmt(id("x"),
                switchCase(num(1)), switchCase(unary("-", num(2))), switchCase(str("a")), switchCase(null))));
        assertFalse(SwitchGroups.allOrdinalLiterals(switchStmt(id("x"), switchCase(str("ab")))));
        assertFalse(SwitchGroups.allOrdinalLiterals(switchStmt(id("x"), switchCase(decimal("1.5")))));
        assertFalse(SwitchGroups.allOrdinalLiterals(switchStmt(id("x"), switchCase(id("KEY")))));
    }

    @Test
    void nestedBreakDetectionIgnoresInnerLoops() {
        assertTrue(SwitchGroups.hasNestedBreak(List.of(ifStmt(id("done"), block(breakStmt()), null))));
        assertFalse(SwitchGroups.hasNestedBreak(List.of(whileStmt(bool(true), block(breakStmt())))));
        assertFalse(SwitchGroups.hasNestedBreak(List.of(action("a"))));
    }
}
