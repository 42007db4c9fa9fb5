package me.christianrobert.ilcodegen.target.delphi;

import me.christianrobert.ilcodegen.codegen.EmitResult;
import me.christianrobert.ilcodegen.codegen.GeneratedCode;
import me.christianrobert.ilcodegen.codegen.TargetBackend;
import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBreak;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnit;
import me.christianrobert.ilcodegen.target.delphi.emitter.DelphiEmitter;
import me.christianrobert.ilcodegen.target.delphi.transformer.DelphiTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DelphiBackendTest {

    private final TargetBackend<?> backend = new TargetBackend<>(new DelphiTransformer(), new DelphiEmitter());

    private GeneratedCode generate(IlNode program) {
        return generate(program, Map.of());
    }

    private GeneratedCode generate(IlNode program, Map<String, ?> options) {
        return backend.generate(program, CodegenOptions.forTarget(CodegenOptions.TARGET_DELPHI, options));
    }

    private static IlNode rotl32() {
        return function("rotl32", "uint32", params(typedId("value", "uint32"), typedId("amount", "uint32")),
                ret(binary("|",
                        binary("<<", id("value"), id("amount")),
                        binary(">>", id("value"), binary("-", num(32), id("amount"))))));
    }

    private static IlNode scanWithNonCanonicalLoop() {
        return program(
                function("cond", "bool", params(typedId("i", "int32")), ret(binary("<", id("i"), num(10)))),
                function("step", null, params(typedId("i", "int32"))),
                function("work", null, params()),
                function("scan", null, params(),
                        forStmt(let("i", "int32", num(0)), call(id("cond"), id("i")), call(id("step"), id("i")),
                                block(
                                        ifStmt(binary(">", id("i"), num(3)), block(continueStmt()), null),
                                        unknown("Bogus"),
                                        expr(call(id("work")))))));
    }

    private static String compact(String text) {
        return text.replaceAll("\\s+", " ");
    }

    @Test
    void rotateFunctionBecomesUnitWithResultAssignment() {
        GeneratedCode code = generate(program(rotl32()));

        String expected = """
                // Generated by ilcodegen (Delphi target)
                // Do not edit by hand.

                unit Generated;

                interface

                function Rotl32(Value: Cardinal; Amount: Cardinal): Cardinal;

                implementation

                function Rotl32(Value: Cardinal; Amount: Cardinal): Cardinal;
                begin
                  Result := (Value shl Amount) or (Value shr (32 - Amount));
                end;

                end.
                """;
        assertEquals(expected, code.getText());
        assertTrue(code.getWarnings().isEmpty());
        assertTrue(code.getHelpers().isEmpty());
    }

    @Test
    void rotateInstructionPullsInRuntimeUnit() {
        IlNode program = program(function("rotl", "uint32", params(typedId("x", "uint32"), typedId("n", "uint32")),
                ret(rotate(IlKind.ROTATE_LEFT, id("x"), id("n"), 32))));

        String text = generate(program).getText();

        assertTrue(text.contains("uses\n  CipherRuntime;\n"), text);
        assertTrue(text.contains("Result := RotateLeft32(X, N);"), text);
    }

    @Test
    void runtimeUnitIsConfigurable() {
        IlNode program = program(function("rotl", "uint32", params(typedId("x", "uint32"), typedId("n", "uint32")),
                ret(rotate(IlKind.ROTATE_LEFT, id("x"), id("n"), 32))));

        String text = generate(program, Map.of("runtimeUnit", "CryptoRt")).getText();

        assertTrue(text.contains("  CryptoRt;"), text);
    }

    @Test
    void countedLoopBecomesPascalFor() {
        IlNode program = program(function("sum", "uint32", params(typedId("n", "uint32")),
                let("total", "uint32", num(0)),
                forStmt(let("i", null, num(0)), binary("<", id("i"), id("n")), update("++", id("i"), false),
                        block(expr(assign("+=", id("total"), id("i"))))),
                ret(id("total"))));

        String text = generate(program).getText();

        assertTrue(text.contains("for I := 0 to N - 1 do"), text);
        assertTrue(text.contains("  I: Integer;"), text);
        assertTrue(text.contains("Result := Total;"), text);
    }

    @Test
    void literalLoopBoundIsFolded() {
        IlNode program = program(function("clear", null, params(typedId("state", "uint32[]")),
                forStmt(let("i", null, num(0)), binary("<", id("i"), num(16)), update("++", id("i"), false),
                        block(expr(assign("=", index(id("state"), id("i")), num(0)))))));

        String text = generate(program).getText();

        assertTrue(text.contains("for I := 0 to 15 do"), text);
    }

    @Test
    void elseBranchFollowsEndWithoutSemicolon() {
        IlNode program = program(function("classify", "uint32", params(typedId("x", "uint32")),
                ifStmt(binary("<", id("x"), num(1)), block(ret(num(0))),
                        ifStmt(binary("<", id("x"), num(2)), block(ret(num(1))), block(ret(num(2)))))));

        String text = generate(program).getText();

        assertTrue(text.contains("  end\n  else if X < 2 then\n"), text);
        assertTrue(text.contains("  end\n  else\n  begin\n"), text);
    }

    @Test
    void unsupportedOperatorSoftFails() {
        IlNode program = program(function("has", "bool", params(id("key"), id("table")),
                ret(binary("in", id("key"), id("table")))));

        GeneratedCode code = generate(program);

        assertTrue(code.getText().contains("0 { unsupported: in }"), code.getText());
        assertEquals(1, code.getWarnings().size());
        CodegenWarning warning = code.getWarnings().get(0);
        assertEquals("Operator 'in' has no Delphi equivalent", warning.getMessage());
        assertEquals("BinaryExpression", warning.getNodeKind());
    }

    @Test
    void unitNameOptionIsApplied() {
        String text = generate(program(rotl32()), Map.of("unitName", "Ciphers", "addComments", false)).getText();

        assertTrue(text.startsWith("unit Ciphers;\n"), text);
        assertTrue(text.endsWith("end.\n"), text);
    }

    @Test
    void topLevelStatementsAreDropped() {
        GeneratedCode code = generate(program(expr(call(id("main")))));

        assertEquals(1, code.getWarnings().size());
        assertEquals("Top-level statement dropped", code.getWarnings().get(0).getMessage());
        assertTrue(code.getText().contains("implementation"));
    }

    @Test
    void nonCanonicalLoopFallsBackToWhile() {
        GeneratedCode code = generate(scanWithNonCanonicalLoop());

        String compact = compact(code.getText());
        assertTrue(compact.contains("I := 0; while Cond(I) do begin if I > 3 then begin Step(I); Continue; end; "
                + "Work; Step(I); end;"), code.getText());
    }

    @Test
    void unknownStatementIsDroppedAndSiblingsSurvive() {
        GeneratedCode code = generate(scanWithNonCanonicalLoop());

        List<String> messages = code.getWarnings().stream().map(CodegenWarning::getMessage).toList();
        assertTrue(messages.contains("Unsupported IL node 'Bogus' dropped"), messages.toString());
        assertFalse(code.getText().contains("Bogus"));
        assertTrue(code.getText().contains("Work;"));
    }

    @Test
    void placeholderCannotCloseItsComment() {
        IlNode program = program(function("odd", "uint32", params(), ret(unknown("Weird}end"))));

        String text = generate(program).getText();

        assertTrue(text.contains("Result := 0 { unsupported: Weird)end };"), text);
        assertFalse(text.contains("Weird}"));
    }

    @Test
    void unknownTargetNodeEmitsNamedPlaceholder() {
        DelphiUnit unit = new DelphiUnit(null, "Odd", List.of(), List.of(DelphiBreak.INSTANCE), List.of());

        EmitResult result = new DelphiEmitter().emit(unit, CodegenOptions.defaults(CodegenOptions.TARGET_DELPHI));

        assertTrue(result.getText().contains("{ Unknown node: BREAK }"), result.getText());
        assertTrue(result.getText().endsWith("end.\n"));
        assertEquals(1, result.getWarnings().size());
    }
}
