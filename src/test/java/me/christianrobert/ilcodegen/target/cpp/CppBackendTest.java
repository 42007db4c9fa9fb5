package me.christianrobert.ilcodegen.target.cpp;

import me.christianrobert.ilcodegen.codegen.GeneratedCode;
import me.christianrobert.ilcodegen.codegen.TargetBackend;
import me.christianrobert.ilcodegen.codegen.context.CodegenWarning;
import me.christianrobert.ilcodegen.codegen.emit.EmitContext;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBreak;
import me.christianrobert.ilcodegen.target.cpp.emitter.CppEmitter;
import me.christianrobert.ilcodegen.target.cpp.emitter.CppExpressionEmitter;
import me.christianrobert.ilcodegen.target.cpp.transformer.CppTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CppBackendTest {

    private final TargetBackend<?> backend = new TargetBackend<>(new CppTransformer(), new CppEmitter());

    private GeneratedCode generate(IlNode program) {
        return generate(program, Map.of());
    }

    private GeneratedCode generate(IlNode program, Map<String, ?> options) {
        return backend.generate(program, CodegenOptions.forTarget(CodegenOptions.TARGET_CPP, options));
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
    void rotateFunctionKeepsPrecedenceAndUnsignedTypes() {
        GeneratedCode code = generate(program(rotl32()));

        String expected = """
                // Generated by ilcodegen (C++ target)
                // Do not edit by hand.

                #include <cstdint>

                namespace generated {

                uint32_t rotl32(uint32_t value, uint32_t amount)
                {
                    return (value << amount) | (value >> (32 - amount));
                }

                }  // namespace generated
                """;
        assertEquals(expected, code.getText());
        assertTrue(code.getWarnings().isEmpty());
        assertTrue(code.getHelpers().isEmpty());
    }

    @Test
    void rotateInstructionUsesStdRotlForCpp20() {
        IlNode program = program(function("rotl", "uint32", params(typedId("x", "uint32"), typedId("n", "uint32")),
                ret(rotate(IlKind.ROTATE_LEFT, id("x"), id("n"), 32))));

        GeneratedCode code = generate(program);

        assertTrue(code.getText().contains("#include <bit>\n#include <cstdint>\n"));
        assertTrue(code.getText().contains("return std::rotl(x, n);"));
        assertTrue(code.getHelpers().isEmpty());
    }

    @Test
    void rotateInstructionUsesRuntimeHelperBeforeCpp20() {
        IlNode program = program(function("rotl", "uint32", params(typedId("x", "uint32"), typedId("n", "uint32")),
                ret(rotate(IlKind.ROTATE_LEFT, id("x"), id("n"), 32))));

        GeneratedCode code = generate(program, Map.of("cppStandard", 17, "runtimeHeader", "crypto_rt.h"));

        assertTrue(code.getText().contains("#include \"crypto_rt.h\""));
        assertTrue(code.getText().contains("return rotateLeft32(x, n);"));
        assertEquals(Set.of(RuntimeHelper.ROTATE_LEFT32), code.getHelpers());
    }

    @Test
    void countedLoopBecomesCanonicalFor() {
        IlNode program = program(function("sum", "uint32", params(typedId("n", "uint32")),
                let("total", "uint32", num(0)),
                forStmt(let("i", null, num(0)), binary("<", id("i"), id("n")), update("++", id("i"), false),
                        block(expr(assign("+=", id("total"), id("i"))))),
                ret(id("total"))));

        String text = generate(program).getText();

        assertTrue(text.contains("for (int32_t i = 0; i < n; i++)"), text);
        assertTrue(text.contains("return total;"), text);
    }

    @Test
    void elseIfChainStaysFlat() {
        IlNode program = program(function("classify", "uint32", params(typedId("x", "uint32")),
                ifStmt(binary("<", id("x"), num(1)), block(ret(num(0))),
                        ifStmt(binary("<", id("x"), num(2)), block(ret(num(1))), block(ret(num(2)))))));

        String text = generate(program).getText();

        String expected = """
                    if (x < 1)
                    {
                        return 0;
                    }
                    else if (x < 2)
                    {
                        return 1;
                    }
                    else
                    {
                        return 2;
                    }
                """;
        assertTrue(text.contains(expected), text);
    }

    @Test
    void severalFunctionsGetPrototypes() {
        IlNode program = program(
                function("first", null, params(), ret(call(id("second")))),
                function("second", "uint32", params(), ret(num(1))));

        String text = generate(program).getText();

        assertTrue(text.contains("uint32_t first();\nuint32_t second();\n\nuint32_t first()\n{"), text);
    }

    @Test
    void unsupportedOperatorSoftFails() {
        IlNode program = program(function("has", "bool", params(id("key"), id("table")),
                ret(binary("in", id("key"), id("table")))));

        GeneratedCode code = generate(program);

        assertTrue(code.getText().contains("0 /* unsupported: in */"));
        assertEquals(1, code.getWarnings().size());
        CodegenWarning warning = code.getWarnings().get(0);
        assertEquals(CodegenWarning.Phase.TRANSFORM, warning.getPhase());
        assertEquals("BinaryExpression", warning.getNodeKind());
    }

    @Test
    void topLevelStatementsAreDropped() {
        GeneratedCode code = generate(program(expr(call(id("main")))));

        assertEquals(1, code.getWarnings().size());
        assertEquals("Top-level statement dropped", code.getWarnings().get(0).getMessage());
    }

    @Test
    void optionsControlNamespaceAndHeader() {
        String text = generate(program(rotl32()), Map.of("namespace", "ciphers", "addComments", false)).getText();

        assertTrue(text.startsWith("#include <cstdint>"));
        assertTrue(text.contains("namespace ciphers {"));
        assertTrue(text.endsWith("}  // namespace ciphers\n"));
    }

    @Test
    void nonProgramRootIsWrapped() {
        GeneratedCode code = generate(rotl32());

        assertTrue(code.getText().contains("uint32_t rotl32("));
        assertEquals("Root is not a Program node", code.getWarnings().get(0).getMessage());
    }

    @Test
    void nonCanonicalLoopFallsBackToWhile() {
        GeneratedCode code = generate(scanWithNonCanonicalLoop());

        String compact = compact(code.getText());
        assertTrue(compact.contains("{ int32_t i = 0; while (cond(i)) "
                + "{ if (i > 3) { step(i); continue; } work(); step(i); } }"), code.getText());
    }

    @Test
    void unknownStatementIsDroppedAndSiblingsSurvive() {
        GeneratedCode code = generate(scanWithNonCanonicalLoop());

        List<String> messages = code.getWarnings().stream().map(CodegenWarning::getMessage).toList();
        assertTrue(messages.contains("Unsupported IL node 'Bogus' dropped"), messages.toString());
        assertFalse(code.getText().contains("Bogus"));
        assertTrue(code.getText().contains("work();"));
    }

    @Test
    void placeholderCannotCloseItsComment() {
        IlNode program = program(function("odd", "uint32", params(), ret(unknown("Weird*/end"))));

        String text = generate(program).getText();

        assertTrue(text.contains("return 0 /* unsupported: Weird* /end */;"), text);
        assertFalse(text.contains("Weird*/"));
    }

    @Test
    void unknownTargetNodeEmitsNamedPlaceholder() {
        EmitContext ctx = EmitContext.root(CodegenOptions.defaults(CodegenOptions.TARGET_CPP));

        String text = CppExpressionEmitter.emit(CppBreak.INSTANCE, ctx);

        assertEquals("/* Unknown node: BREAK */", text);
        assertEquals(1, ctx.getWarnings().size());
        assertEquals("BREAK", ctx.getWarnings().get(0).getNodeKind());
    }
}
