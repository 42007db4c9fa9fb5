package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ModuleWrappersTest {

    private static IlNode cipherFunction() {
        return function("encrypt", "uint32", params(typedId("x", "uint32")), ret(id("x")));
    }

    @Test
    void plainIifeIsFlattenedAndExportReturnDropped() {
        IlNode wrapper = expr(call(functionExpr(params(),
                expr(str("use strict")),
                cipherFunction(),
                ret(id("encrypt")))));

        List<IlNode> flat = ModuleWrappers.flatten(List.of(wrapper));

        assertEquals(1, flat.size());
        assertTrue(flat.get(0).is(IlKind.FUNCTION_DECLARATION));
        assertEquals("encrypt", flat.get(0).name());
    }

    @Test
    void arrowAndPrefixedWrappersAreRecognized() {
        IlNode arrowWrapper = expr(call(arrow(params(), cipherFunction())));
        IlNode bangWrapper = expr(unary("!", call(functionExpr(params(), cipherFunction()))));

        assertTrue(ModuleWrappers.isWrapper(arrowWrapper));
        assertTrue(ModuleWrappers.isWrapper(bangWrapper));
        assertEquals(1, ModuleWrappers.unwrap(bangWrapper).size());
    }

    @Test
    void callFormUsesFunctionBody() {
        IlNode wrapper = expr(call(member(functionExpr(params(), cipherFunction()), "call"), thisExpr()));

        List<IlNode> flat = ModuleWrappers.flatten(List.of(wrapper));

        assertEquals(List.of("encrypt"), flat.stream().map(IlNode::name).toList());
    }

    @Test
    void umdWrapperRecursesIntoFactoryNotLoader() {
        IlNode loader = functionExpr(params(id("root"), id("factory")),
                expr(assign("=", member(id("root"), "Cipher"), call(id("factory")))));
        IlNode factory = functionExpr(params(),
                cipherFunction(),
                ret(id("encrypt")));
        IlNode umd = expr(call(loader, thisExpr(), factory));

        List<IlNode> flat = ModuleWrappers.flatten(List.of(umd));

        assertEquals(1, flat.size());
        assertEquals("encrypt", flat.get(0).name());
    }

    @Test
    void nestedWrappersAreFlattenedInOrder() {
        IlNode inner = expr(call(functionExpr(params(),
                function("decrypt", "uint32", params(typedId("x", "uint32")), ret(id("x"))),
                ret(id("decrypt")))));
        IlNode outer = expr(call(functionExpr(params(), cipherFunction(), inner)));

        List<IlNode> flat = ModuleWrappers.flatten(List.of(outer));

        assertEquals(List.of("encrypt", "decrypt"), flat.stream().map(IlNode::name).toList());
    }

    @Test
    void ordinaryStatementsAreKeptAndDirectivesDropped() {
        IlNode mainCall = expr(call(id("main")));

        List<IlNode> flat = ModuleWrappers.flatten(List.of(expr(str("use strict")), mainCall, cipherFunction()));

        assertEquals(2, flat.size());
        assertSame(mainCall, flat.get(0));
        assertFalse(ModuleWrappers.isWrapper(mainCall));
        assertNull(ModuleWrappers.unwrap(cipherFunction()));
    }
}
