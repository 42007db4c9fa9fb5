package me.christianrobert.ilcodegen.codegen.context;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SymbolEnvironmentTest {

    private SymbolEnvironment symbols;

    @BeforeEach
    void setUp() {
        symbols = new SymbolEnvironment();
    }

    private static SymbolInfo local(String name, TypeDescriptor type) {
        return new SymbolInfo(name, name, type, SymbolRole.LOCAL);
    }

    @Test
    void moduleScopeCannotBePopped() {
        assertEquals(1, symbols.depth());
        assertThrows(IllegalStateException.class, () -> symbols.pop());
    }

    @Test
    void innerDeclarationsShadowOuterOnes() {
        symbols.declare(local("x", TypeDescriptor.UINT32));
        symbols.push(Scope.Kind.FUNCTION, "f");
        symbols.declare(local("x", TypeDescriptor.UINT8));

        assertEquals(TypeDescriptor.UINT8, symbols.lookup("x").getType());

        symbols.pop();
        assertEquals(TypeDescriptor.UINT32, symbols.lookup("x").getType());
    }

    @Test
    void declareGlobalTargetsModuleScope() {
        symbols.push(Scope.Kind.FUNCTION, "f");
        symbols.push(Scope.Kind.BLOCK, "body");
        symbols.declareGlobal(new SymbolInfo("helper", "Helper", TypeDescriptor.VOID, SymbolRole.FUNCTION));
        symbols.pop();
        symbols.pop();

        SymbolInfo helper = symbols.lookup("helper");
        assertNotNull(helper);
        assertEquals("Helper", helper.getEmittedName());
    }

    @Test
    void classMembersOnlyVisibleThroughLookupMember() {
        symbols.push(Scope.Kind.CLASS, "Cipher");
        symbols.declare(new SymbolInfo("rounds", "FRounds", TypeDescriptor.INT32, SymbolRole.FIELD));
        symbols.push(Scope.Kind.FUNCTION, "encrypt");

        assertNull(symbols.lookup("rounds"));
        assertEquals("FRounds", symbols.lookupMember("rounds").getEmittedName());
        assertEquals("Cipher", symbols.enclosingClass().getName());
        assertEquals("encrypt", symbols.enclosingFunction().getName());
    }

    @Test
    void lookupMemberOutsideClassIsNull() {
        assertNull(symbols.lookupMember("anything"));
        assertNull(symbols.enclosingClass());
        assertNull(symbols.enclosingFunction());
        assertNull(symbols.lookup(null));
    }

    @Test
    void isDeclaredInFunctionStopsAtFunctionBoundary() {
        symbols.declare(local("global", TypeDescriptor.UINT32));
        symbols.push(Scope.Kind.FUNCTION, "f");
        symbols.declare(local("param", TypeDescriptor.UINT32));
        symbols.push(Scope.Kind.BLOCK, "loop");
        symbols.declare(local("tmp", TypeDescriptor.UINT32));

        assertTrue(symbols.isDeclaredInFunction("tmp"));
        assertTrue(symbols.isDeclaredInFunction("param"));
        assertFalse(symbols.isDeclaredInFunction("global"));
        assertEquals(3, symbols.depth());
    }

    @Test
    void emittedNameDefaultsToName() {
        SymbolInfo symbol = new SymbolInfo("x", null, TypeDescriptor.UINT32, SymbolRole.PARAMETER);

        assertEquals("x", symbol.getEmittedName());
        assertFalse(symbol.isStatic());
    }
}
