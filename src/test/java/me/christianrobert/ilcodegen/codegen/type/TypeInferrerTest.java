package me.christianrobert.ilcodegen.codegen.type;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import org.junit.jupiter.api.Test;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TypeInferrerTest {

    // ========== NAME HEURISTIC ==========

    @Test
    void loopCounterNamesAreSigned() {
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("i"));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("j"));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("n"));
    }

    @Test
    void byteArrayWordsWinOverIndexWords() {
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.fromName("keySize"));
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.fromName("blockSize"));
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.fromName("dataLength"));
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.fromName("stateIndex"));
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.fromName("blockData"));
    }

    @Test
    void indexWordsWithoutByteArrayWordsAreSigned() {
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("roundCount"));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("wordIndex"));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromName("outLength"));
    }

    @Test
    void unknownNamesDefaultToUnsigned32() {
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.fromName("x"));
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.fromName(""));
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.fromName(null));
    }

    // ========== LITERALS ==========

    @Test
    void integerLiteralsPickWidthAndSignedness() {
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.fromLiteral(num(0xFFFFFFFFL)));
        assertEquals(TypeDescriptor.UINT64, TypeInferrer.fromLiteral(num(4294967296L)));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.fromLiteral(num(-1)));
        assertEquals(TypeDescriptor.INT64, TypeInferrer.fromLiteral(num(-3000000000L)));
    }

    @Test
    void otherLiterals() {
        assertEquals(TypeDescriptor.FLOAT64, TypeInferrer.fromLiteral(decimal("1.5")));
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.fromLiteral(decimal("2.0")));
        assertEquals(TypeDescriptor.STRING, TypeInferrer.fromLiteral(str("abc")));
        assertEquals(TypeDescriptor.BOOL, TypeInferrer.fromLiteral(bool(true)));
        assertNull(TypeInferrer.fromLiteral(nullLiteral()));
    }

    // ========== DECLARATION CASCADE ==========

    @Test
    void annotationWinsOverEverything() {
        TypeDescriptor type = TypeInferrer.inferDeclaration("keyData", "uint16", num(1), null);

        assertEquals(TypeDescriptor.UINT16, type);
    }

    @Test
    void initializerMetadataWinsOverLiteral() {
        IlNode init = IlNode.builder(IlKind.LITERAL).value("value", 5).resultType("uint8").build();

        assertEquals(TypeDescriptor.UINT8, TypeInferrer.inferDeclaration("x", null, init, null));
    }

    @Test
    void literalInitializerWinsOverName() {
        assertEquals(TypeDescriptor.STRING, TypeInferrer.inferDeclaration("keyData", null, str("k"), null));
    }

    @Test
    void fallsBackToNameThenDefault() {
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.inferDeclaration("buffer", null, id("unknown"), null));
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.inferDeclaration("x", null, null, null));
    }

    @Test
    void arrayCreationInitializerIsTyped() {
        TypeDescriptor type = TypeInferrer.inferDeclaration("words", null, arrayCreation("uint32", num(16)), null);

        assertEquals(TypeDescriptor.arrayOf(TypeDescriptor.UINT32), type);
    }

    // ========== EXPRESSIONS ==========

    @Test
    void comparisonsAreBoolean() {
        assertEquals(TypeDescriptor.BOOL, TypeInferrer.inferExpression(binary("<", id("a"), num(1)), null));
        assertEquals(TypeDescriptor.BOOL, TypeInferrer.inferExpression(binary("===", id("a"), id("b")), null));
    }

    @Test
    void stringConcatenationIsString() {
        assertEquals(TypeDescriptor.STRING, TypeInferrer.inferExpression(binary("+", str("a"), num(1)), null));
    }

    @Test
    void unsignedShiftFollowsLeftWidth() {
        SymbolEnvironment symbols = new SymbolEnvironment();
        symbols.declare(new SymbolInfo("wide", "wide", TypeDescriptor.UINT64, SymbolRole.LOCAL));

        assertEquals(TypeDescriptor.UINT32, TypeInferrer.inferExpression(binary(">>>", num(-1), num(0)), symbols));
        assertEquals(TypeDescriptor.UINT64, TypeInferrer.inferExpression(binary(">>>", id("wide"), num(3)), symbols));
    }

    @Test
    void arithmeticWidensToWiderOperand() {
        SymbolEnvironment symbols = new SymbolEnvironment();
        symbols.declare(new SymbolInfo("b", "b", TypeDescriptor.UINT8, SymbolRole.LOCAL));
        symbols.declare(new SymbolInfo("w", "w", TypeDescriptor.UINT64, SymbolRole.LOCAL));

        assertEquals(TypeDescriptor.UINT64, TypeInferrer.inferExpression(binary("+", id("b"), id("w")), symbols));
        assertEquals(TypeDescriptor.UINT8, TypeInferrer.inferExpression(binary("<<", id("b"), id("w")), symbols));
    }

    @Test
    void identifiersResolveThroughSymbols() {
        SymbolEnvironment symbols = new SymbolEnvironment();
        symbols.declare(new SymbolInfo("state", "state", TypeDescriptor.parse("uint32[]"), SymbolRole.LOCAL));

        assertEquals(TypeDescriptor.parse("uint32[]"), TypeInferrer.inferExpression(id("state"), symbols));
        assertEquals(TypeDescriptor.UINT32, TypeInferrer.inferExpression(index(id("state"), num(0)), symbols));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.inferExpression(member(id("state"), "length"), symbols));
        assertNull(TypeInferrer.inferExpression(id("missing"), symbols));
    }

    @Test
    void thisPropertyResolvesThroughEnclosingClass() {
        SymbolEnvironment symbols = new SymbolEnvironment();
        symbols.push(Scope.Kind.CLASS, "Cipher");
        symbols.declare(new SymbolInfo("rounds", "FRounds", TypeDescriptor.INT32, SymbolRole.FIELD));
        symbols.push(Scope.Kind.FUNCTION, "encrypt");

        assertEquals(TypeDescriptor.INT32, TypeInferrer.inferExpression(thisProperty("rounds"), symbols));
    }

    @Test
    void instructionsHaveFixedTypes() {
        assertEquals(TypeDescriptor.UINT64,
                TypeInferrer.inferExpression(rotate(IlKind.ROTATE_LEFT, id("x"), num(3), 64), null));
        assertEquals(TypeDescriptor.UINT32,
                TypeInferrer.inferExpression(rotate(IlKind.ROTATE_RIGHT, id("x"), num(3), 32), null));
        assertEquals(TypeDescriptor.FLOAT64, TypeInferrer.inferExpression(mathCall("sqrt", id("x")), null));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.inferExpression(mathCall("floor", decimal("1.5")), null));
        assertEquals(TypeDescriptor.INT32, TypeInferrer.inferExpression(mathCall("imul", id("a"), id("b")), null));
    }

    @Test
    void arrayLiteralUsesWidestElement() {
        IlNode literal = array(num(1), num(4294967296L));

        assertEquals(TypeDescriptor.arrayOf(TypeDescriptor.UINT64), TypeInferrer.inferExpression(literal, null));
        assertNull(TypeInferrer.inferExpression(array(), null));
    }

    @Test
    void newExpressionsMapTypedArrays() {
        assertEquals(TypeDescriptor.BYTE_ARRAY, TypeInferrer.inferExpression(newExpr("Uint8Array", num(16)), null));
        assertEquals(TypeDescriptor.arrayOf(TypeDescriptor.UINT32),
                TypeInferrer.inferExpression(newExpr("Array", num(4)), null));
        assertNull(TypeInferrer.inferExpression(newExpr("RangeError", str("bad")), null));
    }
}
