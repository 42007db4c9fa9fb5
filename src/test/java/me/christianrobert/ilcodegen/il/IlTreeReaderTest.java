package me.christianrobert.ilcodegen.il;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class IlTreeReaderTest {

    private IlTreeReader reader;

    @BeforeEach
    void setUp() {
        reader = new IlTreeReader();
    }

    @Test
    void readsNestedProgram() {
        String json = """
                {
                  "kind": "Program",
                  "body": [
                    {
                      "kind": "FunctionDeclaration",
                      "id": { "kind": "Identifier", "name": "rotl32" },
                      "params": [
                        { "kind": "Identifier", "name": "x", "typeAnnotation": "uint32" }
                      ],
                      "body": { "kind": "BlockStatement", "body": [] },
                      "returnType": "uint32",
                      "loc": { "start": { "line": 3, "column": 2 } }
                    }
                  ]
                }
                """;

        IlNode program = reader.read(json);

        assertEquals(IlKind.PROGRAM, program.getKind());
        IlNode function = program.nodes("body").get(0);
        assertEquals(IlKind.FUNCTION_DECLARATION, function.getKind());
        assertEquals("rotl32", function.name());
        assertEquals("uint32", function.text("returnType"));
        assertEquals("uint32", function.nodes("params").get(0).text("typeAnnotation"));
        assertEquals(new SourceLocation(3, 2), function.getLocation());
    }

    @Test
    void literalValuesKeepTheirJsonType() {
        IlNode number = reader.read("{\"kind\":\"Literal\",\"value\":4294967296}");
        IlNode text = reader.read("{\"kind\":\"Literal\",\"value\":\"abc\"}");
        IlNode flag = reader.read("{\"kind\":\"Literal\",\"value\":true}");
        IlNode nothing = reader.read("{\"kind\":\"Literal\",\"value\":null}");

        assertEquals(new BigDecimal("4294967296"), number.value("value"));
        assertEquals("abc", text.value("value"));
        assertEquals(Boolean.TRUE, flag.value("value"));
        assertTrue(nothing.getFields().containsKey("value"));
        assertNull(nothing.value("value"));
    }

    @Test
    void numberFieldsAcceptNumericStrings() {
        IlNode rotate = reader.read("""
                {"kind":"RotateLeft","value":{"kind":"Identifier","name":"x"},
                 "amount":{"kind":"Literal","value":3},"bits":"64"}
                """);

        assertEquals(64, rotate.number("bits", 32));
    }

    @Test
    void unknownKindsArePreserved() {
        IlNode node = reader.read("{\"kind\":\"YieldExpression\",\"argument\":{\"kind\":\"Identifier\",\"name\":\"x\"}}");

        assertEquals(IlKind.UNKNOWN, node.getKind());
        assertEquals("YieldExpression", node.getRawKind());
    }

    @Test
    void arrayHolesAreSkipped() {
        IlNode node = reader.read("{\"kind\":\"ArrayExpression\",\"elements\":[null,{\"kind\":\"Literal\",\"value\":1}]}");

        assertEquals(1, node.nodes("elements").size());
    }

    @Test
    void undeclaredFieldsAreIgnored() {
        IlNode node = reader.read("{\"kind\":\"Identifier\",\"name\":\"x\",\"extra\":[1,2,3]}");

        assertFalse(node.has("extra"));
        assertEquals("x", node.name());
    }

    // ========== FAILURES ==========

    @Test
    void rejectsEmptyDocument() {
        IlFormatException e = assertThrows(IlFormatException.class, () -> reader.read("  "));

        assertEquals("$", e.getPath());
    }

    @Test
    void rejectsInvalidJson() {
        IlFormatException e = assertThrows(IlFormatException.class, () -> reader.read("{\"kind\": "));

        assertTrue(e.getMessage().startsWith("IL document is not valid JSON"));
    }

    @Test
    void rejectsNonObjectRoot() {
        IlFormatException e = assertThrows(IlFormatException.class, () -> reader.read("[1, 2]"));

        assertEquals("IL root must be a JSON object (at $)", e.getDetailedMessage());
    }

    @Test
    void rejectsNodeWithoutKind() {
        IlFormatException e = assertThrows(IlFormatException.class,
                () -> reader.read("{\"kind\":\"Program\",\"body\":[{\"name\":\"x\"}]}"));

        assertEquals("$.body[0]", e.getPath());
    }

    @Test
    void rejectsWrongFieldShape() {
        IlFormatException e = assertThrows(IlFormatException.class,
                () -> reader.read("{\"kind\":\"IfStatement\",\"test\":\"x\"}"));

        assertEquals("$.test", e.getPath());
        assertTrue(e.getMessage().contains("must be a node object"));
    }

    @Test
    void rejectsNonIntegerBits() {
        assertThrows(IlFormatException.class, () -> reader.read("{\"kind\":\"RotateLeft\",\"bits\":3.5}"));
        assertThrows(IlFormatException.class, () -> reader.read("{\"kind\":\"RotateLeft\",\"bits\":\"wide\"}"));
    }

    @Test
    void malformedLocationIsDropped() {
        IlNode node = reader.read("{\"kind\":\"EmptyStatement\",\"loc\":\"line 3\"}");

        assertNull(node.getLocation());
    }
}
