package me.christianrobert.ilcodegen.util;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.il.SourceLocation;
import org.junit.jupiter.api.Test;

import static me.christianrobert.ilcodegen.il.IlFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class IlTreeFormatterTest {

    @Test
    void nullTree() {
        assertEquals("(null tree)", IlTreeFormatter.format(null));
    }

    @Test
    void scalarsTypeAndLocationOnOneLine() {
        IlNode node = IlNode.builder(IlKind.IDENTIFIER)
                .text("name", "x")
                .resultType("uint32")
                .location(new SourceLocation(3, 2))
                .build();

        assertEquals("Identifier [name=\"x\"] : uint32 @3:2\n", IlTreeFormatter.format(node));
    }

    @Test
    void childFieldsAreLabelled() {
        String text = IlTreeFormatter.format(program(expr(binary("+", id("a"), num(1)))));

        String expected = """
                Program
                  body:
                    ExpressionStatement
                      expression:
                        BinaryExpression [operator="+"]
                          left:
                            Identifier [name="a"]
                          right:
                            Literal [value=1, raw="1"]
                """;
        assertEquals(expected, text);
    }

    @Test
    void longTextIsTruncatedAndEscaped() {
        String longText = "a".repeat(60);
        String text = IlTreeFormatter.format(str(longText));
        String escaped = IlTreeFormatter.format(str("line\nbreak"));

        assertTrue(text.contains("\"" + "a".repeat(50) + "...\""), text);
        assertTrue(escaped.contains("line\\nbreak"), escaped);
    }
}
