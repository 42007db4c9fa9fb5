package me.christianrobert.ilcodegen.codegen.emit;

import me.christianrobert.ilcodegen.config.CodegenOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListLayoutTest {

    private final EmitContext ctx = EmitContext.root(CodegenOptions.defaults(CodegenOptions.TARGET_CPP));

    @Test
    void shortListStaysOnOneLine() {
        String text = ListLayout.layout("foo", "(", c -> List.of("a", "b"), ",", ")", ctx, false);

        assertEquals("foo(a, b)", text);
    }

    @Test
    void emptyListStaysOnOneLine() {
        assertEquals("foo()", ListLayout.layout("foo", "(", c -> List.of(), ",", ")", ctx, false));
    }

    @Test
    void longListExpandsOneItemPerLine() {
        String item = "x".repeat(40);

        String text = ListLayout.layout("foo", "(", c -> List.of(item, item, item), ",", ")", ctx, false);

        assertEquals("foo(\n    " + item + ",\n    " + item + ",\n    " + item + "\n)", text);
    }

    @Test
    void trailingSeparatorOnlyWhenRequested() {
        String item = "y".repeat(60);

        String text = ListLayout.layout("", "{", c -> List.of(item, item), ",", "}", ctx, true);

        assertTrue(text.endsWith(item + ",\n}"));
    }

    @Test
    void multiLineItemForcesExpansionAtDeeperIndent() {
        String text = ListLayout.layout("call", "(", c -> List.of("[]() {" + c.newline() + c.indent() + "}", "b"),
                ",", ")", ctx.indented(), false);

        assertEquals("call(\n        []() {\n        },\n        b\n    )", text);
    }
}
