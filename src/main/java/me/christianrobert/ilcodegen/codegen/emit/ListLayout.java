package me.christianrobert.ilcodegen.codegen.emit;

import java.util.List;
import java.util.function.Function;

/**
 * Lays out delimited lists (call arguments, initializer elements).
 *
 * <p>The list is rendered on one line first. If that rendering contains a line break or the
 * line would pass {@link #MAX_LINE_WIDTH} columns, the items are re-rendered one level deeper,
 * one per line, each followed by the separator; the last item keeps its separator only for
 * list kinds that take trailing separators. The closing delimiter goes on its own line at the
 * enclosing indent.</p>
 *
 * <pre>
 * one line:    foo(a, b, c)
 * expanded:    foo(
 *                  first,
 *                  second
 *              )
 * </pre>
 */
public final class ListLayout {

    public static final int MAX_LINE_WIDTH = 100;

    private ListLayout() {
    }

    /**
     * @param prefix     text before the opening delimiter on the same line (callee, type name)
     * @param open       opening delimiter
     * @param items      renders the items at the given context
     * @param separator  item separator without spacing ({@code ,} or {@code ;})
     * @param close      closing delimiter
     * @param ctx        context of the line the list starts on
     * @param trailing   whether expanded lists keep a separator after the last item
     */
    public static String layout(String prefix, String open, Function<EmitContext, List<String>> items,
                                String separator, String close, EmitContext ctx, boolean trailing) {
        List<String> oneLineItems = items.apply(ctx);
        String oneLine = prefix + open + String.join(separator + " ", oneLineItems) + close;

        boolean tooLong = ctx.indent().length() + oneLine.length() > MAX_LINE_WIDTH;
        if (oneLineItems.isEmpty() || (!oneLine.contains("\n") && !oneLine.contains("\r") && !tooLong)) {
            return oneLine;
        }

        EmitContext inner = ctx.indented();
        List<String> expandedItems = items.apply(inner);
        StringBuilder sb = new StringBuilder();
        sb.append(prefix).append(open).append(ctx.newline());
        for (int i = 0; i < expandedItems.size(); i++) {
            sb.append(inner.indent()).append(expandedItems.get(i));
            if (i < expandedItems.size() - 1 || trailing) {
                sb.append(separator);
            }
            sb.append(ctx.newline());
        }
        sb.append(ctx.indent()).append(close);
        return sb.toString();
    }
}
