package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a routine produces a value.
 *
 * <p>A routine is value-returning iff its body contains a {@code return <value>} anywhere
 * (nested blocks included, nested function bodies excluded) or it carries an explicit
 * non-void return-type annotation.</p>
 */
public final class ReturnAnalysis {

    private ReturnAnalysis() {
    }

    /**
     * @param body           routine body (a block, or an expression for concise arrows)
     * @param returnTypeHint explicit return annotation, may be null
     */
    public static boolean isValueReturning(IlNode body, String returnTypeHint) {
        TypeDescriptor annotated = TypeDescriptor.parse(returnTypeHint);
        if (annotated != null) {
            return !annotated.isVoid();
        }
        if (body == null) {
            return false;
        }
        if (!body.is(IlKind.BLOCK_STATEMENT) && body.getKind().isExpression()) {
            // concise arrow body
            return true;
        }
        return !valueReturns(body).isEmpty();
    }

    /**
     * All {@code return <value>} statements of a body, outside nested functions, in source order.
     */
    public static List<IlNode> valueReturns(IlNode body) {
        List<IlNode> result = new ArrayList<>();
        collect(body, result);
        return result;
    }

    /**
     * True when the statement is a {@code return} with a value.
     */
    public static boolean isValueReturn(IlNode statement) {
        return statement != null && statement.is(IlKind.RETURN_STATEMENT) && statement.node("argument") != null;
    }

    private static void collect(IlNode node, List<IlNode> result) {
        if (node == null || node.getKind().isFunctionLike()) {
            return;
        }
        if (isValueReturn(node)) {
            result.add(node);
            return;
        }
        for (IlNode child : node.children()) {
            collect(child, result);
        }
    }
}
