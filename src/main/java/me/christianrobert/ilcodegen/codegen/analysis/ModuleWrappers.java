package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects and flattens module wrappers around top-level declarations.
 *
 * <p>Recognized statement shapes (expression statements only):</p>
 * <pre>
 * (function () { ... })();                          // IIFE
 * (() =&gt; { ... })();                                // arrow IIFE
 * !function () { ... }();  void function () {}();   // prefixed IIFE
 * (function () { ... }).call(this);                 // call/apply form
 * (function (root, factory) { ... })(this, function (deps) { ... });   // UMD
 * </pre>
 *
 * <p>For the UMD shape the factory body is recursed into instead of the loader body. A
 * wrapper's top-level {@code return <expr>} (the exported object) and directive strings
 * such as {@code "use strict"} are dropped.</p>
 */
public final class ModuleWrappers {

    private ModuleWrappers() {
    }

    /**
     * Flattens a statement list, replacing every wrapper by its (recursively flattened) body.
     */
    public static List<IlNode> flatten(List<IlNode> statements) {
        List<IlNode> result = new ArrayList<>();
        for (IlNode statement : statements) {
            List<IlNode> body = unwrap(statement);
            if (body == null) {
                if (!isDirective(statement)) {
                    result.add(statement);
                }
                continue;
            }
            for (IlNode inner : flatten(body)) {
                if (!inner.is(IlKind.RETURN_STATEMENT)) {
                    result.add(inner);
                }
            }
        }
        return result;
    }

    public static boolean isWrapper(IlNode statement) {
        return unwrap(statement) != null;
    }

    /**
     * Body statements of a wrapper statement, or null when the statement is not a wrapper.
     */
    public static List<IlNode> unwrap(IlNode statement) {
        if (statement == null || !statement.is(IlKind.EXPRESSION_STATEMENT)) {
            return null;
        }
        return unwrapExpression(statement.node("expression"));
    }

    private static List<IlNode> unwrapExpression(IlNode expression) {
        if (expression == null) {
            return null;
        }
        return switch (expression.getKind()) {
            case UNARY_EXPRESSION -> {
                String operator = expression.text("operator", "");
                yield operator.equals("!") || operator.equals("void")
                        ? unwrapExpression(expression.node("argument"))
                        : null;
            }
            case SEQUENCE_EXPRESSION -> unwrapSequence(expression.nodes("expressions"));
            case CALL_EXPRESSION -> unwrapCall(expression);
            default -> null;
        };
    }

    // A sequence is a wrapper only when every element is one
    private static List<IlNode> unwrapSequence(List<IlNode> expressions) {
        if (expressions.isEmpty()) {
            return null;
        }
        List<IlNode> combined = new ArrayList<>();
        for (IlNode expression : expressions) {
            List<IlNode> body = unwrapExpression(expression);
            if (body == null) {
                return null;
            }
            combined.addAll(body);
        }
        return combined;
    }

    private static List<IlNode> unwrapCall(IlNode call) {
        IlNode callee = call.node("callee");
        if (callee == null) {
            return null;
        }

        IlNode function = null;
        if (isInlineFunction(callee)) {
            function = callee;
        } else if (callee.is(IlKind.MEMBER_EXPRESSION) && !callee.flag("computed")) {
            IlNode property = callee.node("property");
            IlNode object = callee.node("object");
            if (property != null && (property.isIdentifier("call") || property.isIdentifier("apply"))
                    && isInlineFunction(object)) {
                function = object;
            }
        }
        if (function == null) {
            return null;
        }

        IlNode factory = null;
        for (IlNode argument : call.nodes("arguments")) {
            if (isInlineFunction(argument)) {
                factory = argument;
            }
        }

        List<IlNode> body = blockBody(factory != null ? factory : function);
        if (body == null && factory != null) {
            body = blockBody(function);
        }
        return body;
    }

    private static boolean isInlineFunction(IlNode node) {
        return node != null
                && (node.is(IlKind.FUNCTION_EXPRESSION) || node.is(IlKind.ARROW_FUNCTION_EXPRESSION));
    }

    private static List<IlNode> blockBody(IlNode function) {
        IlNode body = function.node("body");
        if (body == null || !body.is(IlKind.BLOCK_STATEMENT)) {
            return null;
        }
        return body.nodes("body");
    }

    private static boolean isDirective(IlNode statement) {
        if (!statement.is(IlKind.EXPRESSION_STATEMENT)) {
            return false;
        }
        IlNode expression = statement.node("expression");
        return expression != null
                && expression.is(IlKind.LITERAL)
                && expression.value("value") instanceof String;
    }
}
