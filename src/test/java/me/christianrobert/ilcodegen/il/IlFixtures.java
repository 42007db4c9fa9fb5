package me.christianrobert.ilcodegen.il;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * Small builders for IL trees used across the tests.
 */
public final class IlFixtures {

    private IlFixtures() {
    }

    public static IlNode program(IlNode... body) {
        return IlNode.builder(IlKind.PROGRAM).nodes("body", List.of(body)).build();
    }

    public static IlNode id(String name) {
        return IlNode.builder(IlKind.IDENTIFIER).text("name", name).build();
    }

    public static IlNode typedId(String name, String type) {
        return IlNode.builder(IlKind.IDENTIFIER).text("name", name).text("typeAnnotation", type).build();
    }

    public static IlNode num(long value) {
        return IlNode.builder(IlKind.LITERAL).value("value", value).text("raw", Long.toString(value)).build();
    }

    public static IlNode decimal(String value) {
        return IlNode.builder(IlKind.LITERAL).value("value", new BigDecimal(value)).text("raw", value).build();
    }

    public static IlNode str(String value) {
        return IlNode.builder(IlKind.LITERAL).value("value", value).build();
    }

    public static IlNode bool(boolean value) {
        return IlNode.builder(IlKind.LITERAL).value("value", value).build();
    }

    public static IlNode nullLiteral() {
        return IlNode.builder(IlKind.LITERAL).value("value", null).text("raw", "null").build();
    }

    public static IlNode binary(String operator, IlNode left, IlNode right) {
        return IlNode.builder(IlKind.BINARY_EXPRESSION)
                .text("operator", operator).node("left", left).node("right", right).build();
    }

    public static IlNode logical(String operator, IlNode left, IlNode right) {
        return IlNode.builder(IlKind.LOGICAL_EXPRESSION)
                .text("operator", operator).node("left", left).node("right", right).build();
    }

    public static IlNode unary(String operator, IlNode argument) {
        return IlNode.builder(IlKind.UNARY_EXPRESSION)
                .text("operator", operator).node("argument", argument).flag("prefix", true).build();
    }

    public static IlNode update(String operator, IlNode argument, boolean prefix) {
        return IlNode.builder(IlKind.UPDATE_EXPRESSION)
                .text("operator", operator).node("argument", argument).flag("prefix", prefix).build();
    }

    public static IlNode assign(String operator, IlNode left, IlNode right) {
        return IlNode.builder(IlKind.ASSIGNMENT_EXPRESSION)
                .text("operator", operator).node("left", left).node("right", right).build();
    }

    public static IlNode member(IlNode object, String property) {
        return IlNode.builder(IlKind.MEMBER_EXPRESSION)
                .node("object", object).node("property", id(property)).flag("computed", false).build();
    }

    public static IlNode index(IlNode object, IlNode index) {
        return IlNode.builder(IlKind.MEMBER_EXPRESSION)
                .node("object", object).node("property", index).flag("computed", true).build();
    }

    public static IlNode call(IlNode callee, IlNode... arguments) {
        return IlNode.builder(IlKind.CALL_EXPRESSION)
                .node("callee", callee).nodes("arguments", List.of(arguments)).build();
    }

    public static IlNode newExpr(String type, IlNode... arguments) {
        return IlNode.builder(IlKind.NEW_EXPRESSION)
                .node("callee", id(type)).nodes("arguments", List.of(arguments)).build();
    }

    public static IlNode array(IlNode... elements) {
        return IlNode.builder(IlKind.ARRAY_EXPRESSION).nodes("elements", List.of(elements)).build();
    }

    public static IlNode conditional(IlNode test, IlNode consequent, IlNode alternate) {
        return IlNode.builder(IlKind.CONDITIONAL_EXPRESSION)
                .node("test", test).node("consequent", consequent).node("alternate", alternate).build();
    }

    // ========== Statements ==========

    public static IlNode block(IlNode... body) {
        return IlNode.builder(IlKind.BLOCK_STATEMENT).nodes("body", List.of(body)).build();
    }

    public static IlNode expr(IlNode expression) {
        return IlNode.builder(IlKind.EXPRESSION_STATEMENT).node("expression", expression).build();
    }

    public static IlNode ret(IlNode argument) {
        IlNode.Builder b = IlNode.builder(IlKind.RETURN_STATEMENT);
        if (argument != null) {
            b.node("argument", argument);
        }
        return b.build();
    }

    public static IlNode let(String name, String type, IlNode init) {
        return declaration("let", name, type, init);
    }

    public static IlNode constant(String name, String type, IlNode init) {
        return declaration("const", name, type, init);
    }

    public static IlNode declaration(String declarationKind, String name, String type, IlNode init) {
        IlNode.Builder declarator = IlNode.builder(IlKind.VARIABLE_DECLARATOR).node("id", id(name));
        if (type != null) {
            declarator.text("typeAnnotation", type);
        }
        if (init != null) {
            declarator.node("init", init);
        }
        return IlNode.builder(IlKind.VARIABLE_DECLARATION)
                .nodes("declarations", List.of(declarator.build()))
                .text("declarationKind", declarationKind)
                .build();
    }

    public static IlNode ifStmt(IlNode test, IlNode consequent, IlNode alternate) {
        IlNode.Builder b = IlNode.builder(IlKind.IF_STATEMENT).node("test", test).node("consequent", consequent);
        if (alternate != null) {
            b.node("alternate", alternate);
        }
        return b.build();
    }

    public static IlNode whileStmt(IlNode test, IlNode body) {
        return IlNode.builder(IlKind.WHILE_STATEMENT).node("test", test).node("body", body).build();
    }

    public static IlNode forStmt(IlNode init, IlNode test, IlNode update, IlNode body) {
        return IlNode.builder(IlKind.FOR_STATEMENT)
                .node("init", init).node("test", test).node("update", update).node("body", body).build();
    }

    public static IlNode breakStmt() {
        return IlNode.builder(IlKind.BREAK_STATEMENT).build();
    }

    public static IlNode continueStmt() {
        return IlNode.builder(IlKind.CONTINUE_STATEMENT).build();
    }

    public static IlNode throwStmt(IlNode argument) {
        return IlNode.builder(IlKind.THROW_STATEMENT).node("argument", argument).build();
    }

    public static IlNode switchCase(IlNode test, IlNode... consequent) {
        IlNode.Builder b = IlNode.builder(IlKind.SWITCH_CASE).nodes("consequent", List.of(consequent));
        if (test != null) {
            b.node("test", test);
        }
        return b.build();
    }

    public static IlNode switchStmt(IlNode discriminant, IlNode... cases) {
        return IlNode.builder(IlKind.SWITCH_STATEMENT)
                .node("discriminant", discriminant).nodes("cases", List.of(cases)).build();
    }

    // ========== Declarations ==========

    public static IlNode function(String name, String returnType, List<IlNode> params, IlNode... body) {
        IlNode.Builder b = IlNode.builder(IlKind.FUNCTION_DECLARATION)
                .node("id", id(name))
                .nodes("params", params)
                .node("body", block(body));
        if (returnType != null) {
            b.text("returnType", returnType);
        }
        return b.build();
    }

    public static IlNode functionExpr(List<IlNode> params, IlNode... body) {
        return IlNode.builder(IlKind.FUNCTION_EXPRESSION).nodes("params", params).node("body", block(body)).build();
    }

    public static IlNode arrow(List<IlNode> params, IlNode... body) {
        return IlNode.builder(IlKind.ARROW_FUNCTION_EXPRESSION)
                .nodes("params", params).node("body", block(body)).build();
    }

    public static IlNode thisExpr() {
        return IlNode.builder(IlKind.THIS_EXPRESSION).build();
    }

    public static IlNode unknown(String rawKind) {
        return IlNode.unknown(rawKind).build();
    }

    public static List<IlNode> params(IlNode... params) {
        return Arrays.asList(params);
    }

    public static IlNode classDecl(String name, String superClass, IlNode... members) {
        IlNode.Builder b = IlNode.builder(IlKind.CLASS_DECLARATION)
                .node("id", id(name)).nodes("body", List.of(members));
        if (superClass != null) {
            b.node("superClass", id(superClass));
        }
        return b.build();
    }

    public static IlNode field(String name, String type, IlNode value, boolean isStatic) {
        IlNode.Builder b = IlNode.builder(IlKind.PROPERTY_DEFINITION)
                .node("key", id(name)).flag("static", isStatic);
        if (type != null) {
            b.text("typeAnnotation", type);
        }
        if (value != null) {
            b.node("value", value);
        }
        return b.build();
    }

    public static IlNode method(String name, String methodKind, boolean isStatic, String returnType,
                                List<IlNode> params, IlNode... body) {
        IlNode.Builder fn = IlNode.builder(IlKind.FUNCTION_EXPRESSION)
                .nodes("params", params)
                .node("body", block(body));
        if (returnType != null) {
            fn.text("returnType", returnType);
        }
        return IlNode.builder(IlKind.METHOD_DEFINITION)
                .node("key", id(name))
                .node("value", fn.build())
                .text("methodKind", methodKind)
                .flag("static", isStatic)
                .build();
    }

    // ========== Normalized nodes and instructions ==========

    public static IlNode thisProperty(String property) {
        return IlNode.builder(IlKind.THIS_PROPERTY_ACCESS).text("property", property).build();
    }

    public static IlNode rotate(IlKind kind, IlNode value, IlNode amount, int bits) {
        return IlNode.builder(kind).node("value", value).node("amount", amount).number("bits", bits).build();
    }

    public static IlNode mathCall(String method, IlNode... arguments) {
        return IlNode.builder(IlKind.MATH_CALL).text("method", method).nodes("arguments", List.of(arguments)).build();
    }

    public static IlNode arrayCreation(String elementType, IlNode size) {
        return IlNode.builder(IlKind.ARRAY_CREATION).text("elementType", elementType).node("size", size).build();
    }

    public static IlNode errorCreation(String errorType, IlNode message) {
        return IlNode.builder(IlKind.ERROR_CREATION).text("errorType", errorType).node("message", message).build();
    }
}
