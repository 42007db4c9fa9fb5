package me.christianrobert.ilcodegen.target.cpp.emitter;

import me.christianrobert.ilcodegen.codegen.emit.EmitContext;
import me.christianrobert.ilcodegen.codegen.emit.ListLayout;
import me.christianrobert.ilcodegen.target.cpp.CppOperators;
import me.christianrobert.ilcodegen.target.cpp.ast.CppAssignment;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCast;
import me.christianrobert.ilcodegen.target.cpp.ast.CppConditional;
import me.christianrobert.ilcodegen.target.cpp.ast.CppElementAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLambda;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;
import me.christianrobert.ilcodegen.target.cpp.ast.CppUnary;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders C++ expressions.
 *
 * <h3>Parentheses</h3>
 * <p>Binary operands are parenthesized through {@link CppOperators}; conditional, assignment
 * and lambda operands are always parenthesized. Postfix targets (member access, subscripts,
 * calls) parenthesize any operator expression.</p>
 *
 * <h3>Lists</h3>
 * <p>Call arguments and brace initializers go through {@link ListLayout}; brace initializers
 * keep a trailing comma when expanded, call arguments do not.</p>
 */
public final class CppExpressionEmitter {

    private static final CppOperators OPERATORS = CppOperators.INSTANCE;

    private static final Set<CppNodeKind> LOOSE_OPERANDS = Set.of(
            CppNodeKind.ASSIGNMENT, CppNodeKind.CONDITIONAL, CppNodeKind.LAMBDA);

    private CppExpressionEmitter() {
    }

    public static String emit(CppNode node, EmitContext ctx) {
        if (node == null) {
            return placeholder("null", ctx);
        }
        return switch (node.getKind()) {
            case LITERAL -> ((CppLiteral) node).getText();
            case IDENTIFIER -> ((CppIdentifier) node).getName();
            case THIS -> "this";
            case BINARY -> emitBinary((CppBinary) node, ctx);
            case UNARY -> emitUnary((CppUnary) node, ctx);
            case ASSIGNMENT -> emitAssignment((CppAssignment) node, ctx);
            case MEMBER_ACCESS -> emitMemberAccess((CppMemberAccess) node, ctx);
            case ELEMENT_ACCESS -> emitElementAccess((CppElementAccess) node, ctx);
            case CALL -> emitCall((CppCall) node, ctx);
            case OBJECT_CREATION -> emitObjectCreation((CppObjectCreation) node, ctx);
            case INITIALIZER_LIST -> emitInitializerList((CppInitializerList) node, ctx);
            case CAST -> emitCast((CppCast) node, ctx);
            case CONDITIONAL -> emitConditional((CppConditional) node, ctx);
            case LAMBDA -> emitLambda((CppLambda) node, ctx);
            case COMPILATION_UNIT, INCLUDE, CLASS, FIELD, FUNCTION, CONSTRUCTOR, PARAMETER, MEMBER_INITIALIZER,
                 COMMENT, BLOCK, VARIABLE_DECLARATION, EXPRESSION_STATEMENT, RETURN, IF, FOR, RANGE_FOR, WHILE,
                 DO_WHILE, SWITCH, SWITCH_CASE, BREAK, CONTINUE, THROW, TRY_CATCH, CATCH_CLAUSE ->
                    placeholder(node.getKind().name(), ctx);
        };
    }

    /**
     * Inline placeholder for a node that cannot be rendered as an expression.
     */
    static String placeholder(String kind, EmitContext ctx) {
        ctx.warn(kind, "Node kind '" + kind + "' cannot be rendered as a C++ expression");
        return "/* Unknown node: " + kind + " */";
    }

    private static String emitBinary(CppBinary binary, EmitContext ctx) {
        String operator = binary.getOperator();
        return operand(binary.getLeft(), operator, false, ctx)
                + " " + operator + " "
                + operand(binary.getRight(), operator, true, ctx);
    }

    private static String operand(CppNode child, String parentOperator, boolean rightOperand, EmitContext ctx) {
        String text = emit(child, ctx);
        if (child == null) {
            return text;
        }
        if (child.getKind() == CppNodeKind.BINARY
                && OPERATORS.needsParens(parentOperator, ((CppBinary) child).getOperator(), rightOperand)) {
            return "(" + text + ")";
        }
        if (LOOSE_OPERANDS.contains(child.getKind())) {
            return "(" + text + ")";
        }
        return text;
    }

    private static String emitUnary(CppUnary unary, EmitContext ctx) {
        CppNode operand = unary.getOperand();
        String text = emit(operand, ctx);
        boolean wrap = operand != null
                && ((operand.getKind() == CppNodeKind.BINARY
                        && OPERATORS.needsParensUnderUnary(((CppBinary) operand).getOperator()))
                    || LOOSE_OPERANDS.contains(operand.getKind())
                    || (operand.getKind() == CppNodeKind.UNARY && unary.isPrefix()
                        && ((CppUnary) operand).getOperator().startsWith(unary.getOperator().substring(0, 1))));
        if (wrap) {
            text = "(" + text + ")";
        }
        return unary.isPrefix() ? unary.getOperator() + text : text + unary.getOperator();
    }

    private static String emitAssignment(CppAssignment assignment, EmitContext ctx) {
        String value = emit(assignment.getValue(), ctx);
        return emit(assignment.getTarget(), ctx) + " " + assignment.getOperator() + " " + value;
    }

    private static String emitMemberAccess(CppMemberAccess access, EmitContext ctx) {
        return postfixTarget(access.getTarget(), ctx) + access.getOperator().getSymbol() + access.getMember();
    }

    private static String emitElementAccess(CppElementAccess access, EmitContext ctx) {
        return postfixTarget(access.getTarget(), ctx) + "[" + emit(access.getIndex(), ctx) + "]";
    }

    private static String emitCall(CppCall call, EmitContext ctx) {
        return ListLayout.layout(postfixTarget(call.getCallee(), ctx), "(",
                c -> emitAll(call.getArguments(), c), ",", ")", ctx, false);
    }

    private static String emitObjectCreation(CppObjectCreation creation, EmitContext ctx) {
        boolean braces = creation.usesBraces();
        return ListLayout.layout(creation.getType().toString(), braces ? "{" : "(",
                c -> emitAll(creation.getArguments(), c), ",", braces ? "}" : ")", ctx, braces);
    }

    private static String emitInitializerList(CppInitializerList list, EmitContext ctx) {
        String prefix = list.getType() != null ? list.getType().toString() : "";
        return ListLayout.layout(prefix, "{", c -> emitAll(list.getElements(), c), ",", "}", ctx, true);
    }

    private static String emitCast(CppCast cast, EmitContext ctx) {
        return "static_cast<" + cast.getType() + ">(" + emit(cast.getExpression(), ctx) + ")";
    }

    private static String emitConditional(CppConditional conditional, EmitContext ctx) {
        CppNode condition = conditional.getCondition();
        String test = emit(condition, ctx);
        if (condition != null && LOOSE_OPERANDS.contains(condition.getKind())) {
            test = "(" + test + ")";
        }
        return test + " ? " + branch(conditional.getWhenTrue(), ctx) + " : " + branch(conditional.getWhenFalse(), ctx);
    }

    private static String branch(CppNode node, EmitContext ctx) {
        String text = emit(node, ctx);
        return node != null && node.getKind() == CppNodeKind.ASSIGNMENT ? "(" + text + ")" : text;
    }

    private static String emitLambda(CppLambda lambda, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(lambda.getCapture() != null ? lambda.getCapture() : "").append(']');
        sb.append(CppEmitter.parameterList(lambda.getParameters(), ctx));
        if (lambda.getReturnType() != null) {
            sb.append(" -> ").append(lambda.getReturnType());
        }
        sb.append(" {").append(ctx.newline());
        EmitContext inner = ctx.indented();
        if (lambda.getBody() != null) {
            for (CppNode statement : lambda.getBody().getStatements()) {
                sb.append(CppEmitter.statement(statement, inner));
            }
        }
        sb.append(ctx.indent()).append('}');
        return sb.toString();
    }

    private static String postfixTarget(CppNode target, EmitContext ctx) {
        String text = emit(target, ctx);
        if (target == null) {
            return text;
        }
        return switch (target.getKind()) {
            case BINARY, UNARY, ASSIGNMENT, CONDITIONAL, LAMBDA -> "(" + text + ")";
            default -> text;
        };
    }

    static List<String> emitAll(List<CppNode> nodes, EmitContext ctx) {
        List<String> rendered = new ArrayList<>();
        for (CppNode node : nodes) {
            rendered.add(emit(node, ctx));
        }
        return rendered;
    }
}
