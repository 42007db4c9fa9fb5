package me.christianrobert.ilcodegen.target.delphi.emitter;

import me.christianrobert.ilcodegen.codegen.emit.EmitContext;
import me.christianrobert.ilcodegen.codegen.emit.ListLayout;
import me.christianrobert.ilcodegen.target.delphi.DelphiOperators;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAnonymousMethod;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiArrayLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIndex;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiMemberAccess;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNodeKind;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnary;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders Delphi expressions.
 *
 * <p>Binary operands are parenthesized through {@link DelphiOperators}. A binary operand of
 * {@code not} or unary minus is always parenthesized, since every binary operator binds
 * looser than the prefix operators. Calls without arguments drop the parentheses.</p>
 */
public final class DelphiExpressionEmitter {

    private static final DelphiOperators OPERATORS = DelphiOperators.INSTANCE;

    private DelphiExpressionEmitter() {
    }

    public static String emit(DelphiNode node, EmitContext ctx) {
        if (node == null) {
            return placeholder("null", ctx);
        }
        return switch (node.getKind()) {
            case LITERAL -> ((DelphiLiteral) node).getText();
            case IDENTIFIER -> ((DelphiIdentifier) node).getName();
            case BINARY -> emitBinary((DelphiBinary) node, ctx);
            case UNARY -> emitUnary((DelphiUnary) node, ctx);
            case MEMBER_ACCESS -> postfixTarget(((DelphiMemberAccess) node).getTarget(), ctx)
                    + "." + ((DelphiMemberAccess) node).getMember();
            case INDEX -> postfixTarget(((DelphiIndex) node).getTarget(), ctx)
                    + "[" + emit(((DelphiIndex) node).getIndex(), ctx) + "]";
            case CALL -> emitCall((DelphiCall) node, ctx);
            case ARRAY_LITERAL -> ListLayout.layout("", "[",
                    c -> emitAll(((DelphiArrayLiteral) node).getElements(), c), ",", "]", ctx, false);
            case ANONYMOUS_METHOD -> emitAnonymousMethod((DelphiAnonymousMethod) node, ctx);
            case UNIT, CLASS, FIELD, PROPERTY, ROUTINE, PARAMETER, CONSTANT, VARIABLE, COMMENT, BLOCK, ASSIGNMENT,
                 EXPRESSION_STATEMENT, IF, FOR, FOR_IN, WHILE, REPEAT, CASE, CASE_ARM, BREAK, CONTINUE, EXIT, RAISE,
                 TRY_EXCEPT, TRY_FINALLY -> placeholder(node.getKind().name(), ctx);
        };
    }

    static String placeholder(String kind, EmitContext ctx) {
        ctx.warn(kind, "Node kind '" + kind + "' cannot be rendered as a Delphi expression");
        return "{ Unknown node: " + kind + " }";
    }

    private static String emitBinary(DelphiBinary binary, EmitContext ctx) {
        String operator = binary.getOperator();
        return operand(binary.getLeft(), operator, false, ctx)
                + " " + operator + " "
                + operand(binary.getRight(), operator, true, ctx);
    }

    private static String operand(DelphiNode child, String parentOperator, boolean rightOperand, EmitContext ctx) {
        String text = emit(child, ctx);
        if (child != null && child.getKind() == DelphiNodeKind.BINARY
                && OPERATORS.needsParens(parentOperator, ((DelphiBinary) child).getOperator(), rightOperand)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static String emitUnary(DelphiUnary unary, EmitContext ctx) {
        DelphiNode operand = unary.getOperand();
        String text = emit(operand, ctx);
        boolean wrap = operand != null
                && ((operand.getKind() == DelphiNodeKind.BINARY
                        && OPERATORS.needsParensUnderUnary(((DelphiBinary) operand).getOperator()))
                    || operand.getKind() == DelphiNodeKind.UNARY);
        if (wrap) {
            text = "(" + text + ")";
        }
        String operator = unary.getOperator();
        return Character.isLetter(operator.charAt(0)) ? operator + " " + text : operator + text;
    }

    private static String emitCall(DelphiCall call, EmitContext ctx) {
        String callee = postfixTarget(call.getCallee(), ctx);
        if (call.getArguments().isEmpty()) {
            return callee;
        }
        return ListLayout.layout(callee, "(", c -> emitAll(call.getArguments(), c), ",", ")", ctx, false);
    }

    private static String emitAnonymousMethod(DelphiAnonymousMethod method, EmitContext ctx) {
        StringBuilder sb = new StringBuilder();
        boolean function = method.getReturnType() != null && !method.getReturnType().isVoid();
        sb.append(function ? "function" : "procedure");
        sb.append(DelphiEmitter.parameterList(method.getParameters(), ctx));
        if (function) {
            sb.append(": ").append(method.getReturnType());
        }
        sb.append(ctx.newline());
        sb.append(DelphiEmitter.varSection(method.getLocals(), ctx));
        String body = DelphiEmitter.block(method.getBody(), ctx, "");
        // the closing end stays open for the enclosing statement's terminator
        sb.append(body, 0, body.length() - ctx.newline().length());
        return sb.toString();
    }

    private static String postfixTarget(DelphiNode target, EmitContext ctx) {
        String text = emit(target, ctx);
        if (target == null) {
            return text;
        }
        return switch (target.getKind()) {
            case BINARY, UNARY, ANONYMOUS_METHOD -> "(" + text + ")";
            default -> text;
        };
    }

    static List<String> emitAll(List<DelphiNode> nodes, EmitContext ctx) {
        List<String> rendered = new ArrayList<>();
        for (DelphiNode node : nodes) {
            rendered.add(emit(node, ctx));
        }
        return rendered;
    }
}
