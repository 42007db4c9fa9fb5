package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiMemberAccess;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRaise;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiTryExcept;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiTryFinally;

import java.util.List;

/**
 * Static helper for exceptions: try statements, raise statements and exception construction.
 *
 * <h3>Error types</h3>
 * <pre>
 * Error       →  Exception
 * TypeError   →  EArgumentException
 * RangeError  →  ERangeError
 * </pre>
 *
 * <h3>try / catch / finally</h3>
 * <pre>
 * try { a(); }                    try
 * catch (e) { b(e.message); }       try
 * finally { c(); }           →        A;
 *                                   except
 *                                     on E: Exception do
 *                                     begin B(E.Message); end;
 *                                   end;
 *                                 finally
 *                                   C;
 *                                 end;
 * </pre>
 * <p>Rethrowing the caught exception becomes a bare {@code raise;}, which keeps Delphi from
 * freeing the exception object twice.</p>
 */
public class VisitTryStatement {

    public static List<DelphiNode> v(IlNode node, DelphiCodeBuilder b) {
        DelphiBlock tryBlock = b.visitBody(node.node("block"));
        IlNode handler = node.node("handler");
        IlNode finalizer = node.node("finalizer");

        if (handler == null && finalizer == null) {
            return tryBlock.getStatements();
        }

        DelphiBlock protectedBlock = tryBlock;
        if (handler != null) {
            DelphiNode tryExcept = tryExcept(tryBlock, handler, b);
            if (finalizer == null) {
                return List.of(tryExcept);
            }
            protectedBlock = new DelphiBlock(List.of(tryExcept));
        }
        return List.of(new DelphiTryFinally(protectedBlock, b.visitBody(finalizer)));
    }

    private static DelphiNode tryExcept(DelphiBlock tryBlock, IlNode handler, DelphiCodeBuilder b) {
        IlNode param = handler.node("param");
        String name = param != null ? param.name() : null;
        String emitted = name != null ? DelphiNames.variable(name) : null;

        b.getContext().getSymbols().push(Scope.Kind.BLOCK, "<catch>");
        b.pushCatchVariable(name);
        try {
            if (name != null) {
                b.getContext().getSymbols().declare(
                        new SymbolInfo(name, emitted, TypeDescriptor.user("Error"), SymbolRole.LOCAL));
            }
            DelphiBlock body = b.visitBody(handler.node("body"));
            b.requireUnit("SysUtils");
            return new DelphiTryExcept(tryBlock, emitted, "Exception", body);
        } finally {
            b.popCatchVariable();
            b.getContext().getSymbols().pop();
        }
    }

    public static DelphiNode throwStatement(IlNode node, DelphiCodeBuilder b) {
        IlNode argument = node.node("argument");
        if (argument == null) {
            return new DelphiRaise(null);
        }
        if (argument.is(IlKind.IDENTIFIER) && b.isCurrentCatchVariable(argument.name())) {
            return new DelphiRaise(null);
        }
        if (argument.is(IlKind.NEW_EXPRESSION)) {
            IlNode callee = argument.node("callee");
            String name = callee != null ? callee.name() : null;
            if (name != null && name.endsWith("Error")) {
                List<IlNode> args = argument.nodes("arguments");
                return new DelphiRaise(errorCreation(name, args.isEmpty() ? null : args.get(0), b));
            }
        }
        TypeDescriptor type = b.typeOf(argument);
        if (type != null && type.isString()) {
            return new DelphiRaise(errorCreation("Error", argument, b));
        }
        return new DelphiRaise(b.visitExpression(argument));
    }

    public static DelphiNode errorCreation(String errorType, IlNode message, DelphiCodeBuilder b) {
        b.requireUnit("SysUtils");
        String type = errorType == null ? "Error" : errorType;
        String delphiType = switch (type) {
            case "RangeError" -> "ERangeError";
            case "TypeError" -> "EArgumentException";
            default -> "Exception";
        };
        DelphiNode text = message != null
                ? VisitLiteralExpression.stringified(message, b)
                : VisitLiteralExpression.stringLiteral(type);
        return new DelphiCall(new DelphiMemberAccess(new DelphiIdentifier(delphiType), "Create"), List.of(text));
    }
}
