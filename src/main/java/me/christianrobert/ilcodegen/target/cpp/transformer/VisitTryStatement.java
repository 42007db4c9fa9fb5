package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCatchClause;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;
import me.christianrobert.ilcodegen.target.cpp.ast.CppThrow;
import me.christianrobert.ilcodegen.target.cpp.ast.CppTryCatch;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for exceptions: try statements, throw statements and error construction.
 *
 * <h3>Error types</h3>
 * <pre>
 * Error       →  std::runtime_error
 * TypeError   →  std::invalid_argument
 * RangeError  →  std::out_of_range
 * </pre>
 *
 * <h3>try / catch / finally</h3>
 * <p>The handler catches {@code const std::exception&}. C++ has no {@code finally}: the
 * finalizer is inlined after the try statement, and when there is no handler it also runs in a
 * catch-all that rethrows.</p>
 */
public class VisitTryStatement {

    public static List<CppNode> v(IlNode node, CppCodeBuilder b) {
        CppBlock tryBlock = b.visitBody(node.node("block"));
        IlNode handler = node.node("handler");
        IlNode finalizer = node.node("finalizer");
        List<CppNode> finallyStatements = finalizer != null ? b.visitBody(finalizer).getStatements() : List.of();

        if (handler == null && finalizer == null) {
            return List.of(tryBlock);
        }

        List<CppCatchClause> catches = new ArrayList<>();
        if (handler != null) {
            catches.add(catchClause(handler, b));
        } else {
            List<CppNode> rethrow = new ArrayList<>(finallyStatements);
            rethrow.add(new CppThrow(null));
            catches.add(new CppCatchClause(null, null, new CppBlock(rethrow)));
        }

        List<CppNode> result = new ArrayList<>();
        result.add(new CppTryCatch(tryBlock, catches));
        result.addAll(finallyStatements);
        return result;
    }

    private static CppCatchClause catchClause(IlNode handler, CppCodeBuilder b) {
        b.include("exception");
        IlNode param = handler.node("param");
        String name = param != null ? param.name() : null;
        String emitted = name != null ? CppNames.variable(name) : null;

        b.getContext().getSymbols().push(Scope.Kind.BLOCK, "<catch>");
        try {
            if (name != null) {
                b.getContext().getSymbols().declare(
                        new SymbolInfo(name, emitted, TypeDescriptor.user("Error"), SymbolRole.LOCAL));
            }
            CppBlock body = b.visitBody(handler.node("body"));
            return new CppCatchClause(CppType.of("std::exception").asConstReference(), emitted, body);
        } finally {
            b.getContext().getSymbols().pop();
        }
    }

    public static CppNode throwStatement(IlNode node, CppCodeBuilder b) {
        IlNode argument = node.node("argument");
        if (argument == null) {
            return new CppThrow(null);
        }
        if (argument.is(IlKind.NEW_EXPRESSION)) {
            IlNode callee = argument.node("callee");
            String name = callee != null ? callee.name() : null;
            if (name != null && name.endsWith("Error")) {
                List<IlNode> args = argument.nodes("arguments");
                return new CppThrow(errorCreation(name, args.isEmpty() ? null : args.get(0), b));
            }
        }
        TypeDescriptor type = b.typeOf(argument);
        if (type != null && type.isString()) {
            return new CppThrow(errorCreation("Error", argument, b));
        }
        return new CppThrow(b.visitExpression(argument));
    }

    public static CppNode errorCreation(String errorType, IlNode message, CppCodeBuilder b) {
        b.include("stdexcept");
        String type = errorType == null ? "Error" : errorType;
        String cppType = switch (type) {
            case "RangeError" -> "std::out_of_range";
            case "TypeError" -> "std::invalid_argument";
            default -> "std::runtime_error";
        };
        CppNode text = message != null
                ? b.visitExpression(message)
                : new CppLiteral(VisitLiteralExpression.stringLiteral(type));
        return new CppObjectCreation(CppType.of(cppType), List.of(text), false);
    }
}
