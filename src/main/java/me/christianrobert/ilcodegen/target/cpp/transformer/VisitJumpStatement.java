package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBreak;
import me.christianrobert.ilcodegen.target.cpp.ast.CppContinue;
import me.christianrobert.ilcodegen.target.cpp.ast.CppExpressionStatement;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppReturn;

import java.util.List;

/**
 * Static helper for return, break and continue.
 *
 * <p>A {@code continue} inside a loop that was lowered to a while loop runs the loop update
 * first, so the update is never skipped:</p>
 * <pre>
 * continue;   →   i += 2;
 *                 continue;
 * </pre>
 */
public class VisitJumpStatement {

    public static List<CppNode> returnStatement(IlNode node, CppCodeBuilder b) {
        TransformationContext.RoutineFrame routine = b.getContext().currentRoutine();
        IlNode argument = node.node("argument");
        if (argument == null || routine == null || routine.isConstructor()) {
            return List.of(new CppReturn(null));
        }
        routine.observeReturn(b.typeOf(argument));
        if (argument.is(IlKind.LITERAL) && argument.value("value") == null) {
            return List.of(new CppReturn(new CppInitializerList(null, List.of())));
        }
        return List.of(new CppReturn(b.visitExpression(argument)));
    }

    public static List<CppNode> breakStatement(IlNode node, CppCodeBuilder b) {
        if (node.node("label") != null) {
            b.getContext().warn(node, "Labeled break not supported, emitted as plain break");
        }
        return List.of(CppBreak.INSTANCE);
    }

    public static List<CppNode> continueStatement(IlNode node, CppCodeBuilder b) {
        if (node.node("label") != null) {
            b.getContext().warn(node, "Labeled continue not supported, emitted as plain continue");
        }
        IlNode update = b.getContext().currentLoopUpdate();
        if (update == null) {
            return List.of(CppContinue.INSTANCE);
        }
        return List.of(new CppExpressionStatement(b.visitExpression(update)), CppContinue.INSTANCE);
    }
}
