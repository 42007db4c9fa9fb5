package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBreak;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiContinue;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExit;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for return, break and continue.
 *
 * <pre>
 * return x;   →   Exit(X);     (Result := X when it is the last statement of the routine)
 * return;     →   Exit;
 * continue;   →   I := I + 2;  (update of a loop lowered to while)
 *                 Continue;
 * </pre>
 */
public class VisitJumpStatement {

    public static List<DelphiNode> returnStatement(IlNode node, DelphiCodeBuilder b) {
        TransformationContext.RoutineFrame routine = b.getContext().currentRoutine();
        IlNode argument = node.node("argument");
        if (argument == null || routine == null || routine.isConstructor()) {
            return List.of(new DelphiExit(null));
        }
        routine.observeReturn(b.typeOf(argument));
        return List.of(new DelphiExit(b.visitExpression(argument)));
    }

    public static List<DelphiNode> breakStatement(IlNode node, DelphiCodeBuilder b) {
        if (node.node("label") != null) {
            b.getContext().warn(node, "Labeled break not supported, emitted as plain Break");
        }
        return List.of(DelphiBreak.INSTANCE);
    }

    public static List<DelphiNode> continueStatement(IlNode node, DelphiCodeBuilder b) {
        if (node.node("label") != null) {
            b.getContext().warn(node, "Labeled continue not supported, emitted as plain Continue");
        }
        IlNode update = b.getContext().currentLoopUpdate();
        if (update == null) {
            return List.of(DelphiContinue.INSTANCE);
        }
        List<DelphiNode> result = new ArrayList<>(b.visitStatement(expressionStatement(update)));
        result.add(DelphiContinue.INSTANCE);
        return result;
    }

    /**
     * Wraps an expression into an IL expression statement so it is lowered as a statement.
     */
    static IlNode expressionStatement(IlNode expression) {
        return IlNode.builder(IlKind.EXPRESSION_STATEMENT)
                .node("expression", expression)
                .location(expression.getLocation())
                .build();
    }
}
