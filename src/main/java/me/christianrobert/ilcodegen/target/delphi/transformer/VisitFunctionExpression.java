package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAnonymousMethod;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRoutine;

import java.util.List;

/**
 * Static helper for functions inside routine bodies.
 *
 * <pre>
 * function helper(a) {...}      →   nested routine before the enclosing begin
 * const f = (a) =&gt; a + 1;       →   nested routine F
 * list.map((x) =&gt; x ^ 0xFF)     →   function(X: Cardinal): Cardinal begin Result := X xor $FF; end
 * </pre>
 */
public class VisitFunctionExpression {

    /**
     * A named local function becomes a nested routine of the enclosing routine; nothing is
     * emitted at the declaration site.
     */
    public static List<DelphiNode> localRoutine(IlNode declaration, String name, IlNode function,
                                                DelphiCodeBuilder b) {
        if (name == null) {
            b.getContext().unsupported(declaration);
            return List.of();
        }
        if (!b.allowsNestedRoutines()) {
            b.getContext().warn(declaration, "Local function '" + name + "' not supported inside an anonymous method");
            return List.of();
        }
        String emitted = DelphiNames.routine(name);
        b.getContext().getSymbols().declare(new SymbolInfo(name, emitted,
                TypeDescriptor.parse(function.text("returnType")), SymbolRole.FUNCTION));

        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(function, name, false, true, b);
        b.getContext().getSymbols().declare(new SymbolInfo(name, emitted, routine.returnType, SymbolRole.FUNCTION));
        b.addNestedRoutine(new DelphiRoutine(routine.kind(), null, emitted, routine.parameters,
                routine.headingReturnType(), routine.locals, routine.nestedRoutines, routine.body, false, null, null,
                VisitFunctionDeclaration.docComment(declaration, b)));
        return List.of();
    }

    public static DelphiNode anonymousMethod(IlNode function, DelphiCodeBuilder b) {
        String name = function.name() != null ? function.name() : "<anonymous>";
        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(function, name, false, false, b);
        return new DelphiAnonymousMethod(routine.parameters, routine.headingReturnType(), routine.locals,
                routine.body);
    }
}
