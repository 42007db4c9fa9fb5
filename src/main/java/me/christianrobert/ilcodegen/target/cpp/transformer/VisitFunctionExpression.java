package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLambda;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVariableDeclaration;

import java.util.List;

/**
 * Static helper for function and arrow expressions, which become lambdas capturing by
 * reference.
 *
 * <pre>
 * (x) =&gt; x ^ 0xFF          →   [&amp;](uint32_t x) -&gt; uint32_t {
 *                                     return x ^ 0xFF;
 *                                 }
 * function helper(a) {...}   →   auto helper = [&amp;](uint32_t a) { ... };   (inside a function)
 * </pre>
 */
public class VisitFunctionExpression {

    public static CppNode lambda(IlNode function, CppCodeBuilder b) {
        String name = function.name() != null ? function.name() : "<lambda>";
        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(function, name, false, b);
        CppType returnType = routine.returnType.isVoid() ? null : routine.cppReturnType;
        return new CppLambda("&", routine.parameters, returnType, routine.body);
    }

    /**
     * A function declared inside a routine body becomes a local lambda variable.
     */
    public static List<CppNode> localFunction(IlNode declaration, CppCodeBuilder b) {
        String name = declaration.name();
        if (name == null) {
            b.getContext().unsupported(declaration);
            return List.of();
        }
        String emitted = CppNames.variable(name);
        TypeDescriptor returnType = TypeDescriptor.parse(declaration.text("returnType"));
        b.getContext().getSymbols().declare(new SymbolInfo(name, emitted, returnType, SymbolRole.FUNCTION));

        CppNode lambda = lambda(declaration, b);
        return List.of(new CppVariableDeclaration(CppType.AUTO, emitted, lambda, false, false, false));
    }
}
