package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.Assignments;
import me.christianrobert.ilcodegen.codegen.analysis.Parameters;
import me.christianrobert.ilcodegen.codegen.analysis.ReturnAnalysis;
import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppComment;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFunction;
import me.christianrobert.ilcodegen.target.cpp.ast.CppParameter;
import me.christianrobert.ilcodegen.target.cpp.ast.CppReturn;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVisibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for transforming routines (free functions, methods, constructors, lambdas).
 *
 * <h3>Signature rules:</h3>
 * <ul>
 *   <li>Parameter types follow the type-inference cascade (annotation, default value, name heuristic).</li>
 *   <li>Vectors, strings and class types are passed by {@code const&}; by {@code &} when the body
 *       writes into their elements; by value when the body reassigns the parameter.</li>
 *   <li>The return type is the annotation, else the type of the first inferable
 *       {@code return <value>}, else {@code uint32_t} for value-returning routines, else {@code void}.</li>
 * </ul>
 *
 * <h3>Example:</h3>
 * <pre>
 * function rotl32(value, amount) {            uint32_t rotl32(uint32_t value, uint32_t amount)
 *   return (value &lt;&lt; amount) | ...;      →   {
 * }                                               return (value &lt;&lt; amount) | ...;
 *                                             }
 * </pre>
 */
public class VisitFunctionDeclaration {

    /**
     * The parts of a transformed routine shared by all routine forms.
     */
    static final class Routine {
        final List<CppParameter> parameters;
        final CppBlock body;
        final TypeDescriptor returnType;
        final CppType cppReturnType;

        Routine(List<CppParameter> parameters, CppBlock body, TypeDescriptor returnType, CppType cppReturnType) {
            this.parameters = parameters;
            this.body = body;
            this.returnType = returnType;
            this.cppReturnType = cppReturnType;
        }
    }

    /**
     * Transforms a namespace-level function. {@code function} is a {@code FunctionDeclaration}
     * or the function/arrow initializer of a top-level variable.
     */
    public static CppFunction v(IlNode function, String name, CppCodeBuilder b) {
        String emittedName = CppNames.function(name);
        Routine routine = routine(function, name, false, b);

        // Redeclare with the return type that was actually determined
        b.getContext().getSymbols().declareGlobal(
                new SymbolInfo(name, emittedName, routine.returnType, SymbolRole.FUNCTION));

        return new CppFunction(routine.cppReturnType, emittedName, routine.parameters, routine.body,
                false, false, CppVisibility.PUBLIC, docComment(function, b));
    }

    /**
     * Prototype (forward declaration) of a transformed free function.
     */
    public static CppFunction prototype(CppFunction function) {
        return new CppFunction(function.getReturnType(), function.getName(), function.getParameters(), null,
                false, false, CppVisibility.PUBLIC, null);
    }

    static Routine routine(IlNode function, String name, boolean constructor, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        IlNode body = function.node("body");
        String returnAnnotation = function.text("returnType");
        TypeDescriptor annotated = TypeDescriptor.parse(returnAnnotation);
        boolean valueReturning = !constructor && ReturnAnalysis.isValueReturning(body, returnAnnotation);

        TransformationContext.RoutineFrame frame =
                new TransformationContext.RoutineFrame(name, annotated, valueReturning, constructor);
        symbols.push(Scope.Kind.FUNCTION, name);
        context.enterRoutine(frame);
        try {
            // STEP 1: Parameters
            List<CppParameter> parameters = new ArrayList<>();
            for (IlNode param : function.nodes("params")) {
                String paramName = Parameters.name(param);
                if (paramName == null) {
                    context.warn(param, "Destructuring parameter not supported");
                    continue;
                }
                TypeDescriptor type = Parameters.type(param, symbols);
                String emitted = CppNames.variable(paramName);
                symbols.declare(new SymbolInfo(paramName, emitted, type, SymbolRole.PARAMETER));

                IlNode defaultValue = Parameters.defaultValue(param);
                parameters.add(new CppParameter(parameterType(type, paramName, body, b), emitted,
                        defaultValue != null ? b.visitExpression(defaultValue) : null));
            }

            // STEP 2: Body (a concise arrow body is a single return)
            CppBlock block;
            if (body != null && !body.is(IlKind.BLOCK_STATEMENT)) {
                frame.observeReturn(b.typeOf(body));
                block = new CppBlock(List.of(new CppReturn(b.visitExpression(body))));
            } else {
                block = new CppBlock(b.visitStatements(body != null ? body.nodes("body") : List.of()));
            }

            // STEP 3: Return type, known only after the body
            TypeDescriptor returnType;
            if (annotated != null) {
                returnType = annotated;
            } else if (!valueReturning) {
                returnType = TypeDescriptor.VOID;
            } else if (frame.getObservedReturnType() != null) {
                returnType = frame.getObservedReturnType();
            } else {
                returnType = TypeDescriptor.UINT32;
            }
            return new Routine(parameters, block, returnType, b.mapType(returnType));
        } finally {
            context.exitRoutine();
            symbols.pop();
        }
    }

    static CppType parameterType(TypeDescriptor type, String paramName, IlNode body, CppCodeBuilder b) {
        CppType mapped = b.mapType(type);
        if (!mapped.isPassedByReference() || Assignments.assigns(body, paramName)) {
            return mapped;
        }
        if (Assignments.writesElements(body, paramName)) {
            return mapped.asReference();
        }
        return mapped.asConstReference();
    }

    static CppComment docComment(IlNode node, CppCodeBuilder b) {
        if (!b.getOptions().isAddComments() || node == null || node.getDescription() == null
                || node.getDescription().isBlank()) {
            return null;
        }
        return new CppComment(node.getDescription().strip(), true);
    }
}
