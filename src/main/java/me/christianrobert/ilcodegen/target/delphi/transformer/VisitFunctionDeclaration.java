package me.christianrobert.ilcodegen.target.delphi.transformer;

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
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAssignment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiComment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExit;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNodeKind;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiParameter;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRoutine;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVariable;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for transforming routines (free routines, methods, constructors, nested
 * routines, anonymous methods).
 *
 * <h3>Signature rules:</h3>
 * <ul>
 *   <li>Parameter types follow the type-inference cascade (annotation, default value, name heuristic).</li>
 *   <li>Arrays, strings and class types are {@code const} parameters unless the body
 *       reassigns them.</li>
 *   <li>A routine with a value-returning body is a {@code function}, otherwise a
 *       {@code procedure}. The return type is the annotation, else the type of the first
 *       inferable {@code return <value>}, else {@code Cardinal}.</li>
 * </ul>
 *
 * <h3>Body rules:</h3>
 * <ul>
 *   <li>Locals of the whole body, nested blocks included, are hoisted into the {@code var} section.</li>
 *   <li>A trailing {@code return v} becomes {@code Result := v}; a trailing bare
 *       {@code return} is dropped; every other return becomes {@code Exit(v)} / {@code Exit}.</li>
 * </ul>
 *
 * <h3>Example:</h3>
 * <pre>
 * function rotl32(value, amount) {           function Rotl32(Value: Cardinal; Amount: Cardinal): Cardinal;
 *   return (value &lt;&lt; amount) | ...;     →   begin
 * }                                            Result := (Value shl Amount) or ...;
 *                                            end;
 * </pre>
 */
public class VisitFunctionDeclaration {

    /**
     * The parts of a transformed routine shared by all routine forms.
     */
    static final class Routine {
        final List<DelphiParameter> parameters;
        final DelphiBlock body;
        final TypeDescriptor returnType;
        final DelphiType delphiReturnType;
        final List<DelphiVariable> locals;
        final List<DelphiRoutine> nestedRoutines;

        Routine(List<DelphiParameter> parameters, DelphiBlock body, TypeDescriptor returnType,
                DelphiType delphiReturnType, List<DelphiVariable> locals, List<DelphiRoutine> nestedRoutines) {
            this.parameters = parameters;
            this.body = body;
            this.returnType = returnType;
            this.delphiReturnType = delphiReturnType;
            this.locals = locals;
            this.nestedRoutines = nestedRoutines;
        }

        DelphiRoutine.Kind kind() {
            return returnType.isVoid() ? DelphiRoutine.Kind.PROCEDURE : DelphiRoutine.Kind.FUNCTION;
        }

        DelphiType headingReturnType() {
            return returnType.isVoid() ? null : delphiReturnType;
        }
    }

    /**
     * Transforms a unit-level routine. {@code function} is a {@code FunctionDeclaration} or the
     * function/arrow initializer of a top-level variable.
     */
    public static DelphiRoutine v(IlNode function, String name, DelphiCodeBuilder b) {
        String emittedName = DelphiNames.routine(name);
        Routine routine = routine(function, name, false, true, b);

        // Redeclare with the return type that was actually determined
        b.getContext().getSymbols().declareGlobal(
                new SymbolInfo(name, emittedName, routine.returnType, SymbolRole.FUNCTION));

        return new DelphiRoutine(routine.kind(), null, emittedName, routine.parameters, routine.headingReturnType(),
                routine.locals, routine.nestedRoutines, routine.body, false, null, null, docComment(function, b));
    }

    static Routine routine(IlNode function, String name, boolean constructor, boolean nestedRoutinesAllowed,
                           DelphiCodeBuilder b) {
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
        DelphiCodeBuilder.LocalSection section = b.openLocals(nestedRoutinesAllowed);
        try {
            // STEP 1: Parameters
            List<DelphiParameter> parameters = new ArrayList<>();
            for (IlNode param : function.nodes("params")) {
                String paramName = Parameters.name(param);
                if (paramName == null) {
                    context.warn(param, "Destructuring parameter not supported");
                    continue;
                }
                TypeDescriptor type = Parameters.type(param, symbols);
                String emitted = DelphiNames.variable(paramName);
                symbols.declare(new SymbolInfo(paramName, emitted, type, SymbolRole.PARAMETER));
                b.reserveParameter(emitted);

                DelphiType mapped = b.mapType(type);
                String modifier = passedAsConst(type, mapped) && !Assignments.assigns(body, paramName) ? "const" : null;
                IlNode defaultValue = Parameters.defaultValue(param);
                parameters.add(new DelphiParameter(modifier, emitted, mapped,
                        defaultValue != null ? b.visitExpression(defaultValue) : null));
            }

            // STEP 2: Body (a concise arrow body is a single return)
            List<DelphiNode> statements;
            if (body != null && !body.is(IlKind.BLOCK_STATEMENT)) {
                IlNode returnStatement = IlNode.builder(IlKind.RETURN_STATEMENT)
                        .node("argument", body)
                        .location(body.getLocation())
                        .build();
                statements = b.visitStatement(returnStatement);
            } else {
                statements = b.visitStatements(body != null ? body.nodes("body") : List.of());
            }

            // STEP 3: Return type, known only after the body
            TypeDescriptor returnType;
            if (constructor) {
                returnType = TypeDescriptor.VOID;
            } else if (annotated != null) {
                returnType = annotated;
            } else if (!valueReturning) {
                returnType = TypeDescriptor.VOID;
            } else if (frame.getObservedReturnType() != null) {
                returnType = frame.getObservedReturnType();
            } else {
                returnType = TypeDescriptor.UINT32;
            }

            return new Routine(parameters, new DelphiBlock(trailingReturn(statements)), returnType,
                    b.mapType(returnType), section.getLocals(), section.getNestedRoutines());
        } finally {
            b.closeLocals();
            context.exitRoutine();
            symbols.pop();
        }
    }

    private static boolean passedAsConst(TypeDescriptor type, DelphiType mapped) {
        return mapped.isArray() || mapped.isString() || (type != null && type.isUser());
    }

    /**
     * The last top-level {@code Exit(v)} assigns {@code Result}; a last bare {@code Exit} is
     * redundant.
     */
    static List<DelphiNode> trailingReturn(List<DelphiNode> statements) {
        if (statements.isEmpty()) {
            return statements;
        }
        DelphiNode last = statements.get(statements.size() - 1);
        if (last.getKind() != DelphiNodeKind.EXIT) {
            return statements;
        }
        List<DelphiNode> result = new ArrayList<>(statements.subList(0, statements.size() - 1));
        DelphiNode value = ((DelphiExit) last).getValue();
        if (value != null) {
            result.add(new DelphiAssignment(DelphiIdentifier.RESULT, value));
        }
        return result;
    }

    static DelphiComment docComment(IlNode node, DelphiCodeBuilder b) {
        if (!b.getOptions().isAddComments() || node == null || node.getDescription() == null
                || node.getDescription().isBlank()) {
            return null;
        }
        return new DelphiComment(node.getDescription().strip(), true);
    }
}
