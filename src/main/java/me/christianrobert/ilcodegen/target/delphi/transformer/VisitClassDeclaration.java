package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.ClassMembers;
import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.SymbolRole;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiClass;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExpressionStatement;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiField;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiMemberAccess;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiProperty;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRoutine;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVisibility;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static helper for class declarations.
 *
 * <h3>Members:</h3>
 * <ul>
 *   <li>Instance fields are {@code FName} private fields when properties are emitted or the
 *       name starts with an underscore; otherwise public fields named after the IL name.</li>
 *   <li>Static fields with a numeric literal value are class constants; other static fields are
 *       {@code class var}s initialized in the unit's {@code initialization} section.</li>
 *   <li>{@code get size()} / {@code set size(v)} become private {@code GetSize} / {@code SetSize}
 *       plus {@code property Size read GetSize write SetSize}.</li>
 *   <li>Field initializers run in the constructor right after the inherited constructor call.
 *       A constructor is synthesized when the class has initializers but no constructor.</li>
 * </ul>
 *
 * <h3>Example:</h3>
 * <pre>
 * class Cipher extends Base {            TCipher = class(TBase)
 *   static ROUNDS = 10;                  private
 *   _state = new Uint8Array(16);    →      FState: TBytes;
 *   constructor(key) { super(); }        public
 * }                                        const ROUNDS = 10;
 *                                          constructor Create(const Key: TBytes);
 *                                        end;
 * </pre>
 */
public class VisitClassDeclaration {

    public static DelphiClass v(IlNode cls, DelphiCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = cls.name();
        String emittedName = DelphiNames.type(name);
        IlNode superNode = cls.node("superClass");
        String superName = superNode != null ? superNode.name() : null;
        declareType(cls, b);

        symbols.push(Scope.Kind.CLASS, name);
        context.enterClass(new TransformationContext.ClassFrame(name, superName));
        try {
            boolean emitProperties = b.getOptions().getBoolean(CodegenOptions.EMIT_PROPERTIES);

            // STEP 1: Declare members so that bodies can refer to members declared later
            Set<String> accessors = accessorNames(cls);
            List<ClassMembers.Field> fields = new ArrayList<>();
            for (ClassMembers.Field field : ClassMembers.collectFields(cls, symbols)) {
                if (accessors.contains(field.getName())) {
                    continue;
                }
                fields.add(field);
                symbols.declare(fieldSymbol(field, emitProperties));
            }
            for (IlNode method : ClassMembers.methods(cls)) {
                declareMethod(method, null, b);
            }

            // STEP 2: Fields
            List<DelphiNode> members = new ArrayList<>();
            for (ClassMembers.Field field : fields) {
                members.addAll(field(field, emittedName, emitProperties, b));
            }

            // STEP 3: Constructor
            IlNode constructor = ClassMembers.findConstructor(cls);
            List<ClassMembers.Field> initialized = new ArrayList<>();
            for (ClassMembers.Field field : fields) {
                if (!field.isStatic() && field.getInitializer() != null) {
                    initialized.add(field);
                }
            }
            if (constructor != null || !initialized.isEmpty()) {
                members.add(constructor(constructor, cls, emittedName, initialized, b));
            }

            // STEP 4: Methods and accessors
            Map<String, DelphiRoutine> getters = new HashMap<>();
            Map<String, DelphiRoutine> setters = new HashMap<>();
            for (IlNode method : ClassMembers.methods(cls)) {
                DelphiRoutine routine = method(method, emittedName, name, b);
                if (routine == null) {
                    continue;
                }
                members.add(routine);
                switch (method.text("methodKind", "method")) {
                    case "get" -> getters.put(method.name(), routine);
                    case "set" -> setters.put(method.name(), routine);
                    default -> {
                    }
                }
            }
            for (String accessor : accessors) {
                members.add(property(accessor, getters.get(accessor), setters.get(accessor)));
            }

            for (IlNode member : cls.nodes("body")) {
                if (!member.is(IlKind.METHOD_DEFINITION) && !member.is(IlKind.PROPERTY_DEFINITION)) {
                    context.unsupported(member);
                }
            }

            return new DelphiClass(emittedName, superName != null ? DelphiNames.type(superName) : null, members,
                    VisitFunctionDeclaration.docComment(cls, b));
        } finally {
            context.exitClass();
            symbols.pop();
        }
    }

    /**
     * Declares the class name globally and registers its hierarchy, method names and static
     * members; done in the program pre-pass as well.
     */
    public static void declareType(IlNode cls, DelphiCodeBuilder b) {
        String name = cls.name();
        b.getContext().getSymbols().declareGlobal(
                new SymbolInfo(name, DelphiNames.type(name), TypeDescriptor.user(name), SymbolRole.TYPE));

        IlNode superNode = cls.node("superClass");
        Set<String> methods = new HashSet<>();
        for (IlNode method : ClassMembers.methods(cls)) {
            if (method.name() == null) {
                continue;
            }
            if (method.flag("static")) {
                b.registerStaticMember(name, method.name(), DelphiNames.routine(method.name()));
            } else if ("method".equals(method.text("methodKind", "method"))) {
                methods.add(method.name());
            }
        }
        for (IlNode member : cls.nodes("body")) {
            if (member.is(IlKind.PROPERTY_DEFINITION) && member.flag("static") && member.name() != null) {
                b.registerStaticMember(name, member.name(), staticFieldName(member.name(), member.node("value")));
            }
        }
        b.registerClass(name, superNode != null ? superNode.name() : null, methods);
    }

    private static String staticFieldName(String name, IlNode init) {
        return isClassConstant(init) ? DelphiNames.constant(name) : DelphiNames.property(name);
    }

    private static boolean isClassConstant(IlNode init) {
        return init != null && init.isNumericLiteral();
    }

    /**
     * Private fields and fields behind a property carry the {@code F} prefix and are used bare
     * inside the class; public fields are used as {@code Self.Name}.
     */
    private static SymbolInfo fieldSymbol(ClassMembers.Field field, boolean emitProperties) {
        String name = field.getName();
        if (field.isStatic()) {
            SymbolRole role = isClassConstant(field.getInitializer()) ? SymbolRole.CONSTANT : SymbolRole.FIELD;
            return new SymbolInfo(name, staticFieldName(name, field.getInitializer()), field.getType(), role, true);
        }
        String emitted = emitProperties || DelphiNames.isPrivateMember(name)
                ? DelphiNames.field(name)
                : DelphiNames.property(name);
        return new SymbolInfo(name, emitted, field.getType(), SymbolRole.FIELD, false);
    }

    private static List<DelphiNode> field(ClassMembers.Field field, String className, boolean emitProperties,
                                          DelphiCodeBuilder b) {
        String name = field.getName();
        DelphiType type = b.mapType(field.getType());
        boolean privateName = DelphiNames.isPrivateMember(name);
        IlNode init = field.getInitializer();

        if (field.isStatic()) {
            DelphiVisibility visibility = privateName ? DelphiVisibility.PRIVATE : DelphiVisibility.PUBLIC;
            if (isClassConstant(init)) {
                return List.of(new DelphiField(DelphiNames.constant(name), type, visibility, true,
                        VisitLiteralExpression.literal(init, b)));
            }
            String emitted = DelphiNames.property(name);
            if (init != null) {
                DelphiNode target = new DelphiMemberAccess(new DelphiIdentifier(className), emitted);
                List<DelphiNode> statements = new ArrayList<>(
                        VisitOperatorExpression.assign(init, target, init, true, b));
                List<DelphiNode> initialization = new ArrayList<>(b.drainPreEffects());
                initialization.addAll(statements);
                initialization.addAll(b.drainPostEffects());
                b.addInitialization(initialization);
            }
            return List.of(new DelphiField(emitted, type, visibility, true, null));
        }

        if (!emitProperties || privateName) {
            DelphiVisibility visibility = privateName ? DelphiVisibility.PRIVATE : DelphiVisibility.PUBLIC;
            String emitted = privateName ? DelphiNames.field(name) : DelphiNames.property(name);
            return List.of(new DelphiField(emitted, type, visibility, false, null));
        }
        String backing = DelphiNames.field(name);
        return List.of(
                new DelphiField(backing, type, DelphiVisibility.PRIVATE, false, null),
                new DelphiProperty(DelphiNames.property(name), type, backing, backing, DelphiVisibility.PUBLIC));
    }

    private static Set<String> accessorNames(IlNode cls) {
        Set<String> names = new LinkedHashSet<>();
        for (IlNode method : ClassMembers.methods(cls)) {
            String kind = method.text("methodKind", "method");
            if ((kind.equals("get") || kind.equals("set")) && method.name() != null) {
                names.add(method.name());
            }
        }
        return names;
    }

    private static void declareMethod(IlNode method, TypeDescriptor returnType, DelphiCodeBuilder b) {
        String name = method.name();
        if (name == null || method.flag("computed")) {
            return;
        }
        SymbolEnvironment symbols = b.getContext().getSymbols();
        String kind = method.text("methodKind", "method");
        boolean isStatic = method.flag("static");
        IlNode function = method.node("value");
        TypeDescriptor type = returnType;
        if (type == null && function != null) {
            type = TypeDescriptor.parse(function.text("returnType"));
        }
        switch (kind) {
            case "get" -> {
                b.registerProperty(b.getContext().currentClass().getName(), name);
                symbols.declare(new SymbolInfo(name, DelphiNames.property(name), type, SymbolRole.FUNCTION, isStatic));
            }
            case "set" -> {
                b.registerProperty(b.getContext().currentClass().getName(), name);
                // a getter of the same property keeps its declaration
                if (symbols.currentScope().lookupLocal(name) == null) {
                    symbols.declare(new SymbolInfo(name, DelphiNames.property(name), null, SymbolRole.FUNCTION,
                            isStatic));
                }
            }
            default -> symbols.declare(new SymbolInfo(name, DelphiNames.routine(name), type, SymbolRole.FUNCTION,
                    isStatic));
        }
    }

    private static DelphiRoutine constructor(IlNode definition, IlNode cls, String className,
                                             List<ClassMembers.Field> initialized, DelphiCodeBuilder b) {
        IlNode function = definition != null ? definition.node("value") : null;
        List<IlNode> statements = function != null && function.node("body") != null
                ? function.node("body").nodes("body")
                : List.of();

        // STEP 1: Field initializers go right after the inherited constructor call
        int superCall = -1;
        for (int i = 0; i < statements.size(); i++) {
            if (isSuperCall(statements.get(i))) {
                superCall = i;
                break;
            }
        }
        List<IlNode> body = new ArrayList<>(statements.subList(0, superCall + 1));
        for (ClassMembers.Field field : initialized) {
            IlNode init = field.getInitializer();
            IlNode target = IlNode.builder(IlKind.THIS_PROPERTY_ACCESS)
                    .text("property", field.getName())
                    .location(init.getLocation())
                    .build();
            body.add(IlNode.builder(IlKind.EXPRESSION_STATEMENT)
                    .node("expression", IlNode.builder(IlKind.ASSIGNMENT_EXPRESSION)
                            .text("operator", "=")
                            .node("left", target)
                            .node("right", init)
                            .location(init.getLocation())
                            .build())
                    .location(init.getLocation())
                    .build());
        }
        body.addAll(statements.subList(superCall + 1, statements.size()));

        IlNode synthesized = IlNode.builder(IlKind.FUNCTION_EXPRESSION)
                .nodes("params", function != null ? function.nodes("params") : List.of())
                .node("body", IlNode.builder(IlKind.BLOCK_STATEMENT).nodes("body", body).build())
                .location(function != null ? function.getLocation() : cls.getLocation())
                .build();
        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(synthesized, "constructor",
                true, true, b);

        // STEP 2: Without an explicit call the inherited constructor runs first
        DelphiBlock block = routine.body;
        if (superCall < 0) {
            List<DelphiNode> withInherited = new ArrayList<>();
            withInherited.add(new DelphiExpressionStatement(new DelphiIdentifier("inherited Create")));
            withInherited.addAll(block.getStatements());
            block = new DelphiBlock(withInherited);
        }
        return new DelphiRoutine(DelphiRoutine.Kind.CONSTRUCTOR, className, "Create", routine.parameters, null,
                routine.locals, routine.nestedRoutines, block, false, DelphiVisibility.PUBLIC, null,
                VisitFunctionDeclaration.docComment(definition, b));
    }

    private static boolean isSuperCall(IlNode statement) {
        IlNode expression = statement.is(IlKind.EXPRESSION_STATEMENT) ? statement.node("expression") : null;
        if (expression == null) {
            return false;
        }
        if (expression.is(IlKind.PARENT_CONSTRUCTOR_CALL)) {
            return true;
        }
        return expression.is(IlKind.CALL_EXPRESSION) && expression.node("callee") != null
                && expression.node("callee").is(IlKind.SUPER);
    }

    private static DelphiRoutine method(IlNode method, String className, String ilClassName, DelphiCodeBuilder b) {
        String name = method.name();
        IlNode function = method.node("value");
        if (name == null || method.flag("computed") || function == null) {
            b.getContext().warn(method, "Computed method name not supported");
            return null;
        }
        String kind = method.text("methodKind", "method");
        boolean isStatic = method.flag("static");

        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(function, name, false, true, b);

        switch (kind) {
            case "get" -> {
                declareMethod(method, routine.returnType, b);
                return new DelphiRoutine(DelphiRoutine.Kind.FUNCTION, className, DelphiNames.getter(name),
                        routine.parameters, routine.delphiReturnType, routine.locals, routine.nestedRoutines,
                        routine.body, isStatic, DelphiVisibility.PRIVATE, null,
                        VisitFunctionDeclaration.docComment(method, b));
            }
            case "set" -> {
                return new DelphiRoutine(DelphiRoutine.Kind.PROCEDURE, className, DelphiNames.setter(name),
                        routine.parameters, null, routine.locals, routine.nestedRoutines, routine.body, isStatic,
                        DelphiVisibility.PRIVATE, null, VisitFunctionDeclaration.docComment(method, b));
            }
            default -> {
                declareMethod(method, routine.returnType, b);
                DelphiVisibility visibility = DelphiNames.isPrivateMember(name)
                        ? DelphiVisibility.PRIVATE
                        : DelphiVisibility.PUBLIC;
                String directive = isStatic ? null : b.directiveFor(ilClassName, name);
                return new DelphiRoutine(routine.kind(), className, DelphiNames.routine(name), routine.parameters,
                        routine.headingReturnType(), routine.locals, routine.nestedRoutines, routine.body, isStatic,
                        visibility, directive, VisitFunctionDeclaration.docComment(method, b));
            }
        }
    }

    private static DelphiProperty property(String name, DelphiRoutine getter, DelphiRoutine setter) {
        DelphiType type;
        if (getter != null) {
            type = getter.getReturnType();
        } else if (setter != null && !setter.getParameters().isEmpty()) {
            type = setter.getParameters().get(0).getType();
        } else {
            type = DelphiType.VARIANT;
        }
        return new DelphiProperty(DelphiNames.property(name), type,
                getter != null ? getter.getName() : null,
                setter != null ? setter.getName() : null,
                DelphiVisibility.PUBLIC);
    }
}
