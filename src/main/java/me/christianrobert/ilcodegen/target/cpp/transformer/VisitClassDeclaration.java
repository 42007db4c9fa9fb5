package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.ClassMembers;
import me.christianrobert.ilcodegen.codegen.analysis.Parameters;
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
import me.christianrobert.ilcodegen.target.cpp.ast.CppClass;
import me.christianrobert.ilcodegen.target.cpp.ast.CppConstructor;
import me.christianrobert.ilcodegen.target.cpp.ast.CppField;
import me.christianrobert.ilcodegen.target.cpp.ast.CppFunction;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberInitializer;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVisibility;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Static helper for class declarations.
 *
 * <h3>Layout of the generated class:</h3>
 * <ol>
 *   <li>{@code public:} constructor, methods, accessors, public fields</li>
 *   <li>{@code private:} methods and fields whose names start with an underscore</li>
 * </ol>
 *
 * <h3>Members:</h3>
 * <ul>
 *   <li>Fields are collected from property definitions and {@code this.x = ...} assignments.</li>
 *   <li>{@code get size()} / {@code set size(v)} become {@code get_size()} / {@code set_size(v)}.</li>
 *   <li>The constructor prologue ({@code super(...)} followed by {@code this.f = param}
 *       assignments of matching type) becomes the member initializer list.</li>
 * </ul>
 *
 * <h3>Example:</h3>
 * <pre>
 * class Cipher extends Base {            class Cipher : public Base
 *   constructor(key) {                   {
 *     super();                     →     public:
 *     this._key = key;                       explicit Cipher(const std::vector&lt;uint8_t&gt;&amp; key)
 *   }                                            : Base(), key_(key)
 * }                                          ...
 * </pre>
 */
public class VisitClassDeclaration {

    public static CppClass v(IlNode cls, CppCodeBuilder b) {
        TransformationContext context = b.getContext();
        SymbolEnvironment symbols = context.getSymbols();

        String name = cls.name();
        String emittedName = CppNames.type(name);
        IlNode superNode = cls.node("superClass");
        String superName = superNode != null ? superNode.name() : null;
        declareType(cls, b);

        symbols.push(Scope.Kind.CLASS, name);
        context.enterClass(new TransformationContext.ClassFrame(name, superName));
        try {
            // STEP 1: Declare members so that bodies can refer to members declared later
            Set<String> accessors = accessorNames(cls);
            List<ClassMembers.Field> fields = new ArrayList<>();
            for (ClassMembers.Field field : ClassMembers.collectFields(cls, symbols)) {
                if (accessors.contains(field.getName())) {
                    continue;
                }
                fields.add(field);
                symbols.declare(new SymbolInfo(field.getName(), CppNames.field(field.getName()), field.getType(),
                        SymbolRole.FIELD, field.isStatic()));
            }
            for (IlNode method : ClassMembers.methods(cls)) {
                declareMethod(method, null, symbols);
            }

            // STEP 2: Transform
            List<CppNode> publicMembers = new ArrayList<>();
            List<CppNode> privateMembers = new ArrayList<>();

            IlNode constructor = ClassMembers.findConstructor(cls);
            if (constructor != null) {
                publicMembers.add(constructor(constructor, emittedName, superName, fields, b));
            }
            for (IlNode method : ClassMembers.methods(cls)) {
                CppFunction function = method(method, b);
                if (function == null) {
                    continue;
                }
                (function.getVisibility() == CppVisibility.PRIVATE ? privateMembers : publicMembers).add(function);
            }
            for (IlNode member : cls.nodes("body")) {
                if (!member.is(IlKind.METHOD_DEFINITION) && !member.is(IlKind.PROPERTY_DEFINITION)) {
                    context.unsupported(member);
                }
            }
            for (ClassMembers.Field field : fields) {
                CppField cppField = field(field, b);
                (cppField.getVisibility() == CppVisibility.PRIVATE ? privateMembers : publicMembers).add(cppField);
            }

            List<CppNode> members = new ArrayList<>(publicMembers);
            members.addAll(privateMembers);
            return new CppClass(emittedName, superName != null ? CppNames.type(superName) : null, members,
                    VisitFunctionDeclaration.docComment(cls, b));
        } finally {
            context.exitClass();
            symbols.pop();
        }
    }

    /**
     * Declares the class name globally; done in the program pre-pass as well.
     */
    public static void declareType(IlNode cls, CppCodeBuilder b) {
        String name = cls.name();
        b.getContext().getSymbols().declareGlobal(
                new SymbolInfo(name, CppNames.type(name), TypeDescriptor.user(name), SymbolRole.TYPE));
    }

    private static Set<String> accessorNames(IlNode cls) {
        Set<String> names = new HashSet<>();
        for (IlNode method : ClassMembers.methods(cls)) {
            String kind = method.text("methodKind", "method");
            if ((kind.equals("get") || kind.equals("set")) && method.name() != null) {
                names.add(method.name());
            }
        }
        return names;
    }

    private static void declareMethod(IlNode method, TypeDescriptor returnType, SymbolEnvironment symbols) {
        String name = method.name();
        if (name == null || method.flag("computed")) {
            return;
        }
        String kind = method.text("methodKind", "method");
        boolean isStatic = method.flag("static");
        IlNode function = method.node("value");
        TypeDescriptor type = returnType;
        if (type == null && function != null) {
            type = TypeDescriptor.parse(function.text("returnType"));
        }
        switch (kind) {
            case "get" -> symbols.declare(new SymbolInfo(name, CppNames.getter(name), type, SymbolRole.FUNCTION, isStatic));
            case "set" -> {
                // a getter of the same property keeps its declaration
                if (symbols.currentScope().lookupLocal(name) == null) {
                    symbols.declare(new SymbolInfo(name, CppNames.getter(name), null, SymbolRole.FUNCTION, isStatic));
                }
            }
            default -> symbols.declare(new SymbolInfo(name, CppNames.function(name), type, SymbolRole.FUNCTION,
                    isStatic));
        }
    }

    private static CppConstructor constructor(IlNode definition, String className, String superName,
                                              List<ClassMembers.Field> fields, CppCodeBuilder b) {
        IlNode function = definition.node("value");
        List<IlNode> statements = function.node("body") != null ? function.node("body").nodes("body") : List.of();
        Map<String, TypeDescriptor> fieldTypes = new HashMap<>();
        for (ClassMembers.Field field : fields) {
            if (!field.isStatic()) {
                fieldTypes.put(field.getName(), field.getType());
            }
        }

        // STEP 1: Split off the prologue
        SymbolEnvironment symbols = b.getContext().getSymbols();
        Map<String, TypeDescriptor> parameterTypes = new HashMap<>();
        for (IlNode param : function.nodes("params")) {
            String paramName = Parameters.name(param);
            if (paramName != null) {
                parameterTypes.put(paramName, Parameters.type(param, symbols));
            }
        }

        List<CppMemberInitializer> initializers = new ArrayList<>();
        int prologue = 0;
        for (; prologue < statements.size(); prologue++) {
            IlNode statement = statements.get(prologue);
            IlNode expression = statement.is(IlKind.EXPRESSION_STATEMENT) ? statement.node("expression") : null;
            List<IlNode> superArguments = superCallArguments(expression);
            if (superArguments != null && superName != null && initializers.isEmpty()) {
                initializers.add(withParameters(function, b,
                        () -> new CppMemberInitializer(CppNames.type(superName), b.visitExpressions(superArguments))));
                continue;
            }
            String field = fieldInitializedFromParameter(expression, fieldTypes, parameterTypes);
            if (field == null) {
                break;
            }
            initializers.add(new CppMemberInitializer(CppNames.field(field),
                    List.of(new CppIdentifier(CppNames.variable(expression.node("right").name())))));
        }

        // STEP 2: The remaining body
        IlNode rest = IlNode.builder(IlKind.FUNCTION_EXPRESSION)
                .nodes("params", function.nodes("params"))
                .node("body", IlNode.builder(IlKind.BLOCK_STATEMENT)
                        .nodes("body", statements.subList(prologue, statements.size())).build())
                .location(function.getLocation())
                .build();
        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(rest, className, true, b);
        return new CppConstructor(className, routine.parameters, initializers, routine.body,
                VisitFunctionDeclaration.docComment(definition, b));
    }

    private static List<IlNode> superCallArguments(IlNode expression) {
        if (expression == null) {
            return null;
        }
        if (expression.is(IlKind.PARENT_CONSTRUCTOR_CALL)) {
            return expression.nodes("arguments");
        }
        if (expression.is(IlKind.CALL_EXPRESSION) && expression.node("callee") != null
                && expression.node("callee").is(IlKind.SUPER)) {
            return expression.nodes("arguments");
        }
        return null;
    }

    private static String fieldInitializedFromParameter(IlNode expression, Map<String, TypeDescriptor> fieldTypes,
                                                        Map<String, TypeDescriptor> parameterTypes) {
        if (expression == null || !expression.is(IlKind.ASSIGNMENT_EXPRESSION)
                || !"=".equals(expression.text("operator", "="))) {
            return null;
        }
        String field = ClassMembers.thisPropertyName(expression.node("left"));
        IlNode right = expression.node("right");
        if (field == null || right == null || !right.is(IlKind.IDENTIFIER)) {
            return null;
        }
        TypeDescriptor fieldType = fieldTypes.get(field);
        TypeDescriptor parameterType = parameterTypes.get(right.name());
        return fieldType != null && fieldType.equals(parameterType) ? field : null;
    }

    /**
     * Runs a transformation with the routine's parameters in scope.
     */
    private static <T> T withParameters(IlNode function, CppCodeBuilder b, Supplier<T> action) {
        SymbolEnvironment symbols = b.getContext().getSymbols();
        symbols.push(Scope.Kind.FUNCTION, "<initializers>");
        try {
            for (IlNode param : function.nodes("params")) {
                String paramName = Parameters.name(param);
                if (paramName != null) {
                    symbols.declare(new SymbolInfo(paramName, CppNames.variable(paramName),
                            Parameters.type(param, symbols), SymbolRole.PARAMETER));
                }
            }
            return action.get();
        } finally {
            symbols.pop();
        }
    }

    private static CppFunction method(IlNode method, CppCodeBuilder b) {
        String name = method.name();
        IlNode function = method.node("value");
        if (name == null || method.flag("computed") || function == null) {
            b.getContext().warn(method, "Computed method name not supported");
            return null;
        }
        String kind = method.text("methodKind", "method");
        boolean isStatic = method.flag("static");

        VisitFunctionDeclaration.Routine routine = VisitFunctionDeclaration.routine(function, name, false, b);
        SymbolEnvironment symbols = b.getContext().getSymbols();

        switch (kind) {
            case "get" -> {
                declareMethod(method, routine.returnType, symbols);
                return new CppFunction(routine.cppReturnType, CppNames.getter(name), routine.parameters, routine.body,
                        isStatic, !isStatic && readsOnly(function), CppVisibility.PUBLIC,
                        VisitFunctionDeclaration.docComment(method, b));
            }
            case "set" -> {
                return new CppFunction(CppType.VOID, CppNames.setter(name), routine.parameters, routine.body,
                        isStatic, false, CppVisibility.PUBLIC, VisitFunctionDeclaration.docComment(method, b));
            }
            default -> {
                declareMethod(method, routine.returnType, symbols);
                CppVisibility visibility = CppNames.isPrivateField(name) ? CppVisibility.PRIVATE : CppVisibility.PUBLIC;
                return new CppFunction(routine.cppReturnType, CppNames.function(name), routine.parameters,
                        routine.body, isStatic, false, visibility, VisitFunctionDeclaration.docComment(method, b));
            }
        }
    }

    /**
     * A getter that only returns a member can be a const member function.
     */
    private static boolean readsOnly(IlNode function) {
        IlNode body = function.node("body");
        if (body == null || !body.is(IlKind.BLOCK_STATEMENT) || body.nodes("body").size() != 1) {
            return false;
        }
        IlNode statement = body.nodes("body").get(0);
        return statement.is(IlKind.RETURN_STATEMENT)
                && ClassMembers.thisPropertyName(statement.node("argument")) != null;
    }

    private static CppField field(ClassMembers.Field field, CppCodeBuilder b) {
        TypeDescriptor type = field.getType();
        IlNode init = field.getInitializer();
        CppNode initializer = VisitVariableDeclaration.initializer(init, b);
        boolean constexpr = field.isStatic() && init != null && init.isNumericLiteral() && !type.isArray();
        CppVisibility visibility = CppNames.isPrivateField(field.getName()) ? CppVisibility.PRIVATE : CppVisibility.PUBLIC;
        return new CppField(b.mapType(type), CppNames.field(field.getName()), initializer, field.isStatic(),
                constexpr, visibility);
    }
}
