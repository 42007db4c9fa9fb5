package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.DelphiTypeTable;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiRoutine;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiVariable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-run dispatcher of the Delphi transformation.
 *
 * <p>Routes every IL node to a static {@code VisitXxx} helper through exhaustive switches over
 * {@link IlKind}, like the C++ builder. On top of the shared {@link TransformationContext} it
 * keeps the state Delphi needs beyond symbols:</p>
 * <ul>
 *   <li>a stack of local sections: every local of a routine is hoisted into its {@code var}
 *       section, and local functions become nested routines;</li>
 *   <li>pending side effects of expression-position {@code ++}/{@code --} and assignments,
 *       flushed around the statement being transformed;</li>
 *   <li>the class hierarchy and the static members of every class of the module, for
 *       {@code virtual}/{@code override} directives and {@code TCipher.X} access;</li>
 *   <li>the catch variables in scope, so rethrowing one becomes {@code raise;}.</li>
 * </ul>
 */
public class DelphiCodeBuilder {

    // no logging here, warnings go to the context

    /**
     * The {@code var} section and nested routines of one routine under construction.
     */
    static final class LocalSection {
        private final Map<String, DelphiVariable> locals = new LinkedHashMap<>();
        private final Set<String> parameters = new HashSet<>();
        private final List<DelphiRoutine> nestedRoutines = new ArrayList<>();
        private final boolean nestedRoutinesAllowed;

        LocalSection(boolean nestedRoutinesAllowed) {
            this.nestedRoutinesAllowed = nestedRoutinesAllowed;
        }

        List<DelphiVariable> getLocals() {
            return new ArrayList<>(locals.values());
        }

        List<DelphiRoutine> getNestedRoutines() {
            return nestedRoutines;
        }
    }

    private final TransformationContext context;
    private final DelphiTypeTable types = new DelphiTypeTable();

    private final Deque<LocalSection> sections = new ArrayDeque<>();
    private final List<DelphiNode> preEffects = new ArrayList<>();
    private final List<DelphiNode> postEffects = new ArrayList<>();
    private final List<DelphiNode> initialization = new ArrayList<>();

    private final Map<String, String> superClasses = new HashMap<>();
    private final Map<String, Set<String>> classMethods = new HashMap<>();
    private final Map<String, Map<String, String>> staticMembers = new HashMap<>();
    private final Map<String, Set<String>> properties = new HashMap<>();
    private final Deque<String> catchVariables = new ArrayDeque<>();

    public DelphiCodeBuilder(TransformationContext context) {
        this.context = context;
    }

    public TransformationContext getContext() {
        return context;
    }

    public CodegenOptions getOptions() {
        return context.getOptions();
    }

    // ========== Statement dispatch ==========

    /**
     * Transforms one statement. Side effects raised by its expressions are placed around it:
     * pending pre-effects before, post-effects after.
     */
    public List<DelphiNode> visitStatement(IlNode node) {
        if (node == null) {
            return List.of();
        }
        List<DelphiNode> outerPre = new ArrayList<>(preEffects);
        List<DelphiNode> outerPost = new ArrayList<>(postEffects);
        preEffects.clear();
        postEffects.clear();
        try {
            List<DelphiNode> lowered = dispatchStatement(node);
            if (preEffects.isEmpty() && postEffects.isEmpty()) {
                return lowered;
            }
            if (!preEffects.isEmpty() && isLoop(node)) {
                context.warn(node, "Side effect in a loop header is evaluated once, before the loop");
            }
            List<DelphiNode> result = new ArrayList<>(preEffects);
            result.addAll(lowered);
            if (!postEffects.isEmpty()) {
                if (!node.is(IlKind.EXPRESSION_STATEMENT) && !node.is(IlKind.VARIABLE_DECLARATION)) {
                    context.warn(node, "Postfix update is applied after the whole statement");
                }
                result.addAll(postEffects);
            }
            return result;
        } finally {
            preEffects.clear();
            preEffects.addAll(outerPre);
            postEffects.clear();
            postEffects.addAll(outerPost);
        }
    }

    private static boolean isLoop(IlNode node) {
        return node.is(IlKind.FOR_STATEMENT) || node.is(IlKind.WHILE_STATEMENT) || node.is(IlKind.DO_WHILE_STATEMENT)
                || node.is(IlKind.FOR_OF_STATEMENT) || node.is(IlKind.FOR_IN_STATEMENT);
    }

    private List<DelphiNode> dispatchStatement(IlNode node) {
        return switch (node.getKind()) {
            case VARIABLE_DECLARATION -> VisitVariableDeclaration.local(node, this);
            case FUNCTION_DECLARATION -> VisitFunctionExpression.localRoutine(node, node.name(), node, this);
            case BLOCK_STATEMENT -> visitNestedBlock(node);
            case EXPRESSION_STATEMENT -> visitExpressionStatement(node.node("expression"));
            case RETURN_STATEMENT -> VisitJumpStatement.returnStatement(node, this);
            case IF_STATEMENT -> List.of(VisitIfStatement.v(node, this));
            case FOR_STATEMENT -> VisitLoopStatement.forStatement(node, this);
            case FOR_OF_STATEMENT -> List.of(VisitLoopStatement.forOf(node, this));
            case FOR_IN_STATEMENT -> List.of(VisitLoopStatement.forIn(node, this));
            case WHILE_STATEMENT -> List.of(VisitLoopStatement.whileStatement(node, this));
            case DO_WHILE_STATEMENT -> List.of(VisitLoopStatement.doWhile(node, this));
            case SWITCH_STATEMENT -> VisitSwitchStatement.v(node, this);
            case BREAK_STATEMENT -> VisitJumpStatement.breakStatement(node, this);
            case CONTINUE_STATEMENT -> VisitJumpStatement.continueStatement(node, this);
            case THROW_STATEMENT -> List.of(VisitTryStatement.throwStatement(node, this));
            case TRY_STATEMENT -> VisitTryStatement.v(node, this);
            case EMPTY_STATEMENT -> List.of();
            case IDENTIFIER, LITERAL, TEMPLATE_LITERAL, BINARY_EXPRESSION, LOGICAL_EXPRESSION, UNARY_EXPRESSION,
                 UPDATE_EXPRESSION, ASSIGNMENT_EXPRESSION, CONDITIONAL_EXPRESSION, CALL_EXPRESSION, NEW_EXPRESSION,
                 MEMBER_EXPRESSION, ARRAY_EXPRESSION, OBJECT_EXPRESSION, FUNCTION_EXPRESSION,
                 ARROW_FUNCTION_EXPRESSION, THIS_EXPRESSION, SUPER, SEQUENCE_EXPRESSION, SPREAD_ELEMENT,
                 CHAIN_EXPRESSION, THIS_PROPERTY_ACCESS, THIS_METHOD_CALL, PARENT_CONSTRUCTOR_CALL,
                 PARENT_METHOD_CALL, ROTATE_LEFT, ROTATE_RIGHT, PACK_BYTES, UNPACK_BYTES, XOR_ARRAYS, ARRAY_SLICE,
                 ARRAY_SPLICE, ARRAY_CLEAR, ARRAY_LENGTH, ARRAY_INDEX_OF, ARRAY_CONCAT, ARRAY_FILL, ARRAY_PUSH,
                 ARRAY_CREATION, HEX_DECODE, HEX_ENCODE, STRING_TO_BYTES, BYTES_TO_STRING, STRING_FROM_CHAR_CODE,
                 STRING_CHAR_CODE_AT, CAST, OPCODES_CALL, MATH_CALL, ERROR_CREATION, POWER, IS_ARRAY_CHECK ->
                    visitExpressionStatement(node);
            case PROGRAM, CLASS_DECLARATION, VARIABLE_DECLARATOR, METHOD_DEFINITION, PROPERTY_DEFINITION,
                 STATIC_BLOCK, ASSIGNMENT_PATTERN, SWITCH_CASE, CATCH_CLAUSE, TEMPLATE_ELEMENT, PROPERTY,
                 UNKNOWN -> {
                context.unsupported(node);
                yield List.of();
            }
        };
    }

    public List<DelphiNode> visitStatements(List<IlNode> statements) {
        List<DelphiNode> result = new ArrayList<>();
        for (IlNode statement : statements) {
            result.addAll(visitStatement(statement));
        }
        return result;
    }

    /**
     * Body of a control statement: a block's statements, or the single statement, in a new
     * block scope.
     */
    public DelphiBlock visitBody(IlNode body) {
        context.getSymbols().push(Scope.Kind.BLOCK, "<block>");
        try {
            if (body == null) {
                return new DelphiBlock(List.of());
            }
            if (body.is(IlKind.BLOCK_STATEMENT)) {
                return new DelphiBlock(visitStatements(body.nodes("body")));
            }
            return new DelphiBlock(visitStatement(body));
        } finally {
            context.getSymbols().pop();
        }
    }

    /**
     * A bare block inside a routine; its locals are hoisted anyway, so the statements are
     * spliced into the enclosing list.
     */
    private List<DelphiNode> visitNestedBlock(IlNode block) {
        return visitBody(block).getStatements();
    }

    private List<DelphiNode> visitExpressionStatement(IlNode expression) {
        if (expression == null) {
            return List.of();
        }
        if (expression.is(IlKind.LITERAL) && expression.value("value") instanceof String) {
            // directive prologue ("use strict")
            return List.of();
        }
        IlNode instruction = VisitCallExpression.statementInstruction(expression);
        IlNode statement = instruction != null ? instruction : expression;
        return switch (statement.getKind()) {
            case UPDATE_EXPRESSION -> List.of(VisitOperatorExpression.updateStatement(statement, this));
            case ASSIGNMENT_EXPRESSION -> VisitOperatorExpression.assignmentStatement(statement, this);
            case SEQUENCE_EXPRESSION -> {
                List<DelphiNode> result = new ArrayList<>();
                for (IlNode part : statement.nodes("expressions")) {
                    result.addAll(visitExpressionStatement(part));
                }
                yield result;
            }
            case ARRAY_PUSH -> List.of(VisitInstruction.pushStatement(statement, this));
            case ARRAY_FILL -> List.of(VisitInstruction.fillStatement(statement, this));
            default -> {
                DelphiNode value = visitExpression(statement);
                if (value instanceof DelphiCall) {
                    yield List.of(VisitInstruction.asStatement(value));
                }
                context.warn(statement, "Expression statement without a call dropped");
                yield List.of();
            }
        };
    }

    // ========== Expression dispatch ==========

    public DelphiNode visitExpression(IlNode node) {
        if (node == null) {
            return placeholder("missing operand");
        }
        return switch (node.getKind()) {
            case IDENTIFIER -> VisitMemberExpression.identifier(node, this);
            case LITERAL -> VisitLiteralExpression.literal(node, this);
            case TEMPLATE_LITERAL -> VisitLiteralExpression.template(node, this);
            case ARRAY_EXPRESSION -> VisitLiteralExpression.array(node, this);
            case OBJECT_EXPRESSION -> VisitLiteralExpression.object(node, this);
            case BINARY_EXPRESSION -> VisitOperatorExpression.binary(node, this);
            case LOGICAL_EXPRESSION -> VisitOperatorExpression.logical(node, this);
            case UNARY_EXPRESSION -> VisitOperatorExpression.unary(node, this);
            case UPDATE_EXPRESSION -> VisitOperatorExpression.update(node, this);
            case ASSIGNMENT_EXPRESSION -> VisitOperatorExpression.assignment(node, this);
            case CONDITIONAL_EXPRESSION -> VisitOperatorExpression.conditional(node, this);
            case SEQUENCE_EXPRESSION -> VisitOperatorExpression.sequence(node, this);
            case CALL_EXPRESSION -> VisitCallExpression.call(node, this);
            case NEW_EXPRESSION -> VisitCallExpression.newExpression(node, this);
            case THIS_METHOD_CALL -> VisitCallExpression.thisMethodCall(node, this);
            case PARENT_METHOD_CALL -> VisitCallExpression.parentMethodCall(node, this);
            case PARENT_CONSTRUCTOR_CALL -> VisitCallExpression.parentConstructorCall(node, this);
            case MEMBER_EXPRESSION -> VisitMemberExpression.member(node, this);
            case THIS_PROPERTY_ACCESS -> VisitMemberExpression.thisProperty(node, this);
            case THIS_EXPRESSION -> DelphiIdentifier.SELF;
            case SUPER -> VisitMemberExpression.superExpression(node, this);
            case CHAIN_EXPRESSION -> visitExpression(node.node("expression"));
            case FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> VisitFunctionExpression.anonymousMethod(node, this);
            case ROTATE_LEFT, ROTATE_RIGHT -> VisitInstruction.rotate(node, this);
            case PACK_BYTES -> VisitInstruction.pack(node, this);
            case UNPACK_BYTES -> VisitInstruction.unpack(node, this);
            case XOR_ARRAYS -> helperCall(RuntimeHelper.XOR_ARRAYS, node.nodes("arguments"));
            case ARRAY_SLICE -> VisitInstruction.slice(node, this);
            case ARRAY_SPLICE -> VisitInstruction.splice(node, this);
            case ARRAY_CLEAR -> helperCall(RuntimeHelper.CLEAR_ARRAY, Arrays.asList(node.node("array")));
            case ARRAY_LENGTH -> DelphiCall.of("Length", visitExpression(node.node("array")));
            case ARRAY_INDEX_OF -> helperCall(RuntimeHelper.ARRAY_INDEX_OF,
                    Arrays.asList(node.node("array"), node.node("value")));
            case ARRAY_CONCAT -> VisitInstruction.concat(node, this);
            case ARRAY_FILL, ARRAY_PUSH, ARRAY_CREATION -> VisitInstruction.statementOnly(node, this);
            case HEX_DECODE -> helperCall(RuntimeHelper.HEX_TO_BYTES, Arrays.asList(node.node("value")));
            case HEX_ENCODE -> helperCall(RuntimeHelper.BYTES_TO_HEX, Arrays.asList(node.node("value")));
            case STRING_TO_BYTES -> helperCall(RuntimeHelper.STRING_TO_BYTES, Arrays.asList(node.node("value")));
            case BYTES_TO_STRING -> helperCall(RuntimeHelper.BYTES_TO_STRING, Arrays.asList(node.node("value")));
            case STRING_FROM_CHAR_CODE -> VisitInstruction.fromCharCode(node, this);
            case STRING_CHAR_CODE_AT -> VisitInstruction.charCodeAt(node, this);
            case CAST -> VisitInstruction.cast(node, this);
            case OPCODES_CALL -> VisitInstruction.opCodesCall(node, this);
            case MATH_CALL -> VisitInstruction.mathCall(node, this);
            case ERROR_CREATION -> VisitTryStatement.errorCreation(node.text("errorType"), node.node("message"), this);
            case POWER -> VisitInstruction.power(node.node("left"), node.node("right"), this);
            case IS_ARRAY_CHECK -> VisitInstruction.isArray(node, this);
            case SPREAD_ELEMENT -> {
                context.warn(node, "Spread element has no Delphi equivalent");
                yield placeholder("spread");
            }
            case PROGRAM, FUNCTION_DECLARATION, CLASS_DECLARATION, VARIABLE_DECLARATION, VARIABLE_DECLARATOR,
                 METHOD_DEFINITION, PROPERTY_DEFINITION, STATIC_BLOCK, ASSIGNMENT_PATTERN, BLOCK_STATEMENT,
                 EXPRESSION_STATEMENT, RETURN_STATEMENT, IF_STATEMENT, FOR_STATEMENT, FOR_OF_STATEMENT,
                 FOR_IN_STATEMENT, WHILE_STATEMENT, DO_WHILE_STATEMENT, SWITCH_STATEMENT, SWITCH_CASE,
                 BREAK_STATEMENT, CONTINUE_STATEMENT, THROW_STATEMENT, TRY_STATEMENT, CATCH_CLAUSE,
                 EMPTY_STATEMENT, TEMPLATE_ELEMENT, PROPERTY, UNKNOWN -> {
                context.unsupported(node);
                yield placeholder(node.getRawKind());
            }
        };
    }

    public List<DelphiNode> visitExpressions(List<IlNode> nodes) {
        List<DelphiNode> result = new ArrayList<>();
        for (IlNode node : nodes) {
            result.add(visitExpression(node));
        }
        return result;
    }

    // ========== Side effects ==========

    public void addPreEffect(DelphiNode statement) {
        preEffects.add(statement);
    }

    public void addPostEffect(DelphiNode statement) {
        postEffects.add(statement);
    }

    /**
     * Takes the pending effects for code transformed outside {@link #visitStatement}, such as
     * module-level initializers. Pre-effects come first in the returned list.
     */
    public List<DelphiNode> drainPreEffects() {
        List<DelphiNode> drained = new ArrayList<>(preEffects);
        preEffects.clear();
        return drained;
    }

    public List<DelphiNode> drainPostEffects() {
        List<DelphiNode> drained = new ArrayList<>(postEffects);
        postEffects.clear();
        return drained;
    }

    // ========== Local sections ==========

    public LocalSection openLocals(boolean nestedRoutinesAllowed) {
        LocalSection section = new LocalSection(nestedRoutinesAllowed);
        sections.push(section);
        return section;
    }

    public void closeLocals() {
        sections.pop();
    }

    public boolean hasLocalSection() {
        return !sections.isEmpty();
    }

    public boolean allowsNestedRoutines() {
        return !sections.isEmpty() && sections.peek().nestedRoutinesAllowed;
    }

    public void reserveParameter(String emittedName) {
        if (!sections.isEmpty()) {
            sections.peek().parameters.add(emittedName.toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Hoists a local into the current routine's {@code var} section. Delphi names are case
     * insensitive, so two IL names that differ only in case share one local; a second
     * declaration with a different type keeps the first type and is reported.
     */
    public void declareLocal(IlNode node, String emittedName, DelphiType type) {
        if (sections.isEmpty()) {
            context.warn(node, "Local '" + emittedName + "' outside a routine");
            return;
        }
        LocalSection section = sections.peek();
        String key = emittedName.toLowerCase(Locale.ROOT);
        if (section.parameters.contains(key)) {
            context.warn(node, "Local '" + emittedName + "' shadows a parameter of the same name");
            return;
        }
        DelphiVariable existing = section.locals.get(key);
        if (existing == null) {
            section.locals.put(key, new DelphiVariable(emittedName, type, null));
        } else if (!existing.getType().equals(type)) {
            context.warn(node, "Local '" + emittedName + "' redeclared as " + type
                    + ", keeping " + existing.getType());
        }
    }

    /**
     * A compiler-introduced local such as {@code SwitchValue}; reused when a local of that name
     * and type exists, numbered otherwise.
     */
    public String temporary(String baseName, DelphiType type) {
        if (sections.isEmpty()) {
            context.warn(null, "Temporary '" + baseName + "' outside a routine");
            return baseName;
        }
        LocalSection section = sections.peek();
        String name = baseName;
        for (int i = 2; ; i++) {
            DelphiVariable existing = section.locals.get(name.toLowerCase(Locale.ROOT));
            if (existing == null) {
                section.locals.put(name.toLowerCase(Locale.ROOT), new DelphiVariable(name, type, null));
                return name;
            }
            if (existing.getType().equals(type)) {
                return name;
            }
            name = baseName + i;
        }
    }

    public void addNestedRoutine(DelphiRoutine routine) {
        sections.peek().nestedRoutines.add(routine);
    }

    public void addInitialization(List<DelphiNode> statements) {
        initialization.addAll(statements);
    }

    public List<DelphiNode> getInitialization() {
        return initialization;
    }

    // ========== Class registries ==========

    public void registerClass(String name, String superName, Set<String> methods) {
        if (superName != null) {
            superClasses.put(name, superName);
        }
        classMethods.put(name, methods);
    }

    /**
     * {@code override} when an ancestor declares the method, {@code virtual} when a
     * descendant redeclares it, otherwise none.
     */
    public String directiveFor(String className, String method) {
        for (String ancestor = superClasses.get(className); ancestor != null; ancestor = superClasses.get(ancestor)) {
            Set<String> methods = classMethods.get(ancestor);
            if (methods != null && methods.contains(method)) {
                return "override";
            }
        }
        for (Map.Entry<String, Set<String>> entry : classMethods.entrySet()) {
            if (entry.getValue().contains(method) && inherits(entry.getKey(), className)) {
                return "virtual";
            }
        }
        return null;
    }

    private boolean inherits(String descendant, String ancestor) {
        for (String parent = superClasses.get(descendant); parent != null; parent = superClasses.get(parent)) {
            if (parent.equals(ancestor)) {
                return true;
            }
        }
        return false;
    }

    public void registerStaticMember(String className, String member, String emittedName) {
        staticMembers.computeIfAbsent(className, k -> new HashMap<>()).put(member, emittedName);
    }

    public String staticMember(String className, String member) {
        Map<String, String> members = staticMembers.get(className);
        return members != null ? members.get(member) : null;
    }

    public void registerProperty(String className, String property) {
        properties.computeIfAbsent(className, k -> new HashSet<>()).add(property);
    }

    public boolean isProperty(String className, String property) {
        Set<String> names = properties.get(className);
        return names != null && names.contains(property);
    }

    // ========== Catch variables ==========

    public void pushCatchVariable(String name) {
        catchVariables.push(name != null ? name : "");
    }

    public void popCatchVariable() {
        catchVariables.pop();
    }

    public boolean isCurrentCatchVariable(String name) {
        return name != null && name.equals(catchVariables.peek());
    }

    // ========== Types ==========

    /**
     * Maps an IL type and records the units it needs.
     */
    public DelphiType mapType(TypeDescriptor type) {
        DelphiType mapped = types.map(type);
        for (String unit : DelphiTypeTable.unitsFor(mapped)) {
            context.requireImport(unit);
        }
        return mapped;
    }

    public TypeDescriptor typeOf(IlNode expression) {
        return TypeInferrer.inferExpression(expression, context.getSymbols());
    }

    public SymbolInfo lookup(String name) {
        return context.getSymbols().lookup(name);
    }

    public void requireUnit(String unit) {
        context.requireImport(unit);
    }

    // ========== Shared node factories ==========

    /**
     * Neutral literal standing in for an operand that could not be transformed.
     */
    public DelphiNode placeholder(String what) {
        return new DelphiLiteral("0 { unsupported: " + DelphiNames.braceCommentText(what) + " }");
    }

    public DelphiNode helperCall(RuntimeHelper helper, List<IlNode> arguments) {
        return helperCallWith(helper, visitExpressions(arguments));
    }

    public DelphiNode helperCallWith(RuntimeHelper helper, List<DelphiNode> arguments) {
        context.useHelper(helper);
        return new DelphiCall(new DelphiIdentifier(helper.getPascalName()), arguments);
    }

    /**
     * A call of a routine from a standard unit, registering the unit.
     */
    public DelphiNode unitCall(String unit, String name, DelphiNode... arguments) {
        requireUnit(unit);
        return DelphiCall.of(name, arguments);
    }
}
