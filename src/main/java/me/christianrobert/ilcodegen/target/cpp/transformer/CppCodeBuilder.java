package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.context.TransformationContext;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.codegen.type.TypeInferrer;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.CppTypeTable;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppExpressionStatement;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-run dispatcher of the C++ transformation.
 *
 * <p>Holds the {@link TransformationContext} of one run and routes every IL node to a static
 * {@code VisitXxx.v(node, builder)} helper through exhaustive switches over {@link IlKind}.
 * The helpers call back into the builder for child nodes.</p>
 *
 * <p>Statements map to a list of C++ statements (a single IL statement may lower to several,
 * e.g. a {@code continue} preceded by the loop update); expressions map to exactly one node.</p>
 */
public class CppCodeBuilder {

    // no logging here, warnings go to the context

    private final TransformationContext context;
    private final CppTypeTable types = new CppTypeTable();

    public CppCodeBuilder(TransformationContext context) {
        this.context = context;
    }

    public TransformationContext getContext() {
        return context;
    }

    public CodegenOptions getOptions() {
        return context.getOptions();
    }

    // ========== Statement dispatch ==========

    public List<CppNode> visitStatement(IlNode node) {
        if (node == null) {
            return List.of();
        }
        return switch (node.getKind()) {
            case VARIABLE_DECLARATION -> VisitVariableDeclaration.local(node, this);
            case FUNCTION_DECLARATION -> VisitFunctionExpression.localFunction(node, this);
            case BLOCK_STATEMENT -> List.of(visitBody(node));
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

    public List<CppNode> visitStatements(List<IlNode> statements) {
        List<CppNode> result = new ArrayList<>();
        for (IlNode statement : statements) {
            result.addAll(visitStatement(statement));
        }
        return result;
    }

    /**
     * Body of a control statement: a block's statements, or the single statement, in a new
     * block scope.
     */
    public CppBlock visitBody(IlNode body) {
        context.getSymbols().push(Scope.Kind.BLOCK, "<block>");
        try {
            if (body == null) {
                return new CppBlock(List.of());
            }
            if (body.is(IlKind.BLOCK_STATEMENT)) {
                return new CppBlock(visitStatements(body.nodes("body")));
            }
            return new CppBlock(visitStatement(body));
        } finally {
            context.getSymbols().pop();
        }
    }

    private List<CppNode> visitExpressionStatement(IlNode expression) {
        if (expression == null) {
            return List.of();
        }
        if (expression.is(IlKind.LITERAL) && expression.value("value") instanceof String) {
            // directive prologue ("use strict")
            return List.of();
        }
        return List.of(new CppExpressionStatement(visitExpression(expression)));
    }

    // ========== Expression dispatch ==========

    public CppNode visitExpression(IlNode node) {
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
            case THIS_EXPRESSION -> VisitMemberExpression.thisExpression(node, this);
            case SUPER -> VisitMemberExpression.superExpression(node, this);
            case CHAIN_EXPRESSION -> visitExpression(node.node("expression"));
            case FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> VisitFunctionExpression.lambda(node, this);
            case ROTATE_LEFT, ROTATE_RIGHT -> VisitInstruction.rotate(node, this);
            case PACK_BYTES -> VisitInstruction.pack(node, this);
            case UNPACK_BYTES -> VisitInstruction.unpack(node, this);
            case XOR_ARRAYS -> helperCall(RuntimeHelper.XOR_ARRAYS, node.nodes("arguments"));
            case ARRAY_SLICE -> VisitInstruction.slice(node, this);
            case ARRAY_SPLICE -> VisitInstruction.splice(node, this);
            case ARRAY_CLEAR -> VisitInstruction.fill(node.node("array"), new CppLiteral("0"), this);
            case ARRAY_FILL -> VisitInstruction.fill(node.node("array"), visitExpression(node.node("value")), this);
            case ARRAY_LENGTH -> VisitInstruction.length(node.node("array"), this);
            case ARRAY_INDEX_OF -> helperCall(RuntimeHelper.ARRAY_INDEX_OF,
                    Arrays.asList(node.node("array"), node.node("value")));
            case ARRAY_CONCAT -> VisitInstruction.concat(node, this);
            case ARRAY_PUSH -> VisitInstruction.push(node, this);
            case ARRAY_CREATION -> VisitInstruction.arrayCreation(node, this);
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
                context.warn(node, "Spread element has no C++ equivalent");
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

    public List<CppNode> visitExpressions(List<IlNode> nodes) {
        List<CppNode> result = new ArrayList<>();
        for (IlNode node : nodes) {
            result.add(visitExpression(node));
        }
        return result;
    }

    // ========== Types ==========

    /**
     * Maps an IL type and records the headers it needs.
     */
    public CppType mapType(TypeDescriptor type) {
        CppType mapped = types.map(type);
        for (String header : CppTypeTable.includesFor(mapped)) {
            context.requireImport(header);
        }
        return mapped;
    }

    public TypeDescriptor typeOf(IlNode expression) {
        return TypeInferrer.inferExpression(expression, context.getSymbols());
    }

    public SymbolInfo lookup(String name) {
        return context.getSymbols().lookup(name);
    }

    public void include(String header) {
        context.requireImport(header);
    }

    // ========== Shared node factories ==========

    /**
     * Neutral literal standing in for an operand that could not be transformed.
     */
    public CppNode placeholder(String what) {
        return new CppLiteral("0 /* unsupported: " + CppNames.blockCommentText(what) + " */");
    }

    public CppNode helperCall(RuntimeHelper helper, List<IlNode> arguments) {
        context.useHelper(helper);
        return new CppCall(new CppIdentifier(helper.getName()), visitExpressions(arguments));
    }

    public CppNode helperCallWith(RuntimeHelper helper, List<CppNode> arguments) {
        context.useHelper(helper);
        return new CppCall(new CppIdentifier(helper.getName()), arguments);
    }

    /**
     * {@code target.method(args)}.
     */
    public CppNode methodCall(CppNode target, String method, List<CppNode> arguments) {
        return new CppCall(new CppMemberAccess(target, method, CppMemberAccess.Operator.DOT), arguments);
    }

    /**
     * {@code std::name(args)}, registering the header.
     */
    public CppNode stdCall(String header, String name, List<CppNode> arguments) {
        include(header);
        return new CppCall(new CppIdentifier("std::" + name), arguments);
    }
}
