package me.christianrobert.ilcodegen.il;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static me.christianrobert.ilcodegen.il.IlFieldSpec.flag;
import static me.christianrobert.ilcodegen.il.IlFieldSpec.node;
import static me.christianrobert.ilcodegen.il.IlFieldSpec.nodes;
import static me.christianrobert.ilcodegen.il.IlFieldSpec.number;
import static me.christianrobert.ilcodegen.il.IlFieldSpec.text;
import static me.christianrobert.ilcodegen.il.IlFieldSpec.value;

/**
 * Tag of an IL node together with the field schema the boundary reader validates against.
 *
 * <p>The wire name is the value of the {@code kind} property in the JSON document. Kinds the
 * reader does not recognize become {@link #UNKNOWN}; the original name is kept on the node.</p>
 *
 * <p>Besides the declared fields every kind may carry {@code resultType} (inferred type metadata),
 * {@code description} (doc text) and {@code loc} (source location).</p>
 */
public enum IlKind {

    // ========== Program structure and declarations ==========

    PROGRAM("Program", Category.STRUCTURE, nodes("body")),
    FUNCTION_DECLARATION("FunctionDeclaration", Category.DECLARATION,
            node("id"), nodes("params"), node("body"), text("returnType")),
    CLASS_DECLARATION("ClassDeclaration", Category.DECLARATION,
            node("id"), node("superClass"), nodes("body")),
    VARIABLE_DECLARATION("VariableDeclaration", Category.DECLARATION,
            nodes("declarations"), text("declarationKind")),
    VARIABLE_DECLARATOR("VariableDeclarator", Category.AUXILIARY,
            node("id"), node("init"), text("typeAnnotation")),
    METHOD_DEFINITION("MethodDefinition", Category.AUXILIARY,
            node("key"), node("value"), text("methodKind"), flag("static"), flag("computed")),
    PROPERTY_DEFINITION("PropertyDefinition", Category.AUXILIARY,
            node("key"), node("value"), flag("static"), text("typeAnnotation")),
    STATIC_BLOCK("StaticBlock", Category.AUXILIARY, nodes("body")),
    ASSIGNMENT_PATTERN("AssignmentPattern", Category.AUXILIARY, node("left"), node("right")),

    // ========== Statements ==========

    BLOCK_STATEMENT("BlockStatement", Category.STATEMENT, nodes("body")),
    EXPRESSION_STATEMENT("ExpressionStatement", Category.STATEMENT, node("expression")),
    RETURN_STATEMENT("ReturnStatement", Category.STATEMENT, node("argument")),
    IF_STATEMENT("IfStatement", Category.STATEMENT,
            node("test"), node("consequent"), node("alternate")),
    FOR_STATEMENT("ForStatement", Category.STATEMENT,
            node("init"), node("test"), node("update"), node("body")),
    FOR_OF_STATEMENT("ForOfStatement", Category.STATEMENT, node("left"), node("right"), node("body")),
    FOR_IN_STATEMENT("ForInStatement", Category.STATEMENT, node("left"), node("right"), node("body")),
    WHILE_STATEMENT("WhileStatement", Category.STATEMENT, node("test"), node("body")),
    DO_WHILE_STATEMENT("DoWhileStatement", Category.STATEMENT, node("body"), node("test")),
    SWITCH_STATEMENT("SwitchStatement", Category.STATEMENT, node("discriminant"), nodes("cases")),
    SWITCH_CASE("SwitchCase", Category.AUXILIARY, node("test"), nodes("consequent")),
    BREAK_STATEMENT("BreakStatement", Category.STATEMENT, node("label")),
    CONTINUE_STATEMENT("ContinueStatement", Category.STATEMENT, node("label")),
    THROW_STATEMENT("ThrowStatement", Category.STATEMENT, node("argument")),
    TRY_STATEMENT("TryStatement", Category.STATEMENT,
            node("block"), node("handler"), node("finalizer")),
    CATCH_CLAUSE("CatchClause", Category.AUXILIARY, node("param"), node("body")),
    EMPTY_STATEMENT("EmptyStatement", Category.STATEMENT),

    // ========== Expressions ==========

    IDENTIFIER("Identifier", Category.EXPRESSION, text("name"), text("typeAnnotation")),
    LITERAL("Literal", Category.EXPRESSION, value("value"), text("raw")),
    TEMPLATE_LITERAL("TemplateLiteral", Category.EXPRESSION, nodes("quasis"), nodes("expressions")),
    TEMPLATE_ELEMENT("TemplateElement", Category.AUXILIARY, text("value")),
    BINARY_EXPRESSION("BinaryExpression", Category.EXPRESSION,
            text("operator"), node("left"), node("right")),
    LOGICAL_EXPRESSION("LogicalExpression", Category.EXPRESSION,
            text("operator"), node("left"), node("right")),
    UNARY_EXPRESSION("UnaryExpression", Category.EXPRESSION,
            text("operator"), node("argument"), flag("prefix")),
    UPDATE_EXPRESSION("UpdateExpression", Category.EXPRESSION,
            text("operator"), node("argument"), flag("prefix")),
    ASSIGNMENT_EXPRESSION("AssignmentExpression", Category.EXPRESSION,
            text("operator"), node("left"), node("right")),
    CONDITIONAL_EXPRESSION("ConditionalExpression", Category.EXPRESSION,
            node("test"), node("consequent"), node("alternate")),
    CALL_EXPRESSION("CallExpression", Category.EXPRESSION, node("callee"), nodes("arguments")),
    NEW_EXPRESSION("NewExpression", Category.EXPRESSION, node("callee"), nodes("arguments")),
    MEMBER_EXPRESSION("MemberExpression", Category.EXPRESSION,
            node("object"), node("property"), flag("computed")),
    ARRAY_EXPRESSION("ArrayExpression", Category.EXPRESSION, nodes("elements")),
    OBJECT_EXPRESSION("ObjectExpression", Category.EXPRESSION, nodes("properties")),
    PROPERTY("Property", Category.AUXILIARY, node("key"), node("value"), flag("computed")),
    FUNCTION_EXPRESSION("FunctionExpression", Category.EXPRESSION,
            node("id"), nodes("params"), node("body"), text("returnType")),
    ARROW_FUNCTION_EXPRESSION("ArrowFunctionExpression", Category.EXPRESSION,
            nodes("params"), node("body"), text("returnType")),
    THIS_EXPRESSION("ThisExpression", Category.EXPRESSION),
    SUPER("Super", Category.EXPRESSION),
    SEQUENCE_EXPRESSION("SequenceExpression", Category.EXPRESSION, nodes("expressions")),
    SPREAD_ELEMENT("SpreadElement", Category.EXPRESSION, node("argument")),
    CHAIN_EXPRESSION("ChainExpression", Category.EXPRESSION, node("expression")),

    // ========== Normalized object access ==========

    THIS_PROPERTY_ACCESS("ThisPropertyAccess", Category.EXPRESSION, text("property")),
    THIS_METHOD_CALL("ThisMethodCall", Category.EXPRESSION, text("method"), nodes("arguments")),
    PARENT_CONSTRUCTOR_CALL("ParentConstructorCall", Category.EXPRESSION, nodes("arguments")),
    PARENT_METHOD_CALL("ParentMethodCall", Category.EXPRESSION, text("method"), nodes("arguments")),

    // ========== Virtual instructions ==========

    ROTATE_LEFT("RotateLeft", Category.INSTRUCTION, node("value"), node("amount"), number("bits")),
    ROTATE_RIGHT("RotateRight", Category.INSTRUCTION, node("value"), node("amount"), number("bits")),
    PACK_BYTES("PackBytes", Category.INSTRUCTION, nodes("arguments"), number("bits"), text("endian")),
    UNPACK_BYTES("UnpackBytes", Category.INSTRUCTION, node("value"), number("bits"), text("endian")),
    XOR_ARRAYS("XorArrays", Category.INSTRUCTION, nodes("arguments")),
    ARRAY_SLICE("ArraySlice", Category.INSTRUCTION, node("array"), node("start"), node("end")),
    ARRAY_SPLICE("ArraySplice", Category.INSTRUCTION,
            node("array"), node("start"), node("deleteCount"), nodes("items")),
    ARRAY_CLEAR("ArrayClear", Category.INSTRUCTION, node("array")),
    ARRAY_LENGTH("ArrayLength", Category.INSTRUCTION, node("array")),
    ARRAY_INDEX_OF("ArrayIndexOf", Category.INSTRUCTION, node("array"), node("value")),
    ARRAY_CONCAT("ArrayConcat", Category.INSTRUCTION, node("array"), nodes("arguments")),
    ARRAY_FILL("ArrayFill", Category.INSTRUCTION, node("array"), node("value")),
    ARRAY_PUSH("ArrayPush", Category.INSTRUCTION, node("array"), nodes("arguments")),
    ARRAY_CREATION("ArrayCreation", Category.INSTRUCTION, text("elementType"), node("size")),
    HEX_DECODE("HexDecode", Category.INSTRUCTION, node("value")),
    HEX_ENCODE("HexEncode", Category.INSTRUCTION, node("value")),
    STRING_TO_BYTES("StringToBytes", Category.INSTRUCTION, node("value")),
    BYTES_TO_STRING("BytesToString", Category.INSTRUCTION, node("value")),
    STRING_FROM_CHAR_CODE("StringFromCharCode", Category.INSTRUCTION, nodes("arguments")),
    STRING_CHAR_CODE_AT("StringCharCodeAt", Category.INSTRUCTION, node("value"), node("index")),
    CAST("Cast", Category.INSTRUCTION, node("value"), text("targetType")),
    OPCODES_CALL("OpCodesCall", Category.INSTRUCTION, text("method"), nodes("arguments")),
    MATH_CALL("MathCall", Category.INSTRUCTION, text("method"), nodes("arguments")),
    ERROR_CREATION("ErrorCreation", Category.INSTRUCTION, node("message"), text("errorType")),
    POWER("Power", Category.INSTRUCTION, node("left"), node("right")),
    IS_ARRAY_CHECK("IsArrayCheck", Category.INSTRUCTION, node("value")),

    UNKNOWN("<unknown>", Category.UNKNOWN);

    /**
     * Broad grouping of kinds, used by dispatchers to reject kinds in the wrong position.
     */
    public enum Category {
        STRUCTURE,
        DECLARATION,
        STATEMENT,
        EXPRESSION,
        INSTRUCTION,
        AUXILIARY,
        UNKNOWN
    }

    private static final Map<String, IlKind> BY_WIRE_NAME = new HashMap<>();

    static {
        for (IlKind kind : values()) {
            if (kind != UNKNOWN) {
                BY_WIRE_NAME.put(kind.wireName, kind);
            }
        }
    }

    private final String wireName;
    private final Category category;
    private final Map<String, IlFieldSpec> fields;

    IlKind(String wireName, Category category, IlFieldSpec... specs) {
        this.wireName = wireName;
        this.category = category;
        Map<String, IlFieldSpec> declared = new LinkedHashMap<>();
        for (IlFieldSpec spec : specs) {
            declared.put(spec.getName(), spec);
        }
        this.fields = Collections.unmodifiableMap(declared);
    }

    /**
     * Resolves the JSON {@code kind} value. Never returns null.
     */
    public static IlKind fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(wireName, UNKNOWN);
    }

    public String getWireName() {
        return wireName;
    }

    public Category getCategory() {
        return category;
    }

    public Map<String, IlFieldSpec> getFields() {
        return fields;
    }

    public IlFieldSpec getField(String name) {
        return fields.get(name);
    }

    public boolean isExpression() {
        return category == Category.EXPRESSION || category == Category.INSTRUCTION;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isFunctionLike() {
        return this == FUNCTION_DECLARATION || this == FUNCTION_EXPRESSION || this == ARROW_FUNCTION_EXPRESSION;
    }
}
