package me.christianrobert.ilcodegen.codegen.type;

import me.christianrobert.ilcodegen.codegen.context.SymbolEnvironment;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.runtime.OpCodesNormalizer;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Determines IL types of declarations and expressions.
 *
 * <p><strong>Declaration cascade</strong> (first hit wins):</p>
 * <ol>
 *   <li>explicit type annotation</li>
 *   <li>{@code resultType} metadata attached to the initializer</li>
 *   <li>literal initializer</li>
 *   <li>non-literal initializer whose type is determinable (array creation, helper calls, known symbols)</li>
 *   <li>name heuristic</li>
 *   <li>unsigned 32-bit default</li>
 * </ol>
 *
 * <p>All methods are static and side-effect free.</p>
 */
public final class TypeInferrer {

    private static final long UINT32_MAX = 0xFFFFFFFFL;

    private static final Set<String> COMPARISON_OPERATORS = Set.of(
            "==", "!=", "===", "!==", "<", "<=", ">", ">=", "instanceof", "in");

    private static final Set<String> INDEX_WORDS = Set.of("index", "length", "size", "count");

    private static final Set<String> INDEX_NAMES = Set.of("i", "j", "n");

    private static final Set<String> BYTE_ARRAY_WORDS = Set.of(
            "key", "data", "input", "output", "block", "buffer", "bytes", "state");

    private TypeInferrer() {
    }

    /**
     * Infers the type of a declared variable, field or parameter.
     *
     * @param name        declared name (for the heuristic), may be null
     * @param annotation  explicit annotation, may be null
     * @param initializer initializer expression, may be null
     * @param symbols     environment for symbol lookups, may be null
     * @return never null
     */
    public static TypeDescriptor inferDeclaration(String name, String annotation, IlNode initializer,
                                                  SymbolEnvironment symbols) {
        TypeDescriptor annotated = TypeDescriptor.parse(annotation);
        if (annotated != null) {
            return annotated;
        }
        if (initializer != null) {
            TypeDescriptor attached = TypeDescriptor.parse(initializer.getResultType());
            if (attached != null) {
                return attached;
            }
            if (initializer.is(IlKind.LITERAL)) {
                TypeDescriptor literal = fromLiteral(initializer);
                if (literal != null) {
                    return literal;
                }
            } else {
                TypeDescriptor inferred = inferExpression(initializer, symbols);
                if (inferred != null) {
                    return inferred;
                }
            }
        }
        return fromName(name);
    }

    /**
     * Name heuristic. Byte-array words are checked before index words, so {@code keySize}
     * and {@code blockData} are both byte arrays while {@code roundCount} is an index.
     */
    public static TypeDescriptor fromName(String name) {
        if (name == null || name.isEmpty()) {
            return TypeDescriptor.UINT32;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (INDEX_NAMES.contains(lower)) {
            return TypeDescriptor.INT32;
        }
        for (String word : BYTE_ARRAY_WORDS) {
            if (lower.contains(word)) {
                return TypeDescriptor.BYTE_ARRAY;
            }
        }
        for (String word : INDEX_WORDS) {
            if (lower.contains(word)) {
                return TypeDescriptor.INT32;
            }
        }
        return TypeDescriptor.UINT32;
    }

    /**
     * Type of a literal node, or null for {@code null} literals.
     */
    public static TypeDescriptor fromLiteral(IlNode literal) {
        Object value = literal.value("value");
        if (value instanceof Boolean) {
            return TypeDescriptor.BOOL;
        }
        if (value instanceof String) {
            return TypeDescriptor.STRING;
        }
        if (value instanceof BigDecimal) {
            BigDecimal number = (BigDecimal) value;
            if (number.stripTrailingZeros().scale() > 0) {
                return TypeDescriptor.FLOAT64;
            }
            if (number.signum() >= 0) {
                return number.compareTo(BigDecimal.valueOf(UINT32_MAX)) > 0
                        ? TypeDescriptor.UINT64
                        : TypeDescriptor.UINT32;
            }
            return number.compareTo(BigDecimal.valueOf(Integer.MIN_VALUE)) < 0
                    ? TypeDescriptor.INT64
                    : TypeDescriptor.INT32;
        }
        return null;
    }

    /**
     * Infers the type of an expression.
     *
     * @return the type, or null when it cannot be determined
     */
    public static TypeDescriptor inferExpression(IlNode node, SymbolEnvironment symbols) {
        if (node == null) {
            return null;
        }
        TypeDescriptor attached = TypeDescriptor.parse(node.getResultType());
        if (attached != null) {
            return attached;
        }

        return switch (node.getKind()) {
            case LITERAL -> fromLiteral(node);
            case TEMPLATE_LITERAL, HEX_ENCODE, BYTES_TO_STRING, STRING_FROM_CHAR_CODE -> TypeDescriptor.STRING;
            case IDENTIFIER -> symbolType(symbols == null ? null : symbols.lookup(node.name()));
            case THIS_PROPERTY_ACCESS -> symbolType(symbols == null ? null : symbols.lookupMember(node.text("property")));
            case MEMBER_EXPRESSION -> inferMember(node, symbols);
            case BINARY_EXPRESSION -> inferBinary(node, symbols);
            case LOGICAL_EXPRESSION, IS_ARRAY_CHECK -> TypeDescriptor.BOOL;
            case UNARY_EXPRESSION -> inferUnary(node, symbols);
            case UPDATE_EXPRESSION -> inferExpression(node.node("argument"), symbols);
            case ASSIGNMENT_EXPRESSION -> inferExpression(node.node("right"), symbols);
            case CONDITIONAL_EXPRESSION -> firstKnown(
                    inferExpression(node.node("consequent"), symbols),
                    inferExpression(node.node("alternate"), symbols));
            case SEQUENCE_EXPRESSION -> lastOf(node.nodes("expressions"), symbols);
            case CHAIN_EXPRESSION -> inferExpression(node.node("expression"), symbols);
            case ARRAY_EXPRESSION -> inferArrayLiteral(node, symbols);
            case NEW_EXPRESSION -> inferNew(node);
            case CALL_EXPRESSION -> inferCall(node, symbols);
            case THIS_METHOD_CALL -> symbolType(symbols == null ? null : symbols.lookupMember(node.text("method")));
            case ROTATE_LEFT, ROTATE_RIGHT, PACK_BYTES -> TypeDescriptor.unsignedOfWidth(node.number("bits", 32));
            case UNPACK_BYTES, XOR_ARRAYS, HEX_DECODE, STRING_TO_BYTES -> TypeDescriptor.BYTE_ARRAY;
            case ARRAY_SLICE, ARRAY_CONCAT, ARRAY_SPLICE -> inferExpression(node.node("array"), symbols);
            case ARRAY_LENGTH, ARRAY_INDEX_OF -> TypeDescriptor.INT32;
            case ARRAY_CREATION -> TypeDescriptor.arrayOf(
                    firstKnown(TypeDescriptor.parse(node.text("elementType")), TypeDescriptor.UINT8));
            case STRING_CHAR_CODE_AT -> TypeDescriptor.UINT8;
            case CAST -> TypeDescriptor.parse(node.text("targetType"));
            case POWER -> TypeDescriptor.FLOAT64;
            case MATH_CALL -> inferMathCall(node, symbols);
            case OPCODES_CALL -> inferExpression(OpCodesNormalizer.normalize(node), symbols);
            case FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> TypeDescriptor.ANY;
            case OBJECT_EXPRESSION, ERROR_CREATION -> null;
            case PROGRAM, FUNCTION_DECLARATION, CLASS_DECLARATION, VARIABLE_DECLARATION, VARIABLE_DECLARATOR,
                 METHOD_DEFINITION, PROPERTY_DEFINITION, STATIC_BLOCK, ASSIGNMENT_PATTERN, BLOCK_STATEMENT,
                 EXPRESSION_STATEMENT, RETURN_STATEMENT, IF_STATEMENT, FOR_STATEMENT, FOR_OF_STATEMENT,
                 FOR_IN_STATEMENT, WHILE_STATEMENT, DO_WHILE_STATEMENT, SWITCH_STATEMENT, SWITCH_CASE,
                 BREAK_STATEMENT, CONTINUE_STATEMENT, THROW_STATEMENT, TRY_STATEMENT, CATCH_CLAUSE,
                 EMPTY_STATEMENT, TEMPLATE_ELEMENT, PROPERTY, THIS_EXPRESSION, SUPER, SPREAD_ELEMENT,
                 PARENT_CONSTRUCTOR_CALL, PARENT_METHOD_CALL, ARRAY_CLEAR, ARRAY_FILL, ARRAY_PUSH,
                 UNKNOWN -> null;
        };
    }

    private static TypeDescriptor inferMember(IlNode node, SymbolEnvironment symbols) {
        IlNode object = node.node("object");
        IlNode property = node.node("property");
        if (node.flag("computed")) {
            TypeDescriptor container = inferExpression(object, symbols);
            if (container != null && container.isArray()) {
                return container.getElementType();
            }
            if (container != null && container.isString()) {
                return TypeDescriptor.STRING;
            }
            return null;
        }
        if (property != null && property.isIdentifier("length")) {
            return TypeDescriptor.INT32;
        }
        if (object != null && object.is(IlKind.THIS_EXPRESSION) && property != null && symbols != null) {
            return symbolType(symbols.lookupMember(property.name()));
        }
        return null;
    }

    private static TypeDescriptor inferBinary(IlNode node, SymbolEnvironment symbols) {
        String operator = node.text("operator", "");
        if (COMPARISON_OPERATORS.contains(operator)) {
            return TypeDescriptor.BOOL;
        }
        TypeDescriptor left = inferExpression(node.node("left"), symbols);
        TypeDescriptor right = inferExpression(node.node("right"), symbols);
        if ("+".equals(operator) && (isString(left) || isString(right))) {
            return TypeDescriptor.STRING;
        }
        if (">>>".equals(operator)) {
            return left != null && left.getBits() == 64 ? TypeDescriptor.UINT64 : TypeDescriptor.UINT32;
        }
        if ("/".equals(operator) && (isFloating(left) || isFloating(right))) {
            return TypeDescriptor.FLOAT64;
        }
        if (left != null && left.isNumeric()) {
            if (right != null && right.isNumeric() && right.getBits() > left.getBits()
                    && !"<<".equals(operator) && !">>".equals(operator)) {
                return right;
            }
            return left;
        }
        if (right != null && right.isNumeric()) {
            return right;
        }
        return null;
    }

    private static TypeDescriptor inferUnary(IlNode node, SymbolEnvironment symbols) {
        String operator = node.text("operator", "");
        return switch (operator) {
            case "!" -> TypeDescriptor.BOOL;
            case "typeof" -> TypeDescriptor.STRING;
            case "void" -> TypeDescriptor.VOID;
            case "~" -> firstKnown(inferExpression(node.node("argument"), symbols), TypeDescriptor.UINT32);
            default -> inferExpression(node.node("argument"), symbols);
        };
    }

    private static TypeDescriptor inferArrayLiteral(IlNode node, SymbolEnvironment symbols) {
        List<IlNode> elements = node.nodes("elements");
        if (elements.isEmpty()) {
            return null;
        }
        TypeDescriptor widest = null;
        for (IlNode element : elements) {
            TypeDescriptor type = inferExpression(element, symbols);
            if (type == null) {
                continue;
            }
            if (widest == null || (type.isNumeric() && widest.isNumeric() && type.getBits() > widest.getBits())) {
                widest = type;
            }
        }
        return widest != null ? TypeDescriptor.arrayOf(widest) : null;
    }

    private static TypeDescriptor inferNew(IlNode node) {
        IlNode callee = node.node("callee");
        String name = callee != null ? callee.name() : null;
        if (name == null) {
            return null;
        }
        if (name.equals("Array")) {
            return TypeDescriptor.arrayOf(TypeDescriptor.UINT32);
        }
        if (name.endsWith("Error")) {
            return null;
        }
        return TypeDescriptor.parse(name);
    }

    private static TypeDescriptor inferCall(IlNode node, SymbolEnvironment symbols) {
        IlNode callee = node.node("callee");
        if (callee == null || symbols == null) {
            return null;
        }
        if (callee.is(IlKind.IDENTIFIER)) {
            return symbolType(symbols.lookup(callee.name()));
        }
        if (callee.is(IlKind.MEMBER_EXPRESSION)) {
            IlNode object = callee.node("object");
            IlNode property = callee.node("property");
            if (object != null && object.is(IlKind.THIS_EXPRESSION) && property != null) {
                return symbolType(symbols.lookupMember(property.name()));
            }
            if (property != null && (property.isIdentifier("slice") || property.isIdentifier("concat"))) {
                return inferExpression(object, symbols);
            }
        }
        return null;
    }

    private static TypeDescriptor inferMathCall(IlNode node, SymbolEnvironment symbols) {
        String method = node.text("method", "");
        List<IlNode> args = node.nodes("arguments");
        TypeDescriptor first = args.isEmpty() ? null : inferExpression(args.get(0), symbols);
        return switch (method) {
            case "floor", "ceil", "round", "trunc" ->
                    first != null && first.isIntegral() ? first : TypeDescriptor.INT32;
            case "abs", "min", "max" -> firstKnown(first, TypeDescriptor.INT32);
            case "imul", "clz32", "sign" -> TypeDescriptor.INT32;
            default -> TypeDescriptor.FLOAT64;
        };
    }

    private static TypeDescriptor lastOf(List<IlNode> nodes, SymbolEnvironment symbols) {
        return nodes.isEmpty() ? null : inferExpression(nodes.get(nodes.size() - 1), symbols);
    }

    private static TypeDescriptor symbolType(SymbolInfo symbol) {
        return symbol != null ? symbol.getType() : null;
    }

    private static TypeDescriptor firstKnown(TypeDescriptor a, TypeDescriptor b) {
        return a != null ? a : b;
    }

    private static boolean isString(TypeDescriptor type) {
        return type != null && type.isString();
    }

    private static boolean isFloating(TypeDescriptor type) {
        return type != null && type.isFloating();
    }
}
