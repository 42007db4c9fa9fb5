package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for literals: scalars, template literals, array and object literals.
 *
 * <h3>Numbers</h3>
 * <p>Hexadecimal and binary spellings are kept. Integers above {@code INT32_MAX} get a {@code u}
 * suffix, above {@code UINT32_MAX} an {@code ULL} suffix, so the constant keeps its unsigned
 * meaning in expressions.</p>
 * <pre>
 * 0x9E3779B9        →   0x9E3779B9u
 * 0x100000000       →   0x100000000ULL
 * 'abc'             →   "abc"
 * `k=${k}`          →   std::string("k=") + std::to_string(k)
 * [1, 2, 3]         →   std::vector&lt;uint32_t&gt;{1, 2, 3}
 * null              →   {}
 * </pre>
 */
public class VisitLiteralExpression {

    private static final BigInteger INT32_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
    private static final BigInteger UINT32_MAX = BigInteger.valueOf(0xFFFFFFFFL);

    public static CppNode literal(IlNode node, CppCodeBuilder b) {
        Object value = node.value("value");
        if (value == null) {
            return new CppLiteral("{}");
        }
        if (value instanceof Boolean) {
            return new CppLiteral(value.toString());
        }
        if (value instanceof String) {
            return new CppLiteral(stringLiteral((String) value));
        }
        if (value instanceof BigDecimal) {
            return new CppLiteral(number((BigDecimal) value, node.text("raw")));
        }
        b.getContext().warn(node, "Unrecognized literal value");
        return b.placeholder("literal");
    }

    static String number(BigDecimal value, String raw) {
        BigDecimal stripped = value.stripTrailingZeros();
        if (stripped.scale() > 0) {
            return value.toPlainString();
        }
        BigInteger integer = value.toBigIntegerExact();
        String text = integer.toString();
        if (raw != null) {
            String lower = raw.replace("_", "").toLowerCase(Locale.ROOT);
            if (lower.startsWith("0x") || lower.startsWith("0b")) {
                text = raw.replace("_", "");
            }
        }
        if (integer.compareTo(UINT32_MAX) > 0) {
            return text + "ULL";
        }
        if (integer.compareTo(INT32_MAX) > 0) {
            return text + "u";
        }
        return text;
    }

    public static String stringLiteral(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            sb.append(c == '"' ? "\\\"" : escape(c));
        }
        return sb.append('"').toString();
    }

    public static String charLiteral(char c) {
        return "'" + (c == '\'' ? "\\'" : c == '"' ? "\"" : escape(c)) + "'";
    }

    private static String escape(char c) {
        return switch (c) {
            case '\\' -> "\\\\";
            case '\n' -> "\\n";
            case '\r' -> "\\r";
            case '\t' -> "\\t";
            case '\0' -> "\\0";
            default -> c < 0x20 || c == 0x7F ? String.format("\\%03o", (int) c) : String.valueOf(c);
        };
    }

    public static CppNode template(IlNode node, CppCodeBuilder b) {
        b.include("string");
        List<IlNode> quasis = node.nodes("quasis");
        List<IlNode> expressions = node.nodes("expressions");

        List<CppNode> parts = new ArrayList<>();
        for (int i = 0; i < quasis.size(); i++) {
            String text = quasis.get(i).text("value", "");
            if (!text.isEmpty()) {
                parts.add(new CppLiteral(stringLiteral(text)));
            }
            if (i < expressions.size()) {
                parts.add(stringified(expressions.get(i), b));
            }
        }
        if (parts.isEmpty()) {
            return new CppObjectCreation(CppType.STRING, List.of(), false);
        }

        // the first operand must be a std::string so that + concatenates
        CppNode result = parts.get(0);
        if (result.getKind() == CppNodeKind.LITERAL) {
            result = new CppObjectCreation(CppType.STRING, List.of(result), false);
        }
        for (int i = 1; i < parts.size(); i++) {
            result = new CppBinary("+", result, parts.get(i));
        }
        return result;
    }

    /**
     * An expression as a {@code std::string}: numbers and booleans go through
     * {@code std::to_string}, everything else is taken as a string already.
     */
    static CppNode stringified(IlNode expression, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(expression);
        CppNode value = b.visitExpression(expression);
        if (type != null && (type.isNumeric() || type.isBool())) {
            return b.stdCall("string", "to_string", List.of(value));
        }
        if (type == null || !type.isString()) {
            return new CppObjectCreation(CppType.STRING, List.of(value), false);
        }
        return value;
    }

    public static CppNode array(IlNode node, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node);
        if (type == null || !type.isArray()) {
            type = TypeDescriptor.arrayOf(TypeDescriptor.UINT32);
        }
        List<CppNode> elements = new ArrayList<>();
        for (IlNode element : node.nodes("elements")) {
            // holes become zero
            elements.add(element != null ? b.visitExpression(element) : new CppLiteral("0"));
        }
        return new CppInitializerList(b.mapType(type), elements);
    }

    /**
     * Object literals have no structural equivalent; the property values become a brace list
     * in declaration order.
     */
    public static CppNode object(IlNode node, CppCodeBuilder b) {
        b.getContext().warn(node, "Object literal lowered to a brace initializer");
        List<CppNode> values = new ArrayList<>();
        for (IlNode property : node.nodes("properties")) {
            if (property == null || !property.is(IlKind.PROPERTY)) {
                b.getContext().unsupported(property);
                continue;
            }
            values.add(b.visitExpression(property.node("value")));
        }
        return new CppInitializerList(null, values);
    }
}
