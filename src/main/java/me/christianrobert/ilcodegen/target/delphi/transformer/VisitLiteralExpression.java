package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiArrayLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Static helper for literals: scalars, template literals, array and object literals.
 *
 * <pre>
 * 0x9E3779B9        →   $9E3779B9
 * 0b1010            →   $A
 * 'it\'s\n'         →   'it''s'#10
 * `k=${k}`          →   'k=' + UIntToStr(K)
 * [1, 2, 3]         →   [1, 2, 3]
 * []                →   nil
 * null              →   nil
 * </pre>
 */
public class VisitLiteralExpression {

    public static DelphiNode literal(IlNode node, DelphiCodeBuilder b) {
        Object value = node.value("value");
        if (value == null) {
            return DelphiLiteral.NIL;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? DelphiLiteral.TRUE : DelphiLiteral.FALSE;
        }
        if (value instanceof String) {
            return stringLiteral((String) value);
        }
        if (value instanceof BigDecimal) {
            return new DelphiLiteral(number((BigDecimal) value, node.text("raw")));
        }
        b.getContext().warn(node, "Unrecognized literal value");
        return b.placeholder("literal");
    }

    static String number(BigDecimal value, String raw) {
        if (value.stripTrailingZeros().scale() > 0) {
            return value.toPlainString();
        }
        BigInteger integer = value.toBigIntegerExact();
        if (raw != null) {
            String lower = raw.replace("_", "").toLowerCase(Locale.ROOT);
            if (lower.startsWith("0x")) {
                return "$" + lower.substring(2).toUpperCase(Locale.ROOT);
            }
            if (lower.startsWith("0b")) {
                return "$" + integer.toString(16).toUpperCase(Locale.ROOT);
            }
        }
        return integer.toString();
    }

    /**
     * A Pascal string literal: quotes doubled, control characters as {@code #N} outside the
     * quotes.
     */
    public static DelphiLiteral stringLiteral(String value) {
        if (value.isEmpty()) {
            return new DelphiLiteral("''");
        }
        StringBuilder sb = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                if (quoted) {
                    sb.append('\'');
                    quoted = false;
                }
                sb.append('#').append((int) c);
                continue;
            }
            if (!quoted) {
                sb.append('\'');
                quoted = true;
            }
            sb.append(c == '\'' ? "''" : String.valueOf(c));
        }
        if (quoted) {
            sb.append('\'');
        }
        return new DelphiLiteral(sb.toString());
    }

    public static DelphiNode template(IlNode node, DelphiCodeBuilder b) {
        List<IlNode> quasis = node.nodes("quasis");
        List<IlNode> expressions = node.nodes("expressions");

        List<DelphiNode> parts = new ArrayList<>();
        for (int i = 0; i < quasis.size(); i++) {
            String text = quasis.get(i).text("value", "");
            if (!text.isEmpty()) {
                parts.add(stringLiteral(text));
            }
            if (i < expressions.size()) {
                parts.add(stringified(expressions.get(i), b));
            }
        }
        if (parts.isEmpty()) {
            return stringLiteral("");
        }
        DelphiNode result = parts.get(0);
        for (int i = 1; i < parts.size(); i++) {
            result = new DelphiBinary("+", result, parts.get(i));
        }
        return result;
    }

    /**
     * An expression as a string: numbers and booleans go through the SysUtils conversion
     * routines, everything else is taken as a string already.
     */
    static DelphiNode stringified(IlNode expression, DelphiCodeBuilder b) {
        return stringify(b.visitExpression(expression), b.typeOf(expression), b);
    }

    static DelphiNode stringify(DelphiNode value, TypeDescriptor type, DelphiCodeBuilder b) {
        if (type == null || type.isString()) {
            return value;
        }
        if (type.isBool()) {
            return b.unitCall("SysUtils", "BoolToStr", value, DelphiLiteral.TRUE);
        }
        if (type.isFloating()) {
            return b.unitCall("SysUtils", "FloatToStr", value);
        }
        if (type.isIntegral()) {
            return b.unitCall("SysUtils", type.isSigned() ? "IntToStr" : "UIntToStr", value);
        }
        return value;
    }

    public static DelphiNode array(IlNode node, DelphiCodeBuilder b) {
        List<IlNode> source = node.nodes("elements");
        if (source.isEmpty()) {
            return DelphiLiteral.NIL;
        }
        List<DelphiNode> elements = new ArrayList<>();
        for (IlNode element : source) {
            // holes become zero
            elements.add(element != null ? b.visitExpression(element) : DelphiLiteral.ZERO);
        }
        return new DelphiArrayLiteral(elements);
    }

    /**
     * Object literals have no structural equivalent in a unit without record declarations.
     */
    public static DelphiNode object(IlNode node, DelphiCodeBuilder b) {
        b.getContext().warn(node, "Object literal not supported");
        return b.placeholder("object literal");
    }
}
