package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.runtime.OpCodesNormalizer;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.config.CodegenOptions;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCast;
import me.christianrobert.ilcodegen.target.cpp.ast.CppElementAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppInitializerList;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper lowering virtual instructions: native C++ where the standard library has an
 * equivalent, otherwise a call into the runtime header.
 *
 * <h3>Native lowerings:</h3>
 * <pre>
 * RotateLeft{bits: 32}     →   std::rotl(x, n)                 (C++20, else rotateLeft32(x, n))
 * ArraySlice(a, s, e)      →   std::vector&lt;T&gt;(a.begin() + s, a.begin() + e)
 * ArrayFill(a, v)          →   std::fill(a.begin(), a.end(), v)
 * ArrayPush(a, x)          →   a.push_back(x)
 * ArrayCreation(uint8, n)  →   std::vector&lt;uint8_t&gt;(n)
 * StringCharCodeAt(s, i)   →   static_cast&lt;uint8_t&gt;(s[i])
 * MathCall(floor, x)       →   static_cast&lt;int32_t&gt;(std::floor(x))
 * </pre>
 *
 * <h3>Runtime helpers:</h3>
 * <pre>
 * PackBytes{bits: 32, endian: big}   →   pack32BE(b0, b1, b2, b3)
 * UnpackBytes{bits: 32, endian: le}  →   unpack32LE(word)
 * ArraySplice / ArrayConcat          →   arraySplice(..) / arrayConcat(..)
 * </pre>
 */
public class VisitInstruction {

    // ========== Bit operations ==========

    public static CppNode rotate(IlNode node, CppCodeBuilder b) {
        int bits = node.number("bits", 32);
        boolean left = node.is(IlKind.ROTATE_LEFT);
        IlNode valueNode = node.node("value");

        if (b.getOptions().getInt(CodegenOptions.CPP_STANDARD) >= 20) {
            TypeDescriptor expected = TypeDescriptor.unsignedOfWidth(bits);
            CppNode value = b.visitExpression(valueNode);
            if (!expected.equals(b.typeOf(valueNode))) {
                // std::rotl only accepts unsigned integer types of the exact width
                value = new CppCast(b.mapType(expected), value);
            }
            return b.stdCall("bit", left ? "rotl" : "rotr", List.of(value, b.visitExpression(node.node("amount"))));
        }
        List<IlNode> arguments = new ArrayList<>();
        arguments.add(valueNode);
        arguments.add(node.node("amount"));
        return b.helperCall(RuntimeHelper.rotate(bits, left), arguments);
    }

    public static CppNode pack(IlNode node, CppCodeBuilder b) {
        RuntimeHelper helper = RuntimeHelper.pack(node.number("bits", 32), isBigEndian(node));
        return b.helperCall(helper, node.nodes("arguments"));
    }

    public static CppNode unpack(IlNode node, CppCodeBuilder b) {
        RuntimeHelper helper = RuntimeHelper.unpack(node.number("bits", 32), isBigEndian(node));
        List<IlNode> arguments = new ArrayList<>();
        arguments.add(node.node("value"));
        return b.helperCall(helper, arguments);
    }

    private static boolean isBigEndian(IlNode node) {
        String endian = node.text("endian", "big");
        return !endian.equalsIgnoreCase("little") && !endian.equalsIgnoreCase("le");
    }

    // ========== Arrays ==========

    public static CppNode slice(IlNode node, CppCodeBuilder b) {
        IlNode array = node.node("array");
        IlNode start = node.node("start");
        IlNode end = node.node("end");
        TypeDescriptor type = b.typeOf(array);

        if (type != null && type.isString()) {
            List<CppNode> arguments = new ArrayList<>();
            arguments.add(start != null ? b.visitExpression(start) : new CppLiteral("0"));
            if (end != null) {
                arguments.add(new CppBinary("-", b.visitExpression(end),
                        start != null ? b.visitExpression(start) : new CppLiteral("0")));
            }
            return b.methodCall(b.visitExpression(array), "substr", arguments);
        }

        CppNode source = b.visitExpression(array);
        if (start == null && end == null) {
            // a copy: value semantics already copy
            return source;
        }
        CppType vector = b.mapType(type != null && type.isArray() ? type : TypeDescriptor.BYTE_ARRAY);
        CppNode from = start != null ? position(source, start, b) : b.methodCall(source, "begin", List.of());
        CppNode to = end != null ? position(source, end, b) : b.methodCall(source, "end", List.of());
        return new CppObjectCreation(vector, List.of(from, to), false);
    }

    /**
     * Iterator for an index; negative literal indices count from the end.
     */
    private static CppNode position(CppNode source, IlNode index, CppCodeBuilder b) {
        if (index.is(IlKind.UNARY_EXPRESSION) && "-".equals(index.text("operator"))) {
            return new CppBinary("-", b.methodCall(source, "end", List.of()),
                    b.visitExpression(index.node("argument")));
        }
        return new CppBinary("+", b.methodCall(source, "begin", List.of()), b.visitExpression(index));
    }

    public static CppNode splice(IlNode node, CppCodeBuilder b) {
        List<IlNode> arguments = new ArrayList<>();
        arguments.add(node.node("array"));
        arguments.add(node.node("start"));
        arguments.add(node.node("deleteCount"));
        arguments.addAll(node.nodes("items"));
        return b.helperCall(RuntimeHelper.ARRAY_SPLICE, arguments);
    }

    public static CppNode fill(IlNode array, CppNode value, CppCodeBuilder b) {
        CppNode target = b.visitExpression(array);
        return b.stdCall("algorithm", "fill", List.of(
                b.methodCall(target, "begin", List.of()), b.methodCall(target, "end", List.of()), value));
    }

    public static CppNode length(IlNode array, CppCodeBuilder b) {
        return b.methodCall(b.visitExpression(array), "size", List.of());
    }

    public static CppNode concat(IlNode node, CppCodeBuilder b) {
        List<IlNode> arguments = new ArrayList<>();
        arguments.add(node.node("array"));
        arguments.addAll(node.nodes("arguments"));
        return b.helperCall(RuntimeHelper.ARRAY_CONCAT, arguments);
    }

    public static CppNode push(IlNode node, CppCodeBuilder b) {
        return push(node.node("array"), node.nodes("arguments"), b);
    }

    static CppNode push(IlNode array, List<IlNode> items, CppCodeBuilder b) {
        CppNode target = b.visitExpression(array);
        if (items.size() == 1 && items.get(0) != null && items.get(0).is(IlKind.SPREAD_ELEMENT)) {
            CppNode source = b.visitExpression(items.get(0).node("argument"));
            return b.methodCall(target, "insert", List.of(b.methodCall(target, "end", List.of()),
                    b.methodCall(source, "begin", List.of()), b.methodCall(source, "end", List.of())));
        }
        if (items.size() == 1) {
            return b.methodCall(target, "push_back", b.visitExpressions(items));
        }
        return b.methodCall(target, "insert", List.of(b.methodCall(target, "end", List.of()),
                new CppInitializerList(null, b.visitExpressions(items))));
    }

    public static CppNode arrayCreation(IlNode node, CppCodeBuilder b) {
        TypeDescriptor element = TypeDescriptor.parse(node.text("elementType"));
        CppType vector = b.mapType(TypeDescriptor.arrayOf(element != null ? element : TypeDescriptor.UINT8));
        IlNode size = node.node("size");
        if (size == null) {
            return new CppInitializerList(vector, List.of());
        }
        return new CppObjectCreation(vector, List.of(b.visitExpression(size)), false);
    }

    // ========== Strings ==========

    public static CppNode fromCharCode(IlNode node, CppCodeBuilder b) {
        b.include("string");
        List<CppNode> chars = new ArrayList<>();
        for (IlNode argument : node.nodes("arguments")) {
            chars.add(new CppCast(CppType.of("char"), b.visitExpression(argument)));
        }
        if (chars.size() == 1) {
            return new CppObjectCreation(CppType.STRING, List.of(new CppLiteral("1"), chars.get(0)), false);
        }
        return new CppObjectCreation(CppType.STRING, chars, true);
    }

    public static CppNode charCodeAt(IlNode node, CppCodeBuilder b) {
        IlNode index = node.node("index");
        CppNode character = new CppElementAccess(b.visitExpression(node.node("value")),
                index != null ? b.visitExpression(index) : new CppLiteral("0"));
        return new CppCast(CppType.UINT8, character);
    }

    // ========== Conversions and library calls ==========

    public static CppNode cast(IlNode node, CppCodeBuilder b) {
        IlNode value = node.node("value");
        TypeDescriptor target = TypeDescriptor.parse(node.text("targetType"));
        if (target == null) {
            b.getContext().warn(node, "Cast without a target type");
            return b.visitExpression(value);
        }
        CppNode operand = b.visitExpression(value);
        if (target.equals(b.typeOf(value))) {
            return operand;
        }
        return new CppCast(b.mapType(target), operand);
    }

    public static CppNode opCodesCall(IlNode node, CppCodeBuilder b) {
        IlNode normalized = OpCodesNormalizer.normalize(node);
        if (normalized != null) {
            return b.visitExpression(normalized);
        }
        String method = node.text("method", "");
        b.getContext().warn(node, "Helper '" + method + "' has no lowering, emitted as a plain call");
        return new CppCall(new CppIdentifier(CppNames.function(method)), b.visitExpressions(node.nodes("arguments")));
    }

    public static CppNode mathCall(IlNode node, CppCodeBuilder b) {
        String method = node.text("method", "");
        List<IlNode> arguments = node.nodes("arguments");
        IlNode first = arguments.isEmpty() ? null : arguments.get(0);
        TypeDescriptor firstType = b.typeOf(first);

        switch (method) {
            case "floor", "ceil", "round", "trunc" -> {
                if (firstType != null && firstType.isIntegral()) {
                    // rounding an integer is the integer
                    return b.visitExpression(first);
                }
                return new CppCast(CppType.INT32, b.stdCall("cmath", method, b.visitExpressions(arguments)));
            }
            case "min", "max" -> {
                if (arguments.size() == 2) {
                    return b.stdCall("algorithm", method, b.visitExpressions(arguments));
                }
                return b.stdCall("algorithm", method,
                        List.of(new CppInitializerList(null, b.visitExpressions(arguments))));
            }
            case "imul" -> {
                CppNode product = new CppBinary("*",
                        new CppCast(CppType.UINT32, b.visitExpression(first)),
                        new CppCast(CppType.UINT32, b.visitExpression(arguments.size() > 1 ? arguments.get(1) : null)));
                return new CppCast(CppType.INT32, product);
            }
            case "clz32" -> {
                if (b.getOptions().getInt(CodegenOptions.CPP_STANDARD) >= 20) {
                    return new CppCast(CppType.INT32, b.stdCall("bit", "countl_zero",
                            List.of(new CppCast(CppType.UINT32, b.visitExpression(first)))));
                }
                b.getContext().warn(node, "Math.clz32 needs C++20");
                return b.placeholder("Math.clz32");
            }
            case "abs", "sqrt", "cbrt", "pow", "exp", "log", "log2", "log10", "sin", "cos", "tan",
                 "asin", "acos", "atan", "atan2", "hypot" -> {
                return b.stdCall("cmath", method, b.visitExpressions(arguments));
            }
            default -> {
                b.getContext().warn(node, "Unsupported Math function '" + method + "'");
                return b.placeholder("Math." + method);
            }
        }
    }

    public static CppNode power(IlNode left, IlNode right, CppCodeBuilder b) {
        return b.stdCall("cmath", "pow", List.of(b.visitExpression(left), b.visitExpression(right)));
    }

    /**
     * Resolved statically from the operand type.
     */
    public static CppNode isArray(IlNode node, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node.node("value"));
        return new CppLiteral(type != null && type.isArray() ? "true" : "false");
    }
}
