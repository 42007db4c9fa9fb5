package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.runtime.OpCodesNormalizer;
import me.christianrobert.ilcodegen.codegen.runtime.RuntimeHelper;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiNames;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiArrayLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAssignment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiExpressionStatement;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiFor;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIndex;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper lowering virtual instructions: RTL routines where Delphi has an equivalent,
 * otherwise a call into the runtime unit.
 *
 * <h3>Native lowerings:</h3>
 * <pre>
 * ArraySlice(a, s, e)      →   Copy(A, S, E - S)
 * ArraySlice(str, s)       →   Copy(Str, S + 1, MaxInt)
 * ArrayFill(a, v)          →   for FillIndex := 0 to High(A) do A[FillIndex] := V;
 * ArrayPush(a, x)          →   A := A + [X];
 * ArrayCreation(uint8, n)  →   SetLength(A, N);
 * StringCharCodeAt(s, i)   →   Ord(S[I + 1])
 * MathCall(floor, x)       →   Floor(X)
 * </pre>
 *
 * <h3>Runtime helpers:</h3>
 * <pre>
 * RotateLeft{bits: 32}               →   RotateLeft32(X, N)
 * PackBytes{bits: 32, endian: big}   →   Pack32BE(B0, B1, B2, B3)
 * UnpackBytes{bits: 32, endian: le}  →   Unpack32LE(Word)
 * ArraySplice                        →   ArraySplice(A, Start, Count, [Items])
 * </pre>
 */
public class VisitInstruction {

    // ========== Bit operations ==========

    public static DelphiNode rotate(IlNode node, DelphiCodeBuilder b) {
        List<IlNode> arguments = new ArrayList<>();
        arguments.add(node.node("value"));
        arguments.add(node.node("amount"));
        return b.helperCall(RuntimeHelper.rotate(node.number("bits", 32), node.is(IlKind.ROTATE_LEFT)), arguments);
    }

    public static DelphiNode pack(IlNode node, DelphiCodeBuilder b) {
        RuntimeHelper helper = RuntimeHelper.pack(node.number("bits", 32), isBigEndian(node));
        return b.helperCall(helper, node.nodes("arguments"));
    }

    public static DelphiNode unpack(IlNode node, DelphiCodeBuilder b) {
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

    public static DelphiNode slice(IlNode node, DelphiCodeBuilder b) {
        IlNode array = node.node("array");
        IlNode start = node.node("start");
        IlNode end = node.node("end");
        TypeDescriptor type = b.typeOf(array);
        DelphiNode source = b.visitExpression(array);

        if (start == null && end == null) {
            return DelphiCall.of("Copy", source);
        }
        DelphiNode from = start != null ? position(source, start, b) : DelphiLiteral.ZERO;
        DelphiNode count = end != null
                ? new DelphiBinary("-", position(source, end, b), from)
                : new DelphiIdentifier("MaxInt");
        if (type != null && type.isString()) {
            DelphiNode oneBased = start != null && !isNegative(start)
                    ? VisitMemberExpression.oneBased(start, b)
                    : new DelphiBinary("+", from, DelphiLiteral.ONE);
            return DelphiCall.of("Copy", source, oneBased, count);
        }
        return DelphiCall.of("Copy", source, from, count);
    }

    /**
     * Zero-based index; a negative literal counts from the end.
     */
    private static DelphiNode position(DelphiNode source, IlNode index, DelphiCodeBuilder b) {
        if (isNegative(index)) {
            return new DelphiBinary("-", DelphiCall.of("Length", source), b.visitExpression(index.node("argument")));
        }
        return b.visitExpression(index);
    }

    private static boolean isNegative(IlNode index) {
        return index.is(IlKind.UNARY_EXPRESSION) && "-".equals(index.text("operator"));
    }

    public static DelphiNode splice(IlNode node, DelphiCodeBuilder b) {
        List<DelphiNode> arguments = new ArrayList<>();
        arguments.add(b.visitExpression(node.node("array")));
        arguments.add(b.visitExpression(node.node("start")));
        IlNode deleteCount = node.node("deleteCount");
        arguments.add(deleteCount != null ? b.visitExpression(deleteCount) : new DelphiIdentifier("MaxInt"));
        arguments.add(new DelphiArrayLiteral(b.visitExpressions(node.nodes("items"))));
        return b.helperCallWith(RuntimeHelper.ARRAY_SPLICE, arguments);
    }

    /**
     * Dynamic arrays concatenate with {@code +}; scalar arguments are appended as one-element
     * arrays.
     */
    public static DelphiNode concat(IlNode node, DelphiCodeBuilder b) {
        DelphiNode result = b.visitExpression(node.node("array"));
        for (IlNode argument : node.nodes("arguments")) {
            TypeDescriptor type = b.typeOf(argument);
            DelphiNode value = b.visitExpression(argument);
            if (type == null || !type.isArray()) {
                value = new DelphiArrayLiteral(List.of(value));
            }
            result = new DelphiBinary("+", result, value);
        }
        return result;
    }

    public static DelphiNode pushStatement(IlNode node, DelphiCodeBuilder b) {
        DelphiNode target = b.visitExpression(node.node("array"));
        List<IlNode> items = node.nodes("arguments");
        if (items.size() == 1 && items.get(0).is(IlKind.SPREAD_ELEMENT)) {
            return new DelphiAssignment(target,
                    new DelphiBinary("+", target, b.visitExpression(items.get(0).node("argument"))));
        }
        return new DelphiAssignment(target, new DelphiBinary("+", target,
                new DelphiArrayLiteral(b.visitExpressions(items))));
    }

    public static DelphiNode fillStatement(IlNode node, DelphiCodeBuilder b) {
        DelphiNode target = b.visitExpression(node.node("array"));
        DelphiNode value = b.visitExpression(node.node("value"));
        String index = b.temporary("FillIndex", DelphiType.INTEGER);
        DelphiNode store = new DelphiAssignment(new DelphiIndex(target, new DelphiIdentifier(index)), value);
        return new DelphiFor(index, DelphiLiteral.ZERO, DelphiCall.of("High", target), false,
                new DelphiBlock(List.of(store)));
    }

    /**
     * {@code SetLength} for a sized array creation. Dynamic arrays keep their contents on
     * {@code SetLength}, so {@code target := nil} comes first when the target may hold an older
     * array.
     */
    static List<DelphiNode> arrayAssignment(DelphiNode target, IlNode creation, boolean resetArray,
                                            DelphiCodeBuilder b) {
        TypeDescriptor element = TypeDescriptor.parse(creation.text("elementType"));
        b.mapType(TypeDescriptor.arrayOf(element != null ? element : TypeDescriptor.UINT8));
        IlNode size = creation.node("size");
        List<DelphiNode> statements = new ArrayList<>();
        if (resetArray || size == null) {
            statements.add(new DelphiAssignment(target, DelphiLiteral.NIL));
        }
        if (size != null) {
            statements.add(DelphiCall.of("SetLength", target, b.visitExpression(size)));
        }
        return statements;
    }

    static DelphiNode asStatement(DelphiNode value) {
        return new DelphiExpressionStatement(value);
    }

    /**
     * Instructions that only exist as Pascal statements, met in expression position.
     */
    public static DelphiNode statementOnly(IlNode node, DelphiCodeBuilder b) {
        b.getContext().warn(node, node.getRawKind() + " is only supported as a statement");
        return b.placeholder(node.getRawKind());
    }

    // ========== Strings ==========

    public static DelphiNode fromCharCode(IlNode node, DelphiCodeBuilder b) {
        DelphiNode result = null;
        for (IlNode argument : node.nodes("arguments")) {
            DelphiNode character = DelphiCall.of("Chr", b.visitExpression(argument));
            result = result == null ? character : new DelphiBinary("+", result, character);
        }
        return result != null ? result : VisitLiteralExpression.stringLiteral("");
    }

    public static DelphiNode charCodeAt(IlNode node, DelphiCodeBuilder b) {
        IlNode index = node.node("index");
        DelphiNode position = index != null ? VisitMemberExpression.oneBased(index, b) : DelphiLiteral.ONE;
        return DelphiCall.of("Ord", new DelphiIndex(b.visitExpression(node.node("value")), position));
    }

    // ========== Conversions and library calls ==========

    public static DelphiNode cast(IlNode node, DelphiCodeBuilder b) {
        IlNode value = node.node("value");
        TypeDescriptor target = TypeDescriptor.parse(node.text("targetType"));
        if (target == null) {
            b.getContext().warn(node, "Cast without a target type");
            return b.visitExpression(value);
        }
        TypeDescriptor source = b.typeOf(value);
        if (target.equals(source)) {
            return b.visitExpression(value);
        }
        if (target.isString()) {
            return VisitLiteralExpression.stringified(value, b);
        }
        if (target.isIntegral() && source != null && source.isFloating()) {
            return DelphiCall.of("Trunc", b.visitExpression(value));
        }
        return DelphiCall.of(b.mapType(target).getName(), b.visitExpression(value));
    }

    public static DelphiNode opCodesCall(IlNode node, DelphiCodeBuilder b) {
        IlNode normalized = OpCodesNormalizer.normalize(node);
        if (normalized != null) {
            return b.visitExpression(normalized);
        }
        String method = node.text("method", "");
        b.getContext().warn(node, "Helper '" + method + "' has no lowering, emitted as a plain call");
        return new DelphiCall(new DelphiIdentifier(DelphiNames.routine(method)),
                b.visitExpressions(node.nodes("arguments")));
    }

    public static DelphiNode mathCall(IlNode node, DelphiCodeBuilder b) {
        String method = node.text("method", "");
        List<IlNode> arguments = node.nodes("arguments");
        IlNode first = arguments.isEmpty() ? null : arguments.get(0);
        IlNode second = arguments.size() > 1 ? arguments.get(1) : null;
        TypeDescriptor firstType = b.typeOf(first);

        switch (method) {
            case "floor", "ceil", "round", "trunc" -> {
                if (firstType != null && firstType.isIntegral()) {
                    // rounding an integer is the integer
                    return b.visitExpression(first);
                }
                return switch (method) {
                    case "floor" -> b.unitCall("Math", "Floor", b.visitExpression(first));
                    case "ceil" -> b.unitCall("Math", "Ceil", b.visitExpression(first));
                    case "round" -> DelphiCall.of("Round", b.visitExpression(first));
                    default -> DelphiCall.of("Trunc", b.visitExpression(first));
                };
            }
            case "min", "max" -> {
                List<DelphiNode> values = b.visitExpressions(arguments);
                if (values.isEmpty()) {
                    b.getContext().warn(node, "Math." + method + " without arguments");
                    return b.placeholder("Math." + method);
                }
                String routine = method.equals("min") ? "Min" : "Max";
                DelphiNode result = values.get(0);
                for (int i = 1; i < values.size(); i++) {
                    result = b.unitCall("Math", routine, result, values.get(i));
                }
                return result;
            }
            case "imul" -> {
                DelphiNode product = new DelphiBinary("*",
                        DelphiCall.of("Cardinal", b.visitExpression(first)),
                        DelphiCall.of("Cardinal", b.visitExpression(second)));
                return DelphiCall.of("Integer", product);
            }
            case "abs", "sqrt", "exp", "sin", "cos" -> {
                String routine = Character.toUpperCase(method.charAt(0)) + method.substring(1);
                return DelphiCall.of(routine, b.visitExpression(first));
            }
            case "log" -> {
                return DelphiCall.of("Ln", b.visitExpression(first));
            }
            case "atan" -> {
                return DelphiCall.of("ArcTan", b.visitExpression(first));
            }
            case "pow" -> {
                return power(first, second, b);
            }
            case "cbrt" -> {
                return b.unitCall("Math", "Power", b.visitExpression(first),
                        new DelphiBinary("/", DelphiLiteral.ONE, new DelphiLiteral("3")));
            }
            case "log2", "log10", "tan", "asin", "acos", "atan2", "hypot", "sign" -> {
                String routine = switch (method) {
                    case "log2" -> "Log2";
                    case "log10" -> "Log10";
                    case "tan" -> "Tan";
                    case "asin" -> "ArcSin";
                    case "acos" -> "ArcCos";
                    case "atan2" -> "ArcTan2";
                    case "hypot" -> "Hypot";
                    default -> "Sign";
                };
                return b.unitCall("Math", routine, b.visitExpressions(arguments).toArray(new DelphiNode[0]));
            }
            default -> {
                b.getContext().warn(node, "Unsupported Math function '" + method + "'");
                return b.placeholder("Math." + method);
            }
        }
    }

    public static DelphiNode power(IlNode left, IlNode right, DelphiCodeBuilder b) {
        return b.unitCall("Math", "Power", b.visitExpression(left), b.visitExpression(right));
    }

    /**
     * Resolved statically from the operand type.
     */
    public static DelphiNode isArray(IlNode node, DelphiCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node.node("value"));
        return type != null && type.isArray() ? DelphiLiteral.TRUE : DelphiLiteral.FALSE;
    }
}
