package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.ClassMembers;
import me.christianrobert.ilcodegen.codegen.context.SymbolInfo;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppNames;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppAssignment;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCall;
import me.christianrobert.ilcodegen.target.cpp.ast.CppCast;
import me.christianrobert.ilcodegen.target.cpp.ast.CppConditional;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppMemberAccess;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppObjectCreation;
import me.christianrobert.ilcodegen.target.cpp.ast.CppUnary;

import java.util.List;
import java.util.Map;

/**
 * Static helper for operator expressions.
 *
 * <h3>Operator mapping:</h3>
 * <pre>
 * a === b          →   a == b
 * x &gt;&gt;&gt; 0          →   static_cast&lt;uint32_t&gt;(x)
 * x &gt;&gt;&gt; n          →   x &gt;&gt; n               (signed x is cast to unsigned first)
 * a ** b           →   std::pow(a, b)
 * f % g  (floats)  →   std::fmod(f, g)
 * "n=" + n         →   std::string("n=") + std::to_string(n)
 * buf == null      →   buf.empty()
 * a, b             →   a, b
 * </pre>
 *
 * <h3>Assignments:</h3>
 * <pre>
 * this.size = n    →   this-&gt;set_size(n)      (accessor property)
 * out.length = n   →   out.resize(n)
 * x &gt;&gt;&gt;= 1         →   x &gt;&gt;= 1
 * x **= 2          →   x = std::pow(x, 2)
 * </pre>
 */
public class VisitOperatorExpression {

    private static final Map<String, String> EQUALITY = Map.of(
            "===", "==",
            "!==", "!=",
            "==", "==",
            "!=", "!=");

    public static CppNode binary(IlNode node, CppCodeBuilder b) {
        String operator = node.text("operator", "");
        IlNode left = node.node("left");
        IlNode right = node.node("right");

        // STEP 1: Equality, including comparisons with null
        if (EQUALITY.containsKey(operator)) {
            String cppOperator = EQUALITY.get(operator);
            if (isNullish(right)) {
                return nullComparison(left, cppOperator, b);
            }
            if (isNullish(left)) {
                return nullComparison(right, cppOperator, b);
            }
            return new CppBinary(cppOperator, b.visitExpression(left), b.visitExpression(right));
        }

        // STEP 2: Operators with a different spelling
        switch (operator) {
            case ">>>" -> {
                return unsignedShift(left, right, b);
            }
            case "**" -> {
                return VisitInstruction.power(left, right, b);
            }
            case "%" -> {
                if (isFloating(left, b) || isFloating(right, b)) {
                    return b.stdCall("cmath", "fmod", List.of(b.visitExpression(left), b.visitExpression(right)));
                }
            }
            case "+" -> {
                if (isString(left, b) || isString(right, b)) {
                    return concatenation(left, right, b);
                }
            }
            case "in", "instanceof" -> {
                b.getContext().warn(node, "Operator '" + operator + "' has no C++ equivalent");
                return b.placeholder(operator);
            }
            default -> {
            }
        }

        return new CppBinary(operator, b.visitExpression(left), b.visitExpression(right));
    }

    private static CppNode unsignedShift(IlNode left, IlNode right, CppCodeBuilder b) {
        TypeDescriptor leftType = b.typeOf(left);
        CppType unsigned = b.mapType(leftType != null && leftType.getBits() == 64
                ? TypeDescriptor.UINT64 : TypeDescriptor.UINT32);
        CppNode value = b.visitExpression(left);

        // x >>> 0 only reinterprets as unsigned
        if (right != null && right.isNumericLiteral() && right.number("value", -1) == 0) {
            return new CppCast(unsigned, value);
        }
        if (leftType == null || leftType.isSigned()) {
            value = new CppCast(unsigned, value);
        }
        return new CppBinary(">>", value, b.visitExpression(right));
    }

    private static CppNode concatenation(IlNode left, IlNode right, CppCodeBuilder b) {
        b.include("string");
        CppNode first = VisitLiteralExpression.stringified(left, b);
        if (left != null && left.is(IlKind.LITERAL) && first instanceof CppLiteral) {
            first = new CppObjectCreation(CppType.STRING, List.of(first), false);
        }
        CppNode second = isString(right, b) ? b.visitExpression(right) : VisitLiteralExpression.stringified(right, b);
        return new CppBinary("+", first, second);
    }

    private static CppNode nullComparison(IlNode value, String operator, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(value);
        CppNode target = b.visitExpression(value);
        if (type != null && (type.isArray() || type.isString())) {
            CppNode empty = b.methodCall(target, "empty", List.of());
            return operator.equals("==") ? empty : new CppUnary("!", empty, true);
        }
        b.getContext().warn(value, "Comparison with null on a value type");
        return new CppBinary(operator, target, new CppLiteral("nullptr"));
    }

    private static boolean isNullish(IlNode node) {
        return node != null && ((node.is(IlKind.LITERAL) && node.value("value") == null)
                || node.isIdentifier("undefined"));
    }

    public static CppNode logical(IlNode node, CppCodeBuilder b) {
        String operator = node.text("operator", "");
        if (operator.equals("??")) {
            b.getContext().warn(node, "Nullish coalescing reduced to its left operand");
            return b.visitExpression(node.node("left"));
        }
        return new CppBinary(operator, b.visitExpression(node.node("left")), b.visitExpression(node.node("right")));
    }

    public static CppNode unary(IlNode node, CppCodeBuilder b) {
        String operator = node.text("operator", "");
        IlNode argument = node.node("argument");
        return switch (operator) {
            case "!", "-", "~" -> new CppUnary(operator, b.visitExpression(argument), true);
            // numeric coercion
            case "+" -> b.visitExpression(argument);
            default -> {
                b.getContext().warn(node, "Unary operator '" + operator + "' has no C++ equivalent");
                yield b.placeholder(operator);
            }
        };
    }

    public static CppNode update(IlNode node, CppCodeBuilder b) {
        return new CppUnary(node.text("operator", "++"), b.visitExpression(node.node("argument")),
                node.flag("prefix"));
    }

    public static CppNode assignment(IlNode node, CppCodeBuilder b) {
        String operator = node.text("operator", "=");
        IlNode left = node.node("left");
        IlNode right = node.node("right");

        // STEP 1: Accessor property of the current class
        String property = ClassMembers.thisPropertyName(left);
        if (property != null) {
            SymbolInfo member = b.getContext().getSymbols().lookupMember(property);
            if (member != null && VisitMemberExpression.isGetter(member)) {
                CppNode value = operator.equals("=")
                        ? b.visitExpression(right)
                        : compoundValue(operator, VisitMemberExpression.thisMember(property, b), right, b);
                return new CppCall(CppMemberAccess.thisMember(CppNames.setter(property)), List.of(value));
            }
        }

        // STEP 2: Resizing through length
        if (left != null && left.is(IlKind.MEMBER_EXPRESSION) && !left.flag("computed")
                && left.node("property") != null && left.node("property").isIdentifier("length")) {
            if (!operator.equals("=")) {
                b.getContext().warn(node, "Compound assignment to length");
            }
            return b.methodCall(b.visitExpression(left.node("object")), "resize", List.of(b.visitExpression(right)));
        }

        // STEP 3: Operators with a different spelling
        CppNode target = b.visitExpression(left);
        switch (operator) {
            case ">>>=" -> {
                return new CppAssignment(">>=", target, b.visitExpression(right));
            }
            case "**=" -> {
                return new CppAssignment("=", target, VisitInstruction.power(left, right, b));
            }
            case "&&=", "||=", "??=" -> {
                b.getContext().warn(node, "Logical assignment '" + operator + "' reduced to plain assignment");
                return new CppAssignment("=", target, b.visitExpression(right));
            }
            case "+=" -> {
                if (isString(left, b) && !isString(right, b)) {
                    return new CppAssignment("+=", target, VisitLiteralExpression.stringified(right, b));
                }
            }
            default -> {
            }
        }
        return new CppAssignment(operator, target, b.visitExpression(right));
    }

    private static CppNode compoundValue(String operator, CppNode current, IlNode right, CppCodeBuilder b) {
        String binaryOperator = operator.substring(0, operator.length() - 1);
        if (binaryOperator.equals(">>>")) {
            binaryOperator = ">>";
        }
        return new CppBinary(binaryOperator, current, b.visitExpression(right));
    }

    public static CppNode conditional(IlNode node, CppCodeBuilder b) {
        return new CppConditional(b.visitExpression(node.node("test")),
                b.visitExpression(node.node("consequent")), b.visitExpression(node.node("alternate")));
    }

    /**
     * Comma operator; the value is the last expression.
     */
    public static CppNode sequence(IlNode node, CppCodeBuilder b) {
        CppNode result = null;
        for (IlNode expression : node.nodes("expressions")) {
            CppNode next = b.visitExpression(expression);
            result = result == null ? next : new CppBinary(",", result, next);
        }
        return result != null ? result : b.placeholder("empty sequence");
    }

    private static boolean isString(IlNode node, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node);
        return type != null && type.isString();
    }

    private static boolean isFloating(IlNode node, CppCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node);
        return type != null && type.isFloating();
    }
}
