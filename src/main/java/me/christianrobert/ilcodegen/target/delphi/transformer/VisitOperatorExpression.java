package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAssignment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCall;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIndex;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiLiteral;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiUnary;

import java.util.List;
import java.util.Map;

/**
 * Static helper for operator expressions.
 *
 * <h3>Operator mapping:</h3>
 * <pre>
 * a === b          →   A = B
 * a !== b          →   A &lt;&gt; B
 * x &gt;&gt;&gt; 0          →   Cardinal(X)
 * x &gt;&gt;&gt; n          →   X shr N               (signed x is cast to Cardinal first)
 * x &lt;&lt; n           →   X shl N
 * a &amp; b / a | b     →   A and B / A or B
 * a ^ b            →   A xor B
 * a % b            →   A mod B               (FMod for floats)
 * a / b            →   A div B               (integral operands)
 * a ** b           →   Power(A, B)
 * "n=" + n         →   'n=' + UIntToStr(N)
 * buf == null      →   Length(Buf) = 0
 * c ? a : b        →   IfThen(C, A, B)
 * </pre>
 *
 * <h3>Assignments and updates:</h3>
 * <p>Pascal has no assignment expressions. In statement position they become plain
 * statements, in expression position the assignment is hoisted in front of the statement
 * (post-increments behind it) and the target is used as the value.</p>
 * <pre>
 * i++;             →   Inc(I);
 * x ^= k;          →   X := X xor K;
 * out.length = n;  →   SetLength(Out, N);
 * buf = new Uint8Array(16);   →   SetLength(Buf, 16);
 * </pre>
 */
public class VisitOperatorExpression {

    private static final Map<String, String> EQUALITY = Map.of(
            "===", "=",
            "!==", "<>",
            "==", "=",
            "!=", "<>");

    private static final Map<String, String> SPELLING = Map.of(
            "<<", "shl",
            ">>", "shr",
            "&", "and",
            "|", "or",
            "^", "xor",
            "%", "mod",
            "instanceof", "is");

    public static DelphiNode binary(IlNode node, DelphiCodeBuilder b) {
        String operator = node.text("operator", "");
        IlNode left = node.node("left");
        IlNode right = node.node("right");

        // STEP 1: Equality, including comparisons with null
        if (EQUALITY.containsKey(operator)) {
            String delphiOperator = EQUALITY.get(operator);
            if (isNullish(right)) {
                return nullComparison(left, delphiOperator, b);
            }
            if (isNullish(left)) {
                return nullComparison(right, delphiOperator, b);
            }
            return new DelphiBinary(delphiOperator, b.visitExpression(left), b.visitExpression(right));
        }

        // STEP 2: Operators that need type information
        switch (operator) {
            case ">>>" -> {
                return unsignedShift(left, right, b);
            }
            case ">>" -> {
                TypeDescriptor type = b.typeOf(left);
                if (type != null && type.isSigned()) {
                    b.getContext().warn(node, "Signed '>>' lowered to logical shr");
                }
            }
            case "**" -> {
                return VisitInstruction.power(left, right, b);
            }
            case "%" -> {
                if (isFloating(left, b) || isFloating(right, b)) {
                    return b.unitCall("Math", "FMod", b.visitExpression(left), b.visitExpression(right));
                }
            }
            case "/" -> {
                if (isFloating(left, b) || isFloating(right, b)) {
                    return new DelphiBinary("/", b.visitExpression(left), b.visitExpression(right));
                }
                return new DelphiBinary("div", b.visitExpression(left), b.visitExpression(right));
            }
            case "+" -> {
                if (isString(left, b) || isString(right, b)) {
                    return new DelphiBinary("+", VisitLiteralExpression.stringified(left, b),
                            VisitLiteralExpression.stringified(right, b));
                }
            }
            case "in" -> {
                b.getContext().warn(node, "Operator 'in' has no Delphi equivalent");
                return b.placeholder(operator);
            }
            default -> {
            }
        }

        String delphiOperator = SPELLING.getOrDefault(operator, operator);
        return new DelphiBinary(delphiOperator, b.visitExpression(left), b.visitExpression(right));
    }

    private static DelphiNode unsignedShift(IlNode left, IlNode right, DelphiCodeBuilder b) {
        TypeDescriptor leftType = b.typeOf(left);
        String unsigned = leftType != null && leftType.getBits() == 64 ? "UInt64" : "Cardinal";
        DelphiNode value = b.visitExpression(left);

        // x >>> 0 only reinterprets as unsigned
        if (right != null && right.isNumericLiteral() && right.number("value", -1) == 0) {
            return DelphiCall.of(unsigned, value);
        }
        if (leftType == null || leftType.isSigned()) {
            value = DelphiCall.of(unsigned, value);
        }
        return new DelphiBinary("shr", value, b.visitExpression(right));
    }

    private static DelphiNode nullComparison(IlNode value, String operator, DelphiCodeBuilder b) {
        TypeDescriptor type = b.typeOf(value);
        DelphiNode target = b.visitExpression(value);
        if (type != null && type.isArray()) {
            return new DelphiBinary(operator, DelphiCall.of("Length", target), DelphiLiteral.ZERO);
        }
        if (type != null && type.isString()) {
            return new DelphiBinary(operator, target, VisitLiteralExpression.stringLiteral(""));
        }
        if (type != null && (type.isNumeric() || type.isBool())) {
            b.getContext().warn(value, "Comparison with null on a value type");
        }
        return new DelphiBinary(operator, target, DelphiLiteral.NIL);
    }

    private static boolean isNullish(IlNode node) {
        return node != null && ((node.is(IlKind.LITERAL) && node.value("value") == null)
                || node.isIdentifier("undefined"));
    }

    public static DelphiNode logical(IlNode node, DelphiCodeBuilder b) {
        String operator = node.text("operator", "");
        if (operator.equals("??")) {
            b.getContext().warn(node, "Nullish coalescing reduced to its left operand");
            return b.visitExpression(node.node("left"));
        }
        return new DelphiBinary(operator.equals("&&") ? "and" : "or",
                condition(node.node("left"), b), condition(node.node("right"), b));
    }

    public static DelphiNode unary(IlNode node, DelphiCodeBuilder b) {
        String operator = node.text("operator", "");
        IlNode argument = node.node("argument");
        return switch (operator) {
            case "!" -> new DelphiUnary("not", condition(argument, b));
            case "~" -> new DelphiUnary("not", b.visitExpression(argument));
            case "-" -> new DelphiUnary("-", b.visitExpression(argument));
            // numeric coercion
            case "+" -> b.visitExpression(argument);
            default -> {
                b.getContext().warn(node, "Unary operator '" + operator + "' has no Delphi equivalent");
                yield b.placeholder(operator);
            }
        };
    }

    /**
     * A truth value for a test: Pascal conditions must be Boolean.
     */
    static DelphiNode condition(IlNode test, DelphiCodeBuilder b) {
        DelphiNode value = b.visitExpression(test);
        TypeDescriptor type = b.typeOf(test);
        if (type == null || type.isBool()) {
            return value;
        }
        if (type.isNumeric()) {
            return new DelphiBinary("<>", value, DelphiLiteral.ZERO);
        }
        if (type.isString()) {
            return new DelphiBinary("<>", value, VisitLiteralExpression.stringLiteral(""));
        }
        if (type.isArray()) {
            return new DelphiBinary(">", DelphiCall.of("Length", value), DelphiLiteral.ZERO);
        }
        if (type.isUser()) {
            return DelphiCall.of("Assigned", value);
        }
        return value;
    }

    // ========== Updates ==========

    public static DelphiNode updateStatement(IlNode node, DelphiCodeBuilder b) {
        boolean increment = "++".equals(node.text("operator", "++"));
        DelphiNode target = b.visitExpression(node.node("argument"));
        if (target instanceof DelphiIdentifier || target instanceof DelphiIndex) {
            return DelphiCall.of(increment ? "Inc" : "Dec", target);
        }
        return new DelphiAssignment(target, new DelphiBinary(increment ? "+" : "-", target, DelphiLiteral.ONE));
    }

    /**
     * An update used as a value: the update runs before (prefix) or after (postfix) the
     * statement containing it.
     */
    public static DelphiNode update(IlNode node, DelphiCodeBuilder b) {
        DelphiNode statement = updateStatement(node, b);
        if (node.flag("prefix")) {
            b.addPreEffect(statement);
        } else {
            b.addPostEffect(statement);
        }
        return b.visitExpression(node.node("argument"));
    }

    // ========== Assignments ==========

    public static DelphiNode assignment(IlNode node, DelphiCodeBuilder b) {
        for (DelphiNode statement : assignmentStatement(node, b)) {
            b.addPreEffect(statement);
        }
        return b.visitExpression(node.node("left"));
    }

    public static List<DelphiNode> assignmentStatement(IlNode node, DelphiCodeBuilder b) {
        String operator = node.text("operator", "=");
        IlNode left = node.node("left");
        IlNode right = node.node("right");

        // STEP 1: Resizing through length
        if (left != null && left.is(IlKind.MEMBER_EXPRESSION) && !left.flag("computed")
                && left.node("property") != null && left.node("property").isIdentifier("length")) {
            if (!operator.equals("=")) {
                b.getContext().warn(node, "Compound assignment to length");
            }
            return List.of(DelphiCall.of("SetLength",
                    b.visitExpression(left.node("object")), b.visitExpression(right)));
        }

        DelphiNode target = b.visitExpression(left);

        // STEP 2: Logical and compound assignments
        switch (operator) {
            case "=" -> {
                return assign(node, target, right, b.getContext().isInLoop(), b);
            }
            case "&&=", "||=", "??=" -> {
                b.getContext().warn(node, "Logical assignment '" + operator + "' reduced to plain assignment");
                return List.of(new DelphiAssignment(target, b.visitExpression(right)));
            }
            default -> {
                String binaryOperator = operator.substring(0, operator.length() - 1);
                IlNode combined = IlNode.builder(IlKind.BINARY_EXPRESSION)
                        .text("operator", binaryOperator)
                        .node("left", left)
                        .node("right", right)
                        .resultType(node.getResultType())
                        .location(node.getLocation())
                        .build();
                return List.of(new DelphiAssignment(target, binary(combined, b)));
            }
        }
    }

    /**
     * {@code target := value}; an array creation becomes {@code SetLength}, preceded by
     * {@code target := nil} when earlier contents must not survive.
     */
    static List<DelphiNode> assign(IlNode origin, DelphiNode target, IlNode value, boolean resetArray,
                                   DelphiCodeBuilder b) {
        IlNode creation = value != null && value.is(IlKind.ARRAY_CREATION)
                ? value : VisitCallExpression.asArrayCreation(value, b);
        if (creation != null) {
            return VisitInstruction.arrayAssignment(target, creation, resetArray, b);
        }
        DelphiNode delphiValue = b.visitExpression(value);
        if (delphiValue == null) {
            b.getContext().warn(origin, "Assignment without a value");
            return List.of();
        }
        return List.of(new DelphiAssignment(target, delphiValue));
    }

    // ========== Other expressions ==========

    public static DelphiNode conditional(IlNode node, DelphiCodeBuilder b) {
        IlNode consequent = node.node("consequent");
        TypeDescriptor type = b.typeOf(node);
        if (type == null) {
            type = b.typeOf(consequent);
        }
        String unit;
        if (type != null && type.isString()) {
            unit = "StrUtils";
        } else {
            unit = "Math";
            if (type == null || !type.isNumeric()) {
                b.getContext().warn(node, "Conditional expression lowered to IfThen evaluates both branches");
            }
        }
        return b.unitCall(unit, "IfThen", condition(node.node("test"), b),
                b.visitExpression(consequent), b.visitExpression(node.node("alternate")));
    }

    /**
     * Comma operator: all but the last expression run as statements in front.
     */
    public static DelphiNode sequence(IlNode node, DelphiCodeBuilder b) {
        List<IlNode> expressions = node.nodes("expressions");
        if (expressions.isEmpty()) {
            return b.placeholder("empty sequence");
        }
        for (int i = 0; i < expressions.size() - 1; i++) {
            for (DelphiNode statement : b.visitStatement(VisitJumpStatement.expressionStatement(expressions.get(i)))) {
                b.addPreEffect(statement);
            }
        }
        return b.visitExpression(expressions.get(expressions.size() - 1));
    }

    private static boolean isString(IlNode node, DelphiCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node);
        return type != null && type.isString();
    }

    private static boolean isFloating(IlNode node, DelphiCodeBuilder b) {
        TypeDescriptor type = b.typeOf(node);
        return type != null && type.isFloating();
    }
}
