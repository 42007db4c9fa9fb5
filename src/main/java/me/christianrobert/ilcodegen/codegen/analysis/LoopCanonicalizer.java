package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

/**
 * Recognizes C-style {@code for} loops that iterate a single variable over a bounded range.
 *
 * <h3>Canonical shape</h3>
 * <ul>
 *   <li><b>init</b>: one variable declarator whose initializer is a simple expression</li>
 *   <li><b>test</b>: {@code v < b}, {@code v <= b}, {@code v > b} or {@code v >= b}, b simple</li>
 *   <li><b>update</b>: {@code v++}, {@code ++v}, {@code v--}, {@code --v}, {@code v += 1},
 *       {@code v -= 1}, {@code v = v + 1}, {@code v = v - 1}</li>
 *   <li>ascending loops test with {@code <}/{@code <=}, descending with {@code >}/{@code >=}</li>
 *   <li>the body assigns neither the variable nor any identifier of the bound</li>
 * </ul>
 *
 * <p>Simple expressions are identifiers, literals, {@code this}, non-computed member
 * accesses, array lengths and arithmetic or unary minus over those.</p>
 */
public final class LoopCanonicalizer {

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%", "<<", ">>", ">>>", "&", "|", "^");

    private LoopCanonicalizer() {
    }

    /**
     * Matches a {@code ForStatement}.
     *
     * @return the recognized loop, or null when the statement must take the while fallback
     */
    public static CountedLoop match(IlNode forStatement) {
        if (forStatement == null || !forStatement.is(IlKind.FOR_STATEMENT)) {
            return null;
        }

        // STEP 1: init
        IlNode init = forStatement.node("init");
        if (init == null || !init.is(IlKind.VARIABLE_DECLARATION)) {
            return null;
        }
        List<IlNode> declarators = init.nodes("declarations");
        if (declarators.size() != 1) {
            return null;
        }
        IlNode declarator = declarators.get(0);
        IlNode id = declarator.node("id");
        IlNode start = declarator.node("init");
        if (id == null || !id.is(IlKind.IDENTIFIER) || start == null || !isSimple(start)) {
            return null;
        }
        String variable = id.name();

        // STEP 2: test
        IlNode test = forStatement.node("test");
        if (test == null || !test.is(IlKind.BINARY_EXPRESSION)) {
            return null;
        }
        IlNode testLeft = test.node("left");
        IlNode bound = test.node("right");
        if (testLeft == null || !testLeft.isIdentifier(variable) || bound == null || !isSimple(bound)) {
            return null;
        }
        String comparison = test.text("operator", "");
        boolean upward;
        boolean inclusive;
        switch (comparison) {
            case "<" -> {
                upward = true;
                inclusive = false;
            }
            case "<=" -> {
                upward = true;
                inclusive = true;
            }
            case ">" -> {
                upward = false;
                inclusive = false;
            }
            case ">=" -> {
                upward = false;
                inclusive = true;
            }
            default -> {
                return null;
            }
        }

        // STEP 3: update direction must agree with the comparison
        Boolean step = stepDirection(forStatement.node("update"), variable);
        if (step == null || step != upward) {
            return null;
        }

        // STEP 4: body must leave the range alone
        IlNode body = forStatement.node("body");
        if (Assignments.assigns(body, variable) || assignsAnyIdentifierOf(body, bound)) {
            return null;
        }

        return new CountedLoop(variable, declarator.text("typeAnnotation"), start, bound, upward, inclusive, body);
    }

    /**
     * True for +1 updates, false for -1 updates, null for anything else.
     */
    static Boolean stepDirection(IlNode update, String variable) {
        if (update == null) {
            return null;
        }
        if (update.is(IlKind.UPDATE_EXPRESSION)) {
            IlNode argument = update.node("argument");
            if (argument == null || !argument.isIdentifier(variable)) {
                return null;
            }
            return switch (update.text("operator", "")) {
                case "++" -> Boolean.TRUE;
                case "--" -> Boolean.FALSE;
                default -> null;
            };
        }
        if (!update.is(IlKind.ASSIGNMENT_EXPRESSION)) {
            return null;
        }
        IlNode left = update.node("left");
        IlNode right = update.node("right");
        if (left == null || !left.isIdentifier(variable) || right == null) {
            return null;
        }
        String operator = update.text("operator", "");
        if (operator.equals("+=") || operator.equals("-=")) {
            return isOne(right) ? operator.equals("+=") : null;
        }
        if (operator.equals("=") && right.is(IlKind.BINARY_EXPRESSION)) {
            String arithmetic = right.text("operator", "");
            IlNode a = right.node("left");
            IlNode b = right.node("right");
            if (a == null || b == null) {
                return null;
            }
            if (arithmetic.equals("+")) {
                if ((a.isIdentifier(variable) && isOne(b)) || (b.isIdentifier(variable) && isOne(a))) {
                    return Boolean.TRUE;
                }
            } else if (arithmetic.equals("-") && a.isIdentifier(variable) && isOne(b)) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    static boolean isSimple(IlNode node) {
        if (node == null) {
            return false;
        }
        return switch (node.getKind()) {
            case IDENTIFIER, LITERAL, THIS_EXPRESSION, THIS_PROPERTY_ACCESS -> true;
            case MEMBER_EXPRESSION -> !node.flag("computed") && isSimple(node.node("object"));
            case ARRAY_LENGTH -> isSimple(node.node("array"));
            case BINARY_EXPRESSION -> ARITHMETIC.contains(node.text("operator", ""))
                    && isSimple(node.node("left")) && isSimple(node.node("right"));
            case UNARY_EXPRESSION -> "-".equals(node.text("operator")) && isSimple(node.node("argument"));
            default -> false;
        };
    }

    private static boolean isOne(IlNode node) {
        return node.isNumericLiteral() && BigDecimal.ONE.compareTo((BigDecimal) node.value("value")) == 0;
    }

    private static boolean assignsAnyIdentifierOf(IlNode body, IlNode expression) {
        if (expression.is(IlKind.IDENTIFIER)) {
            return Assignments.assigns(body, expression.name());
        }
        for (IlNode child : expression.children()) {
            if (assignsAnyIdentifierOf(body, child)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Name bound by a for-of / for-in head ({@code const x} or a bare identifier), or null.
     */
    public static String boundName(IlNode left) {
        if (left == null) {
            return null;
        }
        if (left.is(IlKind.VARIABLE_DECLARATION)) {
            List<IlNode> declarators = left.nodes("declarations");
            return declarators.isEmpty() ? null : declarators.get(0).name();
        }
        return left.is(IlKind.IDENTIFIER) ? left.name() : null;
    }
}
