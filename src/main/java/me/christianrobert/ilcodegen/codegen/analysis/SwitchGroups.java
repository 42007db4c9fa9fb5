package me.christianrobert.ilcodegen.codegen.analysis;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Groups the cases of a {@code SwitchStatement}.
 *
 * <pre>
 * case 1:
 * case 2:            →  group{tests: [1, 2], body: [a()]}
 *     a(); break;
 * default:           →  group{default, body: [b()]}
 *     b();
 * </pre>
 *
 * <p>Consecutive empty cases merge into the next non-empty one. A trailing unlabeled
 * {@code break} is removed from the body; a body that does not end in a jump statement and is
 * not the last group falls through.</p>
 */
public final class SwitchGroups {

    private SwitchGroups() {
    }

    public static List<SwitchGroup> group(IlNode switchStatement) {
        List<SwitchGroup> groups = new ArrayList<>();
        List<IlNode> pendingTests = new ArrayList<>();
        boolean pendingDefault = false;

        List<IlNode> cases = switchStatement.nodes("cases");
        for (int i = 0; i < cases.size(); i++) {
            IlNode switchCase = cases.get(i);
            IlNode test = switchCase.node("test");
            if (test == null) {
                pendingDefault = true;
            } else {
                pendingTests.add(test);
            }

            List<IlNode> consequent = flattenBlock(switchCase.nodes("consequent"));
            boolean last = i == cases.size() - 1;
            if (consequent.isEmpty() && !last) {
                continue;
            }

            List<IlNode> body = new ArrayList<>(consequent);
            boolean terminated = false;
            if (!body.isEmpty()) {
                IlNode tail = body.get(body.size() - 1);
                if (isPlainBreak(tail)) {
                    body.remove(body.size() - 1);
                    terminated = true;
                } else {
                    terminated = isJump(tail);
                }
            }
            groups.add(new SwitchGroup(pendingTests, pendingDefault, body, !terminated && !last));
            pendingTests = new ArrayList<>();
            pendingDefault = false;
        }
        return groups;
    }

    /**
     * Whether every case label is an integral or single-character literal, the
     * precondition for an ordinal {@code case} statement.
     */
    public static boolean allOrdinalLiterals(IlNode switchStatement) {
        for (IlNode switchCase : switchStatement.nodes("cases")) {
            IlNode test = switchCase.node("test");
            if (test == null) {
                continue;
            }
            if (!isOrdinalLiteral(test)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isOrdinalLiteral(IlNode test) {
        if (test.is(IlKind.UNARY_EXPRESSION) && "-".equals(test.text("operator"))) {
            return isOrdinalLiteral(test.node("argument"));
        }
        if (!test.is(IlKind.LITERAL)) {
            return false;
        }
        Object value = test.value("value");
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().scale() <= 0;
        }
        return value instanceof String && ((String) value).length() == 1;
    }

    /**
     * Whether a group body contains a {@code break} that leaves the switch from a nested
     * position (inside an if, not inside a nested loop or switch).
     */
    public static boolean hasNestedBreak(List<IlNode> body) {
        for (IlNode statement : body) {
            if (containsSwitchBreak(statement)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsSwitchBreak(IlNode node) {
        if (node == null) {
            return false;
        }
        return switch (node.getKind()) {
            case BREAK_STATEMENT -> node.node("label") == null;
            case FOR_STATEMENT, FOR_OF_STATEMENT, FOR_IN_STATEMENT, WHILE_STATEMENT, DO_WHILE_STATEMENT,
                 SWITCH_STATEMENT, FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> false;
            default -> node.children().stream().anyMatch(SwitchGroups::containsSwitchBreak);
        };
    }

    private static List<IlNode> flattenBlock(List<IlNode> consequent) {
        if (consequent.size() == 1 && consequent.get(0).is(IlKind.BLOCK_STATEMENT)) {
            return consequent.get(0).nodes("body");
        }
        return consequent;
    }

    private static boolean isPlainBreak(IlNode statement) {
        return statement.is(IlKind.BREAK_STATEMENT) && statement.node("label") == null;
    }

    private static boolean isJump(IlNode statement) {
        return statement.is(IlKind.RETURN_STATEMENT)
                || statement.is(IlKind.THROW_STATEMENT)
                || statement.is(IlKind.CONTINUE_STATEMENT)
                || statement.is(IlKind.BREAK_STATEMENT);
    }
}
