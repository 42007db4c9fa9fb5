package me.christianrobert.ilcodegen.target.cpp;

import me.christianrobert.ilcodegen.codegen.emit.OperatorInfo;
import me.christianrobert.ilcodegen.codegen.emit.OperatorTable;

import java.util.Set;

/**
 * C++ binary operator precedence (higher binds tighter) plus the parentheses GCC and Clang
 * ask for under {@code -Wparentheses}:
 *
 * <ul>
 *   <li>arithmetic, shift or comparison operands of {@code &}, {@code ^}, {@code |}</li>
 *   <li>a different bitwise operator nested in a bitwise operator</li>
 *   <li>arithmetic operands of {@code <<} and {@code >>}</li>
 *   <li>{@code &&} inside {@code ||}</li>
 * </ul>
 *
 * <pre>
 * (value &lt;&lt; amount) | (value &gt;&gt; (32 - amount))
 * </pre>
 */
public class CppOperators extends OperatorTable {

    public static final CppOperators INSTANCE = new CppOperators();

    private static final Set<String> ARITHMETIC = Set.of("*", "/", "%", "+", "-");
    private static final Set<String> SHIFT = Set.of("<<", ">>");
    private static final Set<String> BITWISE = Set.of("&", "^", "|");

    protected CppOperators() {
        super(15);
        register(OperatorInfo.left("*", 13));
        register(OperatorInfo.left("/", 13));
        register(OperatorInfo.left("%", 13));
        register(OperatorInfo.left("+", 12));
        register(OperatorInfo.left("-", 12));
        register(OperatorInfo.left("<<", 11));
        register(OperatorInfo.left(">>", 11));
        register(OperatorInfo.comparison("<", 9));
        register(OperatorInfo.comparison("<=", 9));
        register(OperatorInfo.comparison(">", 9));
        register(OperatorInfo.comparison(">=", 9));
        register(OperatorInfo.comparison("==", 8));
        register(OperatorInfo.comparison("!=", 8));
        register(OperatorInfo.left("&", 7));
        register(OperatorInfo.left("^", 6));
        register(OperatorInfo.left("|", 5));
        register(OperatorInfo.left("&&", 4));
        register(OperatorInfo.left("||", 3));
        register(OperatorInfo.left(",", 1));
    }

    @Override
    protected boolean needsClarityParens(OperatorInfo parent, OperatorInfo child, boolean rightOperand) {
        String p = parent.getSymbol();
        String c = child.getSymbol();
        if (BITWISE.contains(p)) {
            return ARITHMETIC.contains(c) || SHIFT.contains(c) || child.isComparison()
                    || (BITWISE.contains(c) && !c.equals(p));
        }
        if (SHIFT.contains(p)) {
            return ARITHMETIC.contains(c);
        }
        return p.equals("||") && c.equals("&&");
    }
}
