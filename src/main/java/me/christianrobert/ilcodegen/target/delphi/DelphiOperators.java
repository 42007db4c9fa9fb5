package me.christianrobert.ilcodegen.target.delphi;

import me.christianrobert.ilcodegen.codegen.emit.OperatorInfo;
import me.christianrobert.ilcodegen.codegen.emit.OperatorTable;

import java.util.Set;

/**
 * Delphi operator precedence. Pascal has only four levels and {@code and}/{@code or} bind
 * tighter than comparisons, so comparisons under a boolean operator are always
 * parenthesized. On top of that, shift operands of bitwise operators and mixed bitwise
 * operators are parenthesized:
 *
 * <pre>
 * (Value shl Amount) or (Value shr (32 - Amount))
 * (A &gt; 0) and (B &lt; 16)
 * </pre>
 */
public class DelphiOperators extends OperatorTable {

    public static final DelphiOperators INSTANCE = new DelphiOperators();

    private static final Set<String> SHIFT = Set.of("shl", "shr");
    private static final Set<String> BITWISE = Set.of("and", "or", "xor");

    protected DelphiOperators() {
        super(4);
        register(OperatorInfo.left("*", 3));
        register(OperatorInfo.left("/", 3));
        register(OperatorInfo.left("div", 3));
        register(OperatorInfo.left("mod", 3));
        register(OperatorInfo.left("and", 3));
        register(OperatorInfo.left("shl", 3));
        register(OperatorInfo.left("shr", 3));
        register(OperatorInfo.left("+", 2));
        register(OperatorInfo.left("-", 2));
        register(OperatorInfo.left("or", 2));
        register(OperatorInfo.left("xor", 2));
        register(OperatorInfo.comparison("=", 1));
        register(OperatorInfo.comparison("<>", 1));
        register(OperatorInfo.comparison("<", 1));
        register(OperatorInfo.comparison("<=", 1));
        register(OperatorInfo.comparison(">", 1));
        register(OperatorInfo.comparison(">=", 1));
        register(OperatorInfo.comparison("is", 1));
    }

    @Override
    protected boolean needsClarityParens(OperatorInfo parent, OperatorInfo child, boolean rightOperand) {
        String p = parent.getSymbol();
        String c = child.getSymbol();
        if (BITWISE.contains(p)) {
            return SHIFT.contains(c) || (BITWISE.contains(c) && !c.equals(p));
        }
        return SHIFT.contains(p) && SHIFT.contains(c);
    }
}
