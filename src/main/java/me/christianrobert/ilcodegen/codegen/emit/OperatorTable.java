package me.christianrobert.ilcodegen.codegen.emit;

import java.util.HashMap;
import java.util.Map;

/**
 * Precedence table of one target grammar and the parenthesization rules built on it.
 *
 * <p>A child binary expression is parenthesized when:</p>
 * <ol>
 *   <li>its precedence is strictly lower than its parent's, or</li>
 *   <li>its precedence is equal and it sits on the associativity-flipping side
 *       (right operand of a left-associative parent, left operand of a right-associative one), or</li>
 *   <li>both operators are comparisons, or</li>
 *   <li>the target's clarity rule asks for it ({@link #needsClarityParens}).</li>
 * </ol>
 *
 * <p>Operators missing from the table bind loosest, so they are always parenthesized.</p>
 */
public abstract class OperatorTable {

    public static final int LOWEST_PRECEDENCE = 0;

    private final Map<String, OperatorInfo> binary = new HashMap<>();
    private final int unaryPrecedence;

    protected OperatorTable(int unaryPrecedence) {
        this.unaryPrecedence = unaryPrecedence;
    }

    protected void register(OperatorInfo info) {
        binary.put(info.getSymbol(), info);
    }

    public OperatorInfo binary(String symbol) {
        return binary.get(symbol);
    }

    public int precedence(String symbol) {
        OperatorInfo info = binary.get(symbol);
        return info != null ? info.getPrecedence() : LOWEST_PRECEDENCE;
    }

    /**
     * Binding power of prefix operators.
     */
    public int getUnaryPrecedence() {
        return unaryPrecedence;
    }

    /**
     * Decides whether a binary child of a binary parent needs parentheses.
     *
     * @param parentSymbol operator of the enclosing expression
     * @param childSymbol  operator of the operand expression
     * @param rightOperand whether the child is the parent's right operand
     */
    public boolean needsParens(String parentSymbol, String childSymbol, boolean rightOperand) {
        OperatorInfo parent = binary.get(parentSymbol);
        OperatorInfo child = binary.get(childSymbol);
        if (parent == null || child == null) {
            return true;
        }
        if (child.getPrecedence() < parent.getPrecedence()) {
            return true;
        }
        if (child.getPrecedence() == parent.getPrecedence()) {
            boolean flippingSide = parent.getAssociativity() == OperatorInfo.Associativity.LEFT
                    ? rightOperand
                    : !rightOperand;
            if (flippingSide) {
                return true;
            }
        }
        if (parent.isComparison() && child.isComparison()) {
            return true;
        }
        return needsClarityParens(parent, child, rightOperand);
    }

    /**
     * Whether a binary operand of a prefix operator needs parentheses.
     */
    public boolean needsParensUnderUnary(String childSymbol) {
        return precedence(childSymbol) < unaryPrecedence;
    }

    /**
     * Target-specific parentheses that are not needed for correctness but expected by
     * the target's style (compiler warnings, readability). Default: none.
     */
    protected boolean needsClarityParens(OperatorInfo parent, OperatorInfo child, boolean rightOperand) {
        return false;
    }
}
