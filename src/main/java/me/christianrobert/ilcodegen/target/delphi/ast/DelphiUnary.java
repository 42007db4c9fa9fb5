package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * Prefix operator: {@code not} or {@code -}.
 */
public final class DelphiUnary extends DelphiNode {

    private final String operator;
    private final DelphiNode operand;

    public DelphiUnary(String operator, DelphiNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.UNARY;
    }

    public String getOperator() {
        return operator;
    }

    public DelphiNode getOperand() {
        return operand;
    }
}
