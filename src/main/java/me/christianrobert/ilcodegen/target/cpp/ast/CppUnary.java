package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppUnary extends CppNode {

    private final String operator;
    private final CppNode operand;
    private final boolean prefix;

    public CppUnary(String operator, CppNode operand, boolean prefix) {
        this.operator = operator;
        this.operand = operand;
        this.prefix = prefix;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.UNARY;
    }

    public String getOperator() {
        return operator;
    }

    public CppNode getOperand() {
        return operand;
    }

    public boolean isPrefix() {
        return prefix;
    }
}
