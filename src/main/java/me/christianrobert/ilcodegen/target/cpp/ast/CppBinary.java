package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppBinary extends CppNode {

    private final String operator;
    private final CppNode left;
    private final CppNode right;

    public CppBinary(String operator, CppNode left, CppNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.BINARY;
    }

    public String getOperator() {
        return operator;
    }

    public CppNode getLeft() {
        return left;
    }

    public CppNode getRight() {
        return right;
    }
}
