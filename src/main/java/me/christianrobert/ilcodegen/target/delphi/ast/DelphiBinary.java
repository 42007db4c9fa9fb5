package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiBinary extends DelphiNode {

    private final String operator;
    private final DelphiNode left;
    private final DelphiNode right;

    public DelphiBinary(String operator, DelphiNode left, DelphiNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.BINARY;
    }

    public String getOperator() {
        return operator;
    }

    public DelphiNode getLeft() {
        return left;
    }

    public DelphiNode getRight() {
        return right;
    }
}
