package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiExpressionStatement extends DelphiNode {

    private final DelphiNode expression;

    public DelphiExpressionStatement(DelphiNode expression) {
        this.expression = expression;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.EXPRESSION_STATEMENT;
    }

    public DelphiNode getExpression() {
        return expression;
    }
}
