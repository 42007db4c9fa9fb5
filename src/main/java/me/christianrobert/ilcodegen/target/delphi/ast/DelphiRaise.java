package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * {@code raise Expression}; a null expression re-raises the current exception.
 */
public final class DelphiRaise extends DelphiNode {

    private final DelphiNode expression;

    public DelphiRaise(DelphiNode expression) {
        this.expression = expression;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.RAISE;
    }

    public DelphiNode getExpression() {
        return expression;
    }
}
