package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * {@code elseBranch} is null, a {@link DelphiBlock} or another {@link DelphiIf} (else-if chain).
 */
public final class DelphiIf extends DelphiNode {

    private final DelphiNode condition;
    private final DelphiBlock thenBranch;
    private final DelphiNode elseBranch;

    public DelphiIf(DelphiNode condition, DelphiBlock thenBranch, DelphiNode elseBranch) {
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.IF;
    }

    public DelphiNode getCondition() {
        return condition;
    }

    public DelphiBlock getThenBranch() {
        return thenBranch;
    }

    public DelphiNode getElseBranch() {
        return elseBranch;
    }
}
