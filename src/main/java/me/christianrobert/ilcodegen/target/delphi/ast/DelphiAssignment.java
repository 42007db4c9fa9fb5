package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiAssignment extends DelphiNode {

    private final DelphiNode target;
    private final DelphiNode value;

    public DelphiAssignment(DelphiNode target, DelphiNode value) {
        this.target = target;
        this.value = value;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.ASSIGNMENT;
    }

    public DelphiNode getTarget() {
        return target;
    }

    public DelphiNode getValue() {
        return value;
    }
}
