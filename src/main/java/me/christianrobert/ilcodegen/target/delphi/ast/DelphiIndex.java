package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiIndex extends DelphiNode {

    private final DelphiNode target;
    private final DelphiNode index;

    public DelphiIndex(DelphiNode target, DelphiNode index) {
        this.target = target;
        this.index = index;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.INDEX;
    }

    public DelphiNode getTarget() {
        return target;
    }

    public DelphiNode getIndex() {
        return index;
    }
}
