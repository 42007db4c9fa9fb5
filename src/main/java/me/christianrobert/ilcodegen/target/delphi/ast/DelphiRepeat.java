package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiRepeat extends DelphiNode {

    private final DelphiBlock body;
    private final DelphiNode untilCondition;

    public DelphiRepeat(DelphiBlock body, DelphiNode untilCondition) {
        this.body = body;
        this.untilCondition = untilCondition;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.REPEAT;
    }

    public DelphiBlock getBody() {
        return body;
    }

    public DelphiNode getUntilCondition() {
        return untilCondition;
    }
}
