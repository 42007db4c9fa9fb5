package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiWhile extends DelphiNode {

    private final DelphiNode condition;
    private final DelphiBlock body;

    public DelphiWhile(DelphiNode condition, DelphiBlock body) {
        this.condition = condition;
        this.body = body;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.WHILE;
    }

    public DelphiNode getCondition() {
        return condition;
    }

    public DelphiBlock getBody() {
        return body;
    }
}
