package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiMemberAccess extends DelphiNode {

    private final DelphiNode target;
    private final String member;

    public DelphiMemberAccess(DelphiNode target, String member) {
        this.target = target;
        this.member = member;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.MEMBER_ACCESS;
    }

    public DelphiNode getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }
}
