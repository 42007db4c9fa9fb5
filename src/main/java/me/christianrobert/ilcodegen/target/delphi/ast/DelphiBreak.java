package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiBreak extends DelphiNode {

    public static final DelphiBreak INSTANCE = new DelphiBreak();

    private DelphiBreak() {
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.BREAK;
    }
}
