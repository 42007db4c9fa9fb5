package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiContinue extends DelphiNode {

    public static final DelphiContinue INSTANCE = new DelphiContinue();

    private DelphiContinue() {
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CONTINUE;
    }
}
