package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiTryFinally extends DelphiNode {

    private final DelphiBlock body;
    private final DelphiBlock finallyBlock;

    public DelphiTryFinally(DelphiBlock body, DelphiBlock finallyBlock) {
        this.body = body;
        this.finallyBlock = finallyBlock;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.TRY_FINALLY;
    }

    public DelphiBlock getBody() {
        return body;
    }

    public DelphiBlock getFinallyBlock() {
        return finallyBlock;
    }
}
