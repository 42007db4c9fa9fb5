package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * {@code Exit} or {@code Exit(Value)}.
 */
public final class DelphiExit extends DelphiNode {

    private final DelphiNode value;

    public DelphiExit(DelphiNode value) {
        this.value = value;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.EXIT;
    }

    public DelphiNode getValue() {
        return value;
    }
}
