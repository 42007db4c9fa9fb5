package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiIdentifier extends DelphiNode {

    public static final DelphiIdentifier SELF = new DelphiIdentifier("Self");
    public static final DelphiIdentifier RESULT = new DelphiIdentifier("Result");

    private final String name;

    public DelphiIdentifier(String name) {
        this.name = name;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.IDENTIFIER;
    }

    public String getName() {
        return name;
    }
}
