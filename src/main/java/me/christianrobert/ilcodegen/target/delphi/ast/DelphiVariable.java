package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

public final class DelphiVariable extends DelphiNode {

    private final String name;
    private final DelphiType type;
    private final DelphiNode initializer;

    public DelphiVariable(String name, DelphiType type, DelphiNode initializer) {
        this.name = name;
        this.type = type;
        this.initializer = initializer;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.VARIABLE;
    }

    public String getName() {
        return name;
    }

    public DelphiType getType() {
        return type;
    }

    public DelphiNode getInitializer() {
        return initializer;
    }
}
