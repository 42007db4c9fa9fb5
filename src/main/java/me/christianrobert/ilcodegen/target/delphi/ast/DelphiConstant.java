package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

/**
 * A unit constant. Untyped ({@code ROUNDS = 10}) when {@code type} is null.
 */
public final class DelphiConstant extends DelphiNode {

    private final String name;
    private final DelphiType type;
    private final DelphiNode value;

    public DelphiConstant(String name, DelphiType type, DelphiNode value) {
        this.name = name;
        this.type = type;
        this.value = value;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CONSTANT;
    }

    public String getName() {
        return name;
    }

    public DelphiType getType() {
        return type;
    }

    public DelphiNode getValue() {
        return value;
    }
}
