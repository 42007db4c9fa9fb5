package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

/**
 * A formal parameter. {@code modifier} is {@code const}, {@code var} or null for a value parameter.
 */
public final class DelphiParameter extends DelphiNode {

    private final String modifier;
    private final String name;
    private final DelphiType type;
    private final DelphiNode defaultValue;

    public DelphiParameter(String modifier, String name, DelphiType type, DelphiNode defaultValue) {
        this.modifier = modifier;
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.PARAMETER;
    }

    public String getModifier() {
        return modifier;
    }

    public String getName() {
        return name;
    }

    public DelphiType getType() {
        return type;
    }

    public DelphiNode getDefaultValue() {
        return defaultValue;
    }
}
