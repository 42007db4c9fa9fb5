package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

/**
 * A class field. Static fields render as {@code class var}; a static field with a
 * {@code constantValue} renders as a class constant.
 */
public final class DelphiField extends DelphiNode {

    private final String name;
    private final DelphiType type;
    private final DelphiVisibility visibility;
    private final boolean isStatic;
    private final DelphiNode constantValue;

    public DelphiField(String name, DelphiType type, DelphiVisibility visibility, boolean isStatic,
                       DelphiNode constantValue) {
        this.name = name;
        this.type = type;
        this.visibility = visibility;
        this.isStatic = isStatic;
        this.constantValue = constantValue;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.FIELD;
    }

    public String getName() {
        return name;
    }

    public DelphiType getType() {
        return type;
    }

    public DelphiVisibility getVisibility() {
        return visibility;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public DelphiNode getConstantValue() {
        return constantValue;
    }
}
