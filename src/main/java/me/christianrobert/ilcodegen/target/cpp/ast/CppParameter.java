package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

public final class CppParameter extends CppNode {

    private final CppType type;
    private final String name;
    private final CppNode defaultValue;

    public CppParameter(CppType type, String name, CppNode defaultValue) {
        this.type = type;
        this.name = name;
        this.defaultValue = defaultValue;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.PARAMETER;
    }

    public CppType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public CppNode getDefaultValue() {
        return defaultValue;
    }
}
