package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

public final class CppField extends CppNode {

    private final CppType type;
    private final String name;
    private final CppNode initializer;
    private final boolean isStatic;
    private final boolean isConstexpr;
    private final CppVisibility visibility;

    public CppField(CppType type, String name, CppNode initializer, boolean isStatic, boolean isConstexpr,
                    CppVisibility visibility) {
        this.type = type;
        this.name = name;
        this.initializer = initializer;
        this.isStatic = isStatic;
        this.isConstexpr = isConstexpr;
        this.visibility = visibility;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.FIELD;
    }

    public CppType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public CppNode getInitializer() {
        return initializer;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isConstexpr() {
        return isConstexpr;
    }

    public CppVisibility getVisibility() {
        return visibility;
    }
}
