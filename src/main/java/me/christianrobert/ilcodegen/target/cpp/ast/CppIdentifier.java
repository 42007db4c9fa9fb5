package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppIdentifier extends CppNode {

    private final String name;

    public CppIdentifier(String name) {
        this.name = name;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.IDENTIFIER;
    }

    public String getName() {
        return name;
    }
}
