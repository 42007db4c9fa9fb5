package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppThis extends CppNode {

    public static final CppThis INSTANCE = new CppThis();

    private CppThis() {
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.THIS;
    }
}
