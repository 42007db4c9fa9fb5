package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppBreak extends CppNode {

    public static final CppBreak INSTANCE = new CppBreak();

    private CppBreak() {
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.BREAK;
    }
}
