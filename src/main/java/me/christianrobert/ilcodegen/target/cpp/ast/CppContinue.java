package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppContinue extends CppNode {

    public static final CppContinue INSTANCE = new CppContinue();

    private CppContinue() {
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CONTINUE;
    }
}
