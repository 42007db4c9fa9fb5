package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppElementAccess extends CppNode {

    private final CppNode target;
    private final CppNode index;

    public CppElementAccess(CppNode target, CppNode index) {
        this.target = target;
        this.index = index;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.ELEMENT_ACCESS;
    }

    public CppNode getTarget() {
        return target;
    }

    public CppNode getIndex() {
        return index;
    }
}
