package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppConditional extends CppNode {

    private final CppNode condition;
    private final CppNode whenTrue;
    private final CppNode whenFalse;

    public CppConditional(CppNode condition, CppNode whenTrue, CppNode whenFalse) {
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CONDITIONAL;
    }

    public CppNode getCondition() {
        return condition;
    }

    public CppNode getWhenTrue() {
        return whenTrue;
    }

    public CppNode getWhenFalse() {
        return whenFalse;
    }
}
