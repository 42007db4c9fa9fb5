package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppReturn extends CppNode {

    private final CppNode expression;

    public CppReturn(CppNode expression) {
        this.expression = expression;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.RETURN;
    }

    /**
     * Returned value, or null.
     */
    public CppNode getExpression() {
        return expression;
    }
}
