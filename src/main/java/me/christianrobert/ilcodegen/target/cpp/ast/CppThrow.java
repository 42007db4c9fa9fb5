package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * {@code throw expr;}, or a rethrow ({@code throw;}) when the expression is null.
 */
public final class CppThrow extends CppNode {

    private final CppNode expression;

    public CppThrow(CppNode expression) {
        this.expression = expression;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.THROW;
    }

    public CppNode getExpression() {
        return expression;
    }
}
