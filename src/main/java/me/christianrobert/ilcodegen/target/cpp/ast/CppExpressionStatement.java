package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppExpressionStatement extends CppNode {

    private final CppNode expression;

    public CppExpressionStatement(CppNode expression) {
        this.expression = expression;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.EXPRESSION_STATEMENT;
    }

    public CppNode getExpression() {
        return expression;
    }
}
