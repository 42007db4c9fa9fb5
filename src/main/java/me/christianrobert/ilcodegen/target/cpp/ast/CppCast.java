package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

/**
 * {@code static_cast<T>(expr)}.
 */
public final class CppCast extends CppNode {

    private final CppType type;
    private final CppNode expression;

    public CppCast(CppType type, CppNode expression) {
        this.type = type;
        this.expression = expression;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CAST;
    }

    public CppType getType() {
        return type;
    }

    public CppNode getExpression() {
        return expression;
    }
}
