package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppWhile extends CppNode {

    private final CppNode condition;
    private final CppBlock body;

    public CppWhile(CppNode condition, CppBlock body) {
        this.condition = condition;
        this.body = body;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.WHILE;
    }

    public CppNode getCondition() {
        return condition;
    }

    public CppBlock getBody() {
        return body;
    }
}
