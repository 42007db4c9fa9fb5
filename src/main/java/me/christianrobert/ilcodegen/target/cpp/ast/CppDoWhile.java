package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppDoWhile extends CppNode {

    private final CppBlock body;
    private final CppNode condition;

    public CppDoWhile(CppBlock body, CppNode condition) {
        this.body = body;
        this.condition = condition;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.DO_WHILE;
    }

    public CppBlock getBody() {
        return body;
    }

    public CppNode getCondition() {
        return condition;
    }
}
