package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppFor extends CppNode {

    private final CppNode initializer;
    private final CppNode condition;
    private final CppNode update;
    private final CppBlock body;

    public CppFor(CppNode initializer, CppNode condition, CppNode update, CppBlock body) {
        this.initializer = initializer;
        this.condition = condition;
        this.update = update;
        this.body = body;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.FOR;
    }

    public CppNode getInitializer() {
        return initializer;
    }

    public CppNode getCondition() {
        return condition;
    }

    public CppNode getUpdate() {
        return update;
    }

    public CppBlock getBody() {
        return body;
    }
}
