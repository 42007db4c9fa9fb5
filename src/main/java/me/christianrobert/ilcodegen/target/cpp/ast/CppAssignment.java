package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppAssignment extends CppNode {

    private final String operator;
    private final CppNode target;
    private final CppNode value;

    public CppAssignment(String operator, CppNode target, CppNode value) {
        this.operator = operator;
        this.target = target;
        this.value = value;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.ASSIGNMENT;
    }

    public String getOperator() {
        return operator;
    }

    public CppNode getTarget() {
        return target;
    }

    public CppNode getValue() {
        return value;
    }
}
