package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppIf extends CppNode {

    private final CppNode condition;
    private final CppBlock thenBranch;
    private final CppNode elseBranch;

    public CppIf(CppNode condition, CppBlock thenBranch, CppNode elseBranch) {
        this.condition = condition;
        this.thenBranch = thenBranch;
        this.elseBranch = elseBranch;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.IF;
    }

    public CppNode getCondition() {
        return condition;
    }

    public CppBlock getThenBranch() {
        return thenBranch;
    }

    /**
     * A block, another {@link CppIf} (else-if chain), or null.
     */
    public CppNode getElseBranch() {
        return elseBranch;
    }
}
