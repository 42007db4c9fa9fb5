package me.christianrobert.ilcodegen.target.cpp.ast;

public final class CppInclude extends CppNode {

    private final String path;
    private final boolean system;

    public CppInclude(String path, boolean system) {
        this.path = path;
        this.system = system;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.INCLUDE;
    }

    public String getPath() {
        return path;
    }

    /**
     * Angle-bracket include ({@code <vector>}) as opposed to a quoted one.
     */
    public boolean isSystem() {
        return system;
    }
}
