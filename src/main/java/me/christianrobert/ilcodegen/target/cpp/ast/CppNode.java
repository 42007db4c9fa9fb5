package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * Base of the C++ target tree. Every node is immutable and tagged by its {@link CppNodeKind};
 * the emitter dispatches on the tag.
 */
public abstract class CppNode {

    public abstract CppNodeKind getKind();

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
