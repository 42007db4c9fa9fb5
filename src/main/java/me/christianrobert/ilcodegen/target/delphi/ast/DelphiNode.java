package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * Base of the Delphi target tree. Nodes are immutable and tagged by their
 * {@link DelphiNodeKind}; the emitter dispatches on the tag.
 */
public abstract class DelphiNode {

    public abstract DelphiNodeKind getKind();

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
