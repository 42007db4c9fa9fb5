package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

/**
 * A complete unit. Declarations keep source order; the emitter splits them into the
 * interface part (constants, types, routine headings, variables) and the implementation part
 * (routine bodies), and renders {@code initialization} statements last.
 */
public final class DelphiUnit extends DelphiNode {

    private final String headerComment;
    private final String name;
    private final List<String> uses;
    private final List<DelphiNode> declarations;
    private final List<DelphiNode> initialization;

    public DelphiUnit(String headerComment, String name, List<String> uses, List<DelphiNode> declarations,
                      List<DelphiNode> initialization) {
        this.headerComment = headerComment;
        this.name = name;
        this.uses = uses == null ? List.of() : List.copyOf(uses);
        this.declarations = declarations == null ? List.of() : List.copyOf(declarations);
        this.initialization = initialization == null ? List.of() : List.copyOf(initialization);
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.UNIT;
    }

    public String getHeaderComment() {
        return headerComment;
    }

    public String getName() {
        return name;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<DelphiNode> getDeclarations() {
        return declarations;
    }

    public List<DelphiNode> getInitialization() {
        return initialization;
    }
}
