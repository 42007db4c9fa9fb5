package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

/**
 * Dynamic array constant {@code [A, B, C]}.
 */
public final class DelphiArrayLiteral extends DelphiNode {

    private final List<DelphiNode> elements;

    public DelphiArrayLiteral(List<DelphiNode> elements) {
        this.elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.ARRAY_LITERAL;
    }

    public List<DelphiNode> getElements() {
        return elements;
    }
}
