package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

/**
 * Compound statement, rendered {@code begin ... end}.
 */
public final class DelphiBlock extends DelphiNode {

    private final List<DelphiNode> statements;

    public DelphiBlock(List<DelphiNode> statements) {
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.BLOCK;
    }

    public List<DelphiNode> getStatements() {
        return statements;
    }
}
