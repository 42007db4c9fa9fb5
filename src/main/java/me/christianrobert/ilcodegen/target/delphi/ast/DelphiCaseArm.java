package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

public final class DelphiCaseArm extends DelphiNode {

    private final List<DelphiNode> labels;
    private final List<DelphiNode> statements;

    public DelphiCaseArm(List<DelphiNode> labels, List<DelphiNode> statements) {
        this.labels = labels == null ? List.of() : List.copyOf(labels);
        this.statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CASE_ARM;
    }

    public List<DelphiNode> getLabels() {
        return labels;
    }

    public List<DelphiNode> getStatements() {
        return statements;
    }
}
