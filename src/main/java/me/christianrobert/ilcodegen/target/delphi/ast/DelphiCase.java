package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

/**
 * {@code case Selector of ... end}. {@code elseStatements} is null without an else part.
 */
public final class DelphiCase extends DelphiNode {

    private final DelphiNode selector;
    private final List<DelphiCaseArm> arms;
    private final List<DelphiNode> elseStatements;

    public DelphiCase(DelphiNode selector, List<DelphiCaseArm> arms, List<DelphiNode> elseStatements) {
        this.selector = selector;
        this.arms = arms == null ? List.of() : List.copyOf(arms);
        this.elseStatements = elseStatements == null ? null : List.copyOf(elseStatements);
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CASE;
    }

    public DelphiNode getSelector() {
        return selector;
    }

    public List<DelphiCaseArm> getArms() {
        return arms;
    }

    public List<DelphiNode> getElseStatements() {
        return elseStatements;
    }
}
