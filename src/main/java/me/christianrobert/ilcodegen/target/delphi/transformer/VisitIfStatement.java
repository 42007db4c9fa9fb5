package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIf;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

/**
 * Static helper for if statements. Branches always become {@code begin ... end} blocks; an
 * {@code else if} chain stays a chain. Non-boolean conditions are compared against the zero
 * value of their type.
 */
public class VisitIfStatement {

    public static DelphiNode v(IlNode node, DelphiCodeBuilder b) {
        DelphiNode condition = VisitOperatorExpression.condition(node.node("test"), b);
        DelphiBlock thenBranch = b.visitBody(node.node("consequent"));

        IlNode alternate = node.node("alternate");
        DelphiNode elseBranch = null;
        if (alternate != null) {
            elseBranch = alternate.is(IlKind.IF_STATEMENT) ? v(alternate, b) : b.visitBody(alternate);
        }
        return new DelphiIf(condition, thenBranch, elseBranch);
    }
}
