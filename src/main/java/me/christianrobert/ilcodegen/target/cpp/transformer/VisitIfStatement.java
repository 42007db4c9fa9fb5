package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIf;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;

/**
 * Static helper for if statements. Branches always become braced blocks; an
 * {@code else if} chain stays a chain.
 */
public class VisitIfStatement {

    public static CppNode v(IlNode node, CppCodeBuilder b) {
        CppNode condition = b.visitExpression(node.node("test"));
        CppBlock thenBranch = b.visitBody(node.node("consequent"));

        IlNode alternate = node.node("alternate");
        CppNode elseBranch = null;
        if (alternate != null) {
            elseBranch = alternate.is(IlKind.IF_STATEMENT) ? v(alternate, b) : b.visitBody(alternate);
        }
        return new CppIf(condition, thenBranch, elseBranch);
    }
}
