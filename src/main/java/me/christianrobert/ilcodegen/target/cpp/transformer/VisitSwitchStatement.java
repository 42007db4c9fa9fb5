package me.christianrobert.ilcodegen.target.cpp.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.SwitchGroup;
import me.christianrobert.ilcodegen.codegen.analysis.SwitchGroups;
import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.cpp.CppType;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBinary;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBlock;
import me.christianrobert.ilcodegen.target.cpp.ast.CppBreak;
import me.christianrobert.ilcodegen.target.cpp.ast.CppExpressionStatement;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIdentifier;
import me.christianrobert.ilcodegen.target.cpp.ast.CppIf;
import me.christianrobert.ilcodegen.target.cpp.ast.CppLiteral;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNode;
import me.christianrobert.ilcodegen.target.cpp.ast.CppNodeKind;
import me.christianrobert.ilcodegen.target.cpp.ast.CppSwitch;
import me.christianrobert.ilcodegen.target.cpp.ast.CppSwitchCase;
import me.christianrobert.ilcodegen.target.cpp.ast.CppVariableDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Static helper for switch statements.
 *
 * <h3>Integral and single-character labels</h3>
 * <p>Become a C++ {@code switch}. Grouped labels share one arm, every arm that does not fall
 * through or jump ends in {@code break}, deliberate fall-through is marked {@code [[fallthrough]]}.</p>
 *
 * <h3>Other labels (strings, expressions)</h3>
 * <p>Become an if / else-if chain comparing the discriminant, evaluated once into a local when it
 * is not a plain name. Fall-through cannot be expressed there and is reported.</p>
 */
public class VisitSwitchStatement {

    private static final Set<CppNodeKind> JUMPS = Set.of(
            CppNodeKind.RETURN, CppNodeKind.THROW, CppNodeKind.BREAK, CppNodeKind.CONTINUE);

    public static List<CppNode> v(IlNode node, CppCodeBuilder b) {
        List<SwitchGroup> groups = SwitchGroups.group(node);
        if (SwitchGroups.allOrdinalLiterals(node)) {
            return List.of(nativeSwitch(node, groups, b));
        }
        return ifChain(node, groups, b);
    }

    private static CppNode nativeSwitch(IlNode node, List<SwitchGroup> groups, CppCodeBuilder b) {
        CppNode discriminant = b.visitExpression(node.node("discriminant"));
        List<CppSwitchCase> cases = new ArrayList<>();
        for (SwitchGroup group : groups) {
            List<CppNode> labels = new ArrayList<>();
            for (IlNode test : group.getTests()) {
                labels.add(label(test, b));
            }
            List<CppNode> statements = new ArrayList<>(body(group, b));
            if (group.isFallsThrough()) {
                if (!statements.isEmpty()) {
                    statements.add(new CppExpressionStatement(new CppLiteral("[[fallthrough]]")));
                }
            } else if (statements.isEmpty() || !JUMPS.contains(statements.get(statements.size() - 1).getKind())) {
                statements.add(CppBreak.INSTANCE);
            }
            cases.add(new CppSwitchCase(labels, group.includesDefault(), statements));
        }
        return new CppSwitch(discriminant, cases);
    }

    private static List<CppNode> ifChain(IlNode node, List<SwitchGroup> groups, CppCodeBuilder b) {
        List<CppNode> result = new ArrayList<>();

        // STEP 1: Evaluate the discriminant once
        IlNode discriminant = node.node("discriminant");
        CppNode subject = b.visitExpression(discriminant);
        if (discriminant != null && !discriminant.is(IlKind.IDENTIFIER) && !discriminant.is(IlKind.THIS_PROPERTY_ACCESS)) {
            result.add(new CppVariableDeclaration(CppType.AUTO, "switch_value", subject, true, false, false));
            subject = new CppIdentifier("switch_value");
        }

        // STEP 2: Chain the arms from the last one backwards
        List<CppNode> defaultBody = null;
        List<SwitchGroup> arms = new ArrayList<>();
        for (SwitchGroup group : groups) {
            if (group.isFallsThrough()) {
                b.getContext().warn(node, "Switch fall-through cannot be expressed in an if/else chain");
            }
            if (SwitchGroups.hasNestedBreak(group.getBody())) {
                b.getContext().warn(node, "Nested break inside a switch arm lowered to an if/else chain");
            }
            if (group.includesDefault()) {
                defaultBody = body(group, b);
            } else {
                arms.add(group);
            }
        }

        CppNode chain = defaultBody != null ? new CppBlock(defaultBody) : null;
        for (int i = arms.size() - 1; i >= 0; i--) {
            SwitchGroup arm = arms.get(i);
            CppNode condition = null;
            for (IlNode test : arm.getTests()) {
                CppNode comparison = new CppBinary("==", subject, b.visitExpression(test));
                condition = condition == null ? comparison : new CppBinary("||", condition, comparison);
            }
            chain = new CppIf(condition, new CppBlock(body(arm, b)), chain);
        }

        if (chain != null) {
            result.add(chain);
        }
        return result;
    }

    private static List<CppNode> body(SwitchGroup group, CppCodeBuilder b) {
        b.getContext().getSymbols().push(Scope.Kind.BLOCK, "<case>");
        try {
            return b.visitStatements(group.getBody());
        } finally {
            b.getContext().getSymbols().pop();
        }
    }

    private static CppNode label(IlNode test, CppCodeBuilder b) {
        Object value = test.is(IlKind.LITERAL) ? test.value("value") : null;
        if (value instanceof String) {
            return new CppLiteral(VisitLiteralExpression.charLiteral(((String) value).charAt(0)));
        }
        return b.visitExpression(test);
    }
}
