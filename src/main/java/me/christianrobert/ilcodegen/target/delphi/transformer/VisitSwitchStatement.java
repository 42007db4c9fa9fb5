package me.christianrobert.ilcodegen.target.delphi.transformer;

import me.christianrobert.ilcodegen.codegen.analysis.SwitchGroup;
import me.christianrobert.ilcodegen.codegen.analysis.SwitchGroups;
import me.christianrobert.ilcodegen.codegen.context.Scope;
import me.christianrobert.ilcodegen.codegen.type.TypeDescriptor;
import me.christianrobert.ilcodegen.il.IlKind;
import me.christianrobert.ilcodegen.il.IlNode;
import me.christianrobert.ilcodegen.target.delphi.DelphiType;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiAssignment;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBinary;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiBlock;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCase;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiCaseArm;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIdentifier;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiIf;
import me.christianrobert.ilcodegen.target.delphi.ast.DelphiNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for switch statements.
 *
 * <h3>Integer labels</h3>
 * <p>Become a {@code case} statement. Grouped labels share one arm and the default arm is the
 * {@code else} part. Pascal arms never fall through, and {@code Break} inside an arm would leave
 * the enclosing loop, so both are reported.</p>
 * <pre>
 * switch (mode) {             case Mode of
 *   case 0: case 1:             0, 1:
 *     x = 1; break;      →        begin X := 1; end;
 *   default:                    else
 *     x = 2;                      X := 2;
 * }                           end;
 * </pre>
 *
 * <h3>Other labels (strings, characters, expressions)</h3>
 * <p>Become an if / else-if chain comparing the discriminant, evaluated once into the
 * {@code SwitchValue} local when it is not a plain name.</p>
 */
public class VisitSwitchStatement {

    public static List<DelphiNode> v(IlNode node, DelphiCodeBuilder b) {
        List<SwitchGroup> groups = SwitchGroups.group(node);
        if (allIntegerLabels(node)) {
            return List.of(caseStatement(node, groups, b));
        }
        return ifChain(node, groups, b);
    }

    private static boolean allIntegerLabels(IlNode node) {
        if (!SwitchGroups.allOrdinalLiterals(node)) {
            return false;
        }
        for (IlNode switchCase : node.nodes("cases")) {
            IlNode test = switchCase.node("test");
            if (test != null && test.is(IlKind.LITERAL) && test.value("value") instanceof String) {
                return false;
            }
        }
        return true;
    }

    private static DelphiNode caseStatement(IlNode node, List<SwitchGroup> groups, DelphiCodeBuilder b) {
        DelphiNode selector = b.visitExpression(node.node("discriminant"));
        List<DelphiCaseArm> arms = new ArrayList<>();
        List<DelphiNode> elseStatements = null;
        for (SwitchGroup group : groups) {
            if (group.isFallsThrough()) {
                b.getContext().warn(node, "Switch fall-through cannot be expressed in a case statement");
            }
            if (SwitchGroups.hasNestedBreak(group.getBody())) {
                b.getContext().warn(node, "Nested break inside a switch arm would leave the enclosing loop");
            }
            List<DelphiNode> statements = body(group, b);
            if (group.includesDefault()) {
                // labels grouped with default are covered by the else part
                elseStatements = statements;
                continue;
            }
            List<DelphiNode> labels = new ArrayList<>();
            for (IlNode test : group.getTests()) {
                labels.add(b.visitExpression(test));
            }
            arms.add(new DelphiCaseArm(labels, statements));
        }
        return new DelphiCase(selector, arms, elseStatements);
    }

    private static List<DelphiNode> ifChain(IlNode node, List<SwitchGroup> groups, DelphiCodeBuilder b) {
        List<DelphiNode> result = new ArrayList<>();

        // STEP 1: Evaluate the discriminant once
        IlNode discriminant = node.node("discriminant");
        DelphiNode subject = b.visitExpression(discriminant);
        if (discriminant != null && !discriminant.is(IlKind.IDENTIFIER)
                && !discriminant.is(IlKind.THIS_PROPERTY_ACCESS)) {
            TypeDescriptor type = b.typeOf(discriminant);
            DelphiType delphiType = type != null ? b.mapType(type) : DelphiType.CARDINAL;
            String temporary = b.temporary("SwitchValue", delphiType);
            result.add(new DelphiAssignment(new DelphiIdentifier(temporary), subject));
            subject = new DelphiIdentifier(temporary);
        }

        // STEP 2: Chain the arms from the last one backwards
        List<DelphiNode> defaultBody = null;
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

        DelphiNode chain = defaultBody != null ? new DelphiBlock(defaultBody) : null;
        for (int i = arms.size() - 1; i >= 0; i--) {
            SwitchGroup arm = arms.get(i);
            DelphiNode condition = null;
            for (IlNode test : arm.getTests()) {
                DelphiNode comparison = new DelphiBinary("=", subject, b.visitExpression(test));
                condition = condition == null ? comparison : new DelphiBinary("or", condition, comparison);
            }
            chain = new DelphiIf(condition, new DelphiBlock(body(arm, b)), chain);
        }

        if (chain instanceof DelphiBlock) {
            result.addAll(((DelphiBlock) chain).getStatements());
        } else if (chain != null) {
            result.add(chain);
        }
        return result;
    }

    private static List<DelphiNode> body(SwitchGroup group, DelphiCodeBuilder b) {
        b.getContext().getSymbols().push(Scope.Kind.BLOCK, "<case>");
        try {
            return b.visitStatements(group.getBody());
        } finally {
            b.getContext().getSymbols().pop();
        }
    }
}
