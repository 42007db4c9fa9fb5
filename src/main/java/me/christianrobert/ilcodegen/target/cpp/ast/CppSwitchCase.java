package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Case labels sharing one body. An empty label list with {@code isDefault} is the {@code default:} arm.
 */
public final class CppSwitchCase extends CppNode {

    private final List<CppNode> labels;
    private final boolean isDefault;
    private final List<CppNode> statements;

    public CppSwitchCase(List<CppNode> labels, boolean isDefault, List<CppNode> statements) {
        this.labels = labels == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(labels));
        this.isDefault = isDefault;
        this.statements = statements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(statements));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.SWITCH_CASE;
    }

    public List<CppNode> getLabels() {
        return labels;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public List<CppNode> getStatements() {
        return statements;
    }
}
