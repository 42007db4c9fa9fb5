package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppBlock extends CppNode {

    private final List<CppNode> statements;

    public CppBlock(List<CppNode> statements) {
        this.statements = statements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(statements));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.BLOCK;
    }

    public List<CppNode> getStatements() {
        return statements;
    }
}
