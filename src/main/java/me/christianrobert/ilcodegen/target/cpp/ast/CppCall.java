package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppCall extends CppNode {

    private final CppNode callee;
    private final List<CppNode> arguments;

    public CppCall(CppNode callee, List<CppNode> arguments) {
        this.callee = callee;
        this.arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CALL;
    }

    public CppNode getCallee() {
        return callee;
    }

    public List<CppNode> getArguments() {
        return arguments;
    }
}
