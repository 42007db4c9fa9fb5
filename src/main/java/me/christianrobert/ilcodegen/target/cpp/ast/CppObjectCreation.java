package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Direct construction of a temporary: {@code T(args)} or, with braces, {@code T{args}}.
 */
public final class CppObjectCreation extends CppNode {

    private final CppType type;
    private final List<CppNode> arguments;
    private final boolean braces;

    public CppObjectCreation(CppType type, List<CppNode> arguments, boolean braces) {
        this.type = type;
        this.arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
        this.braces = braces;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.OBJECT_CREATION;
    }

    public CppType getType() {
        return type;
    }

    public List<CppNode> getArguments() {
        return arguments;
    }

    public boolean usesBraces() {
        return braces;
    }
}
