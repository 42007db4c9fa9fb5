package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code name(value)} entry of a constructor initializer list.
 */
public final class CppMemberInitializer extends CppNode {

    private final String name;
    private final List<CppNode> arguments;

    public CppMemberInitializer(String name, List<CppNode> arguments) {
        this.name = name;
        this.arguments = arguments == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.MEMBER_INITIALIZER;
    }

    public String getName() {
        return name;
    }

    public List<CppNode> getArguments() {
        return arguments;
    }
}
