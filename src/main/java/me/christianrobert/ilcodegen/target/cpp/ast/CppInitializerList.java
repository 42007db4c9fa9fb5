package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppInitializerList extends CppNode {

    private final CppType type;
    private final List<CppNode> elements;

    public CppInitializerList(CppType type, List<CppNode> elements) {
        this.type = type;
        this.elements = elements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(elements));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.INITIALIZER_LIST;
    }

    /**
     * Type prefix ({@code std::vector<uint8_t>{...}}), or null for a bare list.
     */
    public CppType getType() {
        return type;
    }

    public List<CppNode> getElements() {
        return elements;
    }
}
