package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppClass extends CppNode {

    private final String name;
    private final String baseClass;
    private final List<CppNode> members;
    private final CppComment docComment;

    public CppClass(String name, String baseClass, List<CppNode> members, CppComment docComment) {
        this.name = name;
        this.baseClass = baseClass;
        this.members = members == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(members));
        this.docComment = docComment;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CLASS;
    }

    public String getName() {
        return name;
    }

    /**
     * Public base class, or null.
     */
    public String getBaseClass() {
        return baseClass;
    }

    public List<CppNode> getMembers() {
        return members;
    }

    public CppComment getDocComment() {
        return docComment;
    }
}
