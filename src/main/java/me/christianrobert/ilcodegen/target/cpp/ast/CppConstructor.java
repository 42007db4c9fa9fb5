package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppConstructor extends CppNode {

    private final String className;
    private final List<CppParameter> parameters;
    private final List<CppMemberInitializer> initializers;
    private final CppBlock body;
    private final CppComment docComment;

    public CppConstructor(String className, List<CppParameter> parameters,
                          List<CppMemberInitializer> initializers, CppBlock body, CppComment docComment) {
        this.className = className;
        this.parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.initializers = initializers == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(initializers));
        this.body = body;
        this.docComment = docComment;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CONSTRUCTOR;
    }

    public String getClassName() {
        return className;
    }

    public List<CppParameter> getParameters() {
        return parameters;
    }

    /**
     * Member-initializer list entries; a base-class call comes first.
     */
    public List<CppMemberInitializer> getInitializers() {
        return initializers;
    }

    public CppBlock getBody() {
        return body;
    }

    public CppComment getDocComment() {
        return docComment;
    }
}
