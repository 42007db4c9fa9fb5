package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A free function or a method. A null body renders a forward declaration (prototype).
 */
public final class CppFunction extends CppNode {

    private final CppType returnType;
    private final String name;
    private final List<CppParameter> parameters;
    private final CppBlock body;
    private final boolean isStatic;
    private final boolean isConstMethod;
    private final CppVisibility visibility;
    private final CppComment docComment;

    public CppFunction(CppType returnType, String name, List<CppParameter> parameters, CppBlock body,
                       boolean isStatic, boolean isConstMethod, CppVisibility visibility,
                       CppComment docComment) {
        this.returnType = returnType;
        this.name = name;
        this.parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.body = body;
        this.isStatic = isStatic;
        this.isConstMethod = isConstMethod;
        this.visibility = visibility;
        this.docComment = docComment;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.FUNCTION;
    }

    public CppType getReturnType() {
        return returnType;
    }

    public String getName() {
        return name;
    }

    public List<CppParameter> getParameters() {
        return parameters;
    }

    public CppBlock getBody() {
        return body;
    }

    public boolean isStatic() {
        return isStatic;
    }

    /**
     * Method qualified {@code const} (getters).
     */
    public boolean isConstMethod() {
        return isConstMethod;
    }

    /**
     * Visibility inside a class; ignored for free functions.
     */
    public CppVisibility getVisibility() {
        return visibility;
    }

    public CppComment getDocComment() {
        return docComment;
    }
}
