package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppLambda extends CppNode {

    private final String capture;
    private final List<CppParameter> parameters;
    private final CppType returnType;
    private final CppBlock body;

    public CppLambda(String capture, List<CppParameter> parameters, CppType returnType, CppBlock body) {
        this.capture = capture;
        this.parameters = parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(parameters));
        this.returnType = returnType;
        this.body = body;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.LAMBDA;
    }

    public String getCapture() {
        return capture;
    }

    public List<CppParameter> getParameters() {
        return parameters;
    }

    /**
     * Explicit return type, or null.
     */
    public CppType getReturnType() {
        return returnType;
    }

    public CppBlock getBody() {
        return body;
    }
}
