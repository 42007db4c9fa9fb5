package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

import java.util.List;

public final class DelphiAnonymousMethod extends DelphiNode {

    private final List<DelphiParameter> parameters;
    private final DelphiType returnType;
    private final List<DelphiVariable> locals;
    private final DelphiBlock body;

    public DelphiAnonymousMethod(List<DelphiParameter> parameters, DelphiType returnType, List<DelphiVariable> locals,
                                 DelphiBlock body) {
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.returnType = returnType;
        this.locals = locals == null ? List.of() : List.copyOf(locals);
        this.body = body;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.ANONYMOUS_METHOD;
    }

    public List<DelphiParameter> getParameters() {
        return parameters;
    }

    public DelphiType getReturnType() {
        return returnType;
    }

    public List<DelphiVariable> getLocals() {
        return locals;
    }

    public DelphiBlock getBody() {
        return body;
    }
}
