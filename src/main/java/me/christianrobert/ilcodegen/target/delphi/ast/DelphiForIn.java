package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiForIn extends DelphiNode {

    private final String variable;
    private final DelphiNode collection;
    private final DelphiBlock body;

    public DelphiForIn(String variable, DelphiNode collection, DelphiBlock body) {
        this.variable = variable;
        this.collection = collection;
        this.body = body;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.FOR_IN;
    }

    public String getVariable() {
        return variable;
    }

    public DelphiNode getCollection() {
        return collection;
    }

    public DelphiBlock getBody() {
        return body;
    }
}
