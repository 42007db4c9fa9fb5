package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

/**
 * Routine call. A call without arguments renders without parentheses.
 */
public final class DelphiCall extends DelphiNode {

    private final DelphiNode callee;
    private final List<DelphiNode> arguments;

    public DelphiCall(DelphiNode callee, List<DelphiNode> arguments) {
        this.callee = callee;
        this.arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * {@code Name(args)}.
     */
    public static DelphiCall of(String name, DelphiNode... arguments) {
        return new DelphiCall(new DelphiIdentifier(name), List.of(arguments));
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CALL;
    }

    public DelphiNode getCallee() {
        return callee;
    }

    public List<DelphiNode> getArguments() {
        return arguments;
    }
}
