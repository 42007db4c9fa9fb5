package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * {@code for Variable := Start to End do} (or {@code downto}); both bounds inclusive.
 */
public final class DelphiFor extends DelphiNode {

    private final String variable;
    private final DelphiNode start;
    private final DelphiNode end;
    private final boolean downto;
    private final DelphiBlock body;

    public DelphiFor(String variable, DelphiNode start, DelphiNode end, boolean downto, DelphiBlock body) {
        this.variable = variable;
        this.start = start;
        this.end = end;
        this.downto = downto;
        this.body = body;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.FOR;
    }

    public String getVariable() {
        return variable;
    }

    public DelphiNode getStart() {
        return start;
    }

    public DelphiNode getEnd() {
        return end;
    }

    public boolean isDownto() {
        return downto;
    }

    public DelphiBlock getBody() {
        return body;
    }
}
