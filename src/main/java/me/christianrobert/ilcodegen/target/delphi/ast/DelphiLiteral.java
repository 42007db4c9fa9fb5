package me.christianrobert.ilcodegen.target.delphi.ast;

/**
 * Literal already spelled in Delphi syntax ({@code $FF}, {@code 'abc'#10}, {@code nil}).
 */
public final class DelphiLiteral extends DelphiNode {

    public static final DelphiLiteral NIL = new DelphiLiteral("nil");
    public static final DelphiLiteral TRUE = new DelphiLiteral("True");
    public static final DelphiLiteral FALSE = new DelphiLiteral("False");
    public static final DelphiLiteral ZERO = new DelphiLiteral("0");
    public static final DelphiLiteral ONE = new DelphiLiteral("1");

    private final String text;

    public DelphiLiteral(String text) {
        this.text = text;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.LITERAL;
    }

    public String getText() {
        return text;
    }
}
