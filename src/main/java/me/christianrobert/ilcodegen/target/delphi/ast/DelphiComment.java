package me.christianrobert.ilcodegen.target.delphi.ast;

public final class DelphiComment extends DelphiNode {

    private final String text;
    private final boolean doc;

    public DelphiComment(String text, boolean doc) {
        this.text = text;
        this.doc = doc;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.COMMENT;
    }

    public String getText() {
        return text;
    }

    public boolean isDoc() {
        return doc;
    }
}
