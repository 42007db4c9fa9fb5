package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * A comment line or block. Doc comments render as a doc block, others as {@code //} lines.
 */
public final class CppComment extends CppNode {

    private final String text;
    private final boolean doc;

    public CppComment(String text, boolean doc) {
        this.text = text;
        this.doc = doc;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.COMMENT;
    }

    public String getText() {
        return text;
    }

    public boolean isDoc() {
        return doc;
    }
}
