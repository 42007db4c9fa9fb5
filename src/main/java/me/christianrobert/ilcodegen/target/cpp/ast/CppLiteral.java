package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * A literal in its final C++ spelling ({@code 0xFFu}, {@code "abc"}, {@code true}).
 */
public final class CppLiteral extends CppNode {

    private final String text;

    public CppLiteral(String text) {
        this.text = text;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.LITERAL;
    }

    public String getText() {
        return text;
    }
}
