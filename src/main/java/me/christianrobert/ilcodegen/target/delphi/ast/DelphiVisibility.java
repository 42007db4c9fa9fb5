package me.christianrobert.ilcodegen.target.delphi.ast;

public enum DelphiVisibility {

    PRIVATE("private"),
    PROTECTED("protected"),
    PUBLIC("public");

    private final String keyword;

    DelphiVisibility(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
