package me.christianrobert.ilcodegen.target.delphi.ast;

import java.util.List;

public final class DelphiClass extends DelphiNode {

    private final String name;
    private final String parent;
    private final List<DelphiNode> members;
    private final DelphiComment docComment;

    public DelphiClass(String name, String parent, List<DelphiNode> members, DelphiComment docComment) {
        this.name = name;
        this.parent = parent;
        this.members = members == null ? List.of() : List.copyOf(members);
        this.docComment = docComment;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.CLASS;
    }

    public String getName() {
        return name;
    }

    public String getParent() {
        return parent;
    }

    public List<DelphiNode> getMembers() {
        return members;
    }

    public DelphiComment getDocComment() {
        return docComment;
    }
}
