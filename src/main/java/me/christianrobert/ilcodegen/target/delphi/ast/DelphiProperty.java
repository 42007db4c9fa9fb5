package me.christianrobert.ilcodegen.target.delphi.ast;

import me.christianrobert.ilcodegen.target.delphi.DelphiType;

/**
 * {@code property Name: Type read Reader write Writer;} Either accessor may be null.
 */
public final class DelphiProperty extends DelphiNode {

    private final String name;
    private final DelphiType type;
    private final String reader;
    private final String writer;
    private final DelphiVisibility visibility;

    public DelphiProperty(String name, DelphiType type, String reader, String writer, DelphiVisibility visibility) {
        this.name = name;
        this.type = type;
        this.reader = reader;
        this.writer = writer;
        this.visibility = visibility;
    }

    @Override
    public DelphiNodeKind getKind() {
        return DelphiNodeKind.PROPERTY;
    }

    public String getName() {
        return name;
    }

    public DelphiType getType() {
        return type;
    }

    public String getReader() {
        return reader;
    }

    public String getWriter() {
        return writer;
    }

    public DelphiVisibility getVisibility() {
        return visibility;
    }
}
