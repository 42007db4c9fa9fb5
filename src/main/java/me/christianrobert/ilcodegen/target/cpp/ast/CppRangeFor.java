package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

/**
 * {@code for (const auto& item : range)}.
 */
public final class CppRangeFor extends CppNode {

    private final CppType type;
    private final String name;
    private final CppNode range;
    private final CppBlock body;

    public CppRangeFor(CppType type, String name, CppNode range, CppBlock body) {
        this.type = type;
        this.name = name;
        this.range = range;
        this.body = body;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.RANGE_FOR;
    }

    public CppType getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public CppNode getRange() {
        return range;
    }

    public CppBlock getBody() {
        return body;
    }
}
