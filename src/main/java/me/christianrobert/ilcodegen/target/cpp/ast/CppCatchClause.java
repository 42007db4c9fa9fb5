package me.christianrobert.ilcodegen.target.cpp.ast;

import me.christianrobert.ilcodegen.target.cpp.CppType;

public final class CppCatchClause extends CppNode {

    private final CppType exceptionType;
    private final String name;
    private final CppBlock body;

    public CppCatchClause(CppType exceptionType, String name, CppBlock body) {
        this.exceptionType = exceptionType;
        this.name = name;
        this.body = body;
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.CATCH_CLAUSE;
    }

    /**
     * Caught type, or null for {@code catch (...)}.
     */
    public CppType getExceptionType() {
        return exceptionType;
    }

    public String getName() {
        return name;
    }

    public CppBlock getBody() {
        return body;
    }
}
