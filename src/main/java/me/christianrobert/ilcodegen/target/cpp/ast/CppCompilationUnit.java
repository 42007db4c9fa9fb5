package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Root of a generated C++ file: header comment, includes, and the declarations of one namespace.
 */
public final class CppCompilationUnit extends CppNode {

    private final String headerComment;
    private final List<CppInclude> includes;
    private final String namespaceName;
    private final List<CppNode> declarations;

    public CppCompilationUnit(String headerComment, List<CppInclude> includes, String namespaceName,
                              List<CppNode> declarations) {
        this.headerComment = headerComment;
        this.includes = includes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(includes));
        this.namespaceName = namespaceName;
        this.declarations = declarations == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.COMPILATION_UNIT;
    }

    /**
     * Header comment text, or null when comments are disabled.
     */
    public String getHeaderComment() {
        return headerComment;
    }

    public List<CppInclude> getIncludes() {
        return includes;
    }

    /**
     * Enclosing namespace, or null for the global namespace.
     */
    public String getNamespaceName() {
        return namespaceName;
    }

    public List<CppNode> getDeclarations() {
        return declarations;
    }
}
