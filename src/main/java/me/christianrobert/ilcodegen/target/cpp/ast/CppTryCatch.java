package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppTryCatch extends CppNode {

    private final CppBlock tryBlock;
    private final List<CppCatchClause> catches;

    public CppTryCatch(CppBlock tryBlock, List<CppCatchClause> catches) {
        this.tryBlock = tryBlock;
        this.catches = catches == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(catches));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.TRY_CATCH;
    }

    public CppBlock getTryBlock() {
        return tryBlock;
    }

    public List<CppCatchClause> getCatches() {
        return catches;
    }
}
