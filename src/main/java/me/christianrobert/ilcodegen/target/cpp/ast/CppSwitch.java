package me.christianrobert.ilcodegen.target.cpp.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class CppSwitch extends CppNode {

    private final CppNode expression;
    private final List<CppSwitchCase> cases;

    public CppSwitch(CppNode expression, List<CppSwitchCase> cases) {
        this.expression = expression;
        this.cases = cases == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(cases));
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.SWITCH;
    }

    public CppNode getExpression() {
        return expression;
    }

    public List<CppSwitchCase> getCases() {
        return cases;
    }
}
