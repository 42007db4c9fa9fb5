package me.christianrobert.ilcodegen.target.cpp.ast;

/**
 * Member selection: {@code obj.member}, {@code ptr->member} or {@code Scope::member}.
 */
public final class CppMemberAccess extends CppNode {

    public enum Operator {
        DOT("."),
        ARROW("->"),
        SCOPE("::");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final CppNode target;
    private final String member;
    private final Operator operator;

    public CppMemberAccess(CppNode target, String member, Operator operator) {
        this.target = target;
        this.member = member;
        this.operator = operator;
    }

    public static CppMemberAccess thisMember(String member) {
        return new CppMemberAccess(CppThis.INSTANCE, member, Operator.ARROW);
    }

    @Override
    public CppNodeKind getKind() {
        return CppNodeKind.MEMBER_ACCESS;
    }

    public CppNode getTarget() {
        return target;
    }

    public String getMember() {
        return member;
    }

    public Operator getOperator() {
        return operator;
    }
}
