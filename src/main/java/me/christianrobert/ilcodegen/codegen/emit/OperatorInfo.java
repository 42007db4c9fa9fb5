package me.christianrobert.ilcodegen.codegen.emit;

/**
 * Binding power and grouping of one target operator. Higher precedence binds tighter.
 */
public final class OperatorInfo {

    public enum Associativity {
        LEFT,
        RIGHT
    }

    private final String symbol;
    private final int precedence;
    private final Associativity associativity;
    private final boolean comparison;

    public OperatorInfo(String symbol, int precedence, Associativity associativity, boolean comparison) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.associativity = associativity;
        this.comparison = comparison;
    }

    public static OperatorInfo left(String symbol, int precedence) {
        return new OperatorInfo(symbol, precedence, Associativity.LEFT, false);
    }

    public static OperatorInfo right(String symbol, int precedence) {
        return new OperatorInfo(symbol, precedence, Associativity.RIGHT, false);
    }

    public static OperatorInfo comparison(String symbol, int precedence) {
        return new OperatorInfo(symbol, precedence, Associativity.LEFT, true);
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    public Associativity getAssociativity() {
        return associativity;
    }

    public boolean isComparison() {
        return comparison;
    }

    @Override
    public String toString() {
        return symbol + "(" + precedence + ")";
    }
}
