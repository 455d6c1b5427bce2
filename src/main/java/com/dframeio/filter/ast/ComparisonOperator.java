package com.dframeio.filter.ast;

/**
 * Binary comparison operators of the filter language.
 */
public enum ComparisonOperator {
    EQ("="),
    NE("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    LIKE("LIKE");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Whether the operator needs a total order on its operands ({@code <, <=, >, >=}).
     */
    public boolean isOrdering() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Evaluate the operator against the result of {@code left.compareTo(right)}.
     * Not defined for LIKE.
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case NE -> comparison != 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LIKE -> throw new IllegalStateException("LIKE is not an ordering comparison");
        };
    }
}
