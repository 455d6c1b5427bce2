package com.dframeio.relational;

import com.dframeio.filter.ast.ComparisonOperator;

/**
 * Fixed SQL fragments {@link SqlWriter} may emit.
 */
enum SqlKeyword {
    AND("AND"),
    OR("OR"),
    NOT("NOT"),
    IN("IN"),
    LIKE("LIKE"),
    IS_NULL("IS NULL"),
    IS_NOT_NULL("IS NOT NULL"),
    EQ("="),
    NE("<>"),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    ALWAYS_TRUE("1 = 1"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    COMMA(",");

    private final String sql;

    SqlKeyword(String sql) {
        this.sql = sql;
    }

    String sql() {
        return sql;
    }

    /**
     * Whether a space separates this fragment from the one before it.
     */
    boolean spaceBefore() {
        return this != CLOSE_PAREN && this != COMMA;
    }

    /**
     * Whether a space separates this fragment from the one after it.
     */
    boolean spaceAfter() {
        return this != OPEN_PAREN;
    }

    static SqlKeyword of(ComparisonOperator operator) {
        return switch (operator) {
            case EQ -> EQ;
            case NE -> NE;
            case LT -> LT;
            case LTE -> LTE;
            case GT -> GT;
            case GTE -> GTE;
            case LIKE -> LIKE;
        };
    }
}
