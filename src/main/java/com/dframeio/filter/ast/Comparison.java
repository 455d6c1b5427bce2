package com.dframeio.filter.ast;

import java.util.Objects;

/**
 * {@code column operator literal}, including {@code column LIKE 'pattern'}.
 */
public record Comparison(String column, ComparisonOperator operator, Literal value) implements Expression {

    public Comparison {
        Columns.requireName(column);
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return column + " " + operator.symbol() + " " + value;
    }
}
