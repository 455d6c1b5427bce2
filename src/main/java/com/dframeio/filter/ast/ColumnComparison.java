package com.dframeio.filter.ast;

import java.util.Objects;

/**
 * Comparison of two columns of the same row, e.g. {@code table1.id = table2.id}.
 */
public record ColumnComparison(String left, ComparisonOperator operator, String right) implements Expression {

    public ColumnComparison {
        Columns.requireName(left);
        Columns.requireName(right);
        Objects.requireNonNull(operator, "operator");
        if (operator == ComparisonOperator.LIKE) {
            throw new IllegalArgumentException("LIKE requires a literal pattern");
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitColumnComparison(this);
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
