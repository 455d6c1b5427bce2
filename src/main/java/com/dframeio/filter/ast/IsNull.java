package com.dframeio.filter.ast;

/**
 * {@code column IS NULL}, or {@code column IS NOT NULL} when negated.
 */
public record IsNull(String column, boolean negated) implements Expression {

    public IsNull {
        Columns.requireName(column);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIsNull(this);
    }

    @Override
    public String toString() {
        return column + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
