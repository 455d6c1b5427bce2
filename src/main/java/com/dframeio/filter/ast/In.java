package com.dframeio.filter.ast;

import java.util.List;
import java.util.Objects;

/**
 * Set membership: {@code column IN (v1, v2, ...)}.
 */
public record In(String column, List<Literal> values) implements Expression {

    public In {
        Columns.requireName(column);
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN requires at least one value");
        }
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIn(this);
    }

    @Override
    public String toString() {
        return column + " IN " + values;
    }
}
