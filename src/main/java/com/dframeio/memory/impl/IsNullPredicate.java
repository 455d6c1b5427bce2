package com.dframeio.memory.impl;

import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.memory.ValueResolver;

/**
 * Condition that checks if a column is null or absent, or the opposite when negated.
 */
public class IsNullPredicate implements RowPredicate {

    private final String column;
    private final boolean negated;
    private final ValueResolver resolver;

    public IsNullPredicate(String column, boolean negated, ValueResolver resolver) {
        this.column = column;
        this.negated = negated;
        this.resolver = resolver;
    }

    @Override
    public boolean test(Row row) {
        boolean isNull = resolver.resolve(column, row).isEmpty();
        return negated != isNull;
    }

    @Override
    public String toString() {
        return column + (negated ? " IS NOT NULL" : " IS NULL");
    }
}
