package com.dframeio.memory.impl;

import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;

/**
 * Predicate that selects every row.
 * Used for an empty filter.
 */
public final class AlwaysTruePredicate implements RowPredicate {

    public static final AlwaysTruePredicate INSTANCE = new AlwaysTruePredicate();

    private AlwaysTruePredicate() {
    }

    @Override
    public boolean test(Row row) {
        return true;
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
