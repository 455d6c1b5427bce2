package com.dframeio.memory.impl;

import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;

/**
 * Logical NOT - negates the nested predicate.
 * Two-valued: a nested comparison that was false because of a null value becomes true.
 */
public class NotPredicate implements RowPredicate {

    private final RowPredicate predicate;

    public NotPredicate(RowPredicate predicate) {
        this.predicate = predicate;
    }

    @Override
    public boolean test(Row row) {
        return !predicate.test(row);
    }

    @Override
    public String toString() {
        return "NOT(" + predicate + ")";
    }
}
