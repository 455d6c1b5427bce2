package com.dframeio.memory.impl;

import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;

import java.util.List;

/**
 * Logical OR - at least one nested predicate must be true. Evaluation stops at the first true.
 */
public class OrPredicate implements RowPredicate {

    private final List<RowPredicate> predicates;

    public OrPredicate(List<RowPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    @Override
    public boolean test(Row row) {
        for (RowPredicate predicate : predicates) {
            if (predicate.test(row)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "OR(" + predicates + ")";
    }
}
