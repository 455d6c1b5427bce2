package com.dframeio.memory.impl;

import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;

import java.util.List;

/**
 * Logical AND - all nested predicates must be true. Evaluation stops at the first false.
 */
public class AndPredicate implements RowPredicate {

    private final List<RowPredicate> predicates;

    public AndPredicate(List<RowPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    @Override
    public boolean test(Row row) {
        for (RowPredicate predicate : predicates) {
            if (!predicate.test(row)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "AND(" + predicates + ")";
    }
}
