package com.dframeio.memory.impl;

import com.dframeio.filter.ast.ComparisonOperator;
import com.dframeio.filter.ast.TypeFamily;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.memory.ValueComparator;
import com.dframeio.memory.ValueResolver;

import java.util.Optional;

/**
 * Compares two columns of the same row.
 */
public class ColumnComparisonPredicate implements RowPredicate {

    private final String left;
    private final ComparisonOperator operator;
    private final String right;
    private final ValueResolver resolver;

    public ColumnComparisonPredicate(String left, ComparisonOperator operator, String right,
                                     ValueResolver resolver) {
        this.left = left;
        this.operator = operator;
        this.right = right;
        this.resolver = resolver;
    }

    @Override
    public boolean test(Row row) {
        Optional<Object> leftValue = resolver.resolve(left, row);
        if (leftValue.isEmpty()) {
            return false;
        }
        TypeFamily family = resolver.familyOf(left, leftValue.get());
        Optional<Object> rightValue = resolver.resolveAs(right, row, family);
        if (rightValue.isEmpty()) {
            return false;
        }
        Optional<Object> normalizedLeft = resolver.resolveAs(left, row, family);
        return operator.test(ValueComparator.compare(family, normalizedLeft.get(), rightValue.get()));
    }

    @Override
    public String toString() {
        return left + " " + operator.symbol() + " " + right;
    }
}
