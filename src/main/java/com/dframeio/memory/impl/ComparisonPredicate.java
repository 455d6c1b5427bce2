package com.dframeio.memory.impl;

import com.dframeio.filter.ast.ComparisonOperator;
import com.dframeio.filter.ast.Literal;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.memory.ValueComparator;
import com.dframeio.memory.ValueResolver;

import java.util.Optional;

/**
 * Compares a column value to a literal with =, !=, &lt;, &lt;=, &gt; or &gt;=.
 */
public class ComparisonPredicate implements RowPredicate {

    private final String column;
    private final ComparisonOperator operator;
    private final Literal expected;
    private final ValueResolver resolver;

    public ComparisonPredicate(String column, ComparisonOperator operator, Literal expected,
                               ValueResolver resolver) {
        if (operator == ComparisonOperator.LIKE) {
            throw new IllegalArgumentException("LIKE is handled by LikePredicate");
        }
        this.column = column;
        this.operator = operator;
        this.expected = expected;
        this.resolver = resolver;
    }

    @Override
    public boolean test(Row row) {
        if (expected.isNull()) {
            return false; // Comparison with NULL never matches
        }
        Optional<Object> actual = resolver.resolveAs(column, row, expected.family());
        if (actual.isEmpty()) {
            return false; // Null column = condition is false
        }
        return operator.test(ValueComparator.compare(expected.family(), actual.get(), expected.value()));
    }

    @Override
    public String toString() {
        return column + " " + operator.symbol() + " " + expected;
    }
}
