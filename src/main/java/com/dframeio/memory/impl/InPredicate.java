package com.dframeio.memory.impl;

import com.dframeio.filter.ast.Literal;
import com.dframeio.filter.ast.TypeFamily;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.memory.ValueComparator;
import com.dframeio.memory.ValueResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Condition that checks if a column value is in a list of allowed values.
 * NULL entries of the list never match.
 */
public class InPredicate implements RowPredicate {

    private final String column;
    private final List<Object> allowedValues;
    private final TypeFamily family;
    private final ValueResolver resolver;

    public InPredicate(String column, List<Literal> values, ValueResolver resolver) {
        this.column = column;
        this.resolver = resolver;

        List<Object> allowed = new ArrayList<>();
        TypeFamily listFamily = null;
        for (Literal value : values) {
            if (!value.isNull()) {
                allowed.add(value.value());
                listFamily = value.family();
            }
        }
        this.allowedValues = List.copyOf(allowed);
        this.family = listFamily;
    }

    @Override
    public boolean test(Row row) {
        if (family == null) {
            return false; // Only NULL entries
        }
        Optional<Object> actual = resolver.resolveAs(column, row, family);
        if (actual.isEmpty()) {
            return false;
        }

        Object value = actual.get();
        for (Object allowed : allowedValues) {
            if (ValueComparator.compare(family, value, allowed) == 0) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return column + " IN " + allowedValues;
    }
}
