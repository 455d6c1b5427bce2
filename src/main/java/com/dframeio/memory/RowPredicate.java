package com.dframeio.memory;

import com.dframeio.filter.BackendKind;
import com.dframeio.filter.BackendPredicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Compiled in-memory filter: decides whether a row is selected.
 * Implementations are immutable and safe to call from several threads at once.
 */
public interface RowPredicate extends BackendPredicate {

    /**
     * Evaluate this predicate against a row.
     *
     * @param row Row values
     * @return true if the row is selected
     * @throws com.dframeio.exception.TypeMismatchException if a value has a type the predicate cannot compare
     */
    boolean test(Row row);

    /**
     * Select the matching rows, preserving order.
     */
    default List<Row> filter(Collection<Row> rows) {
        List<Row> selected = new ArrayList<>();
        for (Row row : rows) {
            if (test(row)) {
                selected.add(row);
            }
        }
        return selected;
    }

    @Override
    default BackendKind kind() {
        return BackendKind.IN_MEMORY;
    }
}
