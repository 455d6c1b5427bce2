package com.dframeio.columnar;

import com.dframeio.filter.BackendKind;
import com.dframeio.filter.BackendPredicate;
import com.dframeio.filter.ast.Expression;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterPredicate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Result of compiling a filter for a Parquet reader.
 * <p>
 * The conjunction of {@link #pushdown()} and {@link #residual()} is equivalent to the
 * original filter. The pushdown part goes to the reader; the residual part must be applied
 * to every row batch the reader returns, before projection, row limits or sampling, so
 * that row counts stay correct.
 */
public final class ColumnarPredicate implements BackendPredicate {

    private final FilterPredicate pushdown;
    private final RowPredicate residual;
    private final List<Expression> residualClauses;

    ColumnarPredicate(FilterPredicate pushdown, RowPredicate residual, List<Expression> residualClauses) {
        this.pushdown = pushdown;
        this.residual = residual;
        this.residualClauses = List.copyOf(residualClauses);
    }

    @Override
    public BackendKind kind() {
        return BackendKind.COLUMNAR_PUSHDOWN;
    }

    /**
     * Predicate for the Parquet reader, empty when nothing could be pushed down.
     */
    public Optional<FilterPredicate> pushdown() {
        return Optional.ofNullable(pushdown);
    }

    /**
     * Predicate to re-check in memory, empty when the whole filter was pushed down.
     */
    public Optional<RowPredicate> residual() {
        return Optional.ofNullable(residual);
    }

    /**
     * Top-level conjuncts of the filter that stayed in memory.
     */
    public List<Expression> residualClauses() {
        return residualClauses;
    }

    public boolean hasResidual() {
        return residual != null;
    }

    /**
     * Whether the predicate selects every row.
     */
    public boolean acceptsAll() {
        return pushdown == null && residual == null;
    }

    /**
     * Filter for the Parquet reader, {@link FilterCompat#NOOP} when nothing is pushed down.
     */
    public FilterCompat.Filter toFilter() {
        return pushdown == null ? FilterCompat.NOOP : FilterCompat.get(pushdown);
    }

    /**
     * Apply the residual predicate to a batch of rows returned by the reader.
     *
     * @param batch Rows that passed the pushdown filter
     * @return Rows that also pass the residual, in order
     */
    public List<Row> applyResidual(Collection<Row> batch) {
        if (residual == null) {
            return new ArrayList<>(batch);
        }
        return residual.filter(batch);
    }

    @Override
    public String toString() {
        return "ColumnarPredicate{pushdown=" + pushdown + ", residual=" + residual + "}";
    }
}
