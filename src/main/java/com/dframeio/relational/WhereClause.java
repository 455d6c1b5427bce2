package com.dframeio.relational;

import com.dframeio.filter.BackendKind;
import com.dframeio.filter.BackendPredicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parameterized SQL WHERE clause body.
 * <p>
 * {@link #sql()} holds placeholders only; bind {@link #parameters()} to them in order.
 * Parameters are {@code String}, {@code Long}, {@code Double}, {@code Boolean},
 * {@code java.time.OffsetDateTime} (UTC) or {@code null}.
 */
public final class WhereClause implements BackendPredicate {

    private final String sql;
    private final List<Object> parameters;
    private final boolean alwaysTrue;

    WhereClause(String sql, List<Object> parameters, boolean alwaysTrue) {
        this.sql = sql;
        // nulls are valid parameters, so List.copyOf is not an option
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.alwaysTrue = alwaysTrue;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.RELATIONAL;
    }

    public String sql() {
        return sql;
    }

    public List<Object> parameters() {
        return parameters;
    }

    /**
     * Whether the clause selects every row.
     */
    public boolean isAlwaysTrue() {
        return alwaysTrue;
    }

    /**
     * Clause text to append to a query, starting with {@code " WHERE "}.
     */
    public String toWhereSuffix() {
        return " WHERE " + sql;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WhereClause that)) return false;
        return sql.equals(that.sql) && parameters.equals(that.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, parameters);
    }

    @Override
    public String toString() {
        return "WhereClause{sql='" + sql + "', parameters=" + parameters + "}";
    }
}
