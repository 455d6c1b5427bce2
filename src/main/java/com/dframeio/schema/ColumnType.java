package com.dframeio.schema;

import com.dframeio.filter.ast.TypeFamily;

/**
 * Declared type of a column in a {@link Schema}.
 * Numeric widths matter for the Parquet physical column type used in pushdown.
 */
public enum ColumnType {
    STRING(TypeFamily.STRING),
    INTEGER(TypeFamily.NUMERIC),
    LONG(TypeFamily.NUMERIC),
    FLOAT(TypeFamily.NUMERIC),
    DOUBLE(TypeFamily.NUMERIC),
    BOOLEAN(TypeFamily.BOOLEAN),
    TIMESTAMP(TypeFamily.TIMESTAMP);

    private final TypeFamily family;

    ColumnType(TypeFamily family) {
        this.family = family;
    }

    public TypeFamily family() {
        return family;
    }
}
