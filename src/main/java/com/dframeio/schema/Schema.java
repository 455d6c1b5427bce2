package com.dframeio.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Column names and types known at compile time.
 * <p>
 * {@link #unknown()} stands for "no schema available": column existence and column types
 * are then not checked while compiling and are left to the storage backend.
 */
public final class Schema {

    private static final Schema UNKNOWN = new Schema(null);

    private final Map<String, ColumnType> columns;

    private Schema(Map<String, ColumnType> columns) {
        this.columns = columns;
    }

    public static Schema unknown() {
        return UNKNOWN;
    }

    public static Schema of(Map<String, ColumnType> columns) {
        return new Schema(Collections.unmodifiableMap(new LinkedHashMap<>(columns)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isKnown() {
        return columns != null;
    }

    /**
     * Type of a column. Always empty for an unknown schema.
     */
    public Optional<ColumnType> type(String column) {
        if (columns == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(columns.get(column));
    }

    public Map<String, ColumnType> columns() {
        return columns == null ? Map.of() : columns;
    }

    @Override
    public String toString() {
        return columns == null ? "Schema(unknown)" : "Schema" + columns;
    }

    /**
     * Builder for Schema, preserving column order.
     */
    public static final class Builder {

        private final Map<String, ColumnType> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Column name cannot be null or empty");
            }
            columns.put(name, type);
            return this;
        }

        public Schema build() {
            return Schema.of(columns);
        }
    }
}
