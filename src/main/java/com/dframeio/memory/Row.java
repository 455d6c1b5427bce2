package com.dframeio.memory;

import java.util.Map;
import java.util.Optional;

/**
 * Column values of one row, looked up by column name.
 * Immutable after creation.
 */
public interface Row {

    /**
     * Get a column value.
     *
     * @param column Column name (dotted names are looked up verbatim)
     * @return Column value, or empty if the column is null or absent
     */
    Optional<Object> value(String column);

    /**
     * Get all column values.
     */
    Map<String, Object> values();

    /**
     * Create a row from a column-to-value map. Null values are allowed.
     */
    static Row of(Map<String, ?> values) {
        return new MapRow(values);
    }

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new MapRow.Builder();
    }

    /**
     * Builder for Row.
     */
    interface Builder {
        Builder value(String column, Object value);
        Builder values(Map<String, ?> values);
        Row build();
    }
}
