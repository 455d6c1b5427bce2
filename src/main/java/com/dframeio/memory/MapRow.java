package com.dframeio.memory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Row backed by an unmodifiable snapshot of a map.
 */
final class MapRow implements Row {

    private final Map<String, Object> values;

    MapRow(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new HashMap<String, Object>(values));
    }

    @Override
    public Optional<Object> value(String column) {
        return Optional.ofNullable(values.get(column));
    }

    @Override
    public Map<String, Object> values() {
        return values;
    }

    @Override
    public String toString() {
        return "Row" + values;
    }

    static final class Builder implements Row.Builder {

        private final Map<String, Object> values = new HashMap<>();

        @Override
        public Row.Builder value(String column, Object value) {
            values.put(column, value);
            return this;
        }

        @Override
        public Row.Builder values(Map<String, ?> values) {
            this.values.putAll(values);
            return this;
        }

        @Override
        public Row build() {
            return new MapRow(values);
        }
    }
}
