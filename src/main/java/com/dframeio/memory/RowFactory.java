package com.dframeio.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for creating rows from JSON documents.
 * Nested JSON objects are flattened using dot notation (e.g., {"x":{"y":"z"}} becomes "x.y" -> "z"),
 * which matches qualified column names in filters.
 */
public final class RowFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private RowFactory() {
    }

    /**
     * Create a row from a JSON object.
     *
     * @param json JSON object text
     * @return Row with flattened column values
     */
    public static Row fromJson(String json) {
        Map<String, Object> parsed = parseJson(json, new TypeReference<Map<String, Object>>() {});
        return Row.of(flatten(parsed));
    }

    /**
     * Create rows from a JSON array of objects.
     *
     * @param json JSON array text
     * @return One row per array element, in order
     */
    public static List<Row> fromJsonArray(String json) {
        List<Map<String, Object>> parsed = parseJson(json, new TypeReference<List<Map<String, Object>>>() {});
        List<Row> rows = new ArrayList<>(parsed.size());
        for (Map<String, Object> item : parsed) {
            rows.add(Row.of(flatten(item)));
        }
        return rows;
    }

    /**
     * Create rows from a column-oriented table, the shape of a dataframe read into a dict.
     *
     * @param columns Column name to column values; all columns must have the same length
     * @return One row per index
     */
    public static List<Row> fromColumns(Map<String, List<?>> columns) {
        int size = -1;
        for (Map.Entry<String, List<?>> entry : columns.entrySet()) {
            if (size >= 0 && entry.getValue().size() != size) {
                throw new IllegalArgumentException("Column '" + entry.getKey() + "' has "
                        + entry.getValue().size() + " values, expected " + size);
            }
            size = entry.getValue().size();
        }

        List<Row> rows = new ArrayList<>(Math.max(size, 0));
        for (int i = 0; i < size; i++) {
            Row.Builder builder = Row.builder();
            for (Map.Entry<String, List<?>> entry : columns.entrySet()) {
                builder.value(entry.getKey(), entry.getValue().get(i));
            }
            rows.add(builder.build());
        }
        return rows;
    }

    private static <T> T parseJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON row data: " + e.getMessage(), e);
        }
    }

    /**
     * Flatten nested maps into dot-notation keys.
     * Example: {"x": {"y": "z"}} becomes {"x.y": "z"}
     */
    private static Map<String, Object> flatten(Map<String, Object> map) {
        Map<String, Object> result = new HashMap<>();
        flattenRecursive("", map, result);
        return result;
    }

    @SuppressWarnings("unchecked")
    private static void flattenRecursive(String prefix, Map<String, Object> map, Map<String, Object> result) {
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object value = entry.getValue();

            if (value instanceof Map) {
                flattenRecursive(key, (Map<String, Object>) value, result);
            } else {
                // Lists are kept as-is
                result.put(key, value);
            }
        }
    }
}
