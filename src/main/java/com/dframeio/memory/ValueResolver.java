package com.dframeio.memory;

import com.dframeio.filter.ast.TypeFamily;

import java.util.Optional;

/**
 * Resolves column values from rows and normalizes them for comparison.
 */
public interface ValueResolver {

    /**
     * Resolve a column value as stored in the row.
     *
     * @param column Column name
     * @param row    Row values
     * @return Value, or empty if null or absent
     */
    Optional<Object> resolve(String column, Row row);

    /**
     * Resolve a column value and normalize it to the canonical Java type of a family:
     * String, Number, Boolean or Instant.
     *
     * @param column Column name
     * @param row    Row values
     * @param family Expected family
     * @return Normalized value, or empty if null or absent
     * @throws com.dframeio.exception.TypeMismatchException if the value belongs to another family
     */
    Optional<Object> resolveAs(String column, Row row, TypeFamily family);

    /**
     * Determine the family of a raw row value.
     *
     * @throws com.dframeio.exception.TypeMismatchException if the value type is not comparable at all
     */
    TypeFamily familyOf(String column, Object value);
}
