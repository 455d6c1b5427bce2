package com.dframeio.memory;

import com.dframeio.exception.TypeMismatchException;
import com.dframeio.filter.ast.TypeFamily;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Optional;

/**
 * Default implementation of ValueResolver.
 * <p>
 * Zone-less temporal values ({@link LocalDateTime}, {@link LocalDate}) are read as UTC.
 * Values are never converted across families: a numeric string is still a string.
 */
public class DefaultValueResolver implements ValueResolver {

    public static final DefaultValueResolver INSTANCE = new DefaultValueResolver();

    @Override
    public Optional<Object> resolve(String column, Row row) {
        if (column == null || column.isEmpty() || row == null) {
            return Optional.empty();
        }
        return row.value(column);
    }

    @Override
    public Optional<Object> resolveAs(String column, Row row, TypeFamily family) {
        Optional<Object> actual = resolve(column, row);
        if (actual.isEmpty()) {
            return Optional.empty();
        }

        Object value = actual.get();
        TypeFamily actualFamily = familyOf(column, value);
        if (actualFamily != family) {
            throw new TypeMismatchException("Column '" + column + "' holds " + actualFamily
                    + " value " + value + " but is compared to a " + family + " value");
        }
        return Optional.of(normalize(value, family));
    }

    @Override
    public TypeFamily familyOf(String column, Object value) {
        if (value instanceof CharSequence || value instanceof Character) {
            return TypeFamily.STRING;
        }
        if (value instanceof Number) {
            return TypeFamily.NUMERIC;
        }
        if (value instanceof Boolean) {
            return TypeFamily.BOOLEAN;
        }
        if (value instanceof Instant
                || value instanceof OffsetDateTime
                || value instanceof ZonedDateTime
                || value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof Date) {
            return TypeFamily.TIMESTAMP;
        }
        throw new TypeMismatchException("Column '" + column + "' holds a value of unsupported type "
                + value.getClass().getName());
    }

    /**
     * Convert a value of a known family to its canonical type.
     */
    Object normalize(Object value, TypeFamily family) {
        return switch (family) {
            case STRING -> value.toString();
            case NUMERIC, BOOLEAN -> value;
            case TIMESTAMP -> toInstant(value);
        };
    }

    private Instant toInstant(Object value) {
        if (value instanceof Instant i) {
            return i;
        }
        if (value instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (value instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (value instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        // java.sql.Date does not support toInstant()
        return Instant.ofEpochMilli(((Date) value).getTime());
    }
}
