package com.dframeio.filter.ast;

import java.time.Instant;
import java.util.Objects;

/**
 * A typed constant from the filter text.
 *
 * @param type  Lexical type
 * @param value Decoded value: String, Long, Double, Boolean, Instant, or null for NULL
 */
public record Literal(LiteralType type, Object value) {

    public static final Literal NULL = new Literal(LiteralType.NULL, null);
    public static final Literal TRUE = new Literal(LiteralType.BOOLEAN, Boolean.TRUE);
    public static final Literal FALSE = new Literal(LiteralType.BOOLEAN, Boolean.FALSE);

    public Literal {
        Objects.requireNonNull(type, "type");
        if (type == LiteralType.NULL) {
            if (value != null) {
                throw new IllegalArgumentException("NULL literal cannot carry a value");
            }
        } else if (!expectedClass(type).isInstance(value)) {
            throw new IllegalArgumentException(type + " literal requires a "
                    + expectedClass(type).getSimpleName() + " value, got " + value);
        }
    }

    public static Literal ofString(String value) {
        return new Literal(LiteralType.STRING, value);
    }

    public static Literal ofInteger(long value) {
        return new Literal(LiteralType.INTEGER, value);
    }

    public static Literal ofFloat(double value) {
        return new Literal(LiteralType.FLOAT, value);
    }

    public static Literal ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Literal ofTimestamp(Instant value) {
        return new Literal(LiteralType.TIMESTAMP, value);
    }

    public boolean isNull() {
        return type == LiteralType.NULL;
    }

    public TypeFamily family() {
        return type.family();
    }

    private static Class<?> expectedClass(LiteralType type) {
        return switch (type) {
            case STRING -> String.class;
            case INTEGER -> Long.class;
            case FLOAT -> Double.class;
            case BOOLEAN -> Boolean.class;
            case TIMESTAMP -> Instant.class;
            case NULL -> Void.class;
        };
    }

    @Override
    public String toString() {
        return switch (type) {
            case STRING -> "'" + value + "'";
            case TIMESTAMP -> "TIMESTAMP '" + value + "'";
            case NULL -> "NULL";
            default -> String.valueOf(value);
        };
    }
}
