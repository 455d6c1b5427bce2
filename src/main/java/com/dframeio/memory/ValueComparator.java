package com.dframeio.memory;

import com.dframeio.filter.ast.TypeFamily;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

/**
 * Orders normalized values of the same family.
 * Numbers compare by value across Java numeric types.
 */
public final class ValueComparator {

    private ValueComparator() {
    }

    /**
     * Compare two values normalized to the canonical Java type of {@code family}.
     */
    public static int compare(TypeFamily family, Object left, Object right) {
        return switch (family) {
            case STRING -> ((String) left).compareTo((String) right);
            case NUMERIC -> compareNumbers((Number) left, (Number) right);
            case BOOLEAN -> ((Boolean) left).compareTo((Boolean) right);
            case TIMESTAMP -> ((Instant) left).compareTo((Instant) right);
        };
    }

    static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        if (isFloating(left) && isFloating(right)) {
            return compareDoubles(left.doubleValue(), right.doubleValue());
        }
        // mixed kinds: exact decimal comparison unless a side is NaN or infinite
        BigDecimal l = toBigDecimal(left);
        BigDecimal r = toBigDecimal(right);
        if (l != null && r != null) {
            return l.compareTo(r);
        }
        return compareDoubles(left.doubleValue(), right.doubleValue());
    }

    private static int compareDoubles(double l, double r) {
        // 0.0 and -0.0 are equal values
        return l == r ? 0 : Double.compare(l, r);
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private static boolean isFloating(Number n) {
        return n instanceof Double || n instanceof Float;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal b) {
            return b;
        }
        if (n instanceof BigInteger b) {
            return new BigDecimal(b);
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        return new BigDecimal(d);
    }
}
