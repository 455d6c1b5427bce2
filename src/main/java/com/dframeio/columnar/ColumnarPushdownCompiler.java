package com.dframeio.columnar;

import com.dframeio.exception.UnsupportedPredicateException;
import com.dframeio.filter.BackendCompiler;
import com.dframeio.filter.BackendKind;
import com.dframeio.filter.ast.*;
import com.dframeio.memory.InMemoryCompiler;
import com.dframeio.memory.RowPredicate;
import com.dframeio.schema.ColumnType;
import com.dframeio.schema.Schema;
import com.dframeio.schema.TypeChecker;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.apache.parquet.filter2.predicate.Operators.Column;
import org.apache.parquet.filter2.predicate.Operators.SupportsEqNotEq;
import org.apache.parquet.filter2.predicate.Operators.SupportsLtGt;
import org.apache.parquet.io.api.Binary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Compiles filter expressions into Parquet {@link FilterPredicate}s.
 * <p>
 * Pushable constructs: comparisons of a column with a non-null literal, IN lists,
 * IS [NOT] NULL (schema required, since Parquet null checks are typed), and AND/OR/NOT
 * over pushable operands. LIKE, column-to-column comparisons, comparisons with NULL and,
 * without a schema, timestamp literals cannot be pushed down.
 * <p>
 * With residual splitting enabled the filter is split into its top-level AND conjuncts;
 * pushable conjuncts form the pushdown predicate and the others are compiled into an
 * in-memory residual. With splitting disabled any non-pushable construct fails.
 * <p>
 * Without a schema the Parquet column type is inferred from the literal: integers as
 * INT64, floats as DOUBLE, strings as BINARY. Pass a schema when the file uses other
 * physical types, otherwise the reader rejects the predicate.
 * <p>
 * The pushed predicate selects the same rows as the in-memory backend, null rows included:
 * {@code a != 5} drops rows where {@code a} is null and {@code NOT a > 5} keeps them.
 * The emitted tree contains no Parquet {@code not}.
 */
public class ColumnarPushdownCompiler implements BackendCompiler<ColumnarPredicate> {

    private static final Logger log = LoggerFactory.getLogger(ColumnarPushdownCompiler.class);

    private static final long MAX_EXACT_DOUBLE = 1L << 53;
    private static final long MAX_EXACT_FLOAT = 1L << 24;

    private final InMemoryCompiler residualCompiler;
    private final boolean residualSplit;

    public ColumnarPushdownCompiler() {
        this(new InMemoryCompiler(), true);
    }

    public ColumnarPushdownCompiler(InMemoryCompiler residualCompiler, boolean residualSplit) {
        this.residualCompiler = residualCompiler;
        this.residualSplit = residualSplit;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.COLUMNAR_PUSHDOWN;
    }

    @Override
    public ColumnarPredicate compile(Expression expression, Schema schema) {
        TypeChecker.check(expression, schema);

        List<Expression> conjuncts = new ArrayList<>();
        flattenAnd(expression, conjuncts);

        PushdownBuilder builder = new PushdownBuilder(schema, false);
        FilterPredicate pushdown = null;
        List<Expression> residualClauses = new ArrayList<>();

        for (Expression conjunct : conjuncts) {
            if (conjunct instanceof AlwaysTrue) {
                continue;
            }
            try {
                FilterPredicate pushed = conjunct.accept(builder);
                pushdown = pushdown == null ? pushed : FilterApi.and(pushdown, pushed);
            } catch (UnsupportedPredicateException e) {
                if (!residualSplit) {
                    throw e;
                }
                log.debug("Keeping clause {} for in-memory evaluation: {}", conjunct, e.getMessage());
                residualClauses.add(conjunct);
            }
        }

        RowPredicate residual = null;
        if (!residualClauses.isEmpty()) {
            Expression residualExpression = residualClauses.get(0);
            for (int i = 1; i < residualClauses.size(); i++) {
                residualExpression = new And(residualExpression, residualClauses.get(i));
            }
            residual = residualCompiler.compile(residualExpression, schema);
        }

        log.debug("Compiled columnar predicate: pushdown={}, residual clauses={}", pushdown, residualClauses.size());
        return new ColumnarPredicate(pushdown, residual, residualClauses);
    }

    private static void flattenAnd(Expression expression, List<Expression> conjuncts) {
        if (expression instanceof And and) {
            flattenAnd(and.left(), conjuncts);
            flattenAnd(and.right(), conjuncts);
        } else {
            conjuncts.add(expression);
        }
    }

    /**
     * Physical Parquet column types a predicate can be built for.
     */
    private enum PhysicalType {
        INT32,
        INT64,
        FLOAT,
        DOUBLE,
        BINARY,
        BOOLEAN,
        TIMESTAMP_MICROS
    }

    /**
     * Builds Parquet predicates with the in-memory null semantics: a comparison on a null
     * value is false and NOT of it is true. Parquet's {@code notEq} keeps null rows and its
     * inverse rewriting of {@code not} drops them, so negation is pushed to the leaves here
     * and each leaf carries an explicit null check where the two disagree.
     */
    private static final class PushdownBuilder implements ExpressionVisitor<FilterPredicate> {

        private final Schema schema;
        private final boolean negated;

        private PushdownBuilder(Schema schema, boolean negated) {
            this.schema = schema;
            this.negated = negated;
        }

        @Override
        public FilterPredicate visitComparison(Comparison comparison) {
            String column = comparison.column();
            ComparisonOperator operator = comparison.operator();
            Literal value = comparison.value();

            if (operator == ComparisonOperator.LIKE) {
                throw new UnsupportedPredicateException("LIKE",
                        "LIKE on column '" + column + "' has no Parquet pushdown equivalent");
            }
            if (value.isNull()) {
                throw new UnsupportedPredicateException("NULL comparison",
                        "Comparison of column '" + column + "' with NULL cannot be pushed down");
            }

            PhysicalType type = physicalType(column, value);
            return switch (type) {
                case INT32 -> ordered(FilterApi.intColumn(column), operator, toInt(column, value), negated);
                case INT64 -> ordered(FilterApi.longColumn(column), operator, toLong(column, value), negated);
                case FLOAT -> ordered(FilterApi.floatColumn(column), operator, toFloat(column, value), negated);
                case DOUBLE -> ordered(FilterApi.doubleColumn(column), operator, toDouble(column, value), negated);
                case BINARY -> ordered(FilterApi.binaryColumn(column), operator, toBinary(value), negated);
                case TIMESTAMP_MICROS -> ordered(FilterApi.longColumn(column), operator, toMicros(value), negated);
                case BOOLEAN -> equality(FilterApi.booleanColumn(column), operator, (Boolean) value.value(), negated);
            };
        }

        @Override
        public FilterPredicate visitColumnComparison(ColumnComparison comparison) {
            throw new UnsupportedPredicateException("column comparison",
                    "Comparison of columns '" + comparison.left() + "' and '" + comparison.right()
                            + "' cannot be pushed down");
        }

        @Override
        public FilterPredicate visitIn(In in) {
            String column = in.column();
            List<Literal> values = new ArrayList<>();
            for (Literal value : in.values()) {
                if (!value.isNull()) {
                    values.add(value);
                }
            }
            if (values.isEmpty()) {
                throw new UnsupportedPredicateException("IN (NULL)",
                        "IN list of column '" + column + "' holds only NULL");
            }

            PhysicalType type = physicalType(column, values.get(0));
            return switch (type) {
                case INT32 -> membership(FilterApi.intColumn(column), convertAll(values, v -> toInt(column, v)), negated);
                case INT64 -> membership(FilterApi.longColumn(column), convertAll(values, v -> toLong(column, v)), negated);
                case FLOAT -> membership(FilterApi.floatColumn(column), convertAll(values, v -> toFloat(column, v)), negated);
                case DOUBLE -> membership(FilterApi.doubleColumn(column), convertAll(values, v -> toDouble(column, v)), negated);
                case BINARY -> membership(FilterApi.binaryColumn(column), convertAll(values, ColumnarPushdownCompiler::toBinary), negated);
                case TIMESTAMP_MICROS -> membership(FilterApi.longColumn(column), convertAll(values, ColumnarPushdownCompiler::toMicros), negated);
                case BOOLEAN -> membership(FilterApi.booleanColumn(column), convertAll(values, v -> (Boolean) v.value()), negated);
            };
        }

        @Override
        public FilterPredicate visitIsNull(IsNull isNull) {
            String column = isNull.column();
            ColumnType columnType = schema.type(column).orElseThrow(() -> new UnsupportedPredicateException(
                    isNull.negated() ? "IS NOT NULL" : "IS NULL",
                    "Null check on column '" + column + "' needs a schema to pick the Parquet column type"));

            boolean notNull = isNull.negated() != negated;
            return switch (physicalType(columnType)) {
                case INT32 -> nullCheck(FilterApi.intColumn(column), notNull);
                case INT64, TIMESTAMP_MICROS -> nullCheck(FilterApi.longColumn(column), notNull);
                case FLOAT -> nullCheck(FilterApi.floatColumn(column), notNull);
                case DOUBLE -> nullCheck(FilterApi.doubleColumn(column), notNull);
                case BINARY -> nullCheck(FilterApi.binaryColumn(column), notNull);
                case BOOLEAN -> nullCheck(FilterApi.booleanColumn(column), notNull);
            };
        }

        @Override
        public FilterPredicate visitAnd(And and) {
            FilterPredicate left = and.left().accept(this);
            FilterPredicate right = and.right().accept(this);
            return negated ? FilterApi.or(left, right) : FilterApi.and(left, right);
        }

        @Override
        public FilterPredicate visitOr(Or or) {
            FilterPredicate left = or.left().accept(this);
            FilterPredicate right = or.right().accept(this);
            return negated ? FilterApi.and(left, right) : FilterApi.or(left, right);
        }

        @Override
        public FilterPredicate visitNot(Not not) {
            return not.operand().accept(new PushdownBuilder(schema, !negated));
        }

        @Override
        public FilterPredicate visitAlwaysTrue(AlwaysTrue alwaysTrue) {
            throw new UnsupportedPredicateException("TRUE",
                    "Constant TRUE inside a predicate cannot be pushed down");
        }

        private PhysicalType physicalType(String column, Literal literal) {
            if (schema.isKnown()) {
                return physicalType(schema.type(column).orElseThrow());
            }
            return switch (literal.type()) {
                case INTEGER -> PhysicalType.INT64;
                case FLOAT -> PhysicalType.DOUBLE;
                case STRING -> PhysicalType.BINARY;
                case BOOLEAN -> PhysicalType.BOOLEAN;
                case TIMESTAMP -> throw new UnsupportedPredicateException("TIMESTAMP literal",
                        "Timestamp comparison on column '" + column
                                + "' needs a schema to pick the Parquet time unit");
                case NULL -> throw new IllegalStateException("NULL literal has no column type");
            };
        }

        private static PhysicalType physicalType(ColumnType columnType) {
            return switch (columnType) {
                case INTEGER -> PhysicalType.INT32;
                case LONG -> PhysicalType.INT64;
                case FLOAT -> PhysicalType.FLOAT;
                case DOUBLE -> PhysicalType.DOUBLE;
                case STRING -> PhysicalType.BINARY;
                case BOOLEAN -> PhysicalType.BOOLEAN;
                case TIMESTAMP -> PhysicalType.TIMESTAMP_MICROS;
            };
        }
    }

    /**
     * Operator selecting exactly the non-null values the given one rejects.
     */
    private static ComparisonOperator inverse(ComparisonOperator operator) {
        return switch (operator) {
            case EQ -> ComparisonOperator.NE;
            case NE -> ComparisonOperator.EQ;
            case LT -> ComparisonOperator.GTE;
            case LTE -> ComparisonOperator.GT;
            case GT -> ComparisonOperator.LTE;
            case GTE -> ComparisonOperator.LT;
            case LIKE -> throw new UnsupportedPredicateException("LIKE", "LIKE has no Parquet pushdown equivalent");
        };
    }

    private static <T extends Comparable<T>, C extends Column<T> & SupportsLtGt> FilterPredicate ordered(
            C column, ComparisonOperator operator, T value, boolean negated) {
        ComparisonOperator effective = negated ? inverse(operator) : operator;
        FilterPredicate predicate = switch (effective) {
            case EQ -> FilterApi.eq(column, value);
            case NE -> FilterApi.notEq(column, value);
            case LT -> FilterApi.lt(column, value);
            case LTE -> FilterApi.ltEq(column, value);
            case GT -> FilterApi.gt(column, value);
            case GTE -> FilterApi.gtEq(column, value);
            case LIKE -> throw new UnsupportedPredicateException("LIKE", "LIKE has no Parquet pushdown equivalent");
        };
        return withNulls(column, effective, predicate, negated);
    }

    private static <T extends Comparable<T>, C extends Column<T> & SupportsEqNotEq> FilterPredicate equality(
            C column, ComparisonOperator operator, T value, boolean negated) {
        ComparisonOperator effective = negated ? inverse(operator) : operator;
        FilterPredicate predicate = switch (effective) {
            case EQ -> FilterApi.eq(column, value);
            case NE -> FilterApi.notEq(column, value);
            default -> throw new UnsupportedPredicateException(operator.symbol(),
                    "Operator " + operator.symbol() + " is not supported on column "
                            + column.getColumnPath().toDotString());
        };
        return withNulls(column, effective, predicate, negated);
    }

    /**
     * Negated leaves also select null rows. A positive {@code !=} must not, though Parquet's
     * {@code notEq} does.
     */
    private static <T extends Comparable<T>, C extends Column<T> & SupportsEqNotEq> FilterPredicate withNulls(
            C column, ComparisonOperator effective, FilterPredicate predicate, boolean negated) {
        if (negated) {
            return effective == ComparisonOperator.NE
                    ? predicate
                    : FilterApi.or(nullCheck(column, false), predicate);
        }
        return effective == ComparisonOperator.NE
                ? FilterApi.and(predicate, nullCheck(column, true))
                : predicate;
    }

    private static <T extends Comparable<T>, C extends Column<T> & SupportsEqNotEq> FilterPredicate membership(
            C column, Set<T> values, boolean negated) {
        if (negated) {
            return FilterApi.or(nullCheck(column, false), FilterApi.notIn(column, values));
        }
        return FilterApi.in(column, values);
    }

    private static <T extends Comparable<T>, C extends Column<T> & SupportsEqNotEq> FilterPredicate nullCheck(
            C column, boolean notNull) {
        T nullValue = null;
        return notNull ? FilterApi.notEq(column, nullValue) : FilterApi.eq(column, nullValue);
    }

    private static <T> Set<T> convertAll(List<Literal> values, Function<Literal, T> converter) {
        Set<T> converted = new LinkedHashSet<>();
        for (Literal value : values) {
            converted.add(converter.apply(value));
        }
        return converted;
    }

    private static Integer toInt(String column, Literal value) {
        long l = integral(column, value, "INT32");
        if (l < Integer.MIN_VALUE || l > Integer.MAX_VALUE) {
            throw new UnsupportedPredicateException("INT32 overflow",
                    "Value " + l + " is out of range for INT32 column '" + column + "'");
        }
        return (int) l;
    }

    private static Long toLong(String column, Literal value) {
        return integral(column, value, "INT64");
    }

    private static long integral(String column, Literal value, String physicalType) {
        if (value.type() != LiteralType.INTEGER) {
            throw new UnsupportedPredicateException(value.type() + " literal",
                    value.type() + " literal " + value + " cannot be pushed down on " + physicalType
                            + " column '" + column + "'");
        }
        return (Long) value.value();
    }

    private static Float toFloat(String column, Literal value) {
        if (value.value() instanceof Long l && Math.abs(l) <= MAX_EXACT_FLOAT) {
            return (float) l.longValue();
        }
        if (value.value() instanceof Double d && (double) d.floatValue() == d) {
            return d.floatValue();
        }
        throw new UnsupportedPredicateException("FLOAT precision",
                "Literal " + value + " has no exact FLOAT representation for column '" + column + "'");
    }

    private static Double toDouble(String column, Literal value) {
        if (value.value() instanceof Double d) {
            return d;
        }
        long l = (Long) value.value();
        if (Math.abs(l) > MAX_EXACT_DOUBLE) {
            throw new UnsupportedPredicateException("DOUBLE precision",
                    "Literal " + value + " has no exact DOUBLE representation for column '" + column + "'");
        }
        return (double) l;
    }

    private static Binary toBinary(Literal value) {
        return Binary.fromString((String) value.value());
    }

    private static Long toMicros(Literal value) {
        Instant instant = (Instant) value.value();
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000L), instant.getNano() / 1_000L);
    }
}
