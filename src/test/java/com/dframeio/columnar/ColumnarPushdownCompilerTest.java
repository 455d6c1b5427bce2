package com.dframeio.columnar;

import com.dframeio.exception.UnsupportedPredicateException;
import com.dframeio.filter.BackendKind;
import com.dframeio.filter.FilterExpressionParser;
import com.dframeio.memory.InMemoryCompiler;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.schema.ColumnType;
import com.dframeio.schema.Schema;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.apache.parquet.filter2.recordlevel.IncrementallyUpdatedFilterPredicate;
import org.apache.parquet.filter2.recordlevel.IncrementallyUpdatedFilterPredicate.ValueInspector;
import org.apache.parquet.filter2.recordlevel.IncrementallyUpdatedFilterPredicateBuilder;
import org.apache.parquet.filter2.recordlevel.IncrementallyUpdatedFilterPredicateEvaluator;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.MessageTypeParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.apache.parquet.filter2.predicate.FilterApi.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ColumnarPushdownCompiler.
 * Tests cover:
 * - Translation of pushable predicates to Parquet FilterPredicates
 * - Column types taken from the schema or inferred from literals
 * - Null rows evaluated by Parquet the same way as in memory
 * - Residual split of non-pushable conjuncts and its equivalence to in-memory evaluation
 * - Strict mode
 */
class ColumnarPushdownCompilerTest {

    private static final Schema SCHEMA = Schema.builder()
            .column("id", ColumnType.INTEGER)
            .column("amount", ColumnType.LONG)
            .column("ratio", ColumnType.FLOAT)
            .column("score", ColumnType.DOUBLE)
            .column("name", ColumnType.STRING)
            .column("active", ColumnType.BOOLEAN)
            .column("created", ColumnType.TIMESTAMP)
            .build();

    private static final MessageType INT64_ROW =
            MessageTypeParser.parseMessageType("message row { optional int64 a; }");

    private final ColumnarPushdownCompiler compiler = new ColumnarPushdownCompiler();
    private final ColumnarPushdownCompiler strictCompiler =
            new ColumnarPushdownCompiler(new InMemoryCompiler(), false);

    // =====================================================================
    // Pushdown Translation
    // =====================================================================

    @Test
    @DisplayName("Comparisons without a schema infer the column type from the literal")
    void inferredColumnTypes() {
        ColumnarPredicate predicate = compile("a > 5 AND b = 'x' AND c <= 2.5 AND d != false");

        FilterPredicate expected = and(and(and(
                gt(longColumn("a"), 5L),
                eq(binaryColumn("b"), Binary.fromString("x"))),
                ltEq(doubleColumn("c"), 2.5)),
                and(notEq(booleanColumn("d"), false), notEq(booleanColumn("d"), (Boolean) null)));
        assertEquals(expected, predicate.pushdown().orElseThrow());
        assertFalse(predicate.hasResidual());
        assertEquals(BackendKind.COLUMNAR_PUSHDOWN, predicate.kind());
    }

    @ParameterizedTest
    @DisplayName("Every comparison operator is pushed down")
    @CsvSource({
            "a = 1, Eq",
            "a != 1, And",
            "a < 1, Lt",
            "a <= 1, LtEq",
            "a > 1, Gt",
            "a >= 1, GtEq"
    })
    void operators(String filter, String expectedOperator) {
        FilterPredicate pushed = compile(filter).pushdown().orElseThrow();

        assertEquals(expectedOperator, pushed.getClass().getSimpleName());
    }

    @Test
    @DisplayName("OR and NOT over pushable operands are pushed down without a Parquet not")
    void orAndNot() {
        ColumnarPredicate predicate = compile("NOT a = 1 OR b < 3");

        FilterPredicate expected = or(notEq(longColumn("a"), 1L), lt(longColumn("b"), 3L));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("IN list becomes a Parquet in predicate without NULLs")
    void inList() {
        ColumnarPredicate predicate = compile("color IN ('RED', 'GREEN', NULL)");

        FilterPredicate expected = in(binaryColumn("color"),
                Set.of(Binary.fromString("RED"), Binary.fromString("GREEN")));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("NOT IN is pushed as a not-in predicate that keeps null rows")
    void notInList() {
        ColumnarPredicate predicate = compile("a NOT IN (1, 2)");

        FilterPredicate expected = or(eq(longColumn("a"), (Long) null), notIn(longColumn("a"), Set.of(1L, 2L)));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("NOT over AND is pushed through De Morgan")
    void notOverAnd() {
        ColumnarPredicate predicate = compile("NOT (a > 1 AND b <= 2)");

        FilterPredicate expected = or(
                or(eq(longColumn("a"), (Long) null), ltEq(longColumn("a"), 1L)),
                or(eq(longColumn("b"), (Long) null), gt(longColumn("b"), 2L)));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    // =====================================================================
    // Null Rows
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Parquet evaluates the pushed predicate on null and non-null rows like the in-memory backend")
    @ValueSource(strings = {
            "a != 5",
            "NOT a != 5",
            "a > 5",
            "NOT a > 5",
            "NOT a = 5",
            "NOT NOT a < 5",
            "a IN (5, 7)",
            "a NOT IN (5, 7)",
            "NOT (a > 1 AND a < 9)",
            "NOT (a = 5 OR a = 7)"
    })
    void nullRowsMatchInMemory(String filter) {
        FilterPredicate pushed = compile(filter).pushdown().orElseThrow();
        RowPredicate direct = new InMemoryCompiler().compile(FilterExpressionParser.parse(filter));

        for (Long value : Arrays.asList(null, 3L, 5L, 7L)) {
            assertEquals(direct.test(row("a", value)), parquetAccepts(pushed, value),
                    filter + " on a=" + value);
        }
    }

    @Test
    @DisplayName("Pushed != drops null rows")
    void notEqualDropsNulls() {
        FilterPredicate pushed = compile("a != 5").pushdown().orElseThrow();

        assertFalse(parquetAccepts(pushed, null));
        assertTrue(parquetAccepts(pushed, 6L));
        assertFalse(parquetAccepts(pushed, 5L));
    }

    @Test
    @DisplayName("Pushed NOT keeps null rows")
    void negationKeepsNulls() {
        FilterPredicate pushed = compile("NOT a > 5").pushdown().orElseThrow();

        assertTrue(parquetAccepts(pushed, null));
        assertTrue(parquetAccepts(pushed, 5L));
        assertFalse(parquetAccepts(pushed, 6L));
    }

    // =====================================================================
    // Schema-Typed Columns
    // =====================================================================

    @Test
    @DisplayName("Schema picks the Parquet column type")
    void schemaTypes() {
        ColumnarPredicate predicate = compile(
                "id = 7 AND amount > 7 AND ratio < 0.5 AND score >= 1 AND name = 'n' AND active = true",
                SCHEMA);

        FilterPredicate expected = and(and(and(and(and(
                eq(intColumn("id"), 7),
                gt(longColumn("amount"), 7L)),
                lt(floatColumn("ratio"), 0.5f)),
                gtEq(doubleColumn("score"), 1.0)),
                eq(binaryColumn("name"), Binary.fromString("n"))),
                eq(booleanColumn("active"), true));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("Timestamp column is compared in epoch microseconds")
    void timestampColumn() {
        ColumnarPredicate predicate = compile("created >= TIMESTAMP '2021-01-01 00:00:00.5'", SCHEMA);

        assertEquals(gtEq(longColumn("created"), 1_609_459_200_500_000L), predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("Null checks are pushed with a schema")
    void nullChecks() {
        ColumnarPredicate predicate = compile("id IS NULL OR name IS NOT NULL", SCHEMA);

        FilterPredicate expected = or(eq(intColumn("id"), (Integer) null), notEq(binaryColumn("name"), (Binary) null));
        assertEquals(expected, predicate.pushdown().orElseThrow());
    }

    @ParameterizedTest
    @DisplayName("Lossy literal conversions stay in memory")
    @ValueSource(strings = {
            "id = 1.5",
            "id > 3000000000",
            "amount = 2.0",
            "ratio = 0.1",
            "score = 9007199254740993"
    })
    void lossyConversions(String filter) {
        ColumnarPredicate predicate = compile(filter, SCHEMA);

        assertTrue(predicate.pushdown().isEmpty());
        assertTrue(predicate.hasResidual());
    }

    // =====================================================================
    // Residual Split
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Non-pushable predicates become the residual")
    @ValueSource(strings = {
            "score LIKE '%x%'",
            "a < b",
            "a = NULL",
            "a IN (NULL)",
            "a IS NULL",
            "ts > TIMESTAMP '2021-01-01'",
            "a = 1 OR name LIKE 'x%'"
    })
    void residualOnly(String filter) {
        ColumnarPredicate predicate = compile(filter);

        assertTrue(predicate.pushdown().isEmpty());
        assertTrue(predicate.hasResidual());
        assertEquals(1, predicate.residualClauses().size());
        assertSame(FilterCompat.NOOP, predicate.toFilter());
    }

    @Test
    @DisplayName("Conjuncts are split between pushdown and residual")
    void splitConjuncts() {
        ColumnarPredicate predicate = compile("a > 5 AND name LIKE 'A%' AND b = 1 AND c < d");

        assertEquals(and(gt(longColumn("a"), 5L), eq(longColumn("b"), 1L)), predicate.pushdown().orElseThrow());
        assertEquals(List.of(
                FilterExpressionParser.parse("name LIKE 'A%'"),
                FilterExpressionParser.parse("c < d")), predicate.residualClauses());
        assertNotSame(FilterCompat.NOOP, predicate.toFilter());
    }

    @Test
    @DisplayName("LIKE residual is equivalent to direct in-memory evaluation")
    void likeResidualEquivalence() {
        String filter = "score LIKE '%x%'";
        List<Row> rows = List.of(
                row("score", "axb"), row("score", "abc"), row("score", null), row("score", "x"));

        ColumnarPredicate predicate = compile(filter);
        RowPredicate direct = new InMemoryCompiler().compile(FilterExpressionParser.parse(filter));

        assertEquals(direct.filter(rows), predicate.applyResidual(rows));
        assertEquals(2, predicate.applyResidual(rows).size());
    }

    @Test
    @DisplayName("Pushdown then residual selects what the full filter selects")
    void splitEquivalence() {
        String filter = "age > 30 AND name LIKE 'A%' AND country IN ('DE', 'FR')";
        List<Row> rows = new ArrayList<>();
        String[] names = {"Anna", "Bert", "Alex", "Arno"};
        String[] countries = {"DE", "FR", "US"};
        for (int i = 0; i < 24; i++) {
            rows.add(row("age", 20 + i, "name", names[i % names.length], "country", countries[i % countries.length]));
        }

        ColumnarPredicate predicate = compile(filter);
        RowPredicate direct = new InMemoryCompiler().compile(FilterExpressionParser.parse(filter));
        // stands in for the Parquet reader applying the pushed part
        RowPredicate pushedPart = new InMemoryCompiler().compile(
                FilterExpressionParser.parse("age > 30 AND country IN ('DE', 'FR')"));

        assertEquals(direct.filter(rows), predicate.applyResidual(pushedPart.filter(rows)));
    }

    @Test
    @DisplayName("Empty filter pushes nothing and accepts every row")
    void emptyFilter() {
        ColumnarPredicate predicate = compile("");
        List<Row> rows = List.of(row("a", 1), row("a", null));

        assertTrue(predicate.acceptsAll());
        assertSame(FilterCompat.NOOP, predicate.toFilter());
        assertEquals(rows, predicate.applyResidual(rows));
    }

    // =====================================================================
    // Strict Mode
    // =====================================================================

    @Test
    @DisplayName("Strict mode rejects LIKE")
    void strictRejectsLike() {
        UnsupportedPredicateException e = assertThrows(UnsupportedPredicateException.class,
                () -> strictCompiler.compile(FilterExpressionParser.parse("a > 1 AND score LIKE '%x%'")));

        assertEquals("LIKE", e.getConstruct());
    }

    @Test
    @DisplayName("Strict mode names the unsupported construct")
    void strictNamesConstruct() {
        UnsupportedPredicateException e = assertThrows(UnsupportedPredicateException.class,
                () -> strictCompiler.compile(FilterExpressionParser.parse("a < b")));

        assertEquals("column comparison", e.getConstruct());
    }

    @Test
    @DisplayName("Strict mode compiles fully pushable filters")
    void strictPushable() {
        ColumnarPredicate predicate = strictCompiler.compile(FilterExpressionParser.parse("a > 1 AND b IN ('x')"));

        assertTrue(predicate.pushdown().isPresent());
        assertFalse(predicate.hasResidual());
    }

    // =====================================================================
    // Helper Methods
    // =====================================================================

    private ColumnarPredicate compile(String filter) {
        return compiler.compile(FilterExpressionParser.parse(filter));
    }

    private ColumnarPredicate compile(String filter, Schema schema) {
        return compiler.compile(FilterExpressionParser.parse(filter), schema);
    }

    /**
     * Evaluates a pushed predicate the way the Parquet record reader does, for a single
     * {@code optional int64 a} value.
     */
    private static boolean parquetAccepts(FilterPredicate predicate, Long value) {
        MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(INT64_ROW);
        IncrementallyUpdatedFilterPredicateBuilder builder =
                new IncrementallyUpdatedFilterPredicateBuilder(columnIO.getLeaves());
        IncrementallyUpdatedFilterPredicate streaming = builder.build(predicate);
        for (List<ValueInspector> inspectors : builder.getValueInspectorsByColumn().values()) {
            for (ValueInspector inspector : inspectors) {
                if (value == null) {
                    inspector.updateNull();
                } else {
                    inspector.update(value.longValue());
                }
            }
        }
        return IncrementallyUpdatedFilterPredicateEvaluator.evaluate(streaming);
    }

    private static Row row(Object... keyValues) {
        Map<String, Object> values = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put((String) keyValues[i], keyValues[i + 1]);
        }
        return Row.of(values);
    }
}
