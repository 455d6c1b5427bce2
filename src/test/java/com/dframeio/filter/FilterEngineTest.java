package com.dframeio.filter;

import com.dframeio.columnar.ColumnarPredicate;
import com.dframeio.config.FilterEngineConfig;
import com.dframeio.exception.FilterSyntaxException;
import com.dframeio.exception.UnsupportedPredicateException;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowFactory;
import com.dframeio.memory.RowPredicate;
import com.dframeio.relational.PlaceholderStyle;
import com.dframeio.relational.WhereClause;
import com.dframeio.schema.ColumnType;
import com.dframeio.schema.Schema;
import org.apache.parquet.filter2.predicate.FilterApi;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FilterEngine.
 */
class FilterEngineTest {

    private static final String ROWS = """
            [
                {"name": "Anna", "age": 34, "country": "US"},
                {"name": "Bert", "age": 25, "country": "US"},
                {"name": "Carl", "age": 40, "country": "DE"},
                {"name": "Dora", "age": null, "country": "US"}
            ]
            """;

    private final FilterEngine engine = new FilterEngine();

    @ParameterizedTest
    @DisplayName("compile dispatches to the requested backend")
    @EnumSource(BackendKind.class)
    void dispatch(BackendKind kind) {
        BackendPredicate predicate = engine.compile("age > 30", kind);

        assertEquals(kind, predicate.kind());
    }

    @Test
    @DisplayName("compile returns the concrete predicate types")
    void concreteTypes() {
        assertInstanceOf(RowPredicate.class, engine.compile("a = 1", BackendKind.IN_MEMORY));
        assertInstanceOf(ColumnarPredicate.class, engine.compile("a = 1", BackendKind.COLUMNAR_PUSHDOWN));
        assertInstanceOf(WhereClause.class, engine.compile("a = 1", BackendKind.RELATIONAL));
    }

    @ParameterizedTest
    @DisplayName("Empty filter accepts every row in every backend")
    @ValueSource(strings = {"", "  "})
    void emptyFilterAcceptsEverything(String filter) {
        List<Row> rows = RowFactory.fromJsonArray(ROWS);

        assertEquals(rows, engine.compileInMemory(filter).filter(rows));
        assertTrue(engine.compileColumnar(filter).acceptsAll());
        assertEquals(rows, engine.compileColumnar(filter).applyResidual(rows));
        assertTrue(engine.compileRelational(filter).isAlwaysTrue());
    }

    @Test
    @DisplayName("In-memory filtering of JSON rows")
    void inMemoryRows() {
        List<Row> rows = RowFactory.fromJsonArray(ROWS);

        List<Row> selected = engine.compileInMemory("age > 30 AND country = 'US'").filter(rows);

        assertEquals(1, selected.size());
        assertEquals("Anna", selected.get(0).value("name").orElseThrow());
    }

    @Test
    @DisplayName("Syntax errors surface before any backend is involved")
    void syntaxError() {
        for (BackendKind kind : BackendKind.values()) {
            assertThrows(FilterSyntaxException.class, () -> engine.compile("age >", kind));
        }
    }

    @Test
    @DisplayName("Schema is passed through to the compilers")
    void schemaPassedThrough() {
        Schema schema = Schema.builder().column("age", ColumnType.INTEGER).build();

        ColumnarPredicate predicate = engine.compileColumnar("age > 30", schema);

        assertEquals(FilterApi.gt(FilterApi.intColumn("age"), 30), predicate.pushdown().orElseThrow());
    }

    @Test
    @DisplayName("Engine honours its configuration")
    void configured() {
        FilterEngine configured = new FilterEngine(new FilterEngineConfig(false, PlaceholderStyle.NUMBERED, false));

        assertEquals("a = $1 AND b = $2", configured.compileRelational("a = 1 AND b = 2").sql());
        assertThrows(UnsupportedPredicateException.class, () -> configured.compileColumnar("name LIKE 'A%'"));
        assertSame(PlaceholderStyle.NUMBERED, configured.getConfig().placeholderStyle());
    }

    @Test
    @DisplayName("Default configuration")
    void defaults() {
        FilterEngineConfig config = engine.getConfig();

        assertTrue(config.residualSplit());
        assertEquals(PlaceholderStyle.QUESTION_MARK, config.placeholderStyle());
        assertTrue(config.quoteIdentifiers());
    }
}
