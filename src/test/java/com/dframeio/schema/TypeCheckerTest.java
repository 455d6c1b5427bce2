package com.dframeio.schema;

import com.dframeio.exception.TypeMismatchException;
import com.dframeio.exception.UnknownColumnException;
import com.dframeio.filter.FilterExpressionParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TypeChecker.
 */
class TypeCheckerTest {

    private static final Schema SCHEMA = Schema.builder()
            .column("name", ColumnType.STRING)
            .column("age", ColumnType.INTEGER)
            .column("score", ColumnType.DOUBLE)
            .column("active", ColumnType.BOOLEAN)
            .column("created", ColumnType.TIMESTAMP)
            .column("nickname", ColumnType.STRING)
            .build();

    @ParameterizedTest
    @DisplayName("Rejected without a schema")
    @ValueSource(strings = {
            "active > true",
            "active <= false",
            "name LIKE 5",
            "name LIKE NULL",
            "a IN (1, 'x')",
            "a IN (true, 1.5)"
    })
    void rejectedWithoutSchema(String filter) {
        assertThrows(TypeMismatchException.class, () -> check(filter, Schema.unknown()));
    }

    @ParameterizedTest
    @DisplayName("Accepted without a schema")
    @ValueSource(strings = {
            "a = 'x'",
            "a > 5 AND a < 7.5",
            "a = true",
            "a IN (1, 2.5, NULL)",
            "a LIKE 'x%'",
            "a < b",
            "a IS NULL"
    })
    void acceptedWithoutSchema(String filter) {
        assertDoesNotThrow(() -> check(filter, Schema.unknown()));
    }

    @ParameterizedTest
    @DisplayName("Rejected against the schema")
    @ValueSource(strings = {
            "age = 'thirty'",
            "name > 5",
            "age LIKE '3%'",
            "active < age",
            "name = age",
            "age IN (1, 'x')",
            "score IN ('a', 'b')",
            "created > '2021-01-01'",
            "active > true"
    })
    void rejectedWithSchema(String filter) {
        assertThrows(TypeMismatchException.class, () -> check(filter, SCHEMA));
    }

    @ParameterizedTest
    @DisplayName("Accepted against the schema")
    @ValueSource(strings = {
            "age > 30",
            "age > 30.5",
            "score = 1",
            "name = NULL",
            "name LIKE 'A%'",
            "name = nickname",
            "age < score",
            "active = false",
            "created >= TIMESTAMP '2021-01-01'",
            "age IN (1, 2, NULL)",
            "NOT (name IS NULL OR age < 5)"
    })
    void acceptedWithSchema(String filter) {
        assertDoesNotThrow(() -> check(filter, SCHEMA));
    }

    @Test
    @DisplayName("Unknown column names the column")
    void unknownColumn() {
        UnknownColumnException e = assertThrows(UnknownColumnException.class,
                () -> check("age > 1 AND height > 180", SCHEMA));

        assertEquals("height", e.getColumn());
    }

    @Test
    @DisplayName("Unknown column in a null check")
    void unknownColumnInNullCheck() {
        assertThrows(UnknownColumnException.class, () -> check("height IS NULL", SCHEMA));
    }

    @Test
    @DisplayName("Schema lookups")
    void schemaLookups() {
        assertTrue(SCHEMA.isKnown());
        assertEquals(ColumnType.INTEGER, SCHEMA.type("age").orElseThrow());
        assertTrue(SCHEMA.type("height").isEmpty());
        assertFalse(Schema.unknown().isKnown());
        assertTrue(Schema.unknown().columns().isEmpty());
    }

    private static void check(String filter, Schema schema) {
        TypeChecker.check(FilterExpressionParser.parse(filter), schema);
    }
}
