package com.dframeio.filter.expression;

import java.util.Map;

/**
 * Keywords and operator characters of the filter language.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    /**
     * Keywords mapped to token types. Matching is case-insensitive.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Logical
            Map.entry("AND", TokenType.AND),
            Map.entry("OR", TokenType.OR),
            Map.entry("NOT", TokenType.NOT),

            // Predicates
            Map.entry("IN", TokenType.IN),
            Map.entry("IS", TokenType.IS),
            Map.entry("LIKE", TokenType.LIKE),

            // Literals
            Map.entry("TRUE", TokenType.BOOLEAN),
            Map.entry("FALSE", TokenType.BOOLEAN),
            Map.entry("NULL", TokenType.NULL)
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Prefix word of a typed timestamp literal, {@code TIMESTAMP '2021-01-01 00:00:00'}.
     * Not reserved: it only has this meaning when followed by a string.
     */
    public static final String TIMESTAMP_PREFIX = "TIMESTAMP";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char COMMA = ',';
        public static final char EQUALS = '=';
        public static final char BANG = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKTICK = '`';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char PLUS = '+';
        public static final char UNDERSCORE = '_';

        private Operators() {
        }
    }
}
