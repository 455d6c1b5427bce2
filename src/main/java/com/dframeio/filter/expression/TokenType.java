package com.dframeio.filter.expression;

/**
 * Token types for filter expressions.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    QUOTED_IDENT,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,

    // Delimiters
    LPAREN,
    RPAREN,
    COMMA,

    // Logical operators
    AND,
    OR,
    NOT,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Keyword operators
    IN,
    IS,
    LIKE,

    // Special
    EOF
}
