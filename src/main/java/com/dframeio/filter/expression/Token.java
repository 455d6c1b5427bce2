package com.dframeio.filter.expression;

/**
 * Represents a token in a filter expression.
 *
 * @param type     Token type
 * @param text     Original text
 * @param literal  Decoded value (for strings, numbers, booleans and identifiers)
 * @param position Character offset in the input string
 */
public record Token(TokenType type, String text, Object literal, int position) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
