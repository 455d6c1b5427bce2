package com.dframeio.filter.expression;

import com.dframeio.exception.FilterSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionTokenizer.
 */
class ExpressionTokenizerTest {

    // =====================================================================
    // Operators and Punctuation
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Comparison operators produce their token types")
    @CsvSource({
            "=, EQ",
            "!=, NE",
            "<>, NE",
            "<, LT",
            "<=, LTE",
            ">, GT",
            ">=, GTE"
    })
    void comparisonOperators(String operator, TokenType expected) {
        List<Token> tokens = new ExpressionTokenizer("a " + operator + " 1").tokenize();

        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals(expected, tokens.get(1).type());
        assertEquals(operator, tokens.get(1).text());
        assertEquals(TokenType.NUMBER, tokens.get(2).type());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    @DisplayName("Operators need no surrounding whitespace")
    void operatorsWithoutWhitespace() {
        List<Token> tokens = new ExpressionTokenizer("a>=5").tokenize();

        assertEquals(List.of(TokenType.IDENT, TokenType.GTE, TokenType.NUMBER, TokenType.EOF), types(tokens));
    }

    @Test
    @DisplayName("Token positions are character offsets")
    void tokenPositions() {
        List<Token> tokens = new ExpressionTokenizer("(a = 1) ").tokenize();

        assertEquals(0, tokens.get(0).position());
        assertEquals(1, tokens.get(1).position());
        assertEquals(3, tokens.get(2).position());
        assertEquals(5, tokens.get(3).position());
        assertEquals(6, tokens.get(4).position());
        assertEquals(TokenType.EOF, tokens.get(5).type());
        assertEquals(8, tokens.get(5).position());
    }

    @Test
    @DisplayName("Lone '!' is rejected")
    void loneBang() {
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("a ! 1").tokenize());
        assertEquals(2, e.getOffset());
    }

    @Test
    @DisplayName("Unknown characters are rejected with their offset")
    void unknownCharacter() {
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("a = 1 ; DROP").tokenize());
        assertEquals(6, e.getOffset());
        assertEquals("a = 1 ; DROP", e.getInput());
    }

    // =====================================================================
    // Keywords and Identifiers
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Keywords are case-insensitive")
    @CsvSource({
            "and, AND",
            "Or, OR",
            "NOT, NOT",
            "in, IN",
            "is, IS",
            "like, LIKE",
            "null, NULL",
            "True, BOOLEAN",
            "FALSE, BOOLEAN"
    })
    void keywordsCaseInsensitive(String text, TokenType expected) {
        Token token = new ExpressionTokenizer(text).next();

        assertEquals(expected, token.type());
        assertEquals(text, token.text());
    }

    @Test
    @DisplayName("Boolean keywords carry their value")
    void booleanLiteralValues() {
        List<Token> tokens = new ExpressionTokenizer("true false").tokenize();

        assertEquals(Boolean.TRUE, tokens.get(0).literal());
        assertEquals(Boolean.FALSE, tokens.get(1).literal());
    }

    @Test
    @DisplayName("Dotted identifiers form one token and are never keywords")
    void dottedIdentifier() {
        List<Token> tokens = new ExpressionTokenizer("table1.id and.or").tokenize();

        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals("table1.id", tokens.get(0).literal());
        assertEquals(TokenType.IDENT, tokens.get(1).type());
        assertEquals("and.or", tokens.get(1).literal());
    }

    @Test
    @DisplayName("Identifier may not end with a dot")
    void trailingDot() {
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("a. = 1").tokenize());
        assertEquals(2, e.getOffset());
    }

    @Test
    @DisplayName("Backtick-quoted identifiers keep spaces and keywords")
    void backtickIdentifier() {
        List<Token> tokens = new ExpressionTokenizer("`order date` `AND`").tokenize();

        assertEquals(TokenType.QUOTED_IDENT, tokens.get(0).type());
        assertEquals("order date", tokens.get(0).literal());
        assertEquals("`order date`", tokens.get(0).text());
        assertEquals(TokenType.QUOTED_IDENT, tokens.get(1).type());
        assertEquals("AND", tokens.get(1).literal());
    }

    @Test
    @DisplayName("Unterminated and empty backtick identifiers are rejected")
    void badBacktickIdentifiers() {
        assertThrows(FilterSyntaxException.class, () -> new ExpressionTokenizer("`abc = 1").tokenize());
        assertThrows(FilterSyntaxException.class, () -> new ExpressionTokenizer("`` = 1").tokenize());
    }

    // =====================================================================
    // Literals
    // =====================================================================

    @Test
    @DisplayName("Single and double quoted strings are equivalent")
    void quotedStrings() {
        List<Token> tokens = new ExpressionTokenizer("'xyz' \"xyz\"").tokenize();

        assertEquals(TokenType.STRING, tokens.get(0).type());
        assertEquals("xyz", tokens.get(0).literal());
        assertEquals(TokenType.STRING, tokens.get(1).type());
        assertEquals("xyz", tokens.get(1).literal());
    }

    @Test
    @DisplayName("Backslash escapes the quote and itself only")
    void stringEscapes() {
        List<Token> tokens = new ExpressionTokenizer("'it\\'s' 'a\\\\b' 'c:\\temp'").tokenize();

        assertEquals("it's", tokens.get(0).literal());
        assertEquals("a\\b", tokens.get(1).literal());
        assertEquals("c:\\temp", tokens.get(2).literal());
    }

    @Test
    @DisplayName("Unterminated string reports the opening quote")
    void unterminatedString() {
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("name = 'abc").tokenize());
        assertEquals(7, e.getOffset());
    }

    @ParameterizedTest
    @DisplayName("Numbers decode to Long or Double")
    @CsvSource({
            "5, 5, java.lang.Long",
            "-5, -5, java.lang.Long",
            "+7, 7, java.lang.Long",
            "5.5, 5.5, java.lang.Double",
            ".5, 0.5, java.lang.Double",
            "-.25, -0.25, java.lang.Double",
            "1e3, 1000.0, java.lang.Double",
            "2.5E-1, 0.25, java.lang.Double"
    })
    void numbers(String text, String expectedValue, String expectedClass) {
        Token token = new ExpressionTokenizer(text).next();

        assertEquals(TokenType.NUMBER, token.type());
        assertEquals(expectedClass, token.literal().getClass().getName());
        assertEquals(expectedValue, token.literal().toString());
    }

    @Test
    @DisplayName("Integer overflow is a syntax error")
    void integerOverflow() {
        assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("a = 99999999999999999999").tokenize());
    }

    @Test
    @DisplayName("Letters directly after a number are rejected")
    void numberFollowedByLetter() {
        FilterSyntaxException e = assertThrows(FilterSyntaxException.class,
                () -> new ExpressionTokenizer("a = 12abc").tokenize());
        assertEquals(6, e.getOffset());
    }

    // =====================================================================
    // Iteration
    // =====================================================================

    @Test
    @DisplayName("Empty input yields only EOF")
    void emptyInput() {
        List<Token> tokens = new ExpressionTokenizer("   ").tokenize();

        assertEquals(1, tokens.size());
        assertEquals(TokenType.EOF, tokens.get(0).type());
    }

    @Test
    @DisplayName("Tokenizer is exhausted after EOF")
    void exhaustedAfterEof() {
        ExpressionTokenizer tokenizer = new ExpressionTokenizer("a");
        tokenizer.next();
        tokenizer.next();

        assertFalse(tokenizer.hasNext());
        assertThrows(NoSuchElementException.class, tokenizer::next);
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }
}
