package com.dframeio.filter.expression;

import com.dframeio.exception.FilterSyntaxException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.dframeio.filter.expression.ExpressionConfig.*;

/**
 * Tokenizer for filter expressions.
 * <p>
 * Produces tokens lazily in a single forward pass. The last token is always
 * {@link TokenType#EOF}; the tokenizer cannot be restarted.
 */
public final class ExpressionTokenizer implements Iterator<Token> {

    private final String input;
    private final int length;
    private int pos;
    private boolean finished;

    public ExpressionTokenizer(String input) {
        this.input = input;
        this.length = input.length();
        this.pos = 0;
    }

    /**
     * Drain the remaining input into a list of tokens, ending with EOF.
     *
     * @return List of tokens
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !finished;
    }

    @Override
    public Token next() {
        if (finished) {
            throw new NoSuchElementException("Tokenizer already reached end of input");
        }
        skipWhitespace();

        if (isAtEnd()) {
            finished = true;
            return new Token(TokenType.EOF, "", null, pos);
        }

        int start = pos;
        char c = peek();

        return switch (c) {
            case Operators.LEFT_PAREN -> single(TokenType.LPAREN, start);
            case Operators.RIGHT_PAREN -> single(TokenType.RPAREN, start);
            case Operators.COMMA -> single(TokenType.COMMA, start);
            case Operators.EQUALS -> single(TokenType.EQ, start);
            case Operators.BANG -> {
                advance();
                if (match(Operators.EQUALS)) {
                    yield new Token(TokenType.NE, "!=", null, start);
                }
                throw error("Unexpected '!'", start);
            }
            case Operators.GREATER -> {
                advance();
                if (match(Operators.EQUALS)) {
                    yield new Token(TokenType.GTE, ">=", null, start);
                }
                yield new Token(TokenType.GT, ">", null, start);
            }
            case Operators.LESS -> {
                advance();
                if (match(Operators.EQUALS)) {
                    yield new Token(TokenType.LTE, "<=", null, start);
                }
                if (match(Operators.GREATER)) {
                    yield new Token(TokenType.NE, "<>", null, start);
                }
                yield new Token(TokenType.LT, "<", null, start);
            }
            case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> readString();
            case Operators.BACKTICK -> readQuotedIdentifier();
            default -> {
                if (isIdentifierStart(c)) {
                    yield readIdentifierOrKeyword();
                }
                if (isNumberStart()) {
                    yield readNumber();
                }
                throw error("Unexpected character '" + c + "'", start);
            }
        };
    }

    private Token single(TokenType type, int start) {
        char c = advance();
        return new Token(type, String.valueOf(c), null, start);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        boolean dotted = false;

        readIdentifierPart();
        while (!isAtEnd() && peek() == Operators.DOT) {
            advance();
            if (isAtEnd() || !isIdentifierStart(peek())) {
                throw error("Expected identifier after '.'", pos);
            }
            readIdentifierPart();
            dotted = true;
        }

        String text = input.substring(start, pos);
        if (!dotted) {
            String upper = text.toUpperCase();
            TokenType keywordType = KEYWORDS.get(upper);
            if (keywordType != null) {
                Object literal = null;
                if (keywordType == TokenType.BOOLEAN) {
                    literal = BOOLEAN_VALUES.get(upper);
                }
                return new Token(keywordType, text, literal, start);
            }
        }

        return new Token(TokenType.IDENT, text, text, start);
    }

    private void readIdentifierPart() {
        advance();
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
    }

    private Token readQuotedIdentifier() {
        int start = pos;
        advance();
        int nameStart = pos;

        while (!isAtEnd() && peek() != Operators.BACKTICK) {
            advance();
        }
        if (isAtEnd()) {
            throw error("Unterminated quoted identifier", start);
        }

        String name = input.substring(nameStart, pos);
        advance(); // closing backtick
        if (name.isEmpty()) {
            throw error("Empty quoted identifier", start);
        }
        return new Token(TokenType.QUOTED_IDENT, input.substring(start, pos), name, start);
    }

    private Token readNumber() {
        int start = pos;
        boolean floating = false;

        if (peek() == Operators.MINUS || peek() == Operators.PLUS) {
            advance();
        }

        readDigits();

        if (!isAtEnd() && peek() == Operators.DOT) {
            floating = true;
            advance();
            readDigits();
        }

        if (!isAtEnd() && (peek() == 'e' || peek() == 'E')) {
            floating = true;
            advance();
            if (!isAtEnd() && (peek() == Operators.MINUS || peek() == Operators.PLUS)) {
                advance();
            }
            if (isAtEnd() || !isDigit(peek())) {
                throw error("Invalid number '" + input.substring(start, pos) + "'", start);
            }
            readDigits();
        }

        if (!isAtEnd() && (isIdentifierPart(peek()) || peek() == Operators.DOT)) {
            throw error("Unexpected character '" + peek() + "' in number", pos);
        }

        String text = input.substring(start, pos);
        Object number;

        try {
            if (floating) {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    throw error("Number out of range '" + text + "'", start);
                }
                number = value;
            } else {
                number = Long.parseLong(text);
            }
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }

        return new Token(TokenType.NUMBER, text, number, start);
    }

    private void readDigits() {
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }
    }

    private Token readString() {
        int start = pos;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            // Only the quote character and the backslash itself can be escaped
            if (c == Operators.BACKSLASH && !isAtEnd()
                    && (peek() == quote || peek() == Operators.BACKSLASH)) {
                sb.append(advance());
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", start);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, input.substring(start, pos), sb.toString(), start);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isNumberStart() {
        char c = peek();
        if (isDigit(c)) {
            return true;
        }
        int next = pos + 1;
        if (c == Operators.DOT) {
            return next < length && isDigit(input.charAt(next));
        }
        if (c == Operators.MINUS || c == Operators.PLUS) {
            if (next < length && isDigit(input.charAt(next))) {
                return true;
            }
            return next + 1 < length && input.charAt(next) == Operators.DOT
                    && isDigit(input.charAt(next + 1));
        }
        return false;
    }

    private char advance() {
        return input.charAt(pos++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        pos++;
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private FilterSyntaxException error(String message, int position) {
        return new FilterSyntaxException(message, position, input);
    }
}
