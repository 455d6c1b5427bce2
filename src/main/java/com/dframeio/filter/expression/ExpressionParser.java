package com.dframeio.filter.expression;

import com.dframeio.exception.FilterSyntaxException;
import com.dframeio.filter.ast.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.dframeio.filter.expression.ExpressionConfig.TIMESTAMP_PREFIX;

/**
 * Parser for filter expressions.
 * Converts a token stream into an {@link Expression} tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | predicate
 * predicate  := column ( 'IS' ['NOT'] 'NULL'
 *                      | ['NOT'] 'IN' '(' literal (',' literal)* ')'
 *                      | ['NOT'] 'LIKE' literal
 *                      | operator (literal | column) )
 * literal    := STRING | NUMBER | TRUE | FALSE | NULL | 'TIMESTAMP' STRING
 * </pre>
 * Chains of AND/OR are left-associated. One instance parses one input.
 */
public final class ExpressionParser {

    private final String input;
    private final Iterator<Token> source;
    private final List<Token> lookahead = new ArrayList<>(2);

    public ExpressionParser(String input, Iterator<Token> tokens) {
        this.input = input;
        this.source = tokens;
    }

    public ExpressionParser(String input, List<Token> tokens) {
        this(input, tokens.iterator());
    }

    /**
     * Parse the token stream into an expression tree.
     * An input holding no tokens yields {@link AlwaysTrue}.
     *
     * @return Root expression
     */
    public Expression parse() {
        if (check(TokenType.EOF)) {
            return AlwaysTrue.INSTANCE;
        }
        Expression result = parseOr();
        if (!check(TokenType.EOF)) {
            throw error("Expected end of input");
        }
        return result;
    }

    private Expression parseOr() {
        Expression left = parseAnd();
        while (match(TokenType.OR)) {
            left = new Or(left, parseAnd());
        }
        return left;
    }

    private Expression parseAnd() {
        Expression left = parseNot();
        while (match(TokenType.AND)) {
            left = new And(left, parseNot());
        }
        return left;
    }

    private Expression parseNot() {
        if (match(TokenType.NOT)) {
            return new Not(parseNot());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (match(TokenType.LPAREN)) {
            Expression expr = parseOr();
            expect(TokenType.RPAREN, "Expected ')'");
            return expr;
        }
        return parsePredicate();
    }

    private Expression parsePredicate() {
        if (!checkColumn()) {
            throw error("Expected column name");
        }
        String column = columnName(advance());

        // Keyword predicates are tried before the binary comparison rule
        if (match(TokenType.IS)) {
            boolean negated = match(TokenType.NOT);
            expect(TokenType.NULL, negated ? "Expected NULL after IS NOT" : "Expected NULL or NOT after IS");
            return new IsNull(column, negated);
        }
        if (match(TokenType.NOT)) {
            if (match(TokenType.IN)) {
                return new Not(parseIn(column));
            }
            if (match(TokenType.LIKE)) {
                return new Not(parseLike(column));
            }
            throw error("Expected IN or LIKE after NOT");
        }
        if (match(TokenType.IN)) {
            return parseIn(column);
        }
        if (match(TokenType.LIKE)) {
            return parseLike(column);
        }

        ComparisonOperator operator = parseComparisonOperator();
        if (checkColumn()) {
            return new ColumnComparison(column, operator, columnName(advance()));
        }
        return new Comparison(column, operator, parseLiteral("Expected literal value"));
    }

    private Expression parseIn(String column) {
        expect(TokenType.LPAREN, "Expected '(' after IN");
        List<Literal> values = new ArrayList<>();
        values.add(parseLiteral("Expected literal value in IN list"));
        while (match(TokenType.COMMA)) {
            values.add(parseLiteral("Expected literal value in IN list"));
        }
        expect(TokenType.RPAREN, "Expected ',' or ')' in IN list");
        return new In(column, values);
    }

    private Expression parseLike(String column) {
        return new Comparison(column, ComparisonOperator.LIKE, parseLiteral("Expected LIKE pattern"));
    }

    private ComparisonOperator parseComparisonOperator() {
        TokenType type = peek().type();
        ComparisonOperator operator = switch (type) {
            case EQ -> ComparisonOperator.EQ;
            case NE -> ComparisonOperator.NE;
            case LT -> ComparisonOperator.LT;
            case LTE -> ComparisonOperator.LTE;
            case GT -> ComparisonOperator.GT;
            case GTE -> ComparisonOperator.GTE;
            default -> null;
        };
        if (operator == null) {
            throw error("Expected operator after column");
        }
        advance();
        return operator;
    }

    private Literal parseLiteral(String message) {
        Token token = peek();
        switch (token.type()) {
            case STRING -> {
                advance();
                return Literal.ofString((String) token.literal());
            }
            case NUMBER -> {
                advance();
                if (token.literal() instanceof Long l) {
                    return Literal.ofInteger(l);
                }
                return Literal.ofFloat((Double) token.literal());
            }
            case BOOLEAN -> {
                advance();
                return Literal.ofBoolean((Boolean) token.literal());
            }
            case NULL -> {
                advance();
                return Literal.NULL;
            }
            default -> {
                if (isTimestampLiteral()) {
                    advance();
                    Token text = advance();
                    return Literal.ofTimestamp(parseTimestamp(text));
                }
                throw error(message);
            }
        }
    }

    private Instant parseTimestamp(Token token) {
        String text = ((String) token.literal()).trim();
        String iso = text.replaceFirst(" ", "T");
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the zone-less forms
        }
        try {
            return LocalDateTime.parse(iso).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // not a local date-time, try a plain date
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new FilterSyntaxException("Invalid timestamp '" + text + "'", token.position(), input);
        }
    }

    private boolean isTimestampLiteral() {
        return check(TokenType.IDENT)
                && TIMESTAMP_PREFIX.equalsIgnoreCase(peek().text())
                && peek(1).type() == TokenType.STRING;
    }

    private boolean checkColumn() {
        return check(TokenType.QUOTED_IDENT) || (check(TokenType.IDENT) && !isTimestampLiteral());
    }

    private String columnName(Token token) {
        return (String) token.literal();
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String message) {
        if (!check(type)) {
            throw error(message);
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        Token token = peek();
        if (token.type() != TokenType.EOF) {
            lookahead.remove(0);
        }
        return token;
    }

    private Token peek() {
        return peek(0);
    }

    private Token peek(int distance) {
        while (lookahead.size() <= distance) {
            if (!source.hasNext()) {
                if (lookahead.isEmpty()) {
                    throw new IllegalStateException("Token stream must end with EOF");
                }
                // EOF repeats once the source is drained
                return lookahead.get(lookahead.size() - 1);
            }
            lookahead.add(source.next());
        }
        return lookahead.get(distance);
    }

    private FilterSyntaxException error(String message) {
        Token token = peek();
        String found = token.type() == TokenType.EOF ? "end of input" : "'" + token.text() + "'";
        return new FilterSyntaxException(message + ", found " + found, token.position(), input);
    }
}
