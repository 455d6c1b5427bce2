package com.dframeio.relational;

import com.dframeio.filter.BackendCompiler;
import com.dframeio.filter.BackendKind;
import com.dframeio.filter.ast.*;
import com.dframeio.schema.Schema;
import com.dframeio.schema.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Compiles filter expressions into parameterized SQL WHERE clauses.
 * <p>
 * Every literal is bound as a parameter. {@code NOT} wraps its operand in parentheses;
 * {@code AND} and {@code OR} operands are parenthesized only where precedence requires it.
 * An expression that selects everything renders as {@code 1 = 1}.
 * <p>
 * SQL evaluates comparisons with NULL as unknown, which differs from the in-memory
 * backend under NOT: {@code NOT (a > 5)} does not select rows where {@code a} is NULL.
 * <p>
 * LIKE patterns are bound unchanged and use the database's default escape character.
 * PostgreSQL and MySQL treat backslash as the escape, so {@code '50\%'} matches a literal
 * percent sign there, while the in-memory backend has no escape character.
 */
public class RelationalCompiler implements BackendCompiler<WhereClause> {

    private static final Logger log = LoggerFactory.getLogger(RelationalCompiler.class);

    private static final int PRECEDENCE_OR = 1;
    private static final int PRECEDENCE_AND = 2;
    private static final int PRECEDENCE_NOT = 3;
    private static final int PRECEDENCE_PREDICATE = 4;

    private final PlaceholderStyle placeholderStyle;
    private final boolean quoteIdentifiers;

    public RelationalCompiler() {
        this(PlaceholderStyle.QUESTION_MARK, true);
    }

    public RelationalCompiler(PlaceholderStyle placeholderStyle, boolean quoteIdentifiers) {
        this.placeholderStyle = placeholderStyle;
        this.quoteIdentifiers = quoteIdentifiers;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.RELATIONAL;
    }

    @Override
    public WhereClause compile(Expression expression, Schema schema) {
        TypeChecker.check(expression, schema);
        SqlWriter writer = new SqlWriter(placeholderStyle, quoteIdentifiers);
        expression.accept(new ClauseRenderer(writer));
        WhereClause clause = writer.build(expression instanceof AlwaysTrue);
        log.debug("Compiled where clause: {}", clause);
        return clause;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof Or) {
            return PRECEDENCE_OR;
        }
        if (expression instanceof And) {
            return PRECEDENCE_AND;
        }
        if (expression instanceof Not) {
            return PRECEDENCE_NOT;
        }
        return PRECEDENCE_PREDICATE;
    }

    private static Object parameterValue(Literal literal) {
        if (literal.value() instanceof Instant instant) {
            return instant.atOffset(ZoneOffset.UTC);
        }
        return literal.value();
    }

    private static final class ClauseRenderer implements ExpressionVisitor<Void> {

        private final SqlWriter writer;

        private ClauseRenderer(SqlWriter writer) {
            this.writer = writer;
        }

        @Override
        public Void visitComparison(Comparison comparison) {
            writer.identifier(comparison.column())
                    .keyword(SqlKeyword.of(comparison.operator()))
                    .parameter(parameterValue(comparison.value()));
            return null;
        }

        @Override
        public Void visitColumnComparison(ColumnComparison comparison) {
            writer.identifier(comparison.left())
                    .keyword(SqlKeyword.of(comparison.operator()))
                    .identifier(comparison.right());
            return null;
        }

        @Override
        public Void visitIn(In in) {
            writer.identifier(in.column())
                    .keyword(SqlKeyword.IN)
                    .keyword(SqlKeyword.OPEN_PAREN);
            boolean first = true;
            for (Literal value : in.values()) {
                if (!first) {
                    writer.keyword(SqlKeyword.COMMA);
                }
                writer.parameter(parameterValue(value));
                first = false;
            }
            writer.keyword(SqlKeyword.CLOSE_PAREN);
            return null;
        }

        @Override
        public Void visitIsNull(IsNull isNull) {
            writer.identifier(isNull.column())
                    .keyword(isNull.negated() ? SqlKeyword.IS_NOT_NULL : SqlKeyword.IS_NULL);
            return null;
        }

        @Override
        public Void visitAnd(And and) {
            operand(and.left(), PRECEDENCE_AND);
            writer.keyword(SqlKeyword.AND);
            operand(and.right(), PRECEDENCE_AND);
            return null;
        }

        @Override
        public Void visitOr(Or or) {
            operand(or.left(), PRECEDENCE_OR);
            writer.keyword(SqlKeyword.OR);
            operand(or.right(), PRECEDENCE_OR);
            return null;
        }

        @Override
        public Void visitNot(Not not) {
            writer.keyword(SqlKeyword.NOT).keyword(SqlKeyword.OPEN_PAREN);
            not.operand().accept(this);
            writer.keyword(SqlKeyword.CLOSE_PAREN);
            return null;
        }

        @Override
        public Void visitAlwaysTrue(AlwaysTrue alwaysTrue) {
            writer.keyword(SqlKeyword.ALWAYS_TRUE);
            return null;
        }

        private void operand(Expression operand, int parentPrecedence) {
            if (precedence(operand) < parentPrecedence) {
                writer.keyword(SqlKeyword.OPEN_PAREN);
                operand.accept(this);
                writer.keyword(SqlKeyword.CLOSE_PAREN);
            } else {
                operand.accept(this);
            }
        }
    }
}
