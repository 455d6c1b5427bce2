package com.dframeio.memory;

import com.dframeio.filter.BackendCompiler;
import com.dframeio.filter.BackendKind;
import com.dframeio.filter.ast.*;
import com.dframeio.memory.impl.*;
import com.dframeio.schema.Schema;
import com.dframeio.schema.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles filter expressions into {@link RowPredicate}s evaluated against materialized rows.
 * <p>
 * Null handling is two-valued: a comparison, LIKE or IN against a null column is false,
 * and NOT simply negates its operand. SQL would instead treat such rows as unknown and
 * drop them under NOT, so {@code NOT (a > 5)} selects rows with a null {@code a} here
 * but not in a relational backend.
 */
public class InMemoryCompiler implements BackendCompiler<RowPredicate> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCompiler.class);

    private final ValueResolver resolver;

    public InMemoryCompiler() {
        this(DefaultValueResolver.INSTANCE);
    }

    public InMemoryCompiler(ValueResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.IN_MEMORY;
    }

    @Override
    public RowPredicate compile(Expression expression, Schema schema) {
        TypeChecker.check(expression, schema);
        RowPredicate predicate = expression.accept(new PredicateBuilder());
        log.debug("Compiled in-memory predicate: {}", predicate);
        return predicate;
    }

    private final class PredicateBuilder implements ExpressionVisitor<RowPredicate> {

        @Override
        public RowPredicate visitComparison(Comparison comparison) {
            if (comparison.operator() == ComparisonOperator.LIKE) {
                return new LikePredicate(comparison.column(), (String) comparison.value().value(), resolver);
            }
            return new ComparisonPredicate(comparison.column(), comparison.operator(), comparison.value(), resolver);
        }

        @Override
        public RowPredicate visitColumnComparison(ColumnComparison comparison) {
            return new ColumnComparisonPredicate(comparison.left(), comparison.operator(), comparison.right(), resolver);
        }

        @Override
        public RowPredicate visitIn(In in) {
            return new InPredicate(in.column(), in.values(), resolver);
        }

        @Override
        public RowPredicate visitIsNull(IsNull isNull) {
            return new IsNullPredicate(isNull.column(), isNull.negated(), resolver);
        }

        @Override
        public RowPredicate visitAnd(And and) {
            List<Expression> operands = new ArrayList<>();
            flattenAnd(and, operands);
            return new AndPredicate(compileAll(operands));
        }

        @Override
        public RowPredicate visitOr(Or or) {
            List<Expression> operands = new ArrayList<>();
            flattenOr(or, operands);
            return new OrPredicate(compileAll(operands));
        }

        @Override
        public RowPredicate visitNot(Not not) {
            return new NotPredicate(not.operand().accept(this));
        }

        @Override
        public RowPredicate visitAlwaysTrue(AlwaysTrue alwaysTrue) {
            return AlwaysTruePredicate.INSTANCE;
        }

        private List<RowPredicate> compileAll(List<Expression> expressions) {
            List<RowPredicate> predicates = new ArrayList<>(expressions.size());
            for (Expression expression : expressions) {
                predicates.add(expression.accept(this));
            }
            return predicates;
        }

        private void flattenAnd(Expression expression, List<Expression> operands) {
            if (expression instanceof And and) {
                flattenAnd(and.left(), operands);
                flattenAnd(and.right(), operands);
            } else {
                operands.add(expression);
            }
        }

        private void flattenOr(Expression expression, List<Expression> operands) {
            if (expression instanceof Or or) {
                flattenOr(or.left(), operands);
                flattenOr(or.right(), operands);
            } else {
                operands.add(expression);
            }
        }
    }
}
