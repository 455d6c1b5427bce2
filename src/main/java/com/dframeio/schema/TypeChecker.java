package com.dframeio.schema;

import com.dframeio.exception.TypeMismatchException;
import com.dframeio.exception.UnknownColumnException;
import com.dframeio.filter.ast.*;

import java.util.Optional;

/**
 * Compile-time type validation shared by all backend compilers.
 * <p>
 * Literal-only rules always apply: ordering comparisons on booleans, LIKE with a
 * non-string pattern and IN lists mixing type families are rejected. When the schema
 * is known, referenced columns must exist and their type family must match the literal.
 */
public final class TypeChecker implements ExpressionVisitor<Void> {

    private final Schema schema;

    private TypeChecker(Schema schema) {
        this.schema = schema;
    }

    /**
     * Validate an expression.
     *
     * @throws TypeMismatchException  if an operator is applied to incompatible types
     * @throws UnknownColumnException if the schema is known and lacks a referenced column
     */
    public static void check(Expression expression, Schema schema) {
        expression.accept(new TypeChecker(schema));
    }

    @Override
    public Void visitComparison(Comparison comparison) {
        String column = comparison.column();
        ComparisonOperator operator = comparison.operator();
        Literal value = comparison.value();
        Optional<ColumnType> columnType = columnType(column);

        if (operator == ComparisonOperator.LIKE) {
            if (value.type() != LiteralType.STRING) {
                throw new TypeMismatchException("LIKE on column '" + column
                        + "' requires a string pattern, got " + value.type());
            }
            if (columnType.isPresent() && columnType.get().family() != TypeFamily.STRING) {
                throw new TypeMismatchException("LIKE requires a string column but '" + column
                        + "' is " + columnType.get());
            }
            return null;
        }

        if (operator.isOrdering() && value.type() == LiteralType.BOOLEAN) {
            throw new TypeMismatchException("Operator " + operator.symbol()
                    + " is not defined for BOOLEAN literal on column '" + column + "'");
        }
        if (columnType.isPresent()) {
            requireOrderable(column, columnType.get(), operator);
            requireCompatible(column, columnType.get(), value);
        }
        return null;
    }

    @Override
    public Void visitColumnComparison(ColumnComparison comparison) {
        Optional<ColumnType> left = columnType(comparison.left());
        Optional<ColumnType> right = columnType(comparison.right());
        if (left.isPresent() && right.isPresent()) {
            if (left.get().family() != right.get().family()) {
                throw new TypeMismatchException("Cannot compare column '" + comparison.left() + "' ("
                        + left.get() + ") with column '" + comparison.right() + "' (" + right.get() + ")");
            }
            requireOrderable(comparison.left(), left.get(), comparison.operator());
        }
        return null;
    }

    @Override
    public Void visitIn(In in) {
        TypeFamily listFamily = null;
        for (Literal value : in.values()) {
            if (value.isNull()) {
                continue;
            }
            if (listFamily == null) {
                listFamily = value.family();
            } else if (listFamily != value.family()) {
                throw new TypeMismatchException("IN list for column '" + in.column()
                        + "' mixes " + listFamily + " and " + value.family() + " values");
            }
        }
        Optional<ColumnType> columnType = columnType(in.column());
        if (columnType.isPresent()) {
            for (Literal value : in.values()) {
                requireCompatible(in.column(), columnType.get(), value);
            }
        }
        return null;
    }

    @Override
    public Void visitIsNull(IsNull isNull) {
        columnType(isNull.column());
        return null;
    }

    @Override
    public Void visitAnd(And and) {
        and.left().accept(this);
        and.right().accept(this);
        return null;
    }

    @Override
    public Void visitOr(Or or) {
        or.left().accept(this);
        or.right().accept(this);
        return null;
    }

    @Override
    public Void visitNot(Not not) {
        not.operand().accept(this);
        return null;
    }

    @Override
    public Void visitAlwaysTrue(AlwaysTrue alwaysTrue) {
        return null;
    }

    private Optional<ColumnType> columnType(String column) {
        if (!schema.isKnown()) {
            return Optional.empty();
        }
        return Optional.of(schema.type(column).orElseThrow(() -> new UnknownColumnException(column)));
    }

    private static void requireOrderable(String column, ColumnType type, ComparisonOperator operator) {
        if (operator.isOrdering() && type.family() == TypeFamily.BOOLEAN) {
            throw new TypeMismatchException("Operator " + operator.symbol()
                    + " is not defined for BOOLEAN column '" + column + "'");
        }
    }

    private static void requireCompatible(String column, ColumnType type, Literal value) {
        if (!value.isNull() && value.family() != type.family()) {
            throw new TypeMismatchException("Column '" + column + "' is " + type
                    + " but is compared to " + value.type() + " literal " + value);
        }
    }
}
