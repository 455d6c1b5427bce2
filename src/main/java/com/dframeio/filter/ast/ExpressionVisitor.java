package com.dframeio.filter.ast;

/**
 * Visitor over every filter expression node type.
 *
 * @param <R> Result type
 */
public interface ExpressionVisitor<R> {

    R visitComparison(Comparison comparison);

    R visitColumnComparison(ColumnComparison comparison);

    R visitIn(In in);

    R visitIsNull(IsNull isNull);

    R visitAnd(And and);

    R visitOr(Or or);

    R visitNot(Not not);

    R visitAlwaysTrue(AlwaysTrue alwaysTrue);
}
