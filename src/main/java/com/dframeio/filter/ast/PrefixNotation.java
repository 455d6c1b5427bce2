package com.dframeio.filter.ast;

import java.util.stream.Collectors;

/**
 * Renders an expression in prefix (Polish) notation, e.g. {@code (AND (> Column<a> 1) (<= Column<b> 3))}.
 * Used for debug logging and for asserting parse results.
 */
public final class PrefixNotation implements ExpressionVisitor<String> {

    private static final PrefixNotation INSTANCE = new PrefixNotation();

    private PrefixNotation() {
    }

    public static String format(Expression expression) {
        return expression.accept(INSTANCE);
    }

    @Override
    public String visitComparison(Comparison comparison) {
        return operation(comparison.operator().symbol(),
                column(comparison.column()), literal(comparison.value()));
    }

    @Override
    public String visitColumnComparison(ColumnComparison comparison) {
        return operation(comparison.operator().symbol(),
                column(comparison.left()), column(comparison.right()));
    }

    @Override
    public String visitIn(In in) {
        String values = in.values().stream()
                .map(PrefixNotation::literal)
                .collect(Collectors.joining(",", "[", "]"));
        return operation("IN", column(in.column()), values);
    }

    @Override
    public String visitIsNull(IsNull isNull) {
        return operation(isNull.negated() ? "NOTNULL" : "ISNULL", column(isNull.column()));
    }

    @Override
    public String visitAnd(And and) {
        return operation("AND", and.left().accept(this), and.right().accept(this));
    }

    @Override
    public String visitOr(Or or) {
        return operation("OR", or.left().accept(this), or.right().accept(this));
    }

    @Override
    public String visitNot(Not not) {
        return operation("NOT", not.operand().accept(this));
    }

    @Override
    public String visitAlwaysTrue(AlwaysTrue alwaysTrue) {
        return "TRUE";
    }

    private static String operation(String operator, String... operands) {
        return "(" + operator + " " + String.join(" ", operands) + ")";
    }

    private static String column(String name) {
        return "Column<" + name + ">";
    }

    private static String literal(Literal literal) {
        return switch (literal.type()) {
            case BOOLEAN -> literal.value().toString().toUpperCase();
            default -> literal.toString();
        };
    }
}
