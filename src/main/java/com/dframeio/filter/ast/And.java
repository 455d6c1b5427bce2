package com.dframeio.filter.ast;

import java.util.Objects;

public record And(Expression left, Expression right) implements Expression {

    public And {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
