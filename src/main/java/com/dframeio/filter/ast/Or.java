package com.dframeio.filter.ast;

import java.util.Objects;

public record Or(Expression left, Expression right) implements Expression {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
