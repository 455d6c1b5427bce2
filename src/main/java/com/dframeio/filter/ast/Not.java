package com.dframeio.filter.ast;

import java.util.Objects;

public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
