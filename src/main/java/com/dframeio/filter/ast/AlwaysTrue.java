package com.dframeio.filter.ast;

/**
 * Expression that matches every row.
 * Produced for an empty filter.
 */
public final class AlwaysTrue implements Expression {

    public static final AlwaysTrue INSTANCE = new AlwaysTrue();

    private AlwaysTrue() {
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAlwaysTrue(this);
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
