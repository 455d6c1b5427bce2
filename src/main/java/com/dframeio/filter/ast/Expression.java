package com.dframeio.filter.ast;

/**
 * Node of an immutable filter expression tree.
 * <p>
 * The set of node types is closed; consumers dispatch through {@link ExpressionVisitor}
 * so that adding a node type breaks every consumer until it handles the new type.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
