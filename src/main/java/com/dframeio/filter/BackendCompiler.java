package com.dframeio.filter;

import com.dframeio.filter.ast.Expression;
import com.dframeio.schema.Schema;

/**
 * Translates a filter expression into the native predicate of one backend.
 *
 * @param <P> Predicate type produced by the backend
 */
public interface BackendCompiler<P extends BackendPredicate> {

    /**
     * Backend this compiler targets.
     */
    BackendKind kind();

    /**
     * Compile an expression. Compilation is all-or-nothing.
     *
     * @param expression Parsed filter expression
     * @param schema     Column types, or {@link Schema#unknown()}
     * @return Backend predicate
     * @throws com.dframeio.exception.TypeMismatchException         if types are incompatible
     * @throws com.dframeio.exception.UnsupportedPredicateException if the backend cannot express a construct
     * @throws com.dframeio.exception.UnknownColumnException        if the schema lacks a referenced column
     */
    P compile(Expression expression, Schema schema);

    default P compile(Expression expression) {
        return compile(expression, Schema.unknown());
    }
}
