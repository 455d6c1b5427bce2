package com.dframeio.filter;

/**
 * Storage backends a filter can be compiled for.
 */
public enum BackendKind {
    /**
     * Row-by-row evaluation of materialized data.
     */
    IN_MEMORY,

    /**
     * Parquet predicate pushdown, with an in-memory residual for what cannot be pushed.
     */
    COLUMNAR_PUSHDOWN,

    /**
     * Parameterized SQL WHERE clause.
     */
    RELATIONAL
}
