package com.dframeio.filter;

/**
 * Backend-native form of a compiled filter, consumed by the storage read routine.
 */
public interface BackendPredicate {

    /**
     * Backend this predicate was compiled for.
     */
    BackendKind kind();
}
