package com.dframeio.exception;

/**
 * Exception thrown when a backend has no representation for a filter construct.
 */
public class UnsupportedPredicateException extends FilterException {

    private final String construct;

    public UnsupportedPredicateException(String construct, String message) {
        super(message);
        this.construct = construct;
    }

    /**
     * Name of the construct the backend cannot express, e.g. {@code LIKE}.
     */
    public String getConstruct() {
        return construct;
    }
}
