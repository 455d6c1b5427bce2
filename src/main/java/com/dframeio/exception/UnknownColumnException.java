package com.dframeio.exception;

/**
 * Exception thrown when a filter references a column missing from the supplied schema.
 */
public class UnknownColumnException extends FilterException {

    private final String column;

    public UnknownColumnException(String column) {
        super("Unknown column '" + column + "'");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
