package com.dframeio.exception;

/**
 * Exception thrown when a literal or column type is incompatible with an operator.
 * Values are never coerced to make a comparison work.
 */
public class TypeMismatchException extends FilterException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
