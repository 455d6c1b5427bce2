package com.dframeio.exception;

/**
 * Exception thrown when filter text cannot be tokenized or parsed.
 * Carries the character offset of the offending input.
 */
public class FilterSyntaxException extends FilterException {

    private final int offset;
    private final String input;

    public FilterSyntaxException(String message, int offset, String input) {
        super("Invalid filter at position " + offset + ": " + message + " in '" + input + "'");
        this.offset = offset;
        this.input = input;
    }

    /**
     * Zero-based character offset into the filter text.
     */
    public int getOffset() {
        return offset;
    }

    public String getInput() {
        return input;
    }
}
