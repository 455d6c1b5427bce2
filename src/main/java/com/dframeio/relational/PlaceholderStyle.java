package com.dframeio.relational;

/**
 * How parameter placeholders are written into a WHERE clause.
 */
public enum PlaceholderStyle {

    /** JDBC style: {@code ?}. */
    QUESTION_MARK,

    /** Positional style used by PostgreSQL drivers: {@code $1}, {@code $2}, ... */
    NUMBERED;

    /**
     * Placeholder text for a parameter.
     *
     * @param position 1-based parameter position
     */
    public String placeholder(int position) {
        return switch (this) {
            case QUESTION_MARK -> "?";
            case NUMBERED -> "$" + position;
        };
    }
}
