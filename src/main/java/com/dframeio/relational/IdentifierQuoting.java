package com.dframeio.relational;

import com.dframeio.exception.UnsupportedPredicateException;

import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Renders column names as SQL identifiers.
 * <p>
 * A name is split on {@code .} into qualifier parts. Quoted parts use double quotes with
 * embedded double quotes doubled; unquoted parts must be plain identifiers.
 */
final class IdentifierQuoting {

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private IdentifierQuoting() {
    }

    /**
     * Render a column name for use in SQL.
     *
     * @param column Column name, possibly qualified with dots
     * @param quote  Whether to double-quote every part
     * @return SQL identifier text
     * @throws UnsupportedPredicateException if the name cannot be rendered safely
     */
    static String render(String column, boolean quote) {
        if (column == null || column.isEmpty()) {
            throw new UnsupportedPredicateException("identifier", "Column name cannot be null or empty");
        }
        for (int i = 0; i < column.length(); i++) {
            if (Character.isISOControl(column.charAt(i))) {
                throw new UnsupportedPredicateException("identifier",
                        "Column name contains a control character at position " + i);
            }
        }

        StringJoiner joiner = new StringJoiner(".");
        for (String part : column.split("\\.", -1)) {
            if (part.isEmpty()) {
                throw new UnsupportedPredicateException("identifier",
                        "Column name '" + column + "' has an empty part");
            }
            if (quote) {
                joiner.add(quoteIdentifier(part));
            } else if (PLAIN_IDENTIFIER.matcher(part).matches()) {
                joiner.add(part);
            } else {
                throw new UnsupportedPredicateException("identifier",
                        "Column name '" + column + "' is not a plain identifier and quoting is disabled");
            }
        }
        return joiner.toString();
    }

    static String quoteIdentifier(String part) {
        return "\"" + part.replace("\"", "\"\"") + "\"";
    }
}
