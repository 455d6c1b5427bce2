package com.dframeio.relational;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles WHERE clause text.
 * <p>
 * Only {@link SqlKeyword}s, identifiers rendered by {@link IdentifierQuoting} and
 * parameter placeholders can be written, so no value ever appears in the SQL text.
 */
final class SqlWriter {

    private final PlaceholderStyle placeholderStyle;
    private final boolean quoteIdentifiers;
    private final StringBuilder sql = new StringBuilder();
    private final List<Object> parameters = new ArrayList<>();
    private boolean spacePending;

    SqlWriter(PlaceholderStyle placeholderStyle, boolean quoteIdentifiers) {
        this.placeholderStyle = placeholderStyle;
        this.quoteIdentifiers = quoteIdentifiers;
    }

    SqlWriter keyword(SqlKeyword keyword) {
        append(keyword.sql(), keyword.spaceBefore());
        spacePending = keyword.spaceAfter();
        return this;
    }

    SqlWriter identifier(String column) {
        append(IdentifierQuoting.render(column, quoteIdentifiers), true);
        spacePending = true;
        return this;
    }

    /**
     * Write a placeholder and bind the value to it. The value may be null.
     */
    SqlWriter parameter(Object value) {
        parameters.add(value);
        append(placeholderStyle.placeholder(parameters.size()), true);
        spacePending = true;
        return this;
    }

    WhereClause build(boolean alwaysTrue) {
        return new WhereClause(sql.toString(), parameters, alwaysTrue);
    }

    private void append(String fragment, boolean spaceBefore) {
        if (spacePending && spaceBefore && sql.length() > 0) {
            sql.append(' ');
        }
        sql.append(fragment);
    }
}
