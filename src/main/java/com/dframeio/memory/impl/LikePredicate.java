package com.dframeio.memory.impl;

import com.dframeio.filter.ast.TypeFamily;
import com.dframeio.memory.LikePattern;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowPredicate;
import com.dframeio.memory.ValueResolver;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Condition that checks if a string column matches a SQL LIKE pattern.
 */
public class LikePredicate implements RowPredicate {

    private final String column;
    private final String like;
    private final Pattern pattern;
    private final ValueResolver resolver;

    public LikePredicate(String column, String like, ValueResolver resolver) {
        this.column = column;
        this.like = like;
        this.pattern = LikePattern.compile(like);
        this.resolver = resolver;
    }

    @Override
    public boolean test(Row row) {
        Optional<Object> actual = resolver.resolveAs(column, row, TypeFamily.STRING);
        if (actual.isEmpty()) {
            return false;
        }
        return pattern.matcher((String) actual.get()).matches();
    }

    @Override
    public String toString() {
        return column + " LIKE '" + like + "'";
    }
}
