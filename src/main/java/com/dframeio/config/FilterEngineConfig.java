package com.dframeio.config;

import com.dframeio.relational.PlaceholderStyle;

/**
 * Backend options for a {@link com.dframeio.filter.FilterEngine}.
 *
 * @param residualSplit    Keep non-pushable conjuncts as an in-memory residual instead of failing
 * @param placeholderStyle Placeholder syntax of relational WHERE clauses
 * @param quoteIdentifiers Double-quote column names in relational WHERE clauses
 */
public record FilterEngineConfig(
        boolean residualSplit,
        PlaceholderStyle placeholderStyle,
        boolean quoteIdentifiers
) {
    public FilterEngineConfig {
        if (placeholderStyle == null) {
            placeholderStyle = PlaceholderStyle.QUESTION_MARK;
        }
    }

    public static FilterEngineConfig defaults() {
        return new FilterEngineConfig(true, PlaceholderStyle.QUESTION_MARK, true);
    }
}
