package com.dframeio.filter;

import com.dframeio.filter.ast.AlwaysTrue;
import com.dframeio.filter.ast.Expression;
import com.dframeio.filter.expression.ExpressionParser;
import com.dframeio.filter.expression.ExpressionTokenizer;

/**
 * Facade for parsing filter text into an {@link Expression} tree.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND, OR, NOT</li>
 *   <li>Comparisons: =, !=, &lt;&gt;, &gt;, &gt;=, &lt;, &lt;= against literals or other columns</li>
 *   <li>Set membership: IN, NOT IN</li>
 *   <li>Pattern matching: LIKE, NOT LIKE</li>
 *   <li>Null checks: IS NULL, IS NOT NULL</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: NOT > AND > OR (parentheses override)
 */
public final class FilterExpressionParser {

    private FilterExpressionParser() {
    }

    /**
     * Parse filter text into an expression tree.
     *
     * @param filter Filter text; null or blank means no filtering
     * @return Parsed expression, {@link AlwaysTrue} for an empty filter
     */
    public static Expression parse(String filter) {
        if (filter == null || filter.isBlank()) {
            return AlwaysTrue.INSTANCE;
        }

        ExpressionTokenizer tokenizer = new ExpressionTokenizer(filter);
        ExpressionParser parser = new ExpressionParser(filter, tokenizer);
        return parser.parse();
    }
}
