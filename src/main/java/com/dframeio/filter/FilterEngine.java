package com.dframeio.filter;

import com.dframeio.columnar.ColumnarPredicate;
import com.dframeio.columnar.ColumnarPushdownCompiler;
import com.dframeio.config.FilterEngineConfig;
import com.dframeio.filter.ast.Expression;
import com.dframeio.memory.InMemoryCompiler;
import com.dframeio.memory.RowPredicate;
import com.dframeio.relational.RelationalCompiler;
import com.dframeio.relational.WhereClause;
import com.dframeio.schema.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for compiling filter text into backend predicates.
 * <p>
 * Usage:
 * <pre>
 * FilterEngine engine = new FilterEngine();
 * RowPredicate rows = engine.compileInMemory("age &gt; 30 AND country = 'DE'");
 * WhereClause where = engine.compileRelational("name IN ('a', 'b')");
 * </pre>
 * Instances are immutable and can be shared between threads.
 */
public class FilterEngine {

    private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

    private final FilterEngineConfig config;
    private final InMemoryCompiler inMemoryCompiler;
    private final ColumnarPushdownCompiler columnarCompiler;
    private final RelationalCompiler relationalCompiler;

    public FilterEngine() {
        this(FilterEngineConfig.defaults());
    }

    public FilterEngine(FilterEngineConfig config) {
        this.config = config;
        this.inMemoryCompiler = new InMemoryCompiler();
        this.columnarCompiler = new ColumnarPushdownCompiler(inMemoryCompiler, config.residualSplit());
        this.relationalCompiler = new RelationalCompiler(config.placeholderStyle(), config.quoteIdentifiers());
    }

    public FilterEngineConfig getConfig() {
        return config;
    }

    /**
     * Parse filter text without compiling it.
     *
     * @param filterText Filter text; null or blank means no filtering
     * @return Expression tree
     */
    public Expression parse(String filterText) {
        Expression expression = FilterExpressionParser.parse(filterText);
        log.debug("Parsed filter '{}' into {}", filterText, expression);
        return expression;
    }

    public BackendPredicate compile(String filterText, BackendKind kind) {
        return compile(filterText, kind, Schema.unknown());
    }

    /**
     * Parse filter text and compile it for one backend.
     *
     * @param filterText Filter text; null or blank means no filtering
     * @param kind       Target backend
     * @param schema     Column types, or {@link Schema#unknown()}
     * @return Backend predicate, a {@link RowPredicate}, {@link ColumnarPredicate} or {@link WhereClause}
     */
    public BackendPredicate compile(String filterText, BackendKind kind, Schema schema) {
        Expression expression = parse(filterText);
        return switch (kind) {
            case IN_MEMORY -> inMemoryCompiler.compile(expression, schema);
            case COLUMNAR_PUSHDOWN -> columnarCompiler.compile(expression, schema);
            case RELATIONAL -> relationalCompiler.compile(expression, schema);
        };
    }

    public RowPredicate compileInMemory(String filterText) {
        return compileInMemory(filterText, Schema.unknown());
    }

    public RowPredicate compileInMemory(String filterText, Schema schema) {
        return inMemoryCompiler.compile(parse(filterText), schema);
    }

    public ColumnarPredicate compileColumnar(String filterText) {
        return compileColumnar(filterText, Schema.unknown());
    }

    public ColumnarPredicate compileColumnar(String filterText, Schema schema) {
        return columnarCompiler.compile(parse(filterText), schema);
    }

    public WhereClause compileRelational(String filterText) {
        return compileRelational(filterText, Schema.unknown());
    }

    public WhereClause compileRelational(String filterText, Schema schema) {
        return relationalCompiler.compile(parse(filterText), schema);
    }
}
