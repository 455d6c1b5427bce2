package com.dframeio;

import com.dframeio.columnar.ColumnarPredicate;
import com.dframeio.exception.FilterException;
import com.dframeio.filter.FilterEngine;
import com.dframeio.filter.ast.PrefixNotation;
import com.dframeio.memory.Row;
import com.dframeio.memory.RowFactory;
import com.dframeio.memory.RowPredicate;
import com.dframeio.relational.WhereClause;
import com.dframeio.spring.EnableFilterEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application compiling filters for every backend.
 * Filters are taken from the command line; without arguments a sample filter is used.
 */
@SpringBootApplication
@EnableFilterEngine
public class FilterApplication {

    private static final Logger log = LoggerFactory.getLogger(FilterApplication.class);

    private static final String SAMPLE_FILTER = "age > 30 AND country = 'DE' AND name LIKE 'A%'";

    private static final String SAMPLE_ROWS = """
            [
                {"name": "Anna", "age": 34, "country": "DE"},
                {"name": "Bert", "age": 41, "country": "DE"},
                {"name": "Alex", "age": 25, "country": "FR"},
                {"name": "Arno", "age": null, "country": "DE"}
            ]
            """;

    public static void main(String[] args) {
        SpringApplication.run(FilterApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(FilterEngine filterEngine) {
        return args -> {
            List<String> filters = args.length == 0 ? List.of(SAMPLE_FILTER) : List.of(args);
            List<Row> rows = RowFactory.fromJsonArray(SAMPLE_ROWS);

            for (String filter : filters) {
                log.info("=== Filter: {} ===", filter);
                try {
                    log.info("Parsed: {}", PrefixNotation.format(filterEngine.parse(filter)));

                    RowPredicate predicate = filterEngine.compileInMemory(filter);
                    log.info("In-memory matches: {}", predicate.filter(rows));

                    ColumnarPredicate columnar = filterEngine.compileColumnar(filter);
                    log.info("Columnar pushdown: {}", columnar.pushdown().map(Object::toString).orElse("<none>"));
                    log.info("Columnar residual clauses: {}", columnar.residualClauses());

                    WhereClause where = filterEngine.compileRelational(filter);
                    log.info("Relational: WHERE {} with parameters {}", where.sql(), where.parameters());
                } catch (FilterException e) {
                    log.error("Cannot compile filter '{}': {}", filter, e.getMessage());
                }
            }
        };
    }
}
