package com.rollupduck.runtime;

import com.rollupduck.analysis.Catalog;
import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.exception.MaterializationException;
import com.rollupduck.exception.QueryExecutionException;
import com.rollupduck.generator.SQLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates the summary tables of a catalog in DuckDB.
 *
 * <p>Tables that fail to build are removed from the returned catalog, so the
 * router never sends a query to a table that does not exist. In fail-fast
 * mode the first failure throws {@link MaterializationException} instead.
 */
public class SummaryMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(SummaryMaterializer.class);

    private final QueryExecutor executor;
    private final SQLGenerator generator;
    private final String mainTable;
    private final boolean failFast;

    public SummaryMaterializer(QueryExecutor executor, String mainTable, boolean failFast) {
        this(executor, new SQLGenerator(), mainTable, failFast);
    }

    public SummaryMaterializer(QueryExecutor executor, SQLGenerator generator, String mainTable, boolean failFast) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.mainTable = Objects.requireNonNull(mainTable, "mainTable must not be null");
        this.failFast = failFast;
    }

    /**
     * Materializes every table of the catalog.
     *
     * @param catalog the catalog
     * @return the report, holding the catalog of created tables
     * @throws MaterializationException in fail-fast mode, on the first failure
     */
    public MaterializationReport materialize(Catalog catalog) {
        long start = System.nanoTime();
        List<String> created = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (SummarySpec spec : catalog.specs()) {
            String sql = generator.createSummaryTable(spec, mainTable);
            try {
                executor.executeUpdate(sql);
                created.add(spec.tableName());
                logger.debug("Created {} for queries {}", spec.tableName(), spec.sourceQueries());
            } catch (QueryExecutionException e) {
                if (failFast) {
                    throw new MaterializationException(spec.tableName(), e);
                }
                logger.error("Failed to create summary table {}: {}", spec.tableName(), e.getUserMessage());
                failures.put(spec.tableName(), e.getMessage());
            }
        }

        Catalog remaining = catalog.without(failures.keySet());
        logger.info("Materialized {} of {} summary tables in {}ms",
            created.size(), catalog.size(), (System.nanoTime() - start) / 1_000_000);
        return new MaterializationReport(remaining, created, failures);
    }
}
