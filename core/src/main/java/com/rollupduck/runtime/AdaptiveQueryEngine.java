package com.rollupduck.runtime;

import com.rollupduck.analysis.BatchAnalysis;
import com.rollupduck.analysis.BatchAnalyzer;
import com.rollupduck.analysis.CardinalityGuard;
import com.rollupduck.analysis.Catalog;
import com.rollupduck.analysis.ColumnStatistics;
import com.rollupduck.analysis.ThresholdCardinalityGuard;
import com.rollupduck.config.RollupConfig;
import com.rollupduck.exception.QueryExecutionException;
import com.rollupduck.generator.SQLGenerator;
import com.rollupduck.query.Predicate;
import com.rollupduck.query.Query;
import com.rollupduck.query.QueryBatch;
import com.rollupduck.routing.QueryRouter;
import com.rollupduck.routing.RoutingResult;
import com.rollupduck.routing.RoutingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point tying analysis, materialization and routing together.
 *
 * <pre>
 *   AdaptiveQueryEngine engine = new AdaptiveQueryEngine(runtime, RollupConfig.fromSystemProperties());
 *   engine.prepare(batch);                 // analyze, then build summary tables
 *   QueryResult result = engine.execute(query);
 * </pre>
 *
 * <p>{@link #prepare} replaces the router with one over a new catalog; the
 * previous catalog is left untouched. Before the first {@code prepare} every
 * query falls back to the main table.
 */
public class AdaptiveQueryEngine {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveQueryEngine.class);

    private final RollupConfig config;
    private final QueryExecutor executor;
    private final SQLGenerator generator;
    private final CardinalityGuard guard;
    private final RoutingStats stats = new RoutingStats();
    private volatile QueryRouter router = new QueryRouter(Catalog.empty());

    /**
     * Creates an engine whose cardinality guard uses statistics collected from
     * the main table at {@link #prepare} time.
     */
    public AdaptiveQueryEngine(DuckDBRuntime runtime, RollupConfig config) {
        this(runtime, config, null);
    }

    /**
     * Creates an engine with an explicit cardinality guard.
     *
     * @param runtime the DuckDB runtime holding the main table
     * @param config the configuration
     * @param guard the guard, or null to derive one from collected statistics
     */
    public AdaptiveQueryEngine(DuckDBRuntime runtime, RollupConfig config, CardinalityGuard guard) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.executor = new QueryExecutor(Objects.requireNonNull(runtime, "runtime must not be null"));
        this.generator = new SQLGenerator();
        this.guard = guard;
    }

    public BatchAnalysis prepare(List<Query> queries) {
        return prepare(new QueryBatch(queries, List.of()));
    }

    /**
     * Analyzes a batch, materializes its summary tables and installs the router.
     *
     * @param batch the parsed batch
     * @return the analysis, with the catalog reduced to the tables actually created
     * @throws com.rollupduck.exception.MaterializationException in fail-fast mode
     */
    public BatchAnalysis prepare(QueryBatch batch) {
        CardinalityGuard effectiveGuard = guard != null ? guard : statisticsGuard(batch.queries());

        BatchAnalysis analysis;
        try (BatchAnalyzer analyzer = BatchAnalyzer.fromConfig(config, effectiveGuard)) {
            analysis = analyzer.analyze(batch);
        }

        SummaryMaterializer materializer = new SummaryMaterializer(
            executor, generator, config.mainTable(), config.failFastMaterialization());
        MaterializationReport report = materializer.materialize(analysis.catalog());
        if (!report.isComplete()) {
            logger.warn("{} summary tables failed and were removed from the catalog: {}",
                report.failures().size(), report.failures().keySet());
        }

        BatchAnalysis prepared = analysis.withCatalog(report.catalog());
        this.router = QueryRouter.forAnalysis(prepared);
        return prepared;
    }

    public RoutingResult route(Query query) {
        return router.route(query);
    }

    /**
     * Routes and executes a query, recording the routing decision.
     *
     * @param query the query
     * @return the query result
     * @throws com.rollupduck.exception.QueryExecutionException if execution fails
     */
    public QueryResult execute(Query query) {
        RoutingResult result = router.route(query);
        stats.record(result);
        String sql = generator.generate(result.physicalQuery(config.mainTable()));
        return executor.executeQuery(sql);
    }

    public Catalog catalog() {
        return router.catalog();
    }

    public RoutingStats stats() {
        return stats;
    }

    public QueryExecutor executor() {
        return executor;
    }

    private CardinalityGuard statisticsGuard(List<Query> queries) {
        Set<String> columns = new LinkedHashSet<>();
        for (Query query : queries) {
            columns.addAll(query.groupBy());
            for (Predicate predicate : query.where()) {
                columns.add(predicate.column());
            }
        }
        ColumnStatistics statistics = ColumnStatistics.empty();
        if (!columns.isEmpty()) {
            try {
                statistics = new ColumnStatisticsCollector(executor).collect(config.mainTable(), columns);
            } catch (QueryExecutionException e) {
                logger.warn("Could not collect column statistics, guarding on configured columns only: {}",
                    e.getUserMessage());
            }
        }
        logger.info("Collected statistics for {} columns over {} rows", columns.size(), statistics.rowCount());
        return ThresholdCardinalityGuard.fromConfig(config, statistics);
    }
}
