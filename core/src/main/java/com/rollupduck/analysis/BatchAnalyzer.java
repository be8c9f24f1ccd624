package com.rollupduck.analysis;

import com.rollupduck.config.RollupConfig;
import com.rollupduck.exception.MalformedQueryException;
import com.rollupduck.exception.QueryAnalysisException;
import com.rollupduck.query.Query;
import com.rollupduck.query.QueryBatch;
import com.rollupduck.query.QueryFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the analysis pass over a batch: classify, build, then merge.
 *
 * <p>Classification and building run per query on a worker pool; each task
 * produces an isolated outcome. Outcomes are collected in input order and
 * merged on the calling thread, so the resulting catalog does not depend on
 * thread scheduling.
 *
 * <p>A query that fails analysis is recorded as a {@link QueryFailure}; the
 * rest of the batch continues. Query ids must be unique within a batch: the
 * first query with an id is analyzed and later ones fail as malformed.
 *
 * <p>Usage:
 * <pre>
 *   try (BatchAnalyzer analyzer = new BatchAnalyzer(builder, 4)) {
 *       BatchAnalysis analysis = analyzer.analyze(queries);
 *   }
 * </pre>
 */
public class BatchAnalyzer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final SpecificationBuilder builder;
    private final SignatureMerger merger;
    private final ExecutorService workers;

    public BatchAnalyzer(SpecificationBuilder builder, int threads) {
        this(builder, new SignatureMerger(), threads);
    }

    public BatchAnalyzer(SpecificationBuilder builder, SignatureMerger merger, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.merger = Objects.requireNonNull(merger, "merger must not be null");
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "rollup-analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public static BatchAnalyzer fromConfig(RollupConfig config, CardinalityGuard guard) {
        return new BatchAnalyzer(new SpecificationBuilder(guard), config.analysisThreads());
    }

    /**
     * Analyzes a parsed batch. Parse failures are carried into the result.
     *
     * @param batch the parsed batch
     * @return the analysis
     */
    public BatchAnalysis analyze(QueryBatch batch) {
        return analyze(batch.queries(), batch.failures());
    }

    /**
     * Analyzes a list of queries.
     *
     * @param queries the queries, in input order
     * @return the analysis
     */
    public BatchAnalysis analyze(List<Query> queries) {
        return analyze(queries, List.of());
    }

    private BatchAnalysis analyze(List<Query> queries, List<QueryFailure> priorFailures) {
        long start = System.nanoTime();

        // Ids already taken by parse failures count as seen
        Set<String> seenIds = new HashSet<>();
        priorFailures.forEach(failure -> seenIds.add(failure.queryId()));
        List<Future<BuildOutcome>> futures = new ArrayList<>(queries.size());
        for (Query query : queries) {
            if (seenIds.add(query.id())) {
                futures.add(workers.submit(() -> builder.build(query)));
            } else {
                futures.add(null);
            }
        }

        List<SummarySpec> candidates = new ArrayList<>();
        Map<String, RejectionReason> rejections = new LinkedHashMap<>();
        Set<Query> rejectedQueries = new LinkedHashSet<>();
        List<QueryFailure> failures = new ArrayList<>(priorFailures);

        for (int i = 0; i < futures.size(); i++) {
            Query query = queries.get(i);
            String queryId = query.id();
            if (futures.get(i) == null) {
                logger.warn("Query {} reuses an id already in the batch, skipping it", queryId);
                failures.add(QueryFailure.of(queryId,
                    new MalformedQueryException("Duplicate query id '" + queryId + "'", queryId)));
                continue;
            }
            try {
                BuildOutcome outcome = futures.get(i).get();
                if (outcome instanceof BuildOutcome.Candidate candidate) {
                    candidates.add(candidate.spec());
                } else if (outcome instanceof BuildOutcome.Rejected rejected) {
                    rejections.put(rejected.queryId(), rejected.reason());
                    rejectedQueries.add(query);
                }
            } catch (ExecutionException e) {
                if (e.getCause() instanceof QueryAnalysisException analysisError) {
                    logger.warn("Query {} failed analysis: {}", queryId, analysisError.getMessage());
                    failures.add(QueryFailure.of(queryId, analysisError));
                } else {
                    throw new IllegalStateException("Analysis of query " + queryId + " failed", e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.stream().filter(Objects::nonNull).forEach(f -> f.cancel(true));
                throw new IllegalStateException("Interrupted while analyzing batch", e);
            }
        }

        Catalog catalog = merger.merge(candidates);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        logger.info("Analyzed {} queries in {}ms: {} summary tables, {} rejected, {} failed",
            queries.size(), elapsedMs, catalog.size(), rejections.size(), failures.size());
        return new BatchAnalysis(catalog, rejections, failures, rejectedQueries);
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
