package com.rollupduck.routing;

import com.rollupduck.analysis.BatchAnalysis;
import com.rollupduck.analysis.Catalog;
import com.rollupduck.analysis.Classification;
import com.rollupduck.analysis.FilterClassifier;
import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.exception.QueryAnalysisException;
import com.rollupduck.query.Query;
import com.rollupduck.query.QueryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Matches queries against a frozen {@link Catalog} and rewrites them.
 *
 * <p>A spec is a candidate for a query when:
 * <ol>
 *   <li>its constant filters equal the query's required constants exactly</li>
 *   <li>its dimensions contain all of the query's required dimensions</li>
 *   <li>its aggregates can answer every aggregate in the SELECT list</li>
 * </ol>
 * Among candidates the one with the fewest extra dimensions wins; ties go to
 * the spec inserted first. With no candidate the query falls back to the main
 * table.
 *
 * <p>Malformed queries and queries pinned by value fall back as well. A pinned
 * query only matches when every field, id included, is equal, so a different
 * query that reuses a pinned id is still routed on its own merits.
 *
 * <p>Routing never fails and has no side effects: it reads the catalog only,
 * so a router may be shared across threads.
 */
public class QueryRouter {

    private static final Logger logger = LoggerFactory.getLogger(QueryRouter.class);

    private final Catalog catalog;
    private final Set<Query> pinnedFallbacks;
    private final FilterClassifier classifier;
    private final QueryRewriter rewriter;

    public QueryRouter(Catalog catalog) {
        this(catalog, Set.of());
    }

    /**
     * Creates a router.
     *
     * @param catalog the frozen catalog
     * @param pinnedFallbacks queries that always fall back, e.g. rejected ones
     */
    public QueryRouter(Catalog catalog, Set<Query> pinnedFallbacks) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.pinnedFallbacks = Set.copyOf(pinnedFallbacks);
        this.classifier = new FilterClassifier();
        this.rewriter = new QueryRewriter();
    }

    /**
     * Creates a router over an analysis, pinning its rejected queries to the
     * main table.
     *
     * @param analysis the batch analysis
     * @return the router
     */
    public static QueryRouter forAnalysis(BatchAnalysis analysis) {
        return new QueryRouter(analysis.catalog(), analysis.rejectedQueries());
    }

    public Catalog catalog() {
        return catalog;
    }

    /**
     * Routes a query.
     *
     * @param query the query
     * @return the routing result, never null
     */
    public RoutingResult route(Query query) {
        Objects.requireNonNull(query, "query must not be null");

        if (pinnedFallbacks.contains(query)) {
            logger.debug("Query {} is pinned to the main table", query.id());
            return new RoutingResult.Fallback(query);
        }
        if (!query.isAggregation()) {
            logger.debug("Query {} does not aggregate, using main table", query.id());
            return new RoutingResult.Fallback(query);
        }

        Classification classification;
        try {
            QueryValidator.validate(query);
            classification = classifier.classify(query);
        } catch (QueryAnalysisException e) {
            logger.debug("Query {} is malformed or cannot be classified ({}), using main table", query.id(), e.getMessage());
            return new RoutingResult.Fallback(query);
        }

        SummarySpec best = null;
        int bestExtra = Integer.MAX_VALUE;
        for (SummarySpec spec : catalog.specs()) {
            if (!matches(spec, classification)) {
                continue;
            }
            int extra = spec.dimensions().size() - classification.requiredDimensions().size();
            if (extra < bestExtra) {
                best = spec;
                bestExtra = extra;
            }
        }

        if (best == null) {
            logger.debug("No summary table matches query {}, using main table", query.id());
            return new RoutingResult.Fallback(query);
        }
        logger.debug("Query {} routed to {} ({} extra dimensions)", query.id(), best.tableName(), bestExtra);
        return new RoutingResult.Routed(best, rewriter.rewrite(classification, best));
    }

    private static boolean matches(SummarySpec spec, Classification classification) {
        return spec.constantFilters().equals(classification.requiredConstants())
            && spec.dimensions().containsAll(classification.requiredDimensions())
            && spec.canSatisfyAll(classification.query().aggregates());
    }
}
