package com.rollupduck.routing;

import com.rollupduck.analysis.SummarySpec;
import com.rollupduck.plan.PhysicalQuery;
import com.rollupduck.query.Query;

import java.util.Objects;

/**
 * Outcome of routing one query: a rewrite over a summary table, or the
 * original query for the main table.
 *
 * <p>Results are created per call and share no mutable state.
 */
public sealed interface RoutingResult permits RoutingResult.Routed, RoutingResult.Fallback {

    /**
     * Returns the query to execute.
     *
     * @param mainTable the main table, used by the fallback path
     * @return the physical query
     */
    PhysicalQuery physicalQuery(String mainTable);

    boolean isRouted();

    /**
     * The query is answered by re-aggregating {@code spec}'s table.
     */
    record Routed(SummarySpec spec, PhysicalQuery rewritten) implements RoutingResult {
        public Routed {
            Objects.requireNonNull(spec, "spec must not be null");
            Objects.requireNonNull(rewritten, "rewritten must not be null");
        }

        @Override
        public PhysicalQuery physicalQuery(String mainTable) {
            return rewritten;
        }

        @Override
        public boolean isRouted() {
            return true;
        }
    }

    /**
     * The query runs unchanged against the main table.
     */
    record Fallback(Query original) implements RoutingResult {
        public Fallback {
            Objects.requireNonNull(original, "original must not be null");
        }

        @Override
        public PhysicalQuery physicalQuery(String mainTable) {
            return PhysicalQuery.fromQuery(original, mainTable);
        }

        @Override
        public boolean isRouted() {
            return false;
        }
    }
}
