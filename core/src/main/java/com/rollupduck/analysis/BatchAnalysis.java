package com.rollupduck.analysis;

import com.rollupduck.query.Query;
import com.rollupduck.query.QueryFailure;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Output of analyzing one query batch.
 *
 * @param catalog the frozen catalog of merged summary specs
 * @param rejections query id to rejection reason, in input order
 * @param failures queries that could not be analyzed, in input order
 * @param rejectedQueries the rejected queries themselves, pinned to the main table when routing
 */
public record BatchAnalysis(Catalog catalog, Map<String, RejectionReason> rejections, List<QueryFailure> failures,
                            Set<Query> rejectedQueries) {

    public BatchAnalysis {
        Objects.requireNonNull(catalog, "catalog must not be null");
        rejections = Collections.unmodifiableMap(new LinkedHashMap<>(rejections));
        failures = List.copyOf(failures);
        rejectedQueries = Collections.unmodifiableSet(new LinkedHashSet<>(rejectedQueries));
    }

    /**
     * Returns a copy with a different catalog, e.g. after dropping tables that
     * failed to materialize.
     *
     * @param newCatalog the catalog
     * @return the updated analysis
     */
    public BatchAnalysis withCatalog(Catalog newCatalog) {
        return new BatchAnalysis(newCatalog, rejections, failures, rejectedQueries);
    }
}
