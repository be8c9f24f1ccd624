package com.rollupduck.query;

import java.util.List;

/**
 * Result of parsing a batch of queries: the queries that parsed and validated,
 * and the ones that did not.
 *
 * @param queries the usable queries, in input order
 * @param failures the failed queries, in input order
 */
public record QueryBatch(List<Query> queries, List<QueryFailure> failures) {

    public QueryBatch {
        queries = List.copyOf(queries);
        failures = List.copyOf(failures);
    }
}
