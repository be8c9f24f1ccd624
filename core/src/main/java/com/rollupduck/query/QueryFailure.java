package com.rollupduck.query;

import com.rollupduck.exception.QueryAnalysisException;

/**
 * Record of a query that could not be parsed or analyzed.
 *
 * @param queryId the query id
 * @param kind the error kind, e.g. {@code UNSUPPORTED_PREDICATE}
 * @param message the error message
 */
public record QueryFailure(String queryId, String kind, String message) {

    public static QueryFailure of(String queryId, QueryAnalysisException e) {
        return new QueryFailure(queryId, e.kind(), e.getMessage());
    }
}
