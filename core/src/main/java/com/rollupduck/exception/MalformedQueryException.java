package com.rollupduck.exception;

/**
 * Exception thrown when a query is structurally invalid.
 *
 * <p>Common causes:
 * <ul>
 *   <li>A non-aggregated column in SELECT that is absent from GROUP BY</li>
 *   <li>An ORDER BY expression that is neither selected nor grouped</li>
 *   <li>A BETWEEN predicate without exactly two bounds</li>
 *   <li>An unknown aggregate function</li>
 * </ul>
 */
public class MalformedQueryException extends QueryAnalysisException {

    public MalformedQueryException(String message) {
        super(message, null);
    }

    public MalformedQueryException(String message, String queryId) {
        super(message, queryId);
    }

    public MalformedQueryException(String message, Throwable cause, String queryId) {
        super(message, cause, queryId);
    }

    @Override
    public String kind() {
        return "MALFORMED_QUERY";
    }

    @Override
    public MalformedQueryException withQueryId(String id) {
        return new MalformedQueryException(getMessage(), getCause(), id);
    }
}
