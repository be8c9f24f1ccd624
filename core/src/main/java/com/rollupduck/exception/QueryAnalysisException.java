package com.rollupduck.exception;

/**
 * Base class for errors that make a single query unanalyzable.
 *
 * <p>These errors are scoped to one query: batch analysis records the failing
 * query and continues with the rest of the batch.
 *
 * @see UnsupportedPredicateException
 * @see MalformedQueryException
 */
public abstract class QueryAnalysisException extends RuntimeException {

    private final String queryId;

    protected QueryAnalysisException(String message, String queryId) {
        super(message);
        this.queryId = queryId;
    }

    protected QueryAnalysisException(String message, Throwable cause, String queryId) {
        super(message, cause);
        this.queryId = queryId;
    }

    /**
     * Returns the identifier of the query that failed analysis.
     *
     * @return the query id, or null if the query had not been identified yet
     */
    public String getQueryId() {
        return queryId;
    }

    /**
     * Returns a short name of the error kind, used in batch failure records.
     *
     * @return the error kind
     */
    public abstract String kind();

    /**
     * Returns a copy of this exception bound to the given query id.
     *
     * @param id the query id
     * @return an exception carrying the id
     */
    public abstract QueryAnalysisException withQueryId(String id);
}
