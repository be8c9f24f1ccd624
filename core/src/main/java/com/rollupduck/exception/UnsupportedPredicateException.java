package com.rollupduck.exception;

/**
 * Exception thrown when a query uses a predicate operator outside the
 * supported set ({@code eq, lt, lte, gt, gte, between, in}).
 *
 * <p>Example:
 * <pre>
 *   {"col": "country", "op": "like", "val": "U%"}
 *   // -> UnsupportedPredicateException: Unsupported predicate operator 'like'
 * </pre>
 */
public class UnsupportedPredicateException extends QueryAnalysisException {

    private final String operator;

    /**
     * Creates an unsupported predicate exception.
     *
     * @param operator the operator name as it appeared in the query
     * @param queryId the id of the query, may be null
     */
    public UnsupportedPredicateException(String operator, String queryId) {
        super("Unsupported predicate operator '" + operator + "'", queryId);
        this.operator = operator;
    }

    public UnsupportedPredicateException(String operator) {
        this(operator, null);
    }

    /**
     * Returns the operator name that was rejected.
     *
     * @return the operator
     */
    public String getOperator() {
        return operator;
    }

    @Override
    public String kind() {
        return "UNSUPPORTED_PREDICATE";
    }

    @Override
    public UnsupportedPredicateException withQueryId(String id) {
        return new UnsupportedPredicateException(operator, id);
    }
}
