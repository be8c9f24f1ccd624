package com.rollupduck.query;

import com.rollupduck.exception.MalformedQueryException;

/**
 * Aggregate functions a query may request.
 *
 * <p>Only SUM, MIN and MAX are stored directly in summary tables. AVG and
 * COUNT are reconstructed from stored sums and row counts at routing time.
 */
public enum AggregateFunction {
    SUM,
    AVG,
    COUNT,
    MIN,
    MAX;

    /**
     * Resolves a function by name (case-insensitive).
     *
     * @param name the function name
     * @return the aggregate function
     * @throws MalformedQueryException if the name is not a supported aggregate
     */
    public static AggregateFunction fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase();
            for (AggregateFunction fn : values()) {
                if (fn.name().equals(normalized)) {
                    return fn;
                }
            }
        }
        throw new MalformedQueryException("Unsupported aggregate function '" + name + "'");
    }
}
