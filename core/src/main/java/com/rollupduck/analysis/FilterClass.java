package com.rollupduck.analysis;

/**
 * How a single predicate is treated when building a summary table.
 */
public enum FilterClass {
    /** The column is grouped by the query; the predicate is applied at query time. */
    IGNORED,
    /** Equality on a non-grouped column; baked into the summary table. */
    CONSTANT,
    /** Range or set predicate on a non-grouped column; the column becomes a summary dimension. */
    DIMENSION
}
