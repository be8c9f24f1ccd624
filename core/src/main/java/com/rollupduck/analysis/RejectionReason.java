package com.rollupduck.analysis;

/**
 * Why a query was withheld from summary materialization.
 *
 * <p>A rejection is an outcome, not an error: the query is always answered
 * from the main table.
 */
public enum RejectionReason {

    /** A dimension is high-cardinality and no constant filter narrows the scan. */
    HIGH_CARDINALITY,

    /** An aggregate, such as COUNT of a column, cannot be rebuilt from stored primitives. */
    NON_DECOMPOSABLE_AGGREGATE,

    /** The query neither aggregates nor groups. */
    NOT_AGGREGATED
}
